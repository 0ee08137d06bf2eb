/*
 * Copyright (C) 2026 Google, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.escapedjango;

import com.google.common.base.Ascii;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Optional;

/**
 * Finds the public member of a class that a template lookup such as {@code user.name} refers to.
 * The candidates, in order, are a no-argument method {@code getName()}, a no-argument method
 * {@code isName()} returning boolean, a no-argument method {@code name()}, and a public field
 * {@code name}.
 *
 * <p>For each method found, it determines the public class or interface in which it is declared.
 * This avoids a problem with reflection, where we get an exception if we call a {@code Method} in a
 * non-public class, even if the {@code Method} is public and if there is a public ancestor class or
 * interface that declares it. We need to use the {@code Method} from the public ancestor.
 *
 * <p>Because looking for these members is relatively expensive, an instance of this class keeps a
 * cache of what it previously discovered. An {@link Engine} shares one instance between all of its
 * templates.
 */
class MethodFinder {

  /**
   * A readable property of a class: either a no-argument method or a public field.
   */
  static final class Property {
    private final Method method;
    private final Field field;
    private final boolean altersData;

    private Property(Method method, Field field, boolean altersData) {
      this.method = method;
      this.field = field;
      this.altersData = altersData;
    }

    /** True if the underlying method is annotated {@link AltersData} and must not be invoked. */
    boolean altersData() {
      return altersData;
    }

    Object read(Object target) throws InvocationTargetException {
      try {
        return method != null ? method.invoke(target) : field.get(target);
      } catch (IllegalAccessException e) {
        // We only return members of public, exported classes, so this should not happen.
        throw new IllegalStateException(e);
      }
    }

    @Override
    public String toString() {
      return method != null ? method.toString() : field.toString();
    }
  }

  /**
   * For a given class and name, the property found by {@link #publicProperty}. It is saved the
   * first time it is searched for, and returned directly thereafter. It may be empty.
   */
  private final Table<Class<?>, String, Optional<Property>> propertyCache =
      HashBasedTable.create();

  /**
   * Returns the public property with the given name in the given class, if there is one. Here,
   * "public" means public members of public classes or interfaces. If {@code startClass} is not
   * itself public, its methods are effectively not public either, but inherited methods may still
   * be found, with the {@code Method} objects belonging to public ancestors.
   */
  synchronized Optional<Property> publicProperty(Class<?> startClass, String name) {
    Optional<Property> cached = propertyCache.get(startClass, name);
    if (cached == null) {
      cached = uncachedPublicProperty(startClass, name);
      propertyCache.put(startClass, name, cached);
    }
    return cached;
  }

  private Optional<Property> uncachedPublicProperty(Class<?> startClass, String name) {
    if (name.isEmpty()) {
      return Optional.empty();
    }
    String capitalized = Ascii.toUpperCase(name.substring(0, 1)) + name.substring(1);
    String[] candidates = {"get" + capitalized, "is" + capitalized, name};
    for (String candidate : candidates) {
      Method method;
      try {
        // Class.getMethod only returns public methods, so no need to filter explicitly.
        method = startClass.getMethod(candidate);
      } catch (NoSuchMethodException e) {
        continue;
      }
      if (Modifier.isStatic(method.getModifiers()) || method.getReturnType() == void.class) {
        continue;
      }
      if (candidate.startsWith("is")
          && !candidate.equals(name)
          && method.getReturnType() != boolean.class
          && method.getReturnType() != Boolean.class) {
        continue;
      }
      Method visible = visibleMethod(method, startClass);
      if (visible != null) {
        boolean altersData =
            method.isAnnotationPresent(AltersData.class)
                || visible.isAnnotationPresent(AltersData.class);
        return Optional.of(new Property(visible, null, altersData));
      }
    }
    try {
      Field field = startClass.getField(name);
      if (!Modifier.isStatic(field.getModifiers()) && classIsPublic(field.getDeclaringClass())) {
        return Optional.of(new Property(null, field, false));
      }
    } catch (NoSuchFieldException e) {
      // Fall through to report that there is no such property.
    }
    return Optional.empty();
  }

  /**
   * Returns a Method with the same name and parameter types as the given one, but that is in a
   * public class or interface. This might be the given method, or it might be a method in a
   * superclass or superinterface.
   *
   * @return a public method in a public class or interface, or null if none was found.
   */
  static Method visibleMethod(Method method, Class<?> in) {
    if (in == null) {
      return null;
    }
    Method methodInClass;
    try {
      methodInClass = in.getMethod(method.getName(), method.getParameterTypes());
    } catch (NoSuchMethodException e) {
      return null;
    }
    if (classIsPublic(in)) {
      return methodInClass;
    }
    Method methodInSuperclass = visibleMethod(method, in.getSuperclass());
    if (methodInSuperclass != null) {
      return methodInSuperclass;
    }
    for (Class<?> superinterface : in.getInterfaces()) {
      Method methodInSuperinterface = visibleMethod(method, superinterface);
      if (methodInSuperinterface != null) {
        return methodInSuperinterface;
      }
    }
    return null;
  }

  /**
   * Returns whether the given class is public as seen from this class. With modules, a class can
   * be marked public and yet not be visible, if it is not exported from the module it appears in.
   * A nested class is only visible if its enclosing classes are too.
   */
  private static boolean classIsPublic(Class<?> c) {
    for (Class<?> k = c; k != null; k = k.getEnclosingClass()) {
      if (!Modifier.isPublic(k.getModifiers())) {
        return false;
      }
    }
    return c.getModule().isExported(c.getPackageName());
  }
}
