// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.lman.common;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

/**
 * Reflection utilities.
 */
public class ReflectionHelper {

  private ReflectionHelper() {}

  public static abstract class FieldVisitor {
    protected enum Control { CONTINUE, BREAK }

    private Object returnValue = null;

    protected abstract Control visit(Field field, Object value);

    protected Control breakAndReturn(Object value) {
      returnValue = value;
      return Control.BREAK;
    }
  }

  /**
   * Visits each public instance field of |obj|, in declaration order. Fields annotated with
   * {@link Transient} are skipped unless |includeTransient| is set. Returns whatever the visitor
   * passed to {@link FieldVisitor#breakAndReturn}, or null if it never broke.
   */
  public static Object forEach(Object obj, boolean includeTransient, FieldVisitor visitor) {
    for (Field field : obj.getClass().getFields()) {
      if (Modifier.isStatic(field.getModifiers()))
        continue;
      if (!includeTransient && field.getAnnotation(Transient.class) != null)
        continue;

      Object fieldValue = null;
      try {
        fieldValue = field.get(obj);
      } catch (IllegalAccessException e) {
        throw new IllegalArgumentException(e);
      }

      if (visitor.visit(field, fieldValue) == FieldVisitor.Control.BREAK)
        break;
    }

    return visitor.returnValue;
  }

  public static Object forEach(Object obj, FieldVisitor visitor) {
    return forEach(obj, false, visitor);
  }

}
