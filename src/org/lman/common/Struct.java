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
import java.util.Arrays;

/**
 * {@link Object} wrapper that treats them as "structs", that is, generates equals/hashCode/toString
 * based on reflection over the public fields.
 */
public abstract class Struct {

  @Override
  public final boolean equals(final Object other) {
    if (this == other)
      return true;
    if (other == null)
      return false;
    if (getClass() != other.getClass())
      return false;

    Boolean result = (Boolean) ReflectionHelper.forEach(this, new ReflectionHelper.FieldVisitor() {
      @Override
      public Control visit(Field field, Object value) {
        Object otherValue = null;
        try {
          otherValue = field.get(other);
        } catch (IllegalAccessException e) {
          throw new IllegalArgumentException(e);
        }
        if (!fieldEquals(value, otherValue))
          return breakAndReturn(false);
        return Control.CONTINUE;
      }
    });

    return (result == null) ? true : result.booleanValue();
  }

  private static boolean fieldEquals(Object value, Object otherValue) {
    if (value == null)
      return otherValue == null;
    if (value instanceof Object[] && otherValue instanceof Object[])
      return Arrays.deepEquals((Object[]) value, (Object[]) otherValue);
    return value.equals(otherValue);
  }

  @Override
  public final int hashCode() {
    final int prime = 31;
    final int[] result = { 1 };
    ReflectionHelper.forEach(this, new ReflectionHelper.FieldVisitor() {
      @Override
      protected Control visit(Field field, Object value) {
        result[0] *= prime;
        if (value instanceof Object[])
          result[0] += Arrays.deepHashCode((Object[]) value);
        else if (value != null)
          result[0] += value.hashCode();
        return Control.CONTINUE;
      }
    });
    return result[0];
  }

  @Override
  public final String toString() {
    final StringBuilder buf = new StringBuilder(getClass().getSimpleName() + "{ ");
    final boolean[] needsComma = { false };

    ReflectionHelper.forEach(this, true, new ReflectionHelper.FieldVisitor() {
      @Override
      protected Control visit(Field field, Object value) {
        if (needsComma[0])
          buf.append(", ");
        else
          needsComma[0] = true;
        buf.append(field.getName() + ": ");

        if (value == null)
          buf.append("(null)");
        else if (value instanceof Object[])
          buf.append(Arrays.deepToString((Object[]) value));
        else
          buf.append(value.toString());
        return Control.CONTINUE;
      }
    });

    buf.append(" }");
    return buf.toString();
  }
}
