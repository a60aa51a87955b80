/*
 * Copyright (c) 2024 Hopsworks AB
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
 *
 * See the License for the specific language governing permissions and limitations under the License.
 */

package com.logicalclocks.hsdq;

import org.apache.commons.lang3.math.NumberUtils;

import java.util.Locale;

/**
 * Declared type of a dataset column, used by the schema check to decide whether a value is coercible.
 */
public enum ColumnType {
  INTEGER,
  FLOAT,
  STRING,
  BOOLEAN;

  /**
   * Whether a non-null value can be read as this type. Nulls are never judged here.
   *
   * @param value a non-null scalar from a dataset
   * @return true if the value can be coerced to this type
   */
  public boolean isCoercible(Object value) {
    switch (this) {
      case INTEGER:
        if (value instanceof Double || value instanceof Float) {
          double d = ((Number) value).doubleValue();
          return !Double.isInfinite(d) && d == Math.rint(d);
        }
        if (value instanceof Number) {
          return true;
        }
        return value instanceof String && isLong(((String) value).trim());
      case FLOAT:
        if (value instanceof Number) {
          return true;
        }
        return value instanceof String && NumberUtils.isParsable(((String) value).trim());
      case BOOLEAN:
        if (value instanceof Boolean) {
          return true;
        }
        return value instanceof String
            && ("true".equalsIgnoreCase(((String) value).trim()) || "false".equalsIgnoreCase(((String) value).trim()));
      case STRING:
        return true;
      default:
        throw new IllegalStateException("Unknown column type " + this);
    }
  }

  private static boolean isLong(String value) {
    try {
      Long.parseLong(value);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  public static ColumnType fromString(String name) {
    return valueOf(name.toUpperCase(Locale.ROOT));
  }
}
