/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.apache.keyvalue.converter;

import com.google.common.collect.ImmutableSetMultimap;
import java.nio.charset.StandardCharsets;
import org.apache.keyvalue.memory.Platform;
import org.apache.keyvalue.memory.Slots;
import org.apache.keyvalue.type.Shape;
import org.apache.keyvalue.type.ShapeKind;

/**
 * Conversions by value: primitive widening, enum constant to its name, and the byte array / string
 * pair.
 */
final class ValueConversions {
  // JLS 5.1.2
  private static final ImmutableSetMultimap<Class<?>, Class<?>> WIDENING =
      ImmutableSetMultimap.<Class<?>, Class<?>>builder()
          .putAll(byte.class, short.class, int.class, long.class, float.class, double.class)
          .putAll(short.class, int.class, long.class, float.class, double.class)
          .putAll(char.class, int.class, long.class, float.class, double.class)
          .putAll(int.class, long.class, float.class, double.class)
          .putAll(long.class, float.class, double.class)
          .putAll(float.class, double.class)
          .build();

  private ValueConversions() {}

  /** Returns the by-value converter for the pair, or null when there is none. */
  static Converter forPair(Shape dst, Shape src) {
    Class<?> dstType = dst.getRawType();
    Class<?> srcType = src.getRawType();
    if (dst.isPrimitive() && src.isPrimitive() && WIDENING.containsEntry(srcType, dstType)) {
      return (d, dstOffset, s, srcOffset) ->
          Slots.write(d, dstOffset, dstType, widen(Slots.read(s, srcOffset, srcType), dstType));
    }
    if (dst.getKind() == ShapeKind.STRING && src.getKind() == ShapeKind.ENUM) {
      return (d, dstOffset, s, srcOffset) -> {
        Enum<?> value = (Enum<?>) Platform.getObject(s, srcOffset);
        Platform.putObject(d, dstOffset, value == null ? null : value.name());
      };
    }
    if (dst.getKind() == ShapeKind.STRING && srcType == byte[].class) {
      return (d, dstOffset, s, srcOffset) -> {
        byte[] value = (byte[]) Platform.getObject(s, srcOffset);
        Platform.putObject(
            d, dstOffset, value == null ? null : new String(value, StandardCharsets.UTF_8));
      };
    }
    if (dstType == byte[].class && src.getKind() == ShapeKind.STRING) {
      return (d, dstOffset, s, srcOffset) -> {
        String value = (String) Platform.getObject(s, srcOffset);
        Platform.putObject(
            d, dstOffset, value == null ? null : value.getBytes(StandardCharsets.UTF_8));
      };
    }
    return null;
  }

  private static Object widen(Object value, Class<?> target) {
    Number number =
        value instanceof Character ? Integer.valueOf((Character) value) : (Number) value;
    if (target == long.class) {
      return number.longValue();
    } else if (target == int.class) {
      return number.intValue();
    } else if (target == double.class) {
      return number.doubleValue();
    } else if (target == float.class) {
      return number.floatValue();
    } else {
      return number.shortValue();
    }
  }
}
