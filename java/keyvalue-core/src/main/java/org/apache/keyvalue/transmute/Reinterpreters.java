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

package org.apache.keyvalue.transmute;

import com.google.common.base.Preconditions;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.keyvalue.memory.MemoryCopier;

/**
 * Reinterpretation strategies for a {@link TransmutedShape}. All of them serialize to the same JSON
 * with the same {@code ObjectMapper}:
 *
 * <ul>
 *   <li>{@link #copying} builds a detached tree of maps and lists, the safe default;
 *   <li>{@link #checked} returns a zero-copy {@link TransmutedView} after checking the value's
 *       class;
 *   <li>{@link #unchecked} returns the view without any check. A value of another layout makes the
 *       serializer read arbitrary offsets, so callers must guarantee the type.
 * </ul>
 */
public final class Reinterpreters {
  private Reinterpreters() {}

  public static Reinterpreter copying(TransmutedShape shape) {
    Preconditions.checkNotNull(shape);
    return value -> {
      if (value != null) {
        checkType(shape, value);
      }
      return copy(shape, value);
    };
  }

  public static Reinterpreter checked(TransmutedShape shape) {
    Preconditions.checkNotNull(shape);
    return value -> {
      Preconditions.checkNotNull(value);
      checkType(shape, value);
      return new TransmutedView(shape, value);
    };
  }

  public static Reinterpreter unchecked(TransmutedShape shape) {
    Preconditions.checkNotNull(shape);
    return value -> new TransmutedView(shape, value);
  }

  private static void checkType(TransmutedShape shape, Object value) {
    Class<?> expected = shape.getSourceClass();
    boolean matches =
        shape.getKind() == TransmutedShape.Kind.STRUCT
            ? value.getClass() == expected
            : expected.isInstance(value);
    Preconditions.checkArgument(
        matches, "%s cannot be reinterpreted as %s", value.getClass(), shape.getSourceType());
  }

  private static Object copy(TransmutedShape shape, Object value) {
    if (value == null) {
      return null;
    }
    switch (shape.getKind()) {
      case STRUCT:
        Map<String, Object> struct = new LinkedHashMap<>();
        for (TransmutedField field : shape.getFields()) {
          struct.put(field.getSerialName(), copy(field.getShape(), field.read(value)));
        }
        return struct;
      case SLICE:
        List<Object> slice = new ArrayList<>();
        if (value instanceof Collection) {
          for (Object element : (Collection<?>) value) {
            slice.add(copy(shape.getElementShape(), element));
          }
        } else {
          int length = Array.getLength(value);
          for (int i = 0; i < length; i++) {
            slice.add(copy(shape.getElementShape(), Array.get(value, i)));
          }
        }
        return slice;
      default:
        return copyLeaf(value);
    }
  }

  private static Object copyLeaf(Object value) {
    if (value.getClass().isArray()) {
      return MemoryCopier.copyArray(value);
    }
    if (value instanceof List) {
      return new ArrayList<>((List<?>) value);
    }
    if (value instanceof Map) {
      return new LinkedHashMap<>((Map<?, ?>) value);
    }
    return value;
  }
}
