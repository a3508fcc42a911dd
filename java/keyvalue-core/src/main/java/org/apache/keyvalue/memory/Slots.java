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

package org.apache.keyvalue.memory;

import java.lang.reflect.Array;

/**
 * Typed access to a single slot. Values cross this boundary boxed; storage for a value that has no
 * home yet is a one-element array of its raw type addressed at the array base offset.
 */
public final class Slots {
  private Slots() {}

  /** Allocates fresh storage for one value of {@code type}. */
  public static Object allocate(Class<?> type) {
    return type.isPrimitive() ? Array.newInstance(type, 1) : new Object[1];
  }

  /** Allocates fresh storage for {@code type} already holding {@code value}. */
  public static Object store(Class<?> type, Object value) {
    Object storage = allocate(type);
    write(storage, baseOffset(type), type, value);
    return storage;
  }

  /** Offset of the single slot of storage returned by {@link #allocate(Class)}. */
  public static long baseOffset(Class<?> type) {
    if (!type.isPrimitive()) {
      return Platform.OBJECT_ARRAY_OFFSET;
    }
    if (type == int.class) {
      return Platform.INT_ARRAY_OFFSET;
    } else if (type == long.class) {
      return Platform.LONG_ARRAY_OFFSET;
    } else if (type == double.class) {
      return Platform.DOUBLE_ARRAY_OFFSET;
    } else if (type == float.class) {
      return Platform.FLOAT_ARRAY_OFFSET;
    } else if (type == boolean.class) {
      return Platform.BOOLEAN_ARRAY_OFFSET;
    } else if (type == byte.class) {
      return Platform.BYTE_ARRAY_OFFSET;
    } else if (type == short.class) {
      return Platform.SHORT_ARRAY_OFFSET;
    } else {
      return Platform.CHAR_ARRAY_OFFSET;
    }
  }

  /** Reads the slot, boxing primitives. */
  public static Object read(Object base, long offset, Class<?> type) {
    if (!type.isPrimitive()) {
      return Platform.getObject(base, offset);
    }
    if (type == int.class) {
      return Platform.getInt(base, offset);
    } else if (type == long.class) {
      return Platform.getLong(base, offset);
    } else if (type == double.class) {
      return Platform.getDouble(base, offset);
    } else if (type == float.class) {
      return Platform.getFloat(base, offset);
    } else if (type == boolean.class) {
      return Platform.getBoolean(base, offset);
    } else if (type == byte.class) {
      return Platform.getByte(base, offset);
    } else if (type == short.class) {
      return Platform.getShort(base, offset);
    } else {
      return Platform.getChar(base, offset);
    }
  }

  /** Writes the slot. Primitive slots expect the exact wrapper type and reject null. */
  public static void write(Object base, long offset, Class<?> type, Object value) {
    if (!type.isPrimitive()) {
      Platform.putObject(base, offset, value);
    } else if (type == int.class) {
      Platform.putInt(base, offset, (Integer) value);
    } else if (type == long.class) {
      Platform.putLong(base, offset, (Long) value);
    } else if (type == double.class) {
      Platform.putDouble(base, offset, (Double) value);
    } else if (type == float.class) {
      Platform.putFloat(base, offset, (Float) value);
    } else if (type == boolean.class) {
      Platform.putBoolean(base, offset, (Boolean) value);
    } else if (type == byte.class) {
      Platform.putByte(base, offset, (Byte) value);
    } else if (type == short.class) {
      Platform.putShort(base, offset, (Short) value);
    } else {
      Platform.putChar(base, offset, (Character) value);
    }
  }

  /** Whether the slot holds its type's zero value: null, false or numeric zero. */
  public static boolean isZero(Object base, long offset, Class<?> type) {
    if (!type.isPrimitive()) {
      return Platform.getObject(base, offset) == null;
    }
    if (type == boolean.class) {
      return !Platform.getBoolean(base, offset);
    } else if (type == double.class) {
      return Platform.getDouble(base, offset) == 0d;
    } else if (type == float.class) {
      return Platform.getFloat(base, offset) == 0f;
    }
    switch (primitiveSize(type)) {
      case 1:
        return Platform.getByte(base, offset) == 0;
      case 2:
        return Platform.getShort(base, offset) == 0;
      case 4:
        return Platform.getInt(base, offset) == 0;
      default:
        return Platform.getLong(base, offset) == 0;
    }
  }

  /** Width in bytes of a primitive type. */
  public static int primitiveSize(Class<?> type) {
    if (type == long.class || type == double.class) {
      return 8;
    } else if (type == int.class || type == float.class) {
      return 4;
    } else if (type == short.class || type == char.class) {
      return 2;
    } else if (type == byte.class || type == boolean.class) {
      return 1;
    }
    throw new IllegalArgumentException(type + " is not a primitive type");
  }
}
