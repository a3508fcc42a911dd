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

import com.google.common.base.Preconditions;
import java.lang.reflect.Array;

/**
 * Raw copy of a single slot between two (base, offset) addresses. Primitive slots are copied by
 * width without looking at the value type, reference slots go through the GC aware accessors.
 */
public abstract class MemoryCopier {

  public static final MemoryCopier BYTE = new ByteCopier();
  public static final MemoryCopier SHORT = new ShortCopier();
  public static final MemoryCopier INT = new IntCopier();
  public static final MemoryCopier LONG = new LongCopier();
  public static final MemoryCopier REFERENCE = new ReferenceCopier();

  /** Width in bytes of the slot this copier moves. */
  public abstract int size();

  public abstract void copy(Object dst, long dstOffset, Object src, long srcOffset);

  /**
   * Returns the copier for a slot of the given width.
   *
   * @param size slot width in bytes, ignored for references
   * @param reference whether the slot holds a reference
   */
  public static MemoryCopier forSlot(int size, boolean reference) {
    if (reference) {
      return REFERENCE;
    }
    switch (size) {
      case 1:
        return BYTE;
      case 2:
        return SHORT;
      case 4:
        return INT;
      case 8:
        return LONG;
      default:
        throw new IllegalArgumentException("Unsupported slot size " + size);
    }
  }

  /**
   * Copies a whole array into a freshly allocated one of the same component type and length.
   * Primitive arrays are moved as one raw block, reference arrays element by element.
   */
  public static Object copyArray(Object array) {
    Preconditions.checkNotNull(array);
    Class<?> arrayClass = array.getClass();
    Preconditions.checkArgument(arrayClass.isArray(), "%s is not an array", arrayClass);
    int length = Array.getLength(array);
    Object copy = Array.newInstance(arrayClass.getComponentType(), length);
    if (arrayClass.getComponentType().isPrimitive()) {
      long base = Platform.arrayBaseOffset(arrayClass);
      long bytes = (long) length * Platform.arrayIndexScale(arrayClass);
      Platform.copyMemory(array, base, copy, base, bytes);
    } else {
      System.arraycopy(array, 0, copy, 0, length);
    }
    return copy;
  }

  private static final class ByteCopier extends MemoryCopier {
    @Override
    public int size() {
      return 1;
    }

    @Override
    public void copy(Object dst, long dstOffset, Object src, long srcOffset) {
      Platform.putByte(dst, dstOffset, Platform.getByte(src, srcOffset));
    }
  }

  private static final class ShortCopier extends MemoryCopier {
    @Override
    public int size() {
      return 2;
    }

    @Override
    public void copy(Object dst, long dstOffset, Object src, long srcOffset) {
      Platform.putShort(dst, dstOffset, Platform.getShort(src, srcOffset));
    }
  }

  private static final class IntCopier extends MemoryCopier {
    @Override
    public int size() {
      return 4;
    }

    @Override
    public void copy(Object dst, long dstOffset, Object src, long srcOffset) {
      Platform.putInt(dst, dstOffset, Platform.getInt(src, srcOffset));
    }
  }

  private static final class LongCopier extends MemoryCopier {
    @Override
    public int size() {
      return 8;
    }

    @Override
    public void copy(Object dst, long dstOffset, Object src, long srcOffset) {
      Platform.putLong(dst, dstOffset, Platform.getLong(src, srcOffset));
    }
  }

  private static final class ReferenceCopier extends MemoryCopier {
    @Override
    public int size() {
      return Platform.REFERENCE_SIZE;
    }

    @Override
    public void copy(Object dst, long dstOffset, Object src, long srcOffset) {
      Platform.putObject(dst, dstOffset, Platform.getObject(src, srcOffset));
    }
  }
}
