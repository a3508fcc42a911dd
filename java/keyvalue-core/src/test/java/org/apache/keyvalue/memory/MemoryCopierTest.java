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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotSame;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

import java.lang.reflect.Field;
import java.util.Arrays;
import org.testng.annotations.Test;

public class MemoryCopierTest {

  static class Cell {
    byte b;
    short s;
    int i;
    long l;
    double d;
    Object ref;
  }

  private static long offset(String name) throws NoSuchFieldException {
    Field field = Cell.class.getDeclaredField(name);
    return Platform.objectFieldOffset(field);
  }

  @Test
  public void testForSlot() {
    assertSame(MemoryCopier.forSlot(1, false), MemoryCopier.BYTE);
    assertSame(MemoryCopier.forSlot(2, false), MemoryCopier.SHORT);
    assertSame(MemoryCopier.forSlot(4, false), MemoryCopier.INT);
    assertSame(MemoryCopier.forSlot(8, false), MemoryCopier.LONG);
    assertSame(MemoryCopier.forSlot(8, true), MemoryCopier.REFERENCE);
    assertEquals(MemoryCopier.REFERENCE.size(), Platform.REFERENCE_SIZE);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testUnsupportedSlotSize() {
    MemoryCopier.forSlot(3, false);
  }

  @Test
  public void testCopyFieldSlots() throws Exception {
    Cell src = new Cell();
    src.b = -3;
    src.s = 1234;
    src.i = Integer.MIN_VALUE;
    src.l = 0x0102030405060708L;
    src.d = Math.PI;
    src.ref = new Object();
    Cell dst = new Cell();
    MemoryCopier.BYTE.copy(dst, offset("b"), src, offset("b"));
    MemoryCopier.SHORT.copy(dst, offset("s"), src, offset("s"));
    MemoryCopier.INT.copy(dst, offset("i"), src, offset("i"));
    MemoryCopier.LONG.copy(dst, offset("l"), src, offset("l"));
    // A double is moved as its 8 raw bytes.
    MemoryCopier.LONG.copy(dst, offset("d"), src, offset("d"));
    MemoryCopier.REFERENCE.copy(dst, offset("ref"), src, offset("ref"));
    assertEquals(dst.b, -3);
    assertEquals(dst.s, 1234);
    assertEquals(dst.i, Integer.MIN_VALUE);
    assertEquals(dst.l, 0x0102030405060708L);
    assertEquals(dst.d, Math.PI, 0.0);
    assertSame(dst.ref, src.ref);
  }

  @Test
  public void testCopyBetweenFieldAndArray() throws Exception {
    Cell cell = new Cell();
    cell.i = 42;
    int[] storage = new int[1];
    MemoryCopier.INT.copy(storage, Platform.INT_ARRAY_OFFSET, cell, offset("i"));
    assertEquals(storage[0], 42);
    storage[0] = 7;
    MemoryCopier.INT.copy(cell, offset("i"), storage, Platform.INT_ARRAY_OFFSET);
    assertEquals(cell.i, 7);
  }

  @Test
  public void testCopyPrimitiveArray() {
    long[] longs = {1, -2, Long.MAX_VALUE};
    long[] longCopy = (long[]) MemoryCopier.copyArray(longs);
    assertNotSame(longCopy, longs);
    assertTrue(Arrays.equals(longCopy, longs));

    double[] doubles = {0.5, -1.25};
    assertTrue(Arrays.equals((double[]) MemoryCopier.copyArray(doubles), doubles));
    assertEquals(((byte[]) MemoryCopier.copyArray(new byte[0])).length, 0);
  }

  @Test
  public void testCopyReferenceArray() {
    Object shared = new Object();
    Object[] array = {"a", shared, null};
    Object[] copy = (Object[]) MemoryCopier.copyArray(array);
    assertNotSame(copy, array);
    assertSame(copy[1], shared);
    assertEquals(copy, array);
    assertTrue(copy instanceof Object[]);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testCopyArrayRejectsNonArray() {
    MemoryCopier.copyArray("not an array");
  }

  @Test
  public void testSlots() {
    Object storage = Slots.store(int.class, 5);
    assertTrue(storage instanceof int[]);
    assertEquals(Slots.read(storage, Slots.baseOffset(int.class), int.class), 5);
    assertFalse(Slots.isZero(storage, Slots.baseOffset(int.class), int.class));

    Object empty = Slots.allocate(boolean.class);
    assertTrue(Slots.isZero(empty, Slots.baseOffset(boolean.class), boolean.class));
    Object ref = Slots.allocate(String.class);
    assertTrue(Slots.isZero(ref, Slots.baseOffset(String.class), String.class));
    Slots.write(ref, Slots.baseOffset(String.class), String.class, "x");
    assertEquals(((Object[]) ref)[0], "x");

    assertEquals(Slots.primitiveSize(char.class), 2);
    assertEquals(Slots.primitiveSize(double.class), 8);
  }
}
