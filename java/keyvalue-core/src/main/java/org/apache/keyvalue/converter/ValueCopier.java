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

import com.google.common.base.Preconditions;
import com.google.common.reflect.TypeToken;
import org.apache.keyvalue.memory.Slots;

/**
 * Converts single values between two types through a resolved {@link Converter}. The source is
 * placed in scratch storage and the result read back from a fresh destination slot, so any
 * supported pair works, not only structs.
 *
 * @param <D> destination type
 * @param <S> source type
 */
public final class ValueCopier<D, S> {
  private final TypeToken<D> dstType;
  private final TypeToken<S> srcType;
  private final Class<?> dstRaw;
  private final Class<?> srcRaw;
  private final long dstBase;
  private final long srcBase;
  private final Converter converter;

  public ValueCopier(TypeToken<D> dstType, TypeToken<S> srcType, Converter converter) {
    this.dstType = dstType;
    this.srcType = srcType;
    this.dstRaw = dstType.getRawType();
    this.srcRaw = srcType.getRawType();
    this.dstBase = Slots.baseOffset(dstRaw);
    this.srcBase = Slots.baseOffset(srcRaw);
    this.converter = converter;
  }

  /**
   * Returns {@code value} converted to the destination type. Sources the rules skip, a null
   * reference for example, yield the destination's zero value. A primitive source type rejects
   * null.
   */
  @SuppressWarnings("unchecked")
  public D copy(S value) {
    if (srcRaw.isPrimitive()) {
      Preconditions.checkNotNull(value, "null value for primitive source type %s", srcRaw);
    }
    Object dst = Slots.allocate(dstRaw);
    converter.convert(dst, dstBase, Slots.store(srcRaw, value), srcBase);
    return (D) Slots.read(dst, dstBase, dstRaw);
  }

  public TypeToken<D> getDstType() {
    return dstType;
  }

  public TypeToken<S> getSrcType() {
    return srcType;
  }
}
