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

import org.apache.keyvalue.type.Shape;

/**
 * Copies between two struct classes with a compiled {@link StructCopier}.
 *
 * @param <D> destination struct
 * @param <S> source struct
 */
public final class TypedCopier<D, S> {
  private final Shape dstShape;
  private final StructCopier copier;

  public TypedCopier(Shape dstShape, StructCopier copier) {
    this.dstShape = dstShape;
    this.copier = copier;
  }

  /** Allocates a new destination and copies {@code src} into it; null maps to null. */
  @SuppressWarnings("unchecked")
  public D copy(S src) {
    if (src == null) {
      return null;
    }
    D dst = (D) dstShape.newInstance();
    copier.copy(dst, src);
    return dst;
  }

  /** Copies {@code src} into an existing destination, fields absent from the source are kept. */
  public void copyInto(D dst, S src) {
    copier.copy(dst, src);
  }

  public StructCopier getStructCopier() {
    return copier;
  }
}
