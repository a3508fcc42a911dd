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

import com.google.common.collect.ImmutableList;
import com.google.common.reflect.TypeToken;

/**
 * A serialization view of a source type: the same layout, addressed through the same field
 * offsets, but with every field renamed after the tag of a {@link TagNamespace}. Nothing is
 * generated, the descriptor only tells {@link TransmutedViewSerializer} which names to write.
 */
public final class TransmutedShape {
  public enum Kind {
    /** A struct whose fields are renamed. */
    STRUCT,
    /** An array or list whose elements are transmuted. */
    SLICE,
    /** A type serialized as is. */
    PASS_THROUGH
  }

  private final TypeToken<?> sourceType;
  private final Kind kind;
  private final ImmutableList<TransmutedField> fields;
  private final TransmutedShape elementShape;

  private TransmutedShape(
      TypeToken<?> sourceType,
      Kind kind,
      ImmutableList<TransmutedField> fields,
      TransmutedShape elementShape) {
    this.sourceType = sourceType;
    this.kind = kind;
    this.fields = fields;
    this.elementShape = elementShape;
  }

  static TransmutedShape struct(TypeToken<?> type, ImmutableList<TransmutedField> fields) {
    return new TransmutedShape(type, Kind.STRUCT, fields, null);
  }

  static TransmutedShape slice(TypeToken<?> type, TransmutedShape elementShape) {
    return new TransmutedShape(type, Kind.SLICE, ImmutableList.of(), elementShape);
  }

  static TransmutedShape passThrough(TypeToken<?> type) {
    return new TransmutedShape(type, Kind.PASS_THROUGH, ImmutableList.of(), null);
  }

  public TypeToken<?> getSourceType() {
    return sourceType;
  }

  public Class<?> getSourceClass() {
    return sourceType.getRawType();
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isPassThrough() {
    return kind == Kind.PASS_THROUGH;
  }

  public ImmutableList<TransmutedField> getFields() {
    return fields;
  }

  public TransmutedShape getElementShape() {
    return elementShape;
  }

  /** Serialization names of the struct fields, in layout order. */
  public ImmutableList<String> getSerialNames() {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (TransmutedField field : fields) {
      builder.add(field.getSerialName());
    }
    return builder.build();
  }

  @Override
  public String toString() {
    switch (kind) {
      case STRUCT:
        return "TransmutedShape{" + sourceType + ", " + fields + "}";
      case SLICE:
        return "TransmutedShape{" + sourceType + " of " + elementShape + "}";
      default:
        return "TransmutedShape{" + sourceType + "}";
    }
  }
}
