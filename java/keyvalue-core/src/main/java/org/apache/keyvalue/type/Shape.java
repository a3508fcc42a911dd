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

package org.apache.keyvalue.type;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.reflect.TypeToken;
import java.util.function.Supplier;
import org.apache.keyvalue.memory.MemoryCopier;
import org.apache.keyvalue.memory.Platform;
import org.apache.keyvalue.memory.Slots;

/**
 * Immutable description of a type as seen by the converters: its kind, slot width, element type
 * for wrappers and slices, and for structs the ordered field list. Field types are kept as type
 * tokens, nested shapes are resolved on demand so self-referencing classes can be described.
 */
public final class Shape {
  private final TypeToken<?> type;
  private final ShapeKind kind;
  private final int size;
  private final TypeToken<?> elementType;
  private final ImmutableList<FieldInfo> fields;
  private final ImmutableMap<String, FieldInfo> fieldsByName;
  private final Supplier<Object> instantiator;

  Shape(
      TypeToken<?> type,
      ShapeKind kind,
      TypeToken<?> elementType,
      ImmutableList<FieldInfo> fields,
      ImmutableMap<String, FieldInfo> fieldsByName,
      Supplier<Object> instantiator) {
    this.type = type;
    this.kind = kind;
    Class<?> rawType = type.getRawType();
    this.size = rawType.isPrimitive() ? Slots.primitiveSize(rawType) : Platform.REFERENCE_SIZE;
    this.elementType = elementType;
    this.fields = fields;
    this.fieldsByName = fieldsByName;
    this.instantiator = instantiator;
  }

  public TypeToken<?> getType() {
    return type;
  }

  public Class<?> getRawType() {
    return type.getRawType();
  }

  public ShapeKind getKind() {
    return kind;
  }

  /** Width in bytes of a slot holding a value of this shape. */
  public int getSize() {
    return size;
  }

  public boolean isPrimitive() {
    return kind == ShapeKind.PRIMITIVE;
  }

  public boolean isReference() {
    return kind != ShapeKind.PRIMITIVE;
  }

  public boolean isArray() {
    return type.getRawType().isArray();
  }

  /**
   * Pointee of a {@link ShapeKind#POINTER}, element of a {@link ShapeKind#SLICE}, wrapped type of
   * {@link ShapeKind#OPTIONAL} and {@link ShapeKind#REQUIRED}; null for other kinds.
   */
  public TypeToken<?> getElementType() {
    return elementType;
  }

  /** Fields of a struct, superclass fields first, declaration order within a class. */
  public ImmutableList<FieldInfo> getFields() {
    return fields;
  }

  public FieldInfo getField(String name) {
    return fieldsByName.get(name);
  }

  /** Creates an empty struct instance. */
  public Object newInstance() {
    if (instantiator == null) {
      throw new UnsupportedOperationException(type + " is not a struct");
    }
    return instantiator.get();
  }

  public MemoryCopier slotCopier() {
    return MemoryCopier.forSlot(size, isReference());
  }

  /** Simple name for error attributes, generic arguments included. */
  public String getName() {
    return type.getRawType().isArray() || type.getType() instanceof Class
        ? type.getRawType().getSimpleName()
        : type.toString();
  }

  @Override
  public String toString() {
    return "Shape{" + type + ", " + kind + "}";
  }
}
