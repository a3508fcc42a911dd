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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonSerializable;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.reflect.TypeToken;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.apache.keyvalue.exception.CompilationException;
import org.apache.keyvalue.type.FieldInfo;
import org.apache.keyvalue.type.Shape;
import org.apache.keyvalue.type.ShapeKind;
import org.apache.keyvalue.type.ShapeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the {@link TransmutedShape} of a type for a tag namespace. Structs get their fields
 * renamed after their tags, arrays and lists of structs get a transmuted element, anything else is
 * serialized as is.
 */
public final class ShapeTransmuter {
  private static final Logger LOG = LoggerFactory.getLogger(ShapeTransmuter.class);

  /** Types whose own Jackson representation is kept even when they look like structs. */
  private static final ImmutableSet<Class<?>> NON_TRANSMUTABLE_TYPES =
      ImmutableSet.of(Instant.class, BigDecimal.class);

  private final ShapeResolver shapeResolver;

  public ShapeTransmuter(ShapeResolver shapeResolver) {
    this.shapeResolver = shapeResolver;
  }

  public TransmutedShape derive(Class<?> type, TagNamespace<?> namespace) {
    return derive(TypeToken.of(type), namespace);
  }

  public TransmutedShape derive(TypeToken<?> type, TagNamespace<?> namespace) {
    TransmutedShape shape = derive(type, namespace, ImmutableList.of());
    LOG.debug("Derived {} for {}", shape, namespace);
    return shape;
  }

  private TransmutedShape derive(
      TypeToken<?> type, TagNamespace<?> namespace, List<TypeToken<?>> ancestors) {
    if (NON_TRANSMUTABLE_TYPES.contains(type.getRawType())) {
      return TransmutedShape.passThrough(type);
    }
    if (ancestors.contains(type)) {
      throw new CompilationException(CompilationException.Reason.CIRCULAR_TYPE_REFERENCE)
          .with("type", type);
    }
    Shape shape = shapeResolver.getShape(type);
    if (shape.getKind() == ShapeKind.STRUCT) {
      return deriveStruct(shape, namespace, append(ancestors, type));
    }
    if (shape.getKind() == ShapeKind.SLICE) {
      TypeToken<?> elementType = shape.getElementType();
      Shape element = shapeResolver.getShape(elementType);
      if (element.getKind() == ShapeKind.STRUCT || element.getKind() == ShapeKind.SLICE) {
        TransmutedShape elementShape = derive(elementType, namespace, append(ancestors, type));
        if (!elementShape.isPassThrough()) {
          return TransmutedShape.slice(type, elementShape);
        }
      }
    }
    return TransmutedShape.passThrough(type);
  }

  private TransmutedShape deriveStruct(
      Shape shape, TagNamespace<?> namespace, List<TypeToken<?>> ancestors) {
    Class<?> cls = shape.getRawType();
    if (hasOwnJsonMapping(cls)) {
      throw new CompilationException(CompilationException.Reason.TRANSMUTING_MARSHALLABLE_TYPE)
          .with("type", cls.getName());
    }
    ImmutableList.Builder<TransmutedField> fields = ImmutableList.builder();
    for (FieldInfo field : shape.getFields()) {
      if (field.isTransient()) {
        throw new CompilationException(CompilationException.Reason.UNEXPORTED_FIELD)
            .with("type", cls.getName())
            .with("field", field.getName());
      }
      String serialName = namespace.tagOf(field.getField());
      if (serialName == null) {
        serialName = field.getName();
      }
      fields.add(
          new TransmutedField(
              serialName, field, derive(field.getType(), namespace, ancestors)));
    }
    return TransmutedShape.struct(shape.getType(), fields.build());
  }

  /** Whether Jackson would serialize {@code cls} through logic the class provides itself. */
  static boolean hasOwnJsonMapping(Class<?> cls) {
    if (JsonSerializable.class.isAssignableFrom(cls)
        || cls.isAnnotationPresent(JsonSerialize.class)
        || cls.isAnnotationPresent(JsonDeserialize.class)) {
      return true;
    }
    for (Method method : cls.getDeclaredMethods()) {
      if (method.isAnnotationPresent(JsonValue.class)
          || method.isAnnotationPresent(JsonCreator.class)) {
        return true;
      }
    }
    for (Constructor<?> constructor : cls.getDeclaredConstructors()) {
      if (constructor.isAnnotationPresent(JsonCreator.class)) {
        return true;
      }
    }
    return false;
  }

  private static List<TypeToken<?>> append(List<TypeToken<?>> ancestors, TypeToken<?> type) {
    List<TypeToken<?>> path = new ArrayList<>(ancestors.size() + 1);
    path.addAll(ancestors);
    path.add(type);
    return path;
  }
}
