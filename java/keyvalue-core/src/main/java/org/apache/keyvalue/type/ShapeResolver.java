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

import com.github.f4b6a3.ulid.Ulid;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Primitives;
import com.google.common.reflect.TypeToken;
import com.google.protobuf.MessageLite;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.apache.keyvalue.capability.Required;

/**
 * Introspects types into {@link Shape}s and caches them. A shape is computed once per type token
 * and never changes afterwards.
 */
public final class ShapeResolver {
  @SuppressWarnings("serial")
  public static final TypeToken<Map<String, Object>> DYNAMIC_MAP_TYPE =
      new TypeToken<Map<String, Object>>() {};

  /** Non-JDK classes that must stay opaque even though they look like plain structs. */
  public static final ImmutableSet<Class<?>> DEFAULT_LEAF_TYPES = ImmutableSet.of(Ulid.class);

  private static final String[] PLATFORM_PACKAGES = {"java.", "javax.", "jdk.", "sun.", "com.sun."};

  private final ConcurrentHashMap<TypeToken<?>, Shape> shapes = new ConcurrentHashMap<>();
  private final Set<Class<?>> leafTypes;

  public ShapeResolver() {
    this(DEFAULT_LEAF_TYPES);
  }

  public ShapeResolver(Set<Class<?>> leafTypes) {
    this.leafTypes = ImmutableSet.copyOf(leafTypes);
  }

  public Shape getShape(Class<?> cls) {
    return getShape(TypeToken.of(cls));
  }

  public Shape getShape(Type type) {
    return getShape(TypeToken.of(type));
  }

  public Shape getShape(TypeToken<?> type) {
    Shape shape = shapes.get(type);
    if (shape == null) {
      // Built outside computeIfAbsent: struct introspection is pure and may be repeated.
      shape = buildShape(type);
      Shape previous = shapes.putIfAbsent(type, shape);
      if (previous != null) {
        shape = previous;
      }
    }
    return shape;
  }

  /** Whether {@code cls} is a class whose fields can be copied individually. */
  public boolean isStruct(Class<?> cls) {
    if (cls.isPrimitive()
        || cls.isArray()
        || cls.isInterface()
        || cls.isEnum()
        || cls.isRecord()
        || cls.isAnnotation()
        || cls.isSynthetic()
        || Modifier.isAbstract(cls.getModifiers())) {
      return false;
    }
    if (leafTypes.contains(cls)
        || cls == Required.class
        || MessageLite.class.isAssignableFrom(cls)) {
      return false;
    }
    String name = cls.getName();
    for (String prefix : PLATFORM_PACKAGES) {
      if (name.startsWith(prefix)) {
        return false;
      }
    }
    return true;
  }

  private Shape buildShape(TypeToken<?> type) {
    Class<?> raw = type.getRawType();
    ShapeKind kind;
    TypeToken<?> elementType = null;
    ImmutableList<FieldInfo> fields = ImmutableList.of();
    ImmutableMap<String, FieldInfo> fieldsByName = ImmutableMap.of();
    Supplier<Object> instantiator = null;
    if (raw.isPrimitive()) {
      kind = ShapeKind.PRIMITIVE;
    } else if (Primitives.isWrapperType(raw) && raw != Void.class) {
      kind = ShapeKind.POINTER;
      elementType = TypeToken.of(Primitives.unwrap(raw));
    } else if (raw == String.class) {
      kind = ShapeKind.STRING;
    } else if (raw.isEnum()) {
      kind = ShapeKind.ENUM;
    } else if (raw == Optional.class) {
      kind = ShapeKind.OPTIONAL;
      elementType = type.resolveType(Optional.class.getTypeParameters()[0]);
    } else if (raw == Required.class) {
      kind = ShapeKind.REQUIRED;
      elementType = type.resolveType(Required.class.getTypeParameters()[0]);
    } else if (raw.isArray()) {
      kind = ShapeKind.SLICE;
      elementType = type.getComponentType();
    } else if (List.class.isAssignableFrom(raw)) {
      kind = ShapeKind.SLICE;
      elementType = type.resolveType(List.class.getTypeParameters()[0]);
    } else if (type.equals(DYNAMIC_MAP_TYPE)) {
      kind = ShapeKind.DYNAMIC_MAP;
    } else if (isStruct(raw)) {
      kind = ShapeKind.STRUCT;
      fields = buildFields(type);
      Map<String, FieldInfo> byName = new LinkedHashMap<>();
      for (FieldInfo field : fields) {
        byName.put(field.getName(), field);
      }
      fieldsByName = ImmutableMap.copyOf(byName);
      instantiator = Instantiators.of(raw);
    } else {
      kind = ShapeKind.LEAF;
    }
    return new Shape(type, kind, elementType, fields, fieldsByName, instantiator);
  }

  private static ImmutableList<FieldInfo> buildFields(TypeToken<?> type) {
    List<Class<?>> hierarchy = new ArrayList<>();
    for (Class<?> c = type.getRawType(); c != null && c != Object.class; c = c.getSuperclass()) {
      hierarchy.add(0, c);
    }
    // A subclass field shadows a superclass field of the same name.
    Map<String, FieldInfo> fields = new LinkedHashMap<>();
    for (Class<?> c : hierarchy) {
      for (Field field : c.getDeclaredFields()) {
        if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
          continue;
        }
        fields.remove(field.getName());
        fields.put(
            field.getName(), new FieldInfo(field, type.resolveType(field.getGenericType())));
      }
    }
    return ImmutableList.copyOf(fields.values());
  }
}
