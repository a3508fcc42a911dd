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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Primitives;
import com.google.common.reflect.TypeToken;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.apache.keyvalue.capability.Copyable;
import org.apache.keyvalue.capability.Required;
import org.apache.keyvalue.exception.CompilationException;
import org.apache.keyvalue.exception.ConversionException;
import org.apache.keyvalue.memory.MemoryCopier;
import org.apache.keyvalue.memory.Platform;
import org.apache.keyvalue.memory.Slots;
import org.apache.keyvalue.type.FieldInfo;
import org.apache.keyvalue.type.Shape;
import org.apache.keyvalue.type.ShapeKind;
import org.apache.keyvalue.type.ShapeResolver;

/**
 * Picks the conversion rule for a (destination, source) shape pair and builds its {@link
 * Converter}. Rules are tried in a fixed priority order and the first one that applies wins:
 *
 * <ol>
 *   <li>identical types: raw slot copy
 *   <li>enum destination from a string or another enum: checked against the declared constants
 *   <li>destination is a supertype of the source: reference copy
 *   <li>conversion by value: primitive widening, enum name, UTF-8 bytes and strings
 *   <li>domain pairs, see {@link DomainConversions}, then registered {@link ScalarConversions}
 *   <li>{@link Copyable} source
 *   <li>boxed to boxed
 *   <li>array or list to array or list
 *   <li>{@link Optional} source into a reference
 *   <li>{@link Optional} destination from a reference
 *   <li>{@link Optional} destination from a primitive
 *   <li>{@link Required} source
 *   <li>boxed destination from an unboxed source
 *   <li>boxed source into an unboxed destination
 *   <li>struct to struct, through a nested {@link StructCopier}
 *   <li>struct to {@code Map<String, Object>}
 *   <li>{@code Map<String, Object>} to struct
 * </ol>
 *
 * Anything else is an unsupported pair. Resolution recurses into element and field types, so its
 * depth is the nesting depth of the two shapes.
 */
public final class ConverterResolver {
  private final ShapeResolver shapeResolver;
  private final ScalarConversions scalarConversions;
  private final StructCopierCompiler compiler;

  ConverterResolver(
      ShapeResolver shapeResolver,
      ScalarConversions scalarConversions,
      StructCopierCompiler compiler) {
    this.shapeResolver = shapeResolver;
    this.scalarConversions = scalarConversions;
    this.compiler = compiler;
  }

  public Converter resolve(TypeToken<?> dst, TypeToken<?> src) {
    return resolve(shapeResolver.getShape(dst), shapeResolver.getShape(src), ImmutableSet.of());
  }

  /**
   * Resolves the converter for a pair.
   *
   * @param structPath struct pairs whose copier is being compiled by the callers, used to reject
   *     recursive pairs
   */
  Converter resolve(Shape dst, Shape src, Set<TypePair> structPath) {
    ShapeKind dstKind = dst.getKind();
    ShapeKind srcKind = src.getKind();
    if (dst.getType().equals(src.getType())) {
      MemoryCopier copier = dst.slotCopier();
      return copier::copy;
    }
    if (dstKind == ShapeKind.ENUM && (srcKind == ShapeKind.STRING || srcKind == ShapeKind.ENUM)) {
      return closedEnumConverter(dst);
    }
    if (dst.isReference() && src.isReference() && dst.getType().isSupertypeOf(src.getType())) {
      return MemoryCopier.REFERENCE::copy;
    }
    Converter converter = ValueConversions.forPair(dst, src);
    if (converter != null) {
      return converter;
    }
    converter = DomainConversions.forPair(dst.getRawType(), src.getRawType());
    if (converter != null) {
      return converter;
    }
    ScalarConversion<Object, Object> scalar =
        scalarConversions.get(dst.getRawType(), src.getRawType());
    if (scalar != null) {
      return scalarConverter(dst, src, scalar);
    }
    if (Copyable.class.isAssignableFrom(src.getRawType())) {
      return copyableConverter(dst, src);
    }
    if (dstKind == ShapeKind.POINTER && srcKind == ShapeKind.POINTER) {
      return pointerConverter(dst, src, structPath);
    }
    if (dstKind == ShapeKind.SLICE && srcKind == ShapeKind.SLICE) {
      return sliceConverter(dst, src, structPath);
    }
    if (srcKind == ShapeKind.OPTIONAL && dst.isReference()) {
      return fromOptionalConverter(dst, src, structPath);
    }
    if (dstKind == ShapeKind.OPTIONAL && src.isReference()) {
      return toOptionalConverter(dst, src, structPath);
    }
    if (dstKind == ShapeKind.OPTIONAL) {
      return primitiveToOptionalConverter(dst, src, structPath);
    }
    if (srcKind == ShapeKind.REQUIRED) {
      return requiredConverter(dst, src, structPath);
    }
    if (dstKind == ShapeKind.POINTER) {
      return boxingConverter(dst, src, structPath);
    }
    if (srcKind == ShapeKind.POINTER) {
      return unboxingConverter(dst, src, structPath);
    }
    if (dstKind == ShapeKind.STRUCT && srcKind == ShapeKind.STRUCT) {
      return structConverter(dst, src, structPath);
    }
    if (dstKind == ShapeKind.DYNAMIC_MAP && srcKind == ShapeKind.STRUCT) {
      return structToMapConverter(src);
    }
    if (dstKind == ShapeKind.STRUCT && srcKind == ShapeKind.DYNAMIC_MAP) {
      return mapToStructConverter(dst);
    }
    throw new CompilationException(CompilationException.Reason.UNSUPPORTED_TYPE_PAIR)
        .with("srcType", src.getName())
        .with("dstType", dst.getName());
  }

  private Converter resolveElement(TypeToken<?> dst, TypeToken<?> src, Set<TypePair> structPath) {
    return resolve(shapeResolver.getShape(dst), shapeResolver.getShape(src), structPath);
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static Converter closedEnumConverter(Shape dst) {
    Class<? extends Enum> enumType = (Class<? extends Enum>) dst.getRawType();
    ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
    for (Enum constant : enumType.getEnumConstants()) {
      builder.put(constant.name(), constant);
    }
    ImmutableMap<String, Object> constants = builder.build();
    String dstName = dst.getName();
    return (d, dstOffset, s, srcOffset) -> {
      Object value = Platform.getObject(s, srcOffset);
      if (value == null) {
        return;
      }
      String name = value instanceof Enum ? ((Enum<?>) value).name() : (String) value;
      Object constant = constants.get(name);
      if (constant == null) {
        throw new ConversionException(ConversionException.Reason.BAD_ENUM_VALUE)
            .with("value", name)
            .with("dstType", dstName);
      }
      Platform.putObject(d, dstOffset, constant);
    };
  }

  private static Converter scalarConverter(
      Shape dst, Shape src, ScalarConversion<Object, Object> scalar) {
    Class<?> dstType = dst.getRawType();
    Class<?> srcType = src.getRawType();
    return (d, dstOffset, s, srcOffset) -> {
      Object value = Slots.read(s, srcOffset, srcType);
      if (value == null) {
        return;
      }
      Object converted;
      try {
        converted = scalar.convert(value);
      } catch (Exception e) {
        throw new ConversionException(ConversionException.Reason.CONVERSION_FAILED, e)
            .with("srcType", srcType.getSimpleName())
            .with("dstType", dstType.getSimpleName());
      }
      Slots.write(d, dstOffset, dstType, converted);
    };
  }

  private static Converter copyableConverter(Shape dst, Shape src) {
    Class<?> srcType = src.getRawType();
    TypeToken<?> dstType = dst.getType();
    if (srcType.isInterface()
        || Modifier.isAbstract(srcType.getModifiers())
        || !((Copyable) Platform.newInstance(srcType)).canCopyTo(dstType)) {
      throw new CompilationException(CompilationException.Reason.CANNOT_COPY)
          .with("srcType", src.getName())
          .with("dstType", dst.getName());
    }
    Class<?> dstRaw = dst.getRawType();
    return (d, dstOffset, s, srcOffset) -> {
      Copyable value = (Copyable) Platform.getObject(s, srcOffset);
      if (value != null) {
        Slots.write(d, dstOffset, dstRaw, value.copyTo(dstType));
      }
    };
  }

  private Converter pointerConverter(Shape dst, Shape src, Set<TypePair> structPath) {
    Class<?> dstElement = dst.getElementType().getRawType();
    Class<?> srcElement = src.getElementType().getRawType();
    Converter element = resolveElement(dst.getElementType(), src.getElementType(), structPath);
    long dstBase = Slots.baseOffset(dstElement);
    long srcBase = Slots.baseOffset(srcElement);
    return (d, dstOffset, s, srcOffset) -> {
      Object pointee = Platform.getObject(s, srcOffset);
      if (pointee == null) {
        return;
      }
      Object storage = Slots.allocate(dstElement);
      element.convert(storage, dstBase, Slots.store(srcElement, pointee), srcBase);
      Platform.putObject(d, dstOffset, Slots.read(storage, dstBase, dstElement));
    };
  }

  private Converter sliceConverter(Shape dst, Shape src, Set<TypePair> structPath) {
    Converter element = resolveElement(dst.getElementType(), src.getElementType(), structPath);
    boolean srcIsArray = src.isArray();
    Class<?> srcArrayType = srcIsArray ? src.getRawType() : Object[].class;
    long srcBase = Platform.arrayBaseOffset(srcArrayType);
    long srcScale = Platform.arrayIndexScale(srcArrayType);
    boolean dstIsArray = dst.isArray();
    Class<?> dstArrayType = dstIsArray ? dst.getRawType() : Object[].class;
    Class<?> dstComponent = dstArrayType.getComponentType();
    long dstBase = Platform.arrayBaseOffset(dstArrayType);
    long dstScale = Platform.arrayIndexScale(dstArrayType);
    Supplier<List<Object>> listFactory = dstIsArray ? null : listFactory(dst, src);
    return (d, dstOffset, s, srcOffset) -> {
      Object srcSlice = Platform.getObject(s, srcOffset);
      if (srcSlice == null) {
        return;
      }
      Object srcArray = srcIsArray ? srcSlice : ((Collection<?>) srcSlice).toArray();
      int length = Array.getLength(srcArray);
      Object dstArray = Array.newInstance(dstComponent, length);
      long srcAddress = srcBase;
      long dstAddress = dstBase;
      for (int i = 0; i < length; i++) {
        element.convert(dstArray, dstAddress, srcArray, srcAddress);
        srcAddress += srcScale;
        dstAddress += dstScale;
      }
      if (dstIsArray) {
        Platform.putObject(d, dstOffset, dstArray);
      } else {
        List<Object> list = listFactory.get();
        Collections.addAll(list, (Object[]) dstArray);
        Platform.putObject(d, dstOffset, list);
      }
    };
  }

  /**
   * Picks how destination lists are created. The created list must be an instance of the
   * declared type, otherwise the field would hold a value its type does not admit.
   */
  @SuppressWarnings("unchecked")
  private static Supplier<List<Object>> listFactory(Shape dst, Shape src) {
    Class<?> listType = dst.getRawType();
    if (listType.isAssignableFrom(ArrayList.class)) {
      return ArrayList::new;
    }
    if (!listType.isInterface() && !Modifier.isAbstract(listType.getModifiers())) {
      Constructor<?> constructor = null;
      try {
        constructor = listType.getDeclaredConstructor();
        if (!Modifier.isPublic(constructor.getModifiers())
            || !Modifier.isPublic(listType.getModifiers())) {
          constructor.setAccessible(true);
        }
      } catch (NoSuchMethodException e) {
        constructor = null;
      } catch (RuntimeException e) {
        // InaccessibleObjectException, the class lives in a module that is not open to us.
        constructor = null;
      }
      if (constructor != null) {
        Constructor<?> ctor = constructor;
        return () -> {
          try {
            return (List<Object>) ctor.newInstance();
          } catch (InvocationTargetException e) {
            throw new ConversionException(
                    ConversionException.Reason.CONVERSION_FAILED, e.getCause())
                .with("dstType", listType.getSimpleName());
          } catch (ReflectiveOperationException e) {
            throw new ConversionException(ConversionException.Reason.CONVERSION_FAILED, e)
                .with("dstType", listType.getSimpleName());
          }
        };
      }
    }
    throw new CompilationException(CompilationException.Reason.UNSUPPORTED_TYPE_PAIR)
        .with("srcType", src.getName())
        .with("dstType", dst.getName());
  }

  private Converter fromOptionalConverter(Shape dst, Shape src, Set<TypePair> structPath) {
    TypeToken<?> srcElement = src.getElementType();
    if (dst.getRawType() == Timestamp.class && srcElement.getRawType() == Instant.class) {
      return (d, dstOffset, s, srcOffset) -> {
        Optional<?> value = (Optional<?>) Platform.getObject(s, srcOffset);
        if (value != null && value.isPresent()) {
          Platform.putObject(d, dstOffset, DomainConversions.toTimestamp((Instant) value.get()));
        }
      };
    }
    if (dst.getKind() == ShapeKind.OPTIONAL) {
      Converter element = resolveElement(dst.getElementType(), srcElement, structPath);
      return (d, dstOffset, s, srcOffset) -> {
        Optional<?> value = (Optional<?>) Platform.getObject(s, srcOffset);
        if (value == null || !value.isPresent()) {
          Platform.putObject(d, dstOffset, Optional.empty());
          return;
        }
        Object[] storage = new Object[1];
        element.convert(
            storage,
            Platform.OBJECT_ARRAY_OFFSET,
            new Object[] {value.get()},
            Platform.OBJECT_ARRAY_OFFSET);
        Platform.putObject(d, dstOffset, Optional.ofNullable(storage[0]));
      };
    }
    Converter element = resolveElement(dst.getType(), srcElement, structPath);
    return (d, dstOffset, s, srcOffset) -> {
      Optional<?> value = (Optional<?>) Platform.getObject(s, srcOffset);
      if (value != null && value.isPresent()) {
        element.convert(d, dstOffset, new Object[] {value.get()}, Platform.OBJECT_ARRAY_OFFSET);
      }
    };
  }

  private Converter toOptionalConverter(Shape dst, Shape src, Set<TypePair> structPath) {
    TypeToken<?> dstElement = dst.getElementType();
    if (src.getRawType() == Timestamp.class && dstElement.getRawType() == Instant.class) {
      return (d, dstOffset, s, srcOffset) -> {
        Timestamp value = (Timestamp) Platform.getObject(s, srcOffset);
        Platform.putObject(
            d,
            dstOffset,
            value != null && Timestamps.isValid(value)
                ? Optional.of(DomainConversions.toInstant(value))
                : Optional.empty());
      };
    }
    Converter element = resolveElement(dstElement, src.getType(), structPath);
    return (d, dstOffset, s, srcOffset) -> {
      if (Platform.getObject(s, srcOffset) == null) {
        Platform.putObject(d, dstOffset, Optional.empty());
        return;
      }
      Object[] storage = new Object[1];
      element.convert(storage, Platform.OBJECT_ARRAY_OFFSET, s, srcOffset);
      Platform.putObject(d, dstOffset, Optional.ofNullable(storage[0]));
    };
  }

  private Converter primitiveToOptionalConverter(Shape dst, Shape src, Set<TypePair> structPath) {
    Converter element = resolveElement(dst.getElementType(), src.getType(), structPath);
    Class<?> srcType = src.getRawType();
    return (d, dstOffset, s, srcOffset) -> {
      if (Slots.isZero(s, srcOffset, srcType)) {
        Platform.putObject(d, dstOffset, Optional.empty());
        return;
      }
      Object[] storage = new Object[1];
      element.convert(storage, Platform.OBJECT_ARRAY_OFFSET, s, srcOffset);
      Platform.putObject(d, dstOffset, Optional.ofNullable(storage[0]));
    };
  }

  private Converter requiredConverter(Shape dst, Shape src, Set<TypePair> structPath) {
    Converter element = resolveElement(dst.getType(), src.getElementType(), structPath);
    String srcName = src.getName();
    return (d, dstOffset, s, srcOffset) -> {
      Required<?> value = (Required<?>) Platform.getObject(s, srcOffset);
      if (value == null || !value.hasValue()) {
        throw new ConversionException(ConversionException.Reason.REQUIRED_VALUE_MISSING)
            .with("srcType", srcName);
      }
      element.convert(d, dstOffset, new Object[] {value.get()}, Platform.OBJECT_ARRAY_OFFSET);
    };
  }

  private Converter boxingConverter(Shape dst, Shape src, Set<TypePair> structPath) {
    Class<?> dstElement = dst.getElementType().getRawType();
    Converter element = resolveElement(dst.getElementType(), src.getType(), structPath);
    long dstBase = Slots.baseOffset(dstElement);
    return (d, dstOffset, s, srcOffset) -> {
      Object storage = Slots.allocate(dstElement);
      element.convert(storage, dstBase, s, srcOffset);
      Platform.putObject(d, dstOffset, Slots.read(storage, dstBase, dstElement));
    };
  }

  private Converter unboxingConverter(Shape dst, Shape src, Set<TypePair> structPath) {
    Class<?> srcElement = src.getElementType().getRawType();
    Converter element = resolveElement(dst.getType(), src.getElementType(), structPath);
    long srcBase = Slots.baseOffset(srcElement);
    return (d, dstOffset, s, srcOffset) -> {
      Object pointee = Platform.getObject(s, srcOffset);
      // A null source leaves the destination at its zero value.
      if (pointee != null) {
        element.convert(d, dstOffset, Slots.store(srcElement, pointee), srcBase);
      }
    };
  }

  private Converter structConverter(Shape dst, Shape src, Set<TypePair> structPath) {
    StructCopier copier = compiler.getOrCompile(dst, src, CopierOptions.DEFAULT, structPath);
    return (d, dstOffset, s, srcOffset) -> {
      Object value = Platform.getObject(s, srcOffset);
      if (value == null) {
        return;
      }
      Object target = dst.newInstance();
      copier.copy(target, value);
      Platform.putObject(d, dstOffset, target);
    };
  }

  private static Converter structToMapConverter(Shape src) {
    ImmutableList<FieldInfo> fields = eligibleFields(src);
    return (d, dstOffset, s, srcOffset) -> {
      Object value = Platform.getObject(s, srcOffset);
      if (value == null) {
        return;
      }
      @SuppressWarnings("unchecked")
      Map<String, Object> map = (Map<String, Object>) Platform.getObject(d, dstOffset);
      if (map == null) {
        map = new LinkedHashMap<>();
        Platform.putObject(d, dstOffset, map);
      }
      for (FieldInfo field : fields) {
        map.put(field.getKey(), field.get(value));
      }
    };
  }

  private static Converter mapToStructConverter(Shape dst) {
    ImmutableList<FieldInfo> fields = eligibleFields(dst);
    return (d, dstOffset, s, srcOffset) -> {
      Map<?, ?> map = (Map<?, ?>) Platform.getObject(s, srcOffset);
      if (map == null) {
        map = Collections.emptyMap();
      }
      Object target = dst.newInstance();
      for (FieldInfo field : fields) {
        String key = field.getKey();
        if (!map.containsKey(key)) {
          throw new ConversionException(ConversionException.Reason.MAP_KEY_MISSING)
              .with("key", key);
        }
        Object value = map.get(key);
        Class<?> fieldType = field.getRawType();
        boolean assignable =
            value == null ? !fieldType.isPrimitive() : Primitives.wrap(fieldType).isInstance(value);
        if (!assignable) {
          throw new ConversionException(ConversionException.Reason.MAP_VALUE_INCOMPATIBLE)
              .with("key", key)
              .with("valueType", value == null ? "null" : value.getClass().getSimpleName())
              .with("fieldType", fieldType.getSimpleName());
        }
        field.set(target, value);
      }
      Platform.putObject(d, dstOffset, target);
    };
  }

  private static ImmutableList<FieldInfo> eligibleFields(Shape shape) {
    ImmutableList.Builder<FieldInfo> builder = ImmutableList.builder();
    for (FieldInfo field : shape.getFields()) {
      if (field.isEligible()) {
        builder.add(field);
      }
    }
    return builder.build();
  }
}
