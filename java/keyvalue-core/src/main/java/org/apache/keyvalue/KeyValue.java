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

package org.apache.keyvalue;

import com.google.common.base.Preconditions;
import com.google.common.reflect.TypeToken;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.keyvalue.converter.ConversionCache;
import org.apache.keyvalue.converter.Converter;
import org.apache.keyvalue.converter.CopierOptions;
import org.apache.keyvalue.converter.ScalarConversions;
import org.apache.keyvalue.converter.SliceCopier;
import org.apache.keyvalue.converter.StructCopier;
import org.apache.keyvalue.converter.StructCopierCompiler;
import org.apache.keyvalue.converter.TypedCopier;
import org.apache.keyvalue.converter.ValueCopier;
import org.apache.keyvalue.exception.CompilationException;
import org.apache.keyvalue.transmute.Reinterpreter;
import org.apache.keyvalue.transmute.Reinterpreters;
import org.apache.keyvalue.transmute.ShapeTransmuter;
import org.apache.keyvalue.transmute.TagNamespace;
import org.apache.keyvalue.transmute.TransmutedShape;
import org.apache.keyvalue.type.Shape;
import org.apache.keyvalue.type.ShapeKind;
import org.apache.keyvalue.type.ShapeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for copying values between types and for serialization views. An engine owns its
 * shape cache and its compiled copiers; it is thread safe and meant to be shared:
 *
 * <pre>{@code
 * KeyValue keyValue = KeyValue.builder().build();
 * TypedCopier<UserDto, User> copier = keyValue.typedCopier(UserDto.class, User.class);
 * UserDto dto = copier.copy(user);
 * }</pre>
 */
public final class KeyValue {
  private static final Logger LOG = LoggerFactory.getLogger(KeyValue.class);

  private final ShapeResolver shapeResolver;
  private final ScalarConversions scalarConversions;
  private final ConversionCache cache;
  private final StructCopierCompiler compiler;
  private final ShapeTransmuter transmuter;

  KeyValue(ShapeResolver shapeResolver, ScalarConversions scalarConversions) {
    this.shapeResolver = shapeResolver;
    this.scalarConversions = scalarConversions;
    this.cache = new ConversionCache();
    this.compiler = new StructCopierCompiler(shapeResolver, scalarConversions, cache);
    this.transmuter = new ShapeTransmuter(shapeResolver);
    LOG.debug("Created engine with {} scalar conversions", scalarConversions.size());
  }

  public static KeyValueBuilder builder() {
    return new KeyValueBuilder();
  }

  private static final class DefaultHolder {
    private static final KeyValue INSTANCE = builder().build();
  }

  /** A lazily built engine with the default configuration, shared by the whole JVM. */
  public static KeyValue getDefault() {
    return DefaultHolder.INSTANCE;
  }

  public StructCopier buildStructCopier(Class<?> dst, Class<?> src) {
    return buildStructCopier(TypeToken.of(dst), TypeToken.of(src), CopierOptions.DEFAULT);
  }

  public StructCopier buildStructCopier(Class<?> dst, Class<?> src, CopierOptions options) {
    return buildStructCopier(TypeToken.of(dst), TypeToken.of(src), options);
  }

  /** Returns the copier for the pair, compiled once per engine and options. */
  public StructCopier buildStructCopier(
      TypeToken<?> dst, TypeToken<?> src, CopierOptions options) {
    Preconditions.checkNotNull(options);
    return compiler.getOrCompile(dst, src, options);
  }

  /**
   * Copies the fields of {@code src} into {@code dst}. Both must be structs; on failure fields
   * copied before the failing one keep their new values.
   */
  public void copy(Object dst, Object src) {
    if (dst == null || src == null) {
      throw new CompilationException(CompilationException.Reason.UNSUPPORTED_TYPE_PAIR)
          .with("srcType", src == null ? "null" : src.getClass().getSimpleName())
          .with("dstType", dst == null ? "null" : dst.getClass().getSimpleName());
    }
    Shape dstShape = shapeResolver.getShape(dst.getClass());
    Shape srcShape = shapeResolver.getShape(src.getClass());
    if (dstShape.getKind() != ShapeKind.STRUCT || srcShape.getKind() != ShapeKind.STRUCT) {
      throw new CompilationException(CompilationException.Reason.UNSUPPORTED_TYPE_PAIR)
          .with("srcType", srcShape.getName())
          .with("dstType", dstShape.getName());
    }
    compiler
        .getOrCompile(dstShape.getType(), srcShape.getType(), CopierOptions.DEFAULT)
        .copy(dst, src);
  }

  /** Returns a copier converting single values of any supported pair, not only structs. */
  public <D, S> ValueCopier<D, S> valueCopier(TypeToken<D> dst, TypeToken<S> src) {
    Converter converter = compiler.getConverterResolver().resolve(dst, src);
    return new ValueCopier<>(dst, src, converter);
  }

  public <D, S> ValueCopier<D, S> valueCopier(Class<D> dst, Class<S> src) {
    return valueCopier(TypeToken.of(dst), TypeToken.of(src));
  }

  public <D, S> TypedCopier<D, S> typedCopier(Class<D> dst, Class<S> src) {
    return typedCopier(dst, src, CopierOptions.DEFAULT);
  }

  public <D, S> TypedCopier<D, S> typedCopier(Class<D> dst, Class<S> src, CopierOptions options) {
    StructCopier copier = buildStructCopier(dst, src, options);
    return new TypedCopier<>(shapeResolver.getShape(dst), copier);
  }

  public <D, S> SliceCopier<D, S> sliceCopier(Class<D> dst, Class<S> src) {
    return new SliceCopier<>(typedCopier(dst, src));
  }

  /**
   * Copies a list of structs into a new list of {@code dst} instances. The source class is taken
   * from the elements, which must all share it; null elements stay null.
   */
  @SuppressWarnings("unchecked")
  public <D, S> List<D> copyList(List<S> src, Class<D> dst) {
    Preconditions.checkNotNull(src);
    Class<S> srcType = null;
    for (S element : src) {
      if (element == null) {
        continue;
      }
      if (srcType == null) {
        srcType = (Class<S>) element.getClass();
      } else {
        Preconditions.checkArgument(
            element.getClass() == srcType,
            "Mixed element classes %s and %s",
            srcType,
            element.getClass());
      }
    }
    if (srcType == null) {
      return new ArrayList<>(Collections.nCopies(src.size(), (D) null));
    }
    return sliceCopier(dst, srcType).copy(src);
  }

  public TransmutedShape deriveSerializationShape(Class<?> type, TagNamespace<?> namespace) {
    return transmuter.derive(type, namespace);
  }

  public TransmutedShape deriveSerializationShape(TypeToken<?> type, TagNamespace<?> namespace) {
    return transmuter.derive(type, namespace);
  }

  /** The safe reinterpreter: detached copies that serialize under the shape's names. */
  public Reinterpreter reinterpreter(TransmutedShape shape) {
    return Reinterpreters.copying(shape);
  }

  /** Zero-copy views, after checking each value's class against the shape. */
  public Reinterpreter checkedReinterpreter(TransmutedShape shape) {
    return Reinterpreters.checked(shape);
  }

  /**
   * Zero-copy views without any check. Passing a value of another type leads to reads at
   * meaningless offsets.
   */
  public Reinterpreter unsafeReinterpreter(TransmutedShape shape) {
    return Reinterpreters.unchecked(shape);
  }

  public ShapeResolver getShapeResolver() {
    return shapeResolver;
  }

  public ScalarConversions getScalarConversions() {
    return scalarConversions;
  }

  public ConversionCache getCache() {
    return cache;
  }
}
