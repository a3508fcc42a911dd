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

import com.google.common.collect.ImmutableSet;
import com.google.common.reflect.TypeToken;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.apache.keyvalue.exception.CompilationException;
import org.apache.keyvalue.type.FieldInfo;
import org.apache.keyvalue.type.Shape;
import org.apache.keyvalue.type.ShapeKind;
import org.apache.keyvalue.type.ShapeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a {@link StructCopier} for a pair of struct types: one {@link FieldConverter} per source
 * field, matched to the destination field of the same name. Compiled copiers go through the {@link
 * ConversionCache}, nested struct fields reuse it as well.
 */
public final class StructCopierCompiler {
  private static final Logger LOG = LoggerFactory.getLogger(StructCopierCompiler.class);

  private final ShapeResolver shapeResolver;
  private final ConversionCache cache;
  private final ConverterResolver converterResolver;

  public StructCopierCompiler(
      ShapeResolver shapeResolver, ScalarConversions scalarConversions, ConversionCache cache) {
    this.shapeResolver = shapeResolver;
    this.cache = cache;
    this.converterResolver = new ConverterResolver(shapeResolver, scalarConversions, this);
  }

  public ConverterResolver getConverterResolver() {
    return converterResolver;
  }

  public ShapeResolver getShapeResolver() {
    return shapeResolver;
  }

  public ConversionCache getCache() {
    return cache;
  }

  /** Returns the cached copier for the pair, compiling it on a miss. */
  public StructCopier getOrCompile(TypeToken<?> dst, TypeToken<?> src, CopierOptions options) {
    return getOrCompile(
        shapeResolver.getShape(dst), shapeResolver.getShape(src), options, ImmutableSet.of());
  }

  StructCopier getOrCompile(
      Shape dst, Shape src, CopierOptions options, Set<TypePair> structPath) {
    TypePair pair = TypePair.of(dst, src);
    return cache.getOrCompile(pair, options, () -> compile(dst, src, options, structPath));
  }

  /** Compiles a copier without consulting or filling the cache for the top level pair. */
  public StructCopier compile(TypeToken<?> dst, TypeToken<?> src, CopierOptions options) {
    return compile(
        shapeResolver.getShape(dst), shapeResolver.getShape(src), options, ImmutableSet.of());
  }

  private StructCopier compile(
      Shape dst, Shape src, CopierOptions options, Set<TypePair> structPath) {
    if (dst.getKind() != ShapeKind.STRUCT || src.getKind() != ShapeKind.STRUCT) {
      throw new CompilationException(CompilationException.Reason.TYPE_NOT_STRUCT)
          .with("srcType", src.getName())
          .with("dstType", dst.getName());
    }
    TypePair pair = TypePair.of(dst, src);
    if (structPath.contains(pair)) {
      throw new CompilationException(CompilationException.Reason.CIRCULAR_TYPE_REFERENCE)
          .with("srcType", src.getName())
          .with("dstType", dst.getName());
    }
    Set<TypePair> path = ImmutableSet.<TypePair>builder().addAll(structPath).add(pair).build();
    List<FieldConverter> fieldConverters = new ArrayList<>();
    for (FieldInfo srcField : src.getFields()) {
      String name = srcField.getName();
      if (!srcField.isEligible() || !options.accepts(name)) {
        continue;
      }
      FieldInfo dstField = dst.getField(name);
      if (dstField == null || !dstField.isEligible()) {
        if (options.isOmitUnmatchedFields()) {
          LOG.debug("Skipping {}.{}, no matching field in {}", src.getName(), name, dst.getName());
          continue;
        }
        throw new CompilationException(CompilationException.Reason.FIELD_NOT_FOUND)
            .with(CompilationException.FIELD_ATTRIBUTE, name)
            .with("srcType", src.getName())
            .with("dstType", dst.getName());
      }
      Converter converter;
      try {
        converter =
            converterResolver.resolve(
                shapeResolver.getShape(dstField.getType()),
                shapeResolver.getShape(srcField.getType()),
                path);
      } catch (CompilationException e) {
        throw e.inField(name);
      }
      fieldConverters.add(
          new FieldConverter(name, converter, dstField.getOffset(), srcField.getOffset()));
    }
    StructCopier copier =
        new StructCopier(pair, fieldConverters.toArray(new FieldConverter[0]));
    if (LOG.isDebugEnabled()) {
      LOG.debug("Compiled {}", copier);
    }
    return copier;
  }
}
