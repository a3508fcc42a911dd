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

/**
 * Compiled copy plan for one (destination struct, source struct) pair: one {@link FieldConverter}
 * per copied field, in source declaration order. Immutable and safe to share between threads.
 *
 * <p>A copy that fails leaves the fields converted before the failing one written to the
 * destination.
 */
public final class StructCopier {
  private final TypePair typePair;
  private final FieldConverter[] fieldConverters;

  StructCopier(TypePair typePair, FieldConverter[] fieldConverters) {
    this.typePair = typePair;
    this.fieldConverters = fieldConverters;
  }

  public void copy(Object dst, Object src) {
    for (FieldConverter fieldConverter : fieldConverters) {
      fieldConverter.apply(dst, src);
    }
  }

  public TypePair getTypePair() {
    return typePair;
  }

  /** Names of the source fields this copier converts, in execution order. */
  public ImmutableList<String> getFieldNames() {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (FieldConverter fieldConverter : fieldConverters) {
      builder.add(fieldConverter.getFieldName());
    }
    return builder.build();
  }

  @Override
  public String toString() {
    return "StructCopier{" + typePair + ", fields=" + getFieldNames() + "}";
  }
}
