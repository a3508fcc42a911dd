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
import java.util.LinkedHashSet;
import java.util.Set;
import org.apache.keyvalue.converter.ScalarConversion;
import org.apache.keyvalue.converter.ScalarConversions;
import org.apache.keyvalue.type.ShapeResolver;

/** Builder of {@link KeyValue} engines. */
public final class KeyValueBuilder {
  private final Set<Class<?>> leafTypes = new LinkedHashSet<>(ShapeResolver.DEFAULT_LEAF_TYPES);
  private final ScalarConversions scalarConversions = ScalarConversions.withDefaults();

  KeyValueBuilder() {}

  /**
   * Treats {@code type} as an opaque value: it is copied by reference and never field by field,
   * like a JDK value class.
   */
  public KeyValueBuilder registerLeafType(Class<?> type) {
    Preconditions.checkNotNull(type);
    Preconditions.checkArgument(!type.isPrimitive(), "%s is primitive", type);
    leafTypes.add(type);
    return this;
  }

  /**
   * Adds a conversion the resolver applies to the exact (destination, source) class pair. Engines
   * already built are not affected. Pairs with a built-in domain conversion keep it, see {@link
   * ScalarConversions#register(Class, Class, ScalarConversion)}.
   */
  public <D, S> KeyValueBuilder registerConversion(
      Class<D> dst, Class<S> src, ScalarConversion<D, S> conversion) {
    scalarConversions.register(dst, src, conversion);
    return this;
  }

  /** Builds an engine holding a snapshot of the registrations made so far. */
  public KeyValue build() {
    return new KeyValue(new ShapeResolver(leafTypes), new ScalarConversions(scalarConversions));
  }
}
