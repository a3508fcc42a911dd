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

import com.google.common.base.Preconditions;
import com.google.common.reflect.TypeToken;
import com.google.protobuf.Timestamp;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of ad hoc (destination, source) scalar conversions. The converter resolver consults it
 * after its built-in domain pairs; adapter code that walks values by name at call time uses it
 * directly, so both agree on the representation of identifiers and timestamps.
 *
 * <p>Registrations only affect converters compiled afterwards.
 */
public final class ScalarConversions {
  private static final Logger LOG = LoggerFactory.getLogger(ScalarConversions.class);

  private final Map<TypePair, ScalarConversion<Object, Object>> conversions =
      new ConcurrentHashMap<>();

  public ScalarConversions() {}

  /** Creates a registry holding the same conversions as {@code other}, independent of it. */
  public ScalarConversions(ScalarConversions other) {
    conversions.putAll(other.conversions);
  }

  /** Creates a registry holding the default identifier and timestamp conversions. */
  public static ScalarConversions withDefaults() {
    ScalarConversions conversions = new ScalarConversions();
    conversions.put(String.class, UUID.class, UUID::toString);
    conversions.put(UUID.class, String.class, UUID::fromString);
    conversions.put(Timestamp.class, Instant.class, DomainConversions::toTimestamp);
    conversions.put(Instant.class, Timestamp.class, DomainConversions::toInstant);
    return conversions;
  }

  /**
   * Registers the conversion for the exact (destination, source) class pair, replacing any
   * earlier one. Pairs that have a built-in domain conversion, such as {@code UUID} to {@code
   * String} or {@code Instant} to {@code Timestamp}, cannot be overridden for compiled copiers:
   * the resolver tries the built-in pairs first, so the registration only serves {@link
   * #convert(Class, Object)}.
   */
  public <D, S> void register(Class<D> dst, Class<S> src, ScalarConversion<D, S> conversion) {
    if (DomainConversions.forPair(dst, src) != null) {
      LOG.warn(
          "Scalar conversion to {} from {} is shadowed by the built-in domain conversion",
          dst.getName(),
          src.getName());
    }
    put(dst, src, conversion);
  }

  @SuppressWarnings("unchecked")
  private <D, S> void put(Class<D> dst, Class<S> src, ScalarConversion<D, S> conversion) {
    Preconditions.checkNotNull(conversion);
    TypePair pair = new TypePair(TypeToken.of(dst), TypeToken.of(src));
    ScalarConversion<Object, Object> previous =
        conversions.put(pair, (ScalarConversion<Object, Object>) conversion);
    if (previous != null) {
      LOG.warn("Scalar conversion for {} replaced", pair);
    }
  }

  /** Returns the conversion registered for the exact pair, or null. */
  public ScalarConversion<Object, Object> get(Class<?> dst, Class<?> src) {
    return conversions.get(new TypePair(TypeToken.of(dst), TypeToken.of(src)));
  }

  /** Applies the conversion registered for the runtime class of {@code value}. */
  @SuppressWarnings("unchecked")
  public <D> D convert(Class<D> dst, Object value) throws Exception {
    Preconditions.checkNotNull(value);
    ScalarConversion<Object, Object> conversion = get(dst, value.getClass());
    Preconditions.checkArgument(
        conversion != null, "No conversion to %s from %s", dst, value.getClass());
    return (D) conversion.convert(value);
  }

  public int size() {
    return conversions.size();
  }
}
