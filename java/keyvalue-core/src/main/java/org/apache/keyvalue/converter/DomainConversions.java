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

import com.github.f4b6a3.ulid.Ulid;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.IllformedLocaleException;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Function;
import org.apache.keyvalue.exception.ConversionException;
import org.apache.keyvalue.memory.Platform;

/**
 * Fixed set of conversions between domain value types and their wire representations: protobuf
 * timestamps, identifiers, decimals and language tags. A null source leaves the destination as it
 * is.
 */
public final class DomainConversions {
  private DomainConversions() {}

  /** Returns the converter for the pair, or null when the pair is not a domain pair. */
  static Converter forPair(Class<?> dst, Class<?> src) {
    if (src == Instant.class && dst == Timestamp.class) {
      return map(value -> toTimestamp((Instant) value));
    }
    if (src == Timestamp.class && dst == Instant.class) {
      return mapValidTimestamp(DomainConversions::toInstant);
    }
    if (src == LocalDate.class && dst == Timestamp.class) {
      return map(
          value -> toTimestamp(((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant()));
    }
    if (src == Timestamp.class && dst == LocalDate.class) {
      return mapValidTimestamp(ts -> LocalDate.ofInstant(toInstant(ts), ZoneOffset.UTC));
    }
    if (src == UUID.class && dst == String.class) {
      return map(Object::toString);
    }
    if (src == String.class && dst == UUID.class) {
      return parse(dst, UUID::fromString);
    }
    if (src == Ulid.class && dst == String.class) {
      return map(Object::toString);
    }
    if (src == String.class && dst == Ulid.class) {
      return parse(dst, Ulid::from);
    }
    if (src == BigDecimal.class && dst == String.class) {
      return map(value -> ((BigDecimal) value).toPlainString());
    }
    if (src == String.class && dst == BigDecimal.class) {
      return parse(dst, value -> value.isEmpty() ? BigDecimal.ZERO : new BigDecimal(value));
    }
    if (src == Locale.class && dst == String.class) {
      return map(value -> ((Locale) value).toLanguageTag());
    }
    if (src == String.class && dst == Locale.class) {
      return parse(dst, value -> new Locale.Builder().setLanguageTag(value).build());
    }
    return null;
  }

  public static Timestamp toTimestamp(Instant instant) {
    return Timestamp.newBuilder()
        .setSeconds(instant.getEpochSecond())
        .setNanos(instant.getNano())
        .build();
  }

  public static Instant toInstant(Timestamp timestamp) {
    return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
  }

  private static Converter map(Function<Object, Object> function) {
    return (dst, dstOffset, src, srcOffset) -> {
      Object value = Platform.getObject(src, srcOffset);
      if (value != null) {
        Platform.putObject(dst, dstOffset, function.apply(value));
      }
    };
  }

  /** Invalid timestamps are skipped like null ones. */
  private static Converter mapValidTimestamp(Function<Timestamp, Object> function) {
    return (dst, dstOffset, src, srcOffset) -> {
      Timestamp value = (Timestamp) Platform.getObject(src, srcOffset);
      if (value != null && Timestamps.isValid(value)) {
        Platform.putObject(dst, dstOffset, function.apply(value));
      }
    };
  }

  private static Converter parse(Class<?> dstType, Function<String, Object> parser) {
    return (dst, dstOffset, src, srcOffset) -> {
      String value = (String) Platform.getObject(src, srcOffset);
      if (value == null) {
        return;
      }
      Object parsed;
      try {
        parsed = parser.apply(value);
      } catch (IllegalArgumentException | IllformedLocaleException e) {
        throw new ConversionException(ConversionException.Reason.PARSE_FAILURE, e)
            .with("value", value)
            .with("dstType", dstType.getSimpleName());
      }
      Platform.putObject(dst, dstOffset, parsed);
    };
  }
}
