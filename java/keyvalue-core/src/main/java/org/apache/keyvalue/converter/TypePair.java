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

import com.google.common.reflect.TypeToken;
import java.util.Objects;
import org.apache.keyvalue.type.Shape;

/** Destination and source type of a conversion, used as a cache key. */
public final class TypePair {
  private final TypeToken<?> dst;
  private final TypeToken<?> src;

  public TypePair(TypeToken<?> dst, TypeToken<?> src) {
    this.dst = Objects.requireNonNull(dst);
    this.src = Objects.requireNonNull(src);
  }

  public static TypePair of(Shape dst, Shape src) {
    return new TypePair(dst.getType(), src.getType());
  }

  public TypeToken<?> getDst() {
    return dst;
  }

  public TypeToken<?> getSrc() {
    return src;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    TypePair that = (TypePair) o;
    return dst.equals(that.dst) && src.equals(that.src);
  }

  @Override
  public int hashCode() {
    return 31 * dst.hashCode() + src.hashCode();
  }

  @Override
  public String toString() {
    return dst + " <- " + src;
  }
}
