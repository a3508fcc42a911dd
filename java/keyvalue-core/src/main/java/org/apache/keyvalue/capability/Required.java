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

package org.apache.keyvalue.capability;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A wrapper that must hold a value once it is copied somewhere. Unlike {@link java.util.Optional},
 * absence is a conversion failure rather than an empty result.
 *
 * @param <T> wrapped value type
 */
public final class Required<T> {
  private static final Required<?> EMPTY = new Required<>(null);

  private final T value;

  private Required(T value) {
    this.value = value;
  }

  public static <T> Required<T> of(T value) {
    return new Required<>(Objects.requireNonNull(value));
  }

  @SuppressWarnings("unchecked")
  public static <T> Required<T> empty() {
    return (Required<T>) EMPTY;
  }

  public boolean hasValue() {
    return value != null;
  }

  public T get() {
    if (value == null) {
      throw new NoSuchElementException("No value present");
    }
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Required)) {
      return false;
    }
    return Objects.equals(value, ((Required<?>) o).value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value);
  }

  @Override
  public String toString() {
    return value == null ? "Required.empty" : "Required[" + value + "]";
  }
}
