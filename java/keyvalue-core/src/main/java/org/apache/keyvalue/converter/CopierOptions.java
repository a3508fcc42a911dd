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
import java.util.Arrays;
import java.util.Objects;

/** Immutable options of a struct copier. Use {@link #builder()} to create one. */
public final class CopierOptions {
  public static final CopierOptions DEFAULT = builder().build();

  private final boolean omitUnmatchedFields;
  private final ImmutableSet<String> fieldsToInclude;
  private final ImmutableSet<String> fieldsToExclude;

  private CopierOptions(Builder builder) {
    this.omitUnmatchedFields = builder.omitUnmatchedFields;
    this.fieldsToInclude = builder.fieldsToInclude;
    this.fieldsToExclude = builder.fieldsToExclude;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Skip source fields that have no destination field of the same name instead of failing. */
  public boolean isOmitUnmatchedFields() {
    return omitUnmatchedFields;
  }

  /** Only these source fields are copied; null means all of them. */
  public ImmutableSet<String> getFieldsToInclude() {
    return fieldsToInclude;
  }

  public ImmutableSet<String> getFieldsToExclude() {
    return fieldsToExclude;
  }

  /** Whether the include and exclude lists let source field {@code name} through. */
  public boolean accepts(String name) {
    if (fieldsToExclude.contains(name)) {
      return false;
    }
    return fieldsToInclude == null || fieldsToInclude.contains(name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    CopierOptions that = (CopierOptions) o;
    return omitUnmatchedFields == that.omitUnmatchedFields
        && Objects.equals(fieldsToInclude, that.fieldsToInclude)
        && fieldsToExclude.equals(that.fieldsToExclude);
  }

  @Override
  public int hashCode() {
    return Objects.hash(omitUnmatchedFields, fieldsToInclude, fieldsToExclude);
  }

  @Override
  public String toString() {
    return "CopierOptions{omitUnmatchedFields="
        + omitUnmatchedFields
        + ", fieldsToInclude="
        + fieldsToInclude
        + ", fieldsToExclude="
        + fieldsToExclude
        + "}";
  }

  public static final class Builder {
    private boolean omitUnmatchedFields;
    private ImmutableSet<String> fieldsToInclude;
    private ImmutableSet<String> fieldsToExclude = ImmutableSet.of();

    private Builder() {}

    public Builder omitUnmatchedFields(boolean omitUnmatchedFields) {
      this.omitUnmatchedFields = omitUnmatchedFields;
      return this;
    }

    public Builder includeFields(String... names) {
      this.fieldsToInclude = ImmutableSet.copyOf(Arrays.asList(names));
      return this;
    }

    public Builder excludeFields(String... names) {
      this.fieldsToExclude = ImmutableSet.copyOf(Arrays.asList(names));
      return this;
    }

    public CopierOptions build() {
      return new CopierOptions(this);
    }
  }
}
