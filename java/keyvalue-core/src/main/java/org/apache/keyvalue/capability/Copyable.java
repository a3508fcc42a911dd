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

import com.google.common.reflect.TypeToken;

/**
 * A source type that knows how to produce values of other types itself. When a field of such a type
 * is copied, the converter first asks a zero instance (allocated without running a constructor)
 * whether the destination type is supported, the pair is rejected at compile time otherwise.
 */
public interface Copyable {

  /** Whether {@link #copyTo} can produce a value of {@code target}. Must not depend on state. */
  boolean canCopyTo(TypeToken<?> target);

  /**
   * Produces the value to store into a destination slot of type {@code target}. Primitive targets
   * expect the matching wrapper object.
   */
  Object copyTo(TypeToken<?> target);
}
