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

package org.apache.keyvalue.type;

/** Structural category of a {@link Shape}, decides which conversion rules may apply. */
public enum ShapeKind {
  /** A primitive value, never null. */
  PRIMITIVE,
  /** A boxed primitive: a nullable reference to a primitive cell. */
  POINTER,
  STRING,
  /** A Java enum, the closed enumeration of the converter rules. */
  ENUM,
  /** A mutable class whose fields are copied one by one. */
  STRUCT,
  /** An array or a {@link java.util.List}. */
  SLICE,
  /** {@code Map<String, Object>}. */
  DYNAMIC_MAP,
  /** {@link java.util.Optional}. */
  OPTIONAL,
  /** {@link org.apache.keyvalue.capability.Required}. */
  REQUIRED,
  /** Anything opaque: JDK value classes, protobuf messages, records, interfaces. */
  LEAF
}
