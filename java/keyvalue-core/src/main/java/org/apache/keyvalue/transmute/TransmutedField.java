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

package org.apache.keyvalue.transmute;

import org.apache.keyvalue.type.FieldInfo;

/** A struct field of a {@link TransmutedShape}: the source field under its serialization name. */
public final class TransmutedField {
  private final String serialName;
  private final FieldInfo field;
  private final TransmutedShape shape;

  TransmutedField(String serialName, FieldInfo field, TransmutedShape shape) {
    this.serialName = serialName;
    this.field = field;
    this.shape = shape;
  }

  public String getSerialName() {
    return serialName;
  }

  public FieldInfo getField() {
    return field;
  }

  /** Shape of the field value, a pass-through shape for leaves. */
  public TransmutedShape getShape() {
    return shape;
  }

  /** Reads the field straight from the source instance by its offset. */
  Object read(Object target) {
    return field.get(target);
  }

  @Override
  public String toString() {
    return field.getName() + " as \"" + serialName + "\"";
  }
}
