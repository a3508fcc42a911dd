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

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

/**
 * A source value seen through a {@link TransmutedShape}. The view holds the original reference and
 * copies nothing, Jackson serializes it with {@link TransmutedViewSerializer}.
 */
@JsonSerialize(using = TransmutedViewSerializer.class)
public final class TransmutedView {
  private final TransmutedShape shape;
  private final Object target;

  TransmutedView(TransmutedShape shape, Object target) {
    this.shape = shape;
    this.target = target;
  }

  public TransmutedShape getShape() {
    return shape;
  }

  /** The viewed value itself, not a copy. */
  public Object getTarget() {
    return target;
  }

  @Override
  public String toString() {
    return "TransmutedView{" + shape.getSourceClass().getSimpleName() + "}";
  }
}
