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

import org.apache.keyvalue.exception.KeyValueException;

/** A {@link Converter} bound to the offsets of one destination field and one source field. */
public final class FieldConverter {
  private final String fieldName;
  private final Converter converter;
  private final long dstOffset;
  private final long srcOffset;

  public FieldConverter(String fieldName, Converter converter, long dstOffset, long srcOffset) {
    this.fieldName = fieldName;
    this.converter = converter;
    this.dstOffset = dstOffset;
    this.srcOffset = srcOffset;
  }

  public void apply(Object dst, Object src) {
    try {
      converter.convert(dst, dstOffset, src, srcOffset);
    } catch (KeyValueException e) {
      throw e.inField(fieldName);
    }
  }

  public String getFieldName() {
    return fieldName;
  }

  public long getDstOffset() {
    return dstOffset;
  }

  public long getSrcOffset() {
    return srcOffset;
  }
}
