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

/**
 * Moves one value from a source slot to a destination slot, converting its representation on the
 * way. Slots are (base object, offset) addresses as understood by {@link
 * org.apache.keyvalue.memory.Platform}. A converter may allocate new objects reachable only from
 * the destination slot, and keeps no state between calls beyond what was captured when it was
 * built.
 *
 * <p>Failures are thrown as {@link org.apache.keyvalue.exception.ConversionException}.
 */
@FunctionalInterface
public interface Converter {
  void convert(Object dst, long dstOffset, Object src, long srcOffset);
}
