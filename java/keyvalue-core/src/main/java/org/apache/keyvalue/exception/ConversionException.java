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

package org.apache.keyvalue.exception;

/**
 * Failure detected while running a compiled converter against actual data. The copy in progress is
 * aborted, fields written before the failure stay written.
 */
public class ConversionException extends KeyValueException {

  public enum Reason {
    BAD_ENUM_VALUE("bad value for closed enum"),
    PARSE_FAILURE("unable to parse value"),
    REQUIRED_VALUE_MISSING("required field has no value"),
    MAP_KEY_MISSING("missing field in structure for key"),
    MAP_VALUE_INCOMPATIBLE("unable to set field in structure for key"),
    CONVERSION_FAILED("conversion failed");

    private final String message;

    Reason(String message) {
      this.message = message;
    }

    public String message() {
      return message;
    }
  }

  private final Reason reason;

  public ConversionException(Reason reason) {
    super(reason.message());
    this.reason = reason;
  }

  public ConversionException(Reason reason, Throwable cause) {
    super(reason.message(), cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }

  @Override
  public ConversionException with(String key, Object value) {
    super.with(key, value);
    return this;
  }

  @Override
  public ConversionException inField(String name) {
    super.inField(name);
    return this;
  }
}
