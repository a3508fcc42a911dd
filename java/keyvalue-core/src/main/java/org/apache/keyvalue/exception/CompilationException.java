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
 * Shape incompatibility detected while compiling a converter or deriving a transmuted shape. It is
 * raised once per shape pair and never cached, a later request for the same pair compiles again.
 */
public class CompilationException extends KeyValueException {

  public enum Reason {
    TYPE_NOT_STRUCT("type not struct"),
    FIELD_NOT_FOUND("field not found"),
    UNSUPPORTED_TYPE_PAIR("unsupported pair"),
    CANNOT_COPY("can't copy"),
    CIRCULAR_TYPE_REFERENCE("circular type reference not supported"),
    UNEXPORTED_FIELD("unexported field in transmutable structure"),
    TRANSMUTING_MARSHALLABLE_TYPE("transmuting (un)marshallable type");

    private final String message;

    Reason(String message) {
      this.message = message;
    }

    public String message() {
      return message;
    }
  }

  private final Reason reason;

  public CompilationException(Reason reason) {
    super(reason.message());
    this.reason = reason;
  }

  public CompilationException(Reason reason, Throwable cause) {
    super(reason.message(), cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }

  @Override
  public CompilationException with(String key, Object value) {
    super.with(key, value);
    return this;
  }

  @Override
  public CompilationException inField(String name) {
    super.inField(name);
    return this;
  }
}
