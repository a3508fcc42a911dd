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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of all keyvalue failures. Besides the plain message an exception carries ordered key/value
 * attributes naming the values and types involved, rendered as {@code message key=value ...}.
 */
public class KeyValueException extends RuntimeException {
  /** Attribute holding the dotted path of the struct field a failure happened in. */
  public static final String FIELD_ATTRIBUTE = "srcField";

  private final Map<String, String> attributes = new LinkedHashMap<>();

  public KeyValueException(String message) {
    super(message);
  }

  public KeyValueException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Adds or replaces an attribute, returning this exception for chaining. */
  public KeyValueException with(String key, Object value) {
    attributes.put(key, String.valueOf(value));
    return this;
  }

  /**
   * Records that the failure happened inside field {@code name}. Enclosing struct copiers call this
   * while the exception unwinds, so the outermost field ends up first in the path.
   */
  public KeyValueException inField(String name) {
    String path = attributes.get(FIELD_ATTRIBUTE);
    attributes.put(FIELD_ATTRIBUTE, path == null ? name : name + "." + path);
    return this;
  }

  public String getAttribute(String key) {
    return attributes.get(key);
  }

  public Map<String, String> getAttributes() {
    return Collections.unmodifiableMap(attributes);
  }

  @Override
  public String getMessage() {
    String message = super.getMessage();
    if (attributes.isEmpty()) {
      return message;
    }
    StringBuilder builder = new StringBuilder(message);
    attributes.forEach((k, v) -> builder.append(' ').append(k).append('=').append(v));
    return builder.toString();
  }
}
