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

import com.google.common.reflect.TypeToken;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import org.apache.keyvalue.annotation.Ignore;
import org.apache.keyvalue.annotation.Key;
import org.apache.keyvalue.memory.Platform;
import org.apache.keyvalue.memory.Slots;

/** A struct field with its resolved generic type and the offset of its slot in an instance. */
public final class FieldInfo {
  private final Field field;
  private final TypeToken<?> type;
  private final long offset;
  private final String key;
  private final boolean ignored;
  private final boolean isTransient;

  FieldInfo(Field field, TypeToken<?> type) {
    this.field = field;
    this.type = type;
    this.offset = Platform.objectFieldOffset(field);
    Key keyAnnotation = field.getAnnotation(Key.class);
    this.key =
        keyAnnotation != null && !keyAnnotation.value().isEmpty()
            ? keyAnnotation.value()
            : field.getName();
    this.ignored = field.isAnnotationPresent(Ignore.class);
    this.isTransient = Modifier.isTransient(field.getModifiers());
  }

  public String getName() {
    return field.getName();
  }

  public Field getField() {
    return field;
  }

  public TypeToken<?> getType() {
    return type;
  }

  public Class<?> getRawType() {
    return field.getType();
  }

  public long getOffset() {
    return offset;
  }

  /** Key used for this field in a dynamic map, {@link Key} when present, the name otherwise. */
  public String getKey() {
    return key;
  }

  public boolean isIgnored() {
    return ignored;
  }

  /** Transient fields play the role of unexported fields: they are never copied or transmuted. */
  public boolean isTransient() {
    return isTransient;
  }

  /** Whether the field takes part in struct copies and map conversions. */
  public boolean isEligible() {
    return !ignored && !isTransient;
  }

  public Object get(Object target) {
    return Slots.read(target, offset, field.getType());
  }

  public void set(Object target, Object value) {
    Slots.write(target, offset, field.getType(), value);
  }

  @Override
  public String toString() {
    return field.getDeclaringClass().getSimpleName() + "." + field.getName() + "@" + offset;
  }
}
