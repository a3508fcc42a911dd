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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.util.function.Function;
import org.apache.keyvalue.annotation.Key;

/**
 * A family of field annotations that carry serialization names, the Java counterpart of a struct
 * tag key. {@link #JSON} reads Jackson's {@link JsonProperty}, {@link #KEY} reads {@link Key}.
 *
 * @param <A> annotation type holding the name
 */
public final class TagNamespace<A extends Annotation> {
  public static final TagNamespace<JsonProperty> JSON =
      new TagNamespace<>("json", JsonProperty.class, JsonProperty::value);
  public static final TagNamespace<Key> KEY = new TagNamespace<>("key", Key.class, Key::value);

  private final String name;
  private final Class<A> annotationType;
  private final Function<A, String> nameExtractor;

  public TagNamespace(String name, Class<A> annotationType, Function<A, String> nameExtractor) {
    this.name = Preconditions.checkNotNull(name);
    this.annotationType = Preconditions.checkNotNull(annotationType);
    this.nameExtractor = Preconditions.checkNotNull(nameExtractor);
  }

  /** Returns the serialization name declared on {@code field}, or null when there is none. */
  public String tagOf(Field field) {
    A annotation = field.getAnnotation(annotationType);
    if (annotation == null) {
      return null;
    }
    String tag = nameExtractor.apply(annotation);
    return tag == null || tag.isEmpty() ? null : tag;
  }

  public String getName() {
    return name;
  }

  public Class<A> getAnnotationType() {
    return annotationType;
  }

  @Override
  public String toString() {
    return "TagNamespace{" + name + ", @" + annotationType.getSimpleName() + "}";
  }
}
