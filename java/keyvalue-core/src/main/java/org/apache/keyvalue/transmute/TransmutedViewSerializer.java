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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.lang.reflect.Array;
import java.util.Collection;

/**
 * Writes a {@link TransmutedView}: struct fields are read by offset from the viewed instance and
 * written under their serialization names, leaves are handed back to Jackson.
 */
public class TransmutedViewSerializer extends StdSerializer<TransmutedView> {
  private static final long serialVersionUID = 1L;

  public TransmutedViewSerializer() {
    super(TransmutedView.class);
  }

  @Override
  public void serialize(TransmutedView view, JsonGenerator gen, SerializerProvider provider)
      throws IOException {
    write(view.getShape(), view.getTarget(), gen, provider);
  }

  private void write(
      TransmutedShape shape, Object value, JsonGenerator gen, SerializerProvider provider)
      throws IOException {
    if (value == null) {
      provider.defaultSerializeNull(gen);
      return;
    }
    switch (shape.getKind()) {
      case STRUCT:
        gen.writeStartObject(value);
        for (TransmutedField field : shape.getFields()) {
          gen.writeFieldName(field.getSerialName());
          write(field.getShape(), field.read(value), gen, provider);
        }
        gen.writeEndObject();
        break;
      case SLICE:
        TransmutedShape elementShape = shape.getElementShape();
        if (value instanceof Collection) {
          Collection<?> elements = (Collection<?>) value;
          gen.writeStartArray(value, elements.size());
          for (Object element : elements) {
            write(elementShape, element, gen, provider);
          }
        } else {
          int length = Array.getLength(value);
          gen.writeStartArray(value, length);
          for (int i = 0; i < length; i++) {
            write(elementShape, Array.get(value, i), gen, provider);
          }
        }
        gen.writeEndArray();
        break;
      default:
        provider.defaultSerializeValue(value, gen);
    }
  }
}
