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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Data;
import org.apache.keyvalue.annotation.Key;
import org.apache.keyvalue.exception.CompilationException;
import org.apache.keyvalue.type.ShapeResolver;
import org.testng.annotations.Test;

public class ShapeTransmuterTest {
  private final ShapeTransmuter transmuter = new ShapeTransmuter(new ShapeResolver());

  @Data
  public static class Engine {
    @JsonProperty("hp")
    private int horsePower;

    @Key("fuel_type")
    @JsonProperty("fuel")
    private String fuel;
  }

  @Data
  public static class Garage {
    @JsonProperty("engines")
    private List<Engine> engines;

    @JsonProperty("spare")
    private Engine[] spares;

    @JsonProperty("labels")
    private List<String> labels;

    private Instant opened;
  }

  @Data
  public static class Employee {
    @JsonProperty("name")
    private String name;

    @JsonProperty("subordinates")
    private List<Employee> subordinates;
  }

  @Data
  public static class Node {
    private Node next;
  }

  @Data
  public static class Session {
    private String user;
    private transient String token;
  }

  public static class Amount {
    private final long cents;

    @JsonCreator
    public Amount(long cents) {
      this.cents = cents;
    }

    @JsonValue
    public long getCents() {
      return cents;
    }
  }

  @JsonSerialize(using = ToStringSerializer.class)
  public static class Code {
    private String value;
  }

  @Data
  public static class Invoice {
    @JsonProperty("amount")
    private Amount amount;
  }

  @Test
  public void testRenamesStructFields() {
    TransmutedShape shape = transmuter.derive(Engine.class, TagNamespace.JSON);
    assertEquals(shape.getKind(), TransmutedShape.Kind.STRUCT);
    assertSame(shape.getSourceClass(), Engine.class);
    assertEquals(shape.getSerialNames(), List.of("hp", "fuel"));
    assertEquals(shape.getFields().get(0).getField().getName(), "horsePower");
    assertTrue(shape.getFields().get(0).getShape().isPassThrough());
  }

  @Test
  public void testOtherNamespace() {
    TransmutedShape shape = transmuter.derive(Engine.class, TagNamespace.KEY);
    // An untagged field keeps its Java name.
    assertEquals(shape.getSerialNames(), List.of("horsePower", "fuel_type"));
  }

  @Test
  public void testSlicesOfStructs() {
    TransmutedShape shape = transmuter.derive(Garage.class, TagNamespace.JSON);
    assertEquals(shape.getSerialNames(), List.of("engines", "spare", "labels", "opened"));
    TransmutedShape engines = shape.getFields().get(0).getShape();
    assertEquals(engines.getKind(), TransmutedShape.Kind.SLICE);
    assertEquals(engines.getElementShape().getSerialNames(), List.of("hp", "fuel"));
    TransmutedShape spares = shape.getFields().get(1).getShape();
    assertEquals(spares.getKind(), TransmutedShape.Kind.SLICE);
    assertSame(spares.getSourceClass(), Engine[].class);
    assertTrue(shape.getFields().get(2).getShape().isPassThrough());
    assertTrue(shape.getFields().get(3).getShape().isPassThrough());
  }

  @Test
  public void testNonTransmutableTypesPassThrough() {
    assertTrue(transmuter.derive(Instant.class, TagNamespace.JSON).isPassThrough());
    assertTrue(transmuter.derive(BigDecimal.class, TagNamespace.JSON).isPassThrough());
    assertTrue(transmuter.derive(String.class, TagNamespace.JSON).isPassThrough());
    assertTrue(transmuter.derive(int[].class, TagNamespace.JSON).isPassThrough());
    assertFalse(transmuter.derive(Engine[].class, TagNamespace.JSON).isPassThrough());
  }

  @Test
  public void testCircularReference() {
    CompilationException e =
        expectThrows(
            CompilationException.class, () -> transmuter.derive(Employee.class, TagNamespace.JSON));
    assertEquals(e.getReason(), CompilationException.Reason.CIRCULAR_TYPE_REFERENCE);
    assertTrue(e.getMessage().startsWith("circular type reference not supported"));
    e =
        expectThrows(
            CompilationException.class, () -> transmuter.derive(Node.class, TagNamespace.JSON));
    assertEquals(e.getReason(), CompilationException.Reason.CIRCULAR_TYPE_REFERENCE);
  }

  @Test
  public void testTransientFieldRejected() {
    CompilationException e =
        expectThrows(
            CompilationException.class, () -> transmuter.derive(Session.class, TagNamespace.JSON));
    assertEquals(e.getReason(), CompilationException.Reason.UNEXPORTED_FIELD);
    assertEquals(e.getAttribute("field"), "token");
  }

  @Test
  public void testOwnJsonMappingRejected() {
    assertTrue(ShapeTransmuter.hasOwnJsonMapping(Amount.class));
    assertTrue(ShapeTransmuter.hasOwnJsonMapping(Code.class));
    assertFalse(ShapeTransmuter.hasOwnJsonMapping(Engine.class));
    CompilationException e =
        expectThrows(
            CompilationException.class, () -> transmuter.derive(Code.class, TagNamespace.JSON));
    assertEquals(e.getReason(), CompilationException.Reason.TRANSMUTING_MARSHALLABLE_TYPE);
    // Nested as a field it is rejected as well.
    e =
        expectThrows(
            CompilationException.class, () -> transmuter.derive(Invoice.class, TagNamespace.JSON));
    assertEquals(e.getReason(), CompilationException.Reason.TRANSMUTING_MARSHALLABLE_TYPE);
  }
}
