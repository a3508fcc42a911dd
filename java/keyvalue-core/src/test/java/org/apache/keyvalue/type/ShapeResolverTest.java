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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

import com.github.f4b6a3.ulid.Ulid;
import com.google.common.reflect.TypeToken;
import com.google.protobuf.Timestamp;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.keyvalue.annotation.Ignore;
import org.apache.keyvalue.annotation.Key;
import org.apache.keyvalue.capability.Required;
import org.apache.keyvalue.memory.Platform;
import org.testng.annotations.Test;

public class ShapeResolverTest {
  private final ShapeResolver resolver = new ShapeResolver();

  enum Level {
    LOW,
    HIGH
  }

  static class Base {
    long id;
    String label;
  }

  static class Derived extends Base {
    @Key("display_name")
    String name;

    String label;
    transient int cached;
    @Ignore String internal;
    static int counter;
  }

  static class WithDefaults {
    String value = "init";
  }

  static class NoDefaultConstructor {
    final String value;

    NoDefaultConstructor(String value) {
      this.value = value;
    }
  }

  static class Holder<T> {
    T value;
    List<T> values;
  }

  static class StringHolder extends Holder<String> {}

  abstract static class AbstractShape {}

  private ShapeKind kindOf(TypeToken<?> type) {
    return resolver.getShape(type).getKind();
  }

  private ShapeKind kindOf(Class<?> cls) {
    return resolver.getShape(cls).getKind();
  }

  @Test
  public void testKinds() {
    assertEquals(kindOf(int.class), ShapeKind.PRIMITIVE);
    assertEquals(kindOf(Integer.class), ShapeKind.POINTER);
    assertEquals(kindOf(String.class), ShapeKind.STRING);
    assertEquals(kindOf(Level.class), ShapeKind.ENUM);
    assertEquals(kindOf(Derived.class), ShapeKind.STRUCT);
    assertEquals(kindOf(int[].class), ShapeKind.SLICE);
    assertEquals(kindOf(new TypeToken<List<String>>() {}), ShapeKind.SLICE);
    assertEquals(kindOf(new TypeToken<ArrayList<Long>>() {}), ShapeKind.SLICE);
    assertEquals(kindOf(new TypeToken<Map<String, Object>>() {}), ShapeKind.DYNAMIC_MAP);
    assertEquals(kindOf(new TypeToken<Map<String, String>>() {}), ShapeKind.LEAF);
    assertEquals(kindOf(new TypeToken<Optional<String>>() {}), ShapeKind.OPTIONAL);
    assertEquals(kindOf(new TypeToken<Required<Integer>>() {}), ShapeKind.REQUIRED);
    assertEquals(kindOf(Instant.class), ShapeKind.LEAF);
    assertEquals(kindOf(BigDecimal.class), ShapeKind.LEAF);
    assertEquals(kindOf(Timestamp.class), ShapeKind.LEAF);
    assertEquals(kindOf(Ulid.class), ShapeKind.LEAF);
    assertEquals(kindOf(AbstractShape.class), ShapeKind.LEAF);
    assertEquals(kindOf(Runnable.class), ShapeKind.LEAF);
  }

  @Test
  public void testElementTypes() {
    assertEquals(resolver.getShape(Integer.class).getElementType(), TypeToken.of(int.class));
    assertEquals(resolver.getShape(long[].class).getElementType(), TypeToken.of(long.class));
    assertEquals(
        resolver.getShape(new TypeToken<List<String>>() {}).getElementType(),
        TypeToken.of(String.class));
    assertEquals(
        resolver.getShape(new TypeToken<Optional<Instant>>() {}).getElementType(),
        TypeToken.of(Instant.class));
    assertNull(resolver.getShape(String.class).getElementType());
  }

  @Test
  public void testSizes() {
    assertEquals(resolver.getShape(byte.class).getSize(), 1);
    assertEquals(resolver.getShape(char.class).getSize(), 2);
    assertEquals(resolver.getShape(float.class).getSize(), 4);
    assertEquals(resolver.getShape(long.class).getSize(), 8);
    assertEquals(resolver.getShape(String.class).getSize(), Platform.REFERENCE_SIZE);
  }

  @Test
  public void testStructFields() {
    Shape shape = resolver.getShape(Derived.class);
    List<String> names =
        shape.getFields().stream().map(FieldInfo::getName).collect(Collectors.toList());
    // Superclass fields first; the subclass label shadows the inherited one.
    assertEquals(names, List.of("id", "name", "label", "cached", "internal"));
    assertSame(shape.getField("label").getField().getDeclaringClass(), Derived.class);
    assertEquals(shape.getField("name").getKey(), "display_name");
    assertEquals(shape.getField("id").getKey(), "id");
    assertTrue(shape.getField("cached").isTransient());
    assertFalse(shape.getField("cached").isEligible());
    assertTrue(shape.getField("internal").isIgnored());
    assertFalse(shape.getField("internal").isEligible());
    assertTrue(shape.getField("name").isEligible());
    assertNull(shape.getField("counter"));
  }

  @Test
  public void testFieldAccess() {
    Shape shape = resolver.getShape(Derived.class);
    Derived derived = new Derived();
    shape.getField("id").set(derived, 12L);
    shape.getField("name").set(derived, "abc");
    assertEquals(derived.id, 12L);
    assertEquals(derived.name, "abc");
    assertEquals(shape.getField("id").get(derived), 12L);
  }

  @Test
  public void testGenericFieldTypes() {
    Shape shape = resolver.getShape(StringHolder.class);
    assertEquals(shape.getField("value").getType(), TypeToken.of(String.class));
    assertEquals(shape.getField("values").getType(), new TypeToken<List<String>>() {});
  }

  @Test
  public void testNewInstance() {
    WithDefaults withDefaults = (WithDefaults) resolver.getShape(WithDefaults.class).newInstance();
    assertEquals(withDefaults.value, "init");
    NoDefaultConstructor noDefault =
        (NoDefaultConstructor) resolver.getShape(NoDefaultConstructor.class).newInstance();
    assertNull(noDefault.value);
  }

  @Test(expectedExceptions = UnsupportedOperationException.class)
  public void testNewInstanceOfNonStruct() {
    resolver.getShape(String.class).newInstance();
  }

  @Test
  public void testShapesAreCached() {
    assertSame(resolver.getShape(Derived.class), resolver.getShape(Derived.class));
    assertSame(
        resolver.getShape(new TypeToken<List<String>>() {}),
        resolver.getShape(new TypeToken<List<String>>() {}));
  }

  @Test
  public void testCustomLeafTypes() {
    ShapeResolver custom = new ShapeResolver(Set.of(Base.class));
    assertEquals(custom.getShape(Base.class).getKind(), ShapeKind.LEAF);
    assertEquals(custom.getShape(Derived.class).getKind(), ShapeKind.STRUCT);
    assertFalse(custom.isStruct(Base.class));
  }
}
