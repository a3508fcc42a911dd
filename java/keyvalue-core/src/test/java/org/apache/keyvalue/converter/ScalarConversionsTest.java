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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotNull;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.expectThrows;

import com.google.protobuf.Timestamp;
import java.time.Instant;
import java.util.UUID;
import org.testng.annotations.Test;

public class ScalarConversionsTest {

  @Test
  public void testDefaults() throws Exception {
    ScalarConversions conversions = ScalarConversions.withDefaults();
    assertEquals(conversions.size(), 4);
    UUID id = UUID.randomUUID();
    assertEquals(conversions.convert(String.class, id), id.toString());
    assertEquals(conversions.convert(UUID.class, id.toString()), id);
    Instant instant = Instant.ofEpochSecond(10, 20);
    Timestamp timestamp = conversions.convert(Timestamp.class, instant);
    assertEquals(timestamp.getSeconds(), 10);
    assertEquals(timestamp.getNanos(), 20);
    assertEquals(conversions.convert(Instant.class, timestamp), instant);
  }

  @Test
  public void testRegisterAndReplace() throws Exception {
    ScalarConversions conversions = new ScalarConversions();
    assertNull(conversions.get(String.class, Integer.class));
    conversions.register(String.class, Integer.class, value -> "#" + value);
    assertNotNull(conversions.get(String.class, Integer.class));
    assertEquals(conversions.convert(String.class, 5), "#5");
    conversions.register(String.class, Integer.class, value -> "n" + value);
    assertEquals(conversions.size(), 1);
    assertEquals(conversions.convert(String.class, 5), "n5");
  }

  @Test
  public void testCopyIsIndependent() throws Exception {
    ScalarConversions conversions = ScalarConversions.withDefaults();
    ScalarConversions snapshot = new ScalarConversions(conversions);
    conversions.register(String.class, Integer.class, value -> "#" + value);
    assertEquals(conversions.size(), 5);
    assertEquals(snapshot.size(), 4);
    assertNull(snapshot.get(String.class, Integer.class));
    UUID id = UUID.randomUUID();
    assertEquals(snapshot.convert(String.class, id), id.toString());
  }

  @Test
  public void testMissingConversion() {
    ScalarConversions conversions = new ScalarConversions();
    expectThrows(IllegalArgumentException.class, () -> conversions.convert(String.class, 1L));
  }
}
