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
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.expectThrows;

import com.google.common.reflect.TypeToken;
import java.util.Arrays;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.keyvalue.annotation.Ignore;
import org.apache.keyvalue.exception.CompilationException;
import org.apache.keyvalue.exception.ConversionException;
import org.apache.keyvalue.type.ShapeResolver;
import org.testng.annotations.Test;

public class StructCopierCompilerTest {

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class User {
    private String name;
    private int age;
    private String email;
    private transient String session;
    @Ignore private String password;
  }

  @Data
  @NoArgsConstructor
  public static class UserSummary {
    private String name;
    private int age;
  }

  @Data
  @NoArgsConstructor
  public static class UserView {
    private String name;
    private int age;
    private String email;
    private String session;
  }

  @Data
  @NoArgsConstructor
  public static class GuardedView {
    private String name;
    private int age;
    private transient String email;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Employee {
    private String name;
    private Employee manager;
  }

  @Data
  @NoArgsConstructor
  public static class EmployeeDto {
    private String name;
    private EmployeeDto manager;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Team {
    private String title;
    private Employee[] members;
  }

  @Data
  @NoArgsConstructor
  public static class TeamDto {
    private String title;
    private EmployeeDto[] members;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Inner {
    private String level;
  }

  @Data
  @NoArgsConstructor
  public static class InnerDto {
    private Level level;
  }

  public enum Level {
    LOW,
    HIGH
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Outer {
    private String id;
    private Inner inner;
  }

  @Data
  @NoArgsConstructor
  public static class OuterDto {
    private String id;
    private InnerDto inner;
  }

  private final StructCopierCompiler compiler = newCompiler();

  private static StructCopierCompiler newCompiler() {
    return new StructCopierCompiler(
        new ShapeResolver(), ScalarConversions.withDefaults(), new ConversionCache());
  }

  private StructCopier compile(Class<?> dst, Class<?> src, CopierOptions options) {
    return compiler.getOrCompile(TypeToken.of(dst), TypeToken.of(src), options);
  }

  @Test
  public void testSkipsTransientAndIgnoredFields() {
    StructCopier copier = compile(UserView.class, User.class, CopierOptions.DEFAULT);
    assertEquals(copier.getFieldNames(), Arrays.asList("name", "age", "email"));
    UserView view = new UserView();
    copier.copy(view, new User("ann", 30, "ann@example.com", "s-1", "pw"));
    assertEquals(view.getName(), "ann");
    assertEquals(view.getAge(), 30);
    assertEquals(view.getEmail(), "ann@example.com");
    assertNull(view.getSession());
  }

  @Test
  public void testFieldNotFound() {
    CompilationException e =
        expectThrows(
            CompilationException.class,
            () -> compile(UserSummary.class, User.class, CopierOptions.DEFAULT));
    assertEquals(e.getReason(), CompilationException.Reason.FIELD_NOT_FOUND);
    assertEquals(e.getAttribute("srcField"), "email");
    assertEquals(e.getAttribute("srcType"), "User");
    assertEquals(
        e.getMessage(), "field not found srcField=email srcType=User dstType=UserSummary");
  }

  @Test
  public void testTransientDestinationFieldIsNotAMatch() {
    CompilationException e =
        expectThrows(
            CompilationException.class,
            () -> compile(GuardedView.class, User.class, CopierOptions.DEFAULT));
    assertEquals(e.getReason(), CompilationException.Reason.FIELD_NOT_FOUND);
    assertEquals(e.getAttribute("srcField"), "email");
  }

  @Test
  public void testOmitUnmatchedFields() {
    StructCopier copier =
        compile(
            UserSummary.class,
            User.class,
            CopierOptions.builder().omitUnmatchedFields(true).build());
    assertEquals(copier.getFieldNames(), Arrays.asList("name", "age"));
  }

  @Test
  public void testIncludeAndExcludeFields() {
    StructCopier included =
        compile(UserView.class, User.class, CopierOptions.builder().includeFields("age").build());
    assertEquals(included.getFieldNames(), Arrays.asList("age"));
    UserView view = new UserView();
    included.copy(view, new User("ann", 30, "ann@example.com", null, null));
    assertNull(view.getName());
    assertEquals(view.getAge(), 30);

    StructCopier excluded =
        compile(
            UserSummary.class, User.class, CopierOptions.builder().excludeFields("email").build());
    assertEquals(excluded.getFieldNames(), Arrays.asList("name", "age"));

    // Exclusion wins over inclusion.
    StructCopier both =
        compile(
            UserView.class,
            User.class,
            CopierOptions.builder().includeFields("name", "age").excludeFields("name").build());
    assertEquals(both.getFieldNames(), Arrays.asList("age"));
  }

  @Test
  public void testTypeNotStruct() {
    CompilationException e =
        expectThrows(
            CompilationException.class,
            () -> compile(String.class, User.class, CopierOptions.DEFAULT));
    assertEquals(e.getReason(), CompilationException.Reason.TYPE_NOT_STRUCT);
    e =
        expectThrows(
            CompilationException.class,
            () -> compile(User.class, Integer.class, CopierOptions.DEFAULT));
    assertEquals(e.getReason(), CompilationException.Reason.TYPE_NOT_STRUCT);
  }

  @Test
  public void testCircularTypeReference() {
    StructCopierCompiler fresh = newCompiler();
    CompilationException e =
        expectThrows(
            CompilationException.class,
            () ->
                fresh.getOrCompile(
                    TypeToken.of(EmployeeDto.class),
                    TypeToken.of(Employee.class),
                    CopierOptions.DEFAULT));
    assertEquals(e.getReason(), CompilationException.Reason.CIRCULAR_TYPE_REFERENCE);
    assertEquals(e.getAttribute("srcField"), "manager");
    // Failed compilations are not cached.
    assertEquals(fresh.getCache().size(), 0);

    // Reached through a slice, the cycle is found as well.
    e =
        expectThrows(
            CompilationException.class,
            () -> compile(TeamDto.class, Team.class, CopierOptions.DEFAULT));
    assertEquals(e.getReason(), CompilationException.Reason.CIRCULAR_TYPE_REFERENCE);
    assertEquals(e.getAttribute("srcField"), "members.manager");
  }

  @Test
  public void testSelfReferenceWithIdenticalTypes() {
    // Same type on both sides is a reference copy, no nested copier is needed.
    StructCopier copier = compile(Employee.class, Employee.class, CopierOptions.DEFAULT);
    Employee boss = new Employee("boss", null);
    Employee copy = new Employee();
    copier.copy(copy, new Employee("ann", boss));
    assertSame(copy.getManager(), boss);
  }

  @Test
  public void testNestedFieldPath() {
    StructCopier copier = compile(OuterDto.class, Outer.class, CopierOptions.DEFAULT);
    OuterDto dst = new OuterDto();
    copier.copy(dst, new Outer("o-1", new Inner("HIGH")));
    assertEquals(dst.getInner().getLevel(), Level.HIGH);

    OuterDto partial = new OuterDto();
    Outer invalid = new Outer("o-2", new Inner("x"));
    ConversionException e =
        expectThrows(ConversionException.class, () -> copier.copy(partial, invalid));
    assertEquals(e.getAttribute("srcField"), "inner.level");
    // Fields copied before the failure keep their values.
    assertEquals(partial.getId(), "o-2");
    assertNull(partial.getInner());
  }

  @Test
  public void testCompileBypassesCache() {
    StructCopierCompiler fresh = newCompiler();
    TypePair pair = new TypePair(TypeToken.of(UserView.class), TypeToken.of(User.class));
    StructCopier copier = fresh.compile(pair.getDst(), pair.getSrc(), CopierOptions.DEFAULT);
    assertEquals(copier.getTypePair(), pair);
    assertNull(fresh.getCache().get(pair, CopierOptions.DEFAULT));
  }
}
