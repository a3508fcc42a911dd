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

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.function.Supplier;
import org.apache.keyvalue.exception.KeyValueException;
import org.apache.keyvalue.memory.Platform;

/**
 * Creates struct instances: through the no-arg constructor when the class declares one, so field
 * initializers run, otherwise without any constructor call.
 */
final class Instantiators {
  private Instantiators() {}

  static Supplier<Object> of(Class<?> cls) {
    Constructor<?> constructor;
    try {
      constructor = cls.getDeclaredConstructor();
      constructor.setAccessible(true);
    } catch (NoSuchMethodException e) {
      return () -> Platform.newInstance(cls);
    } catch (RuntimeException e) {
      // InaccessibleObjectException, the class lives in a module that is not open to us.
      return () -> Platform.newInstance(cls);
    }
    Constructor<?> ctor = constructor;
    return () -> {
      try {
        return ctor.newInstance();
      } catch (InvocationTargetException e) {
        throw new KeyValueException("constructor of " + cls.getName() + " failed", e.getCause());
      } catch (ReflectiveOperationException e) {
        throw new KeyValueException("unable to instantiate " + cls.getName(), e);
      }
    };
  }
}
