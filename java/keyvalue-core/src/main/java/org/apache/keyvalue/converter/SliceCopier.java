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

import java.util.ArrayList;
import java.util.List;

/**
 * Copies lists of structs element by element. A null element stays null; the first failing element
 * aborts the whole copy.
 *
 * @param <D> destination element
 * @param <S> source element
 */
public final class SliceCopier<D, S> {
  private final TypedCopier<D, S> elementCopier;

  public SliceCopier(TypedCopier<D, S> elementCopier) {
    this.elementCopier = elementCopier;
  }

  public List<D> copy(List<S> src) {
    if (src == null) {
      return null;
    }
    List<D> result = new ArrayList<>(src.size());
    for (S element : src) {
      result.add(elementCopier.copy(element));
    }
    return result;
  }
}
