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

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of compiled struct copiers keyed by type pair and options. Entries are added once and
 * never evicted. Lookups share a read lock; compilation runs outside any lock and only the insert
 * takes the write lock, so two threads missing on the same pair may both compile it. Compilation
 * is deterministic, the second insert just replaces an equivalent copier. Failed compilations are
 * not stored.
 */
public final class ConversionCache {
  private static final Logger LOG = LoggerFactory.getLogger(ConversionCache.class);

  private final Map<Key, StructCopier> copiers = new HashMap<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  /** Returns the cached copier, or null. */
  public StructCopier get(TypePair pair, CopierOptions options) {
    Key key = new Key(pair, options);
    lock.readLock().lock();
    try {
      return copiers.get(key);
    } finally {
      lock.readLock().unlock();
    }
  }

  public StructCopier getOrCompile(
      TypePair pair, CopierOptions options, Supplier<StructCopier> compiler) {
    StructCopier copier = get(pair, options);
    if (copier != null) {
      return copier;
    }
    LOG.debug("No cached copier for {} with {}, compiling", pair, options);
    copier = compiler.get();
    lock.writeLock().lock();
    try {
      copiers.put(new Key(pair, options), copier);
    } finally {
      lock.writeLock().unlock();
    }
    return copier;
  }

  public int size() {
    lock.readLock().lock();
    try {
      return copiers.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  private static final class Key {
    private final TypePair pair;
    private final CopierOptions options;

    Key(TypePair pair, CopierOptions options) {
      this.pair = pair;
      this.options = options;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Key)) {
        return false;
      }
      Key key = (Key) o;
      return pair.equals(key.pair) && options.equals(key.options);
    }

    @Override
    public int hashCode() {
      return Objects.hash(pair, options);
    }
  }
}
