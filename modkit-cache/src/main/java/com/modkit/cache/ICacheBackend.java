/*
 * Copyright (c) 2024. The ModKit Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *    http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and limitations under the License.
 */

package com.modkit.cache;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * A physical key/value store with per-entry expiry. Keys passed here are already prefixed.
 * Failures surface as {@link CacheBackendException}.
 */
public interface ICacheBackend {
    CacheStore store();

    <T> Optional<T> get(String key, Class<T> type);

    /**
     * Store a value. Callers never pass {@link Ttl#DISABLED}.
     */
    void set(String key, Object value, Ttl ttl);

    void del(String key);

    /**
     * Lazily enumerate keys that may match {@code pattern}. The result can be a superset, callers
     * test every key themselves. Closing the stream stops the enumeration.
     */
    Stream<String> scan(KeyPattern pattern);

    /**
     * Count keys under {@code prefix}; an empty prefix counts everything the store holds.
     */
    long keyCount(String prefix);

    /**
     * Evict expired entries eagerly where the store does not do it by itself.
     */
    void prune();

    void reset();

    void close();
}
