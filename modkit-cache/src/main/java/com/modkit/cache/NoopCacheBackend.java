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
 * Stores nothing; every lookup is a miss.
 */
public class NoopCacheBackend implements ICacheBackend {
    @Override
    public CacheStore store() {
        return CacheStore.NONE;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return Optional.empty();
    }

    @Override
    public void set(String key, Object value, Ttl ttl) {
    }

    @Override
    public void del(String key) {
    }

    @Override
    public Stream<String> scan(KeyPattern pattern) {
        return Stream.empty();
    }

    @Override
    public long keyCount(String prefix) {
        return 0;
    }

    @Override
    public void prune() {
    }

    @Override
    public void reset() {
    }

    @Override
    public void close() {
    }
}
