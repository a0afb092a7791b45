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

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.ArrayList;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * In-process store bounded by entry count, with a ttl carried by each entry.
 */
public class MemoryCacheBackend implements ICacheBackend {
    private record TimedValue(Object value, long ttlNanos) {
    }

    private static class PerEntryExpiry implements Expiry<String, TimedValue> {
        @Override
        public long expireAfterCreate(String key, TimedValue value, long currentTime) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, TimedValue value, long currentTime, long currentDuration) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, TimedValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    private final Cache<String, TimedValue> entries;

    public MemoryCacheBackend(long maxEntries) {
        this(maxEntries, Ticker.systemTicker());
    }

    public MemoryCacheBackend(long maxEntries, Ticker ticker) {
        entries = Caffeine.newBuilder()
            .maximumSize(maxEntries)
            .expireAfter(new PerEntryExpiry())
            .ticker(ticker)
            .executor(MoreExecutors.directExecutor())
            .build();
    }

    @Override
    public CacheStore store() {
        return CacheStore.MEMORY;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        TimedValue timed = entries.getIfPresent(key);
        if (timed == null) {
            return Optional.empty();
        }
        return Optional.of(type.cast(timed.value));
    }

    @Override
    public void set(String key, Object value, Ttl ttl) {
        long ttlNanos = ttl.expires() ? TimeUnit.SECONDS.toNanos(ttl.seconds()) : Long.MAX_VALUE;
        entries.put(key, new TimedValue(value, ttlNanos));
    }

    @Override
    public void del(String key) {
        entries.invalidate(key);
    }

    @Override
    public Stream<String> scan(KeyPattern pattern) {
        // snapshot so callers may delete while consuming
        return new ArrayList<>(entries.asMap().keySet()).stream();
    }

    @Override
    public long keyCount(String prefix) {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    @Override
    public void prune() {
        entries.cleanUp();
    }

    @Override
    public void reset() {
        entries.invalidateAll();
    }

    @Override
    public void close() {
        // nothing held outside the heap
    }
}
