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

import com.google.common.base.Preconditions;
import com.modkit.metrics.ContainerMetric;
import com.modkit.metrics.IContainerMeter;
import com.modkit.sysprops.props.CachePruneMinTTLCapSeconds;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * A logical cache over one {@link ICacheBackend}. Keys are transparently prefixed so several
 * logical caches can share one physical store.
 *
 * <p>Lookups degrade to a miss when the backend fails. Writes, deletes and bulk operations
 * propagate {@link CacheBackendException} so callers whose correctness depends on them can react.
 */
@Slf4j
public class ManagedCache {
    private final String name;
    private final CacheProviderConfig config;
    private final String fingerprint;
    private final boolean defaultCache;
    private final String prefix;
    private final ICacheBackend backend;
    private final ScheduledExecutorService timer;
    private final IContainerMeter meter;
    private final LongAdder requests = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private volatile ScheduledFuture<?> pruneTask;
    private volatile Duration pruneInterval;

    public ManagedCache(String name,
                        CacheProviderConfig config,
                        ICacheBackend backend,
                        boolean defaultCache,
                        ScheduledExecutorService timer) {
        this.name = name;
        this.config = config.normalize();
        Preconditions.checkArgument(this.config.getStore() == backend.store(),
            "backend %s does not match configured store %s", backend.store(), this.config.getStore());
        this.fingerprint = this.config.fingerprint();
        this.defaultCache = defaultCache;
        this.prefix = this.config.getPrefix();
        this.backend = backend;
        this.timer = timer;
        this.meter = IContainerMeter.get(name);
    }

    public static ManagedCache open(String name,
                                    CacheProviderConfig config,
                                    boolean defaultCache,
                                    ScheduledExecutorService timer) {
        CacheProviderConfig normalized = config.normalize();
        return new ManagedCache(name, normalized, CacheBackends.create(normalized), defaultCache, timer);
    }

    public String name() {
        return name;
    }

    public CacheStore store() {
        return backend.store();
    }

    public String prefix() {
        return prefix;
    }

    public boolean isDefaultCache() {
        return defaultCache;
    }

    public CacheProviderConfig providerConfig() {
        return config.copy();
    }

    public Ttl defaultTtl() {
        return config.getTtl();
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        requests.increment();
        meter.recordCount(ContainerMetric.CacheRequestCount);
        Optional<T> value;
        try {
            value = backend.get(prefix + key, type);
        } catch (CacheBackendException e) {
            meter.recordCount(ContainerMetric.CacheBackendErrorCount);
            log.warn("[Cache:{}] get '{}' failed, treating as miss", name, key, e);
            value = Optional.empty();
        }
        if (value.isEmpty()) {
            misses.increment();
            meter.recordCount(ContainerMetric.CacheMissCount);
        }
        return value;
    }

    public void set(String key, Object value) {
        set(key, value, config.getTtl());
    }

    public void set(String key, Object value, Ttl ttl) {
        Preconditions.checkNotNull(value, "cannot cache null for key %s", key);
        if (ttl.isDisabled()) {
            return;
        }
        backend.set(prefix + key, value, ttl);
    }

    public void del(String key) {
        backend.del(prefix + key);
    }

    /**
     * Return the cached value for {@code key}, or compute, store and return it. A disabled ttl
     * bypasses the cache entirely. A failure to store the computed value is logged, not thrown.
     */
    public <T> T wrap(String key, Class<T> type, Supplier<T> loader, Ttl ttl) {
        if (ttl.isDisabled()) {
            return loader.get();
        }
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        T value = loader.get();
        if (value != null) {
            try {
                set(key, value, ttl);
            } catch (CacheBackendException e) {
                log.warn("[Cache:{}] storing computed value for '{}' failed", name, key, e);
            }
        }
        return value;
    }

    public <T> T wrap(String key, Class<T> type, Supplier<T> loader) {
        return wrap(key, type, loader, config.getTtl());
    }

    /**
     * Drop every key of this logical cache. A prefixed cache only removes its own keys.
     */
    public void reset() {
        if (prefix.isEmpty()) {
            backend.reset();
        } else {
            interactWithCacheByKeyPattern("*", KeyPatternAction.DELETE);
        }
    }

    /**
     * Whether {@code candidate} describes the same provider as this cache.
     */
    public boolean equalProvider(CacheProviderConfig candidate) {
        return fingerprint.equals(candidate.fingerprint());
    }

    /**
     * Schedule recurring eviction of expired entries for a private memory cache. The interval is
     * twice the smallest expiring ttl in {@code ttls}, with that ttl capped by
     * {@link CachePruneMinTTLCapSeconds}. Default caches and non-memory stores are left alone.
     */
    public synchronized void setPruneInterval(Collection<Ttl> ttls) {
        if (defaultCache || backend.store() != CacheStore.MEMORY) {
            return;
        }
        OptionalLong min = ttls.stream().filter(Ttl::expires).mapToLong(Ttl::seconds).min();
        cancelPruneTask();
        if (min.isEmpty()) {
            log.debug("[Cache:{}] no expiring ttl configured, pruning disabled", name);
            pruneInterval = null;
            return;
        }
        long minSeconds = Math.min(min.getAsLong(), CachePruneMinTTLCapSeconds.INSTANCE.get());
        pruneInterval = Duration.ofSeconds(minSeconds * 2);
        log.debug("[Cache:{}] pruning every {}s", name, pruneInterval.getSeconds());
        pruneTask = timer.scheduleAtFixedRate(this::prune,
            pruneInterval.toMillis(), pruneInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Optional<Duration> pruneInterval() {
        return Optional.ofNullable(pruneInterval);
    }

    private void prune() {
        try {
            backend.prune();
        } catch (Throwable e) {
            log.warn("[Cache:{}] prune failed", name, e);
        }
    }

    private void cancelPruneTask() {
        ScheduledFuture<?> task = pruneTask;
        if (task != null) {
            task.cancel(false);
            pruneTask = null;
        }
    }

    public long getCacheKeyCount() {
        return backend.keyCount(backend.store() == CacheStore.REDIS ? prefix : "");
    }

    public KeyPatternResult interactWithCacheByKeyPattern(String pattern, KeyPatternAction action) {
        return interact(KeyPattern.parse(pattern, prefix), action);
    }

    public KeyPatternResult interactWithCacheByKeyPattern(Pattern pattern, KeyPatternAction action) {
        return interact(KeyPattern.of(pattern), action);
    }

    public KeyPatternResult deleteByKeyPattern(String pattern) {
        return interactWithCacheByKeyPattern(pattern, KeyPatternAction.DELETE);
    }

    public Map<String, Object> getByKeyPattern(String pattern) {
        return interactWithCacheByKeyPattern(pattern, KeyPatternAction.GET).values();
    }

    private KeyPatternResult interact(KeyPattern pattern, KeyPatternAction action) {
        Set<String> keys = new LinkedHashSet<>();
        Map<String, Object> values = new LinkedHashMap<>();
        try (Stream<String> candidates = backend.scan(pattern)) {
            candidates
                .filter(key -> prefix.isEmpty() || key.contains(prefix))
                .filter(pattern::matches)
                .forEach(key -> {
                    switch (action) {
                        case DELETE:
                            backend.del(key);
                            keys.add(key);
                            break;
                        case GET:
                        default:
                            backend.get(key, Object.class).ifPresent(value -> {
                                keys.add(key);
                                values.put(key, value);
                            });
                            break;
                    }
                });
        }
        log.debug("[Cache:{}] {} by pattern '{}' touched {} key(s)", name, action, pattern, keys.size());
        return new KeyPatternResult(keys, values);
    }

    public CacheStats stats() {
        return new CacheStats(requests.sum(), misses.sum());
    }

    /**
     * Stop pruning and release what this cache owns. Contents of a private memory cache are
     * dropped; shared default caches keep their entries for other users.
     */
    public synchronized void destroy() {
        cancelPruneTask();
        pruneInterval = null;
        if (defaultCache) {
            return;
        }
        if (backend.store() == CacheStore.MEMORY) {
            backend.reset();
        }
        backend.close();
    }

    /**
     * Release the backend whether or not the cache is shared. Only the owner of a default cache calls this.
     */
    public synchronized void close() {
        cancelPruneTask();
        pruneInterval = null;
        backend.close();
    }
}
