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

package com.modkit.resources;

import com.modkit.cache.CacheProviderConfig;
import com.modkit.cache.ManagedCache;
import com.modkit.dispatch.DispatchQueue;
import com.modkit.dispatch.DispatchScheduler;
import com.modkit.dispatch.IActivityPipeline;
import com.modkit.dispatch.IActivityResolver;
import com.modkit.resources.config.CachingConfig;
import com.modkit.resources.config.ContainerConfig;
import com.modkit.resources.config.TtlConfig;
import com.modkit.util.CachePrefix;
import com.modkit.util.ThreadUtil;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the shared default cache and hands every container its resources. A container gets the
 * shared cache unless its caching settings describe a different provider, in which case it gets a
 * private cache under its own key prefix.
 */
@Slf4j
public class ResourcesManager {
    static final String SHARED = "SHARED";

    private final Map<String, ContainerResources> resources = new ConcurrentHashMap<>();
    private final String configuredPrefix;
    private final CacheProviderConfig defaultProvider;
    private final TtlConfig ttlDefaults;
    private final ManagedCache defaultCache;
    private final IActivityResolver resolver;
    private final IActivityPipeline pipeline;
    private final Clock clock;
    private final ScheduledExecutorService timer;
    private final boolean ownTimer;

    public ResourcesManager(CachingConfig caching, IActivityResolver resolver, IActivityPipeline pipeline) {
        this(caching, resolver, pipeline, Clock.systemUTC(), ThreadUtil.timerExecutor("modkit-timer-%d", 2), true);
    }

    public ResourcesManager(CachingConfig caching,
                            IActivityResolver resolver,
                            IActivityPipeline pipeline,
                            Clock clock,
                            ScheduledExecutorService timer) {
        this(caching, resolver, pipeline, clock, timer, false);
    }

    private ResourcesManager(CachingConfig caching,
                             IActivityResolver resolver,
                             IActivityPipeline pipeline,
                             Clock clock,
                             ScheduledExecutorService timer,
                             boolean ownTimer) {
        CacheProviderConfig provider = caching.getProvider() == null
            ? CacheProviderConfig.fromStore("memory") : caching.getProvider();
        this.configuredPrefix = CachePrefix.build(provider.getPrefix());
        this.defaultProvider = provider.copy();
        this.defaultProvider.setPrefix(CachePrefix.build(provider.getPrefix(), SHARED));
        this.ttlDefaults = caching.getTtl() == null
            ? TtlConfig.defaults() : caching.getTtl().withDefaults(TtlConfig.defaults());
        this.resolver = resolver;
        this.pipeline = pipeline;
        this.clock = clock;
        this.timer = timer;
        this.ownTimer = ownTimer;
        this.defaultCache = ManagedCache.open(SHARED, defaultProvider, true, timer);
        log.info("[Resources] default cache store={} prefix='{}'", defaultCache.store(), defaultCache.prefix());
    }

    public ManagedCache defaultCache() {
        return defaultCache;
    }

    public TtlConfig ttlDefaults() {
        return ttlDefaults;
    }

    public Optional<ContainerResources> get(String name) {
        return Optional.ofNullable(resources.get(name));
    }

    /**
     * Create or reconfigure the resources of container {@code name}. An existing container keeps
     * its dispatch queue and scheduler; only the cache and ttl set may change.
     */
    public synchronized ContainerResources set(String name, ContainerConfig config) {
        ContainerResources existing = resources.get(name);
        TtlConfig ttl = ttlDefaults;
        ManagedCache cache = defaultCache;

        CachingConfig caching = config.getCaching();
        if (caching != null) {
            if (caching.getTtl() != null) {
                ttl = caching.getTtl().withDefaults(ttlDefaults);
            }
            if (!config.isSharedCache()) {
                cache = resolveCache(name, caching, existing, ttl);
            }
        }

        if (existing == null) {
            DispatchQueue queue = new DispatchQueue(name);
            DispatchScheduler scheduler = new DispatchScheduler(queue, resolver, pipeline, clock, timer);
            ContainerResources created = new ContainerResources(name, cache, ttl, queue, scheduler);
            resources.put(name, created);
            scheduler.start();
            log.info("[Resources:{}] created with {} cache", name, cache.isDefaultCache() ? "shared" : "private");
            return created;
        }
        ManagedCache previous = existing.configure(cache, ttl);
        if (previous != cache) {
            previous.destroy();
            log.info("[Resources:{}] cache replaced, now {}", name, cache.isDefaultCache() ? "shared" : "private");
        }
        return existing;
    }

    private ManagedCache resolveCache(String name, CachingConfig caching, ContainerResources existing, TtlConfig ttl) {
        CacheProviderConfig candidate = caching.getProvider() == null
            ? defaultProvider.copy() : caching.getProvider().copy();
        // the shared prefix is scoped down to the container so private keys never land in the shared space
        if (CachePrefix.build(candidate.getPrefix()).equals(defaultCache.prefix())) {
            candidate.setPrefix(CachePrefix.build(configuredPrefix, name));
        }
        if (defaultCache.equalProvider(candidate)) {
            return defaultCache;
        }
        if (existing != null && existing.cache().equalProvider(candidate)) {
            existing.cache().setPruneInterval(ttl.all());
            return existing.cache();
        }
        ManagedCache cache = ManagedCache.open(name, candidate, false, timer);
        cache.setPruneInterval(ttl.all());
        return cache;
    }

    public CompletableFuture<Void> destroy(String name) {
        ContainerResources removed;
        synchronized (this) {
            removed = resources.remove(name);
        }
        if (removed == null) {
            return CompletableFuture.completedFuture(null);
        }
        return removed.destroy();
    }

    /**
     * Destroy every container, then release the default cache.
     */
    public CompletableFuture<Void> destroyAll() {
        CompletableFuture<?>[] all = resources.keySet().stream()
            .map(this::destroy)
            .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(all).whenComplete((v, e) -> {
            defaultCache.close();
            if (ownTimer) {
                timer.shutdown();
            }
        });
    }
}
