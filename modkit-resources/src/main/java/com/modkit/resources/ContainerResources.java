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

import com.modkit.cache.KeyPatternResult;
import com.modkit.cache.ManagedCache;
import com.modkit.dispatch.DispatchQueue;
import com.modkit.dispatch.DispatchScheduler;
import com.modkit.metrics.ContainerMetric;
import com.modkit.metrics.IContainerMeter;
import com.modkit.resources.config.TtlConfig;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * Everything a single container works with: its cache, which may be shared, and its dispatch queue
 * with the scheduler draining it. The queue outlives cache reconfiguration.
 */
@Slf4j
public class ContainerResources {
    private final String name;
    private final DispatchQueue queue;
    private final DispatchScheduler scheduler;
    private volatile ManagedCache cache;
    private volatile TtlConfig ttl;

    ContainerResources(String name,
                       ManagedCache cache,
                       TtlConfig ttl,
                       DispatchQueue queue,
                       DispatchScheduler scheduler) {
        this.name = name;
        this.cache = cache;
        this.ttl = ttl;
        this.queue = queue;
        this.scheduler = scheduler;
        IContainerMeter.gauging(name, ContainerMetric.CacheKeyNumGauge, () -> this.cache.getCacheKeyCount());
    }

    public String name() {
        return name;
    }

    public ManagedCache cache() {
        return cache;
    }

    public TtlConfig ttl() {
        return ttl;
    }

    public DispatchQueue queue() {
        return queue;
    }

    public DispatchScheduler scheduler() {
        return scheduler;
    }

    /**
     * Swap in a new cache and ttl set, returning the cache that was replaced.
     */
    ManagedCache configure(ManagedCache cache, TtlConfig ttl) {
        ManagedCache previous = this.cache;
        this.cache = cache;
        this.ttl = ttl;
        return previous;
    }

    /**
     * Drop every cached entry whose key mentions the activity, e.g. after the bot acted on it.
     */
    public KeyPatternResult invalidateActivity(String activityId) {
        KeyPatternResult result = cache.deleteByKeyPattern("*" + activityId + "*");
        log.debug("[Resources:{}] invalidated {} cached key(s) for {}", name, result.keys().size(), activityId);
        return result;
    }

    CompletableFuture<Void> destroy() {
        IContainerMeter.stopGauging(name, ContainerMetric.CacheKeyNumGauge);
        return scheduler.stop().whenComplete((v, e) -> {
            queue.close();
            cache.destroy();
            log.debug("[Resources:{}] destroyed", name);
        });
    }
}
