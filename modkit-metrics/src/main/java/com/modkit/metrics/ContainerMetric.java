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

package com.modkit.metrics;

import io.micrometer.core.instrument.Meter;

public enum ContainerMetric {
    // cache related metrics
    CacheRequestCount("modkit.cache.request.count", Meter.Type.COUNTER),
    CacheMissCount("modkit.cache.miss.count", Meter.Type.COUNTER),
    CacheBackendErrorCount("modkit.cache.backend.error.count", Meter.Type.COUNTER),
    CacheKeyNumGauge("modkit.cache.key.num.gauge", Meter.Type.GAUGE),

    // dispatch related metrics
    DispatchEnqueueCount("modkit.dispatch.enqueue.count", Meter.Type.COUNTER),
    DispatchSkipCount("modkit.dispatch.skip.count", Meter.Type.COUNTER),
    DispatchReplaceCount("modkit.dispatch.replace.count", Meter.Type.COUNTER),
    DispatchCancelCount("modkit.dispatch.cancel.count", Meter.Type.COUNTER),
    DispatchExecuteCount("modkit.dispatch.execute.count", Meter.Type.COUNTER),
    DispatchExecuteFailureCount("modkit.dispatch.execute.failure.count", Meter.Type.COUNTER),
    DispatchTardyCount("modkit.dispatch.tardy.count", Meter.Type.COUNTER),
    DispatchExecuteLatency("modkit.dispatch.execute.latency", Meter.Type.TIMER),
    DispatchQueueSizeGauge("modkit.dispatch.queue.size.gauge", Meter.Type.GAUGE);

    public final String metricName;
    public final Meter.Type meterType;

    ContainerMetric(String metricName, Meter.Type meterType) {
        this.metricName = metricName;
        this.meterType = meterType;
    }
}
