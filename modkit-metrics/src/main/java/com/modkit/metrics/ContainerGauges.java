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

import static com.modkit.metrics.IContainerMeter.TAG_CONTAINER;

import com.google.common.base.Preconditions;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Metrics;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

class ContainerGauges {
    private static final ConcurrentMap<String, Map<ContainerMetric, Gauge>> CONTAINER_GAUGES =
        new ConcurrentHashMap<>();

    static void gauging(String container, ContainerMetric gaugeMetric, Supplier<Number> supplier) {
        Preconditions.checkArgument(gaugeMetric.meterType == Meter.Type.GAUGE, "%s is not a gauge", gaugeMetric);
        CONTAINER_GAUGES.compute(container, (k, v) -> {
            if (v == null) {
                v = new EnumMap<>(ContainerMetric.class);
            }
            v.computeIfAbsent(gaugeMetric, metric -> Gauge.builder(metric.metricName, supplier)
                .tag(TAG_CONTAINER, container)
                .register(Metrics.globalRegistry));
            return v;
        });
    }

    static void stopGauging(String container, ContainerMetric gaugeMetric) {
        Preconditions.checkArgument(gaugeMetric.meterType == Meter.Type.GAUGE, "%s is not a gauge", gaugeMetric);
        CONTAINER_GAUGES.computeIfPresent(container, (k, gaugeMap) -> {
            Gauge gauge = gaugeMap.remove(gaugeMetric);
            if (gauge != null) {
                Metrics.globalRegistry.remove(gauge);
            }
            return gaugeMap.isEmpty() ? null : gaugeMap;
        });
    }
}
