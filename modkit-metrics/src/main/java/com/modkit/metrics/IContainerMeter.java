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

import io.micrometer.core.instrument.Timer;
import java.util.function.Supplier;

/**
 * Meters scoped to one moderated container. Instances are shared per container name and
 * unregister their meters once no caller holds them anymore.
 */
public interface IContainerMeter {
    String TAG_CONTAINER = "container";

    static IContainerMeter get(String container) {
        return ContainerMeterCache.get(container);
    }

    static void gauging(String container, ContainerMetric gaugeMetric, Supplier<Number> supplier) {
        ContainerGauges.gauging(container, gaugeMetric, supplier);
    }

    static void stopGauging(String container, ContainerMetric gaugeMetric) {
        ContainerGauges.stopGauging(container, gaugeMetric);
    }

    void recordCount(ContainerMetric metric);

    void recordCount(ContainerMetric metric, double inc);

    Timer timer(ContainerMetric metric);
}
