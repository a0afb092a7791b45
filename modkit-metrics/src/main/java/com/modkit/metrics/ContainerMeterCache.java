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

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

class ContainerMeterCache {
    private static final LoadingCache<String, ContainerMeter> CONTAINER_METER_CACHE = Caffeine.newBuilder()
        .weakValues()
        .build(ContainerMeter::new);

    static IContainerMeter get(String container) {
        return CONTAINER_METER_CACHE.get(container);
    }

    static void cleanUp() {
        CONTAINER_METER_CACHE.cleanUp();
    }
}
