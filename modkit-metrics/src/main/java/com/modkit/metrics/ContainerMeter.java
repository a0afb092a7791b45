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

import com.google.common.base.Preconditions;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.lang.ref.Cleaner;
import java.util.EnumMap;
import java.util.Map;

class ContainerMeter implements IContainerMeter {
    private static final Cleaner CLEANER = Cleaner.create();

    private static class State implements Runnable {
        final Map<ContainerMetric, Meter> meters = new EnumMap<>(ContainerMetric.class);

        State(Tags tags) {
            for (ContainerMetric metric : ContainerMetric.values()) {
                switch (metric.meterType) {
                    case COUNTER:
                        meters.put(metric, Metrics.counter(metric.metricName, tags));
                        break;
                    case TIMER:
                        meters.put(metric, Metrics.timer(metric.metricName, tags));
                        break;
                    case GAUGE:
                        // registered on demand by ContainerGauges
                        break;
                    default:
                        throw new UnsupportedOperationException("Unsupported container meter type");
                }
            }
        }

        @Override
        public void run() {
            meters.values().forEach(Metrics.globalRegistry::remove);
            meters.clear();
        }
    }

    private final State state;

    ContainerMeter(String container) {
        this.state = new State(Tags.of(TAG_CONTAINER, container));
        CLEANER.register(this, state);
    }

    @Override
    public void recordCount(ContainerMetric metric) {
        recordCount(metric, 1);
    }

    @Override
    public void recordCount(ContainerMetric metric, double inc) {
        Preconditions.checkArgument(metric.meterType == Meter.Type.COUNTER, "%s is not a counter", metric);
        ((Counter) state.meters.get(metric)).increment(inc);
    }

    @Override
    public Timer timer(ContainerMetric metric) {
        Preconditions.checkArgument(metric.meterType == Meter.Type.TIMER, "%s is not a timer", metric);
        return (Timer) state.meters.get(metric);
    }
}
