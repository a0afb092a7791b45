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

package com.modkit.sysprops.props;

import com.modkit.sysprops.ModKitSysProp;
import com.modkit.sysprops.parser.LongParser;

/**
 * How often the dispatch scheduler wakes up to look for due records.
 */
public final class DispatchTickIntervalMillis extends ModKitSysProp<Long, LongParser> {
    public static final DispatchTickIntervalMillis INSTANCE = new DispatchTickIntervalMillis();

    private DispatchTickIntervalMillis() {
        super("dispatch_tick_interval_millis", 1000L, LongParser.between(10, 3_600_000));
    }
}
