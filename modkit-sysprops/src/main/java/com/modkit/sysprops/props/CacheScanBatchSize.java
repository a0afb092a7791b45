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
 * The COUNT hint passed to each Redis SCAN round trip.
 */
public final class CacheScanBatchSize extends ModKitSysProp<Long, LongParser> {
    public static final CacheScanBatchSize INSTANCE = new CacheScanBatchSize();

    private CacheScanBatchSize() {
        super("cache_scan_batch_size", 100L, LongParser.between(1, 100_000));
    }
}
