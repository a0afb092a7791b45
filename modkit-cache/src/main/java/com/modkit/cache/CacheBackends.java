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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.modkit.sysprops.props.CacheScanBatchSize;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CacheBackends {
    private static final ObjectMapper VALUE_MAPPER = new ObjectMapper();

    /**
     * Build the backend described by a normalized provider config.
     */
    public static ICacheBackend create(CacheProviderConfig normalized) {
        switch (normalized.getStore()) {
            case REDIS:
                return RedisCacheBackend.connect(normalized, VALUE_MAPPER,
                    CacheScanBatchSize.INSTANCE.get().intValue());
            case NONE:
                return new NoopCacheBackend();
            case MEMORY:
            default:
                return new MemoryCacheBackend(normalized.getMax());
        }
    }
}
