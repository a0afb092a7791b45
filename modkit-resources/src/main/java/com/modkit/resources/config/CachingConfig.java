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

package com.modkit.resources.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.modkit.cache.CacheProviderConfig;
import lombok.Getter;
import lombok.Setter;

/**
 * Cache provider plus the ttl fields written next to it, e.g.
 * <pre>
 * caching:
 *   provider: memory
 *   authorTTL: 120
 * </pre>
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class CachingConfig {
    private CacheProviderConfig provider;
    @JsonUnwrapped
    private TtlConfig ttl = new TtlConfig();
}
