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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.hash.Hashing;
import com.modkit.util.CachePrefix;
import java.nio.charset.StandardCharsets;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Operator facing description of a cache provider.
 */
@Getter
@Setter
@NoArgsConstructor
@ToString(exclude = "authPass")
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheProviderConfig {
    public static final Ttl DEFAULT_TTL = Ttl.ofSeconds(60);
    public static final int DEFAULT_MAX = 500;
    public static final String DEFAULT_REDIS_HOST = "localhost";
    public static final int DEFAULT_REDIS_PORT = 6379;

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();

    private CacheStore store;
    private String host;
    private Integer port;
    @JsonProperty("auth_pass")
    private String authPass;
    private Integer db;
    private Ttl ttl;
    private Integer max;
    private String prefix;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CacheProviderConfig fromStore(String store) {
        CacheProviderConfig config = new CacheProviderConfig();
        config.setStore(CacheStore.fromValue(store));
        return config;
    }

    public CacheProviderConfig copy() {
        CacheProviderConfig copy = new CacheProviderConfig();
        copy.store = store;
        copy.host = host;
        copy.port = port;
        copy.authPass = authPass;
        copy.db = db;
        copy.ttl = ttl;
        copy.max = max;
        copy.prefix = prefix;
        return copy;
    }

    /**
     * Returns a copy with defaults filled in, the prefix in canonical {@code a:b:} form and the
     * settings that do not apply to the chosen store removed.
     */
    public CacheProviderConfig normalize() {
        CacheProviderConfig normalized = new CacheProviderConfig();
        normalized.store = store == null ? CacheStore.MEMORY : store;
        normalized.ttl = ttl == null ? DEFAULT_TTL : ttl;
        normalized.prefix = CachePrefix.build(prefix);
        switch (normalized.store) {
            case REDIS:
                normalized.host = host == null || host.isBlank() ? DEFAULT_REDIS_HOST : host.trim();
                normalized.port = port == null ? DEFAULT_REDIS_PORT : port;
                normalized.authPass = authPass;
                normalized.db = db == null ? 0 : db;
                break;
            case MEMORY:
                normalized.max = max == null ? DEFAULT_MAX : max;
                break;
            case NONE:
            default:
                break;
        }
        return normalized;
    }

    /**
     * A content hash of the normalized settings. Two configs that describe the same provider have
     * the same fingerprint regardless of how they were written.
     */
    public String fingerprint() {
        try {
            String canonical = CANONICAL_MAPPER.writeValueAsString(normalize());
            return Hashing.sha256().hashString(canonical, StandardCharsets.UTF_8).toString();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize cache provider config", e);
        }
    }
}
