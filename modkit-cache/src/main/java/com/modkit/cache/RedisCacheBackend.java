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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Streams;
import java.util.Collections;
import java.util.Iterator;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

/**
 * Redis store. Values are kept as JSON text; key enumeration uses {@code SCAN} so large key
 * spaces are walked page by page.
 */
@Slf4j
public class RedisCacheBackend implements ICacheBackend {
    private final UnifiedJedis jedis;
    private final ObjectMapper mapper;
    private final int scanBatchSize;

    public RedisCacheBackend(UnifiedJedis jedis, ObjectMapper mapper, int scanBatchSize) {
        this.jedis = jedis;
        this.mapper = mapper;
        this.scanBatchSize = scanBatchSize;
    }

    public static RedisCacheBackend connect(CacheProviderConfig config, ObjectMapper mapper, int scanBatchSize) {
        DefaultJedisClientConfig clientConfig = DefaultJedisClientConfig.builder()
            .password(config.getAuthPass())
            .database(config.getDb() == null ? 0 : config.getDb())
            .build();
        log.debug("Connecting redis cache backend: host={}, port={}, db={}",
            config.getHost(), config.getPort(), config.getDb());
        JedisPooled pooled = new JedisPooled(new HostAndPort(config.getHost(), config.getPort()), clientConfig);
        return new RedisCacheBackend(pooled, mapper, scanBatchSize);
    }

    @Override
    public CacheStore store() {
        return CacheStore.REDIS;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        String raw;
        try {
            raw = jedis.get(key);
        } catch (JedisException e) {
            throw new CacheBackendException("redis GET failed for key " + key, e);
        }
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(raw, type));
        } catch (JsonProcessingException e) {
            throw new CacheBackendException("cached value for key " + key + " is not a " + type.getSimpleName(), e);
        }
    }

    @Override
    public void set(String key, Object value, Ttl ttl) {
        String json;
        try {
            json = mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheBackendException("value for key " + key + " cannot be serialized", e);
        }
        try {
            if (ttl.expires()) {
                jedis.setex(key, ttl.seconds(), json);
            } else {
                jedis.set(key, json);
            }
        } catch (JedisException e) {
            throw new CacheBackendException("redis SET failed for key " + key, e);
        }
    }

    @Override
    public void del(String key) {
        try {
            jedis.del(key);
        } catch (JedisException e) {
            throw new CacheBackendException("redis DEL failed for key " + key, e);
        }
    }

    @Override
    public Stream<String> scan(KeyPattern pattern) {
        ScanParams params = new ScanParams().count(scanBatchSize);
        pattern.glob().ifPresent(params::match);
        return Streams.stream(scanIterator(params));
    }

    @Override
    public long keyCount(String prefix) {
        ScanParams params = new ScanParams().count(scanBatchSize).match(prefix.isEmpty() ? "*" : prefix + "*");
        Iterator<String> keys = scanIterator(params);
        long count = 0;
        while (keys.hasNext()) {
            keys.next();
            count++;
        }
        return count;
    }

    private Iterator<String> scanIterator(ScanParams params) {
        return new AbstractIterator<>() {
            private String cursor = ScanParams.SCAN_POINTER_START;
            private Iterator<String> page = Collections.emptyIterator();
            private boolean complete = false;

            @Override
            protected String computeNext() {
                while (!page.hasNext()) {
                    if (complete) {
                        return endOfData();
                    }
                    ScanResult<String> result;
                    try {
                        result = jedis.scan(cursor, params);
                    } catch (JedisException e) {
                        throw new CacheBackendException("redis SCAN failed at cursor " + cursor, e);
                    }
                    cursor = result.getCursor();
                    complete = result.isCompleteIteration();
                    page = result.getResult().iterator();
                }
                return page.next();
            }
        };
    }

    @Override
    public void prune() {
        // redis expires keys by itself
    }

    @Override
    public void reset() {
        try {
            jedis.flushDB();
        } catch (JedisException e) {
            throw new CacheBackendException("redis FLUSHDB failed", e);
        }
    }

    @Override
    public void close() {
        jedis.close();
    }
}
