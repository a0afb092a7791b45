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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.testng.annotations.Test;

public class CacheProviderConfigTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void normalizeFillsDefaults() {
        CacheProviderConfig memory = new CacheProviderConfig().normalize();
        assertEquals(memory.getStore(), CacheStore.MEMORY);
        assertEquals(memory.getTtl(), Ttl.ofSeconds(60));
        assertEquals(memory.getMax(), Integer.valueOf(500));
        assertEquals(memory.getPrefix(), "");
        assertNull(memory.getHost());

        CacheProviderConfig redis = CacheProviderConfig.fromStore("redis");
        redis.setMax(20);
        redis.setPrefix("modkit");
        CacheProviderConfig normalizedRedis = redis.normalize();
        assertEquals(normalizedRedis.getHost(), "localhost");
        assertEquals(normalizedRedis.getPort(), Integer.valueOf(6379));
        assertEquals(normalizedRedis.getDb(), Integer.valueOf(0));
        assertEquals(normalizedRedis.getPrefix(), "modkit:");
        assertNull(normalizedRedis.getMax());
    }

    @Test
    public void fingerprintIgnoresFieldOrderAndDefaults() throws Exception {
        CacheProviderConfig c1 = mapper.readValue(
            "{\"store\":\"redis\",\"host\":\"cache.local\",\"ttl\":120,\"prefix\":\"bot\"}",
            CacheProviderConfig.class);
        CacheProviderConfig c2 = mapper.readValue(
            "{\"prefix\":\"bot:\",\"ttl\":120,\"port\":6379,\"host\":\"cache.local\",\"store\":\"REDIS\",\"max\":9}",
            CacheProviderConfig.class);
        assertEquals(c1.fingerprint(), c2.fingerprint());

        CacheProviderConfig c3 = mapper.readValue(
            "{\"store\":\"redis\",\"host\":\"cache.local\",\"ttl\":60,\"prefix\":\"bot\"}",
            CacheProviderConfig.class);
        assertNotEquals(c1.fingerprint(), c3.fingerprint());
    }

    @Test
    public void bareStoreString() throws Exception {
        CacheProviderConfig config = mapper.readValue("\"none\"", CacheProviderConfig.class);
        assertEquals(config.getStore(), CacheStore.NONE);
    }

    @Test
    public void authPassProperty() throws Exception {
        CacheProviderConfig config = mapper.readValue("{\"store\":\"redis\",\"auth_pass\":\"secret\"}",
            CacheProviderConfig.class);
        assertEquals(config.getAuthPass(), "secret");
        assertTrue(!config.toString().contains("secret"));
    }

    @Test
    public void ttlForms() throws Exception {
        assertEquals(mapper.readValue("true", Ttl.class), Ttl.INDEFINITE);
        assertEquals(mapper.readValue("0", Ttl.class), Ttl.INDEFINITE);
        assertTrue(mapper.readValue("false", Ttl.class).isDisabled());
        assertEquals(mapper.readValue("30", Ttl.class).seconds(), 30);
        assertEquals(mapper.writeValueAsString(Ttl.DISABLED), "false");
        assertEquals(mapper.writeValueAsString(Ttl.ofSeconds(5)), "5");
        assertThrows(IllegalArgumentException.class, () -> Ttl.ofSeconds(-3));
        assertThrows(IllegalStateException.class, () -> Ttl.INDEFINITE.toDuration());
    }
}
