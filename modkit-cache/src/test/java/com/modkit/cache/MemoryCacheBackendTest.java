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
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class MemoryCacheBackendTest {
    private AtomicLong nanos;
    private MemoryCacheBackend backend;

    @BeforeMethod
    public void setup() {
        nanos = new AtomicLong();
        Ticker ticker = nanos::get;
        backend = new MemoryCacheBackend(100, ticker);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    @Test
    public void perEntryTtl() {
        backend.set("short", "a", Ttl.ofSeconds(5));
        backend.set("long", "b", Ttl.ofSeconds(60));
        backend.set("forever", "c", Ttl.INDEFINITE);

        advance(Duration.ofSeconds(6));
        assertFalse(backend.get("short", String.class).isPresent());
        assertEquals(backend.get("long", String.class).get(), "b");

        advance(Duration.ofDays(365));
        assertFalse(backend.get("long", String.class).isPresent());
        assertEquals(backend.get("forever", String.class).get(), "c");
    }

    @Test
    public void overwriteRefreshesTtl() {
        backend.set("k", 1, Ttl.ofSeconds(5));
        advance(Duration.ofSeconds(4));
        backend.set("k", 2, Ttl.ofSeconds(5));
        advance(Duration.ofSeconds(4));
        assertEquals(backend.get("k", Integer.class).get(), Integer.valueOf(2));
    }

    @Test
    public void keyCountAndScanSkipExpired() {
        backend.set("a", 1, Ttl.ofSeconds(1));
        backend.set("b", 2, Ttl.ofSeconds(100));
        assertEquals(backend.keyCount(""), 2);

        advance(Duration.ofSeconds(2));
        backend.prune();
        assertEquals(backend.keyCount(""), 1);
        assertEquals(backend.scan(KeyPattern.parse("*", "")).collect(Collectors.toList()), List.of("b"));
    }

    @Test
    public void boundedSize() {
        MemoryCacheBackend small = new MemoryCacheBackend(3);
        for (int i = 0; i < 50; i++) {
            small.set("k" + i, i, Ttl.INDEFINITE);
        }
        assertTrue(small.keyCount("") <= 3);
    }

    @Test
    public void reset() {
        backend.set("a", 1, Ttl.INDEFINITE);
        backend.del("missing");
        backend.reset();
        assertEquals(backend.keyCount(""), 0);
    }
}
