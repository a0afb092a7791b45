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
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.Objects;

/**
 * Time-to-live of a cache entry. {@code true} and {@code 0} mean the entry never expires,
 * {@code false} means the value is not cached at all.
 */
public final class Ttl {
    public static final Ttl INDEFINITE = new Ttl(0);
    public static final Ttl DISABLED = new Ttl(-1);

    private final long seconds;

    private Ttl(long seconds) {
        this.seconds = seconds;
    }

    public static Ttl ofSeconds(long seconds) {
        Preconditions.checkArgument(seconds >= 0, "ttl must not be negative: %s", seconds);
        return seconds == 0 ? INDEFINITE : new Ttl(seconds);
    }

    @JsonCreator
    public static Ttl of(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? INDEFINITE : DISABLED;
        }
        if (value instanceof Number) {
            return ofSeconds(((Number) value).longValue());
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if ("true".equalsIgnoreCase(text)) {
                return INDEFINITE;
            }
            if ("false".equalsIgnoreCase(text)) {
                return DISABLED;
            }
            return ofSeconds(Long.parseLong(text));
        }
        throw new IllegalArgumentException("Unsupported ttl value: " + value);
    }

    public boolean isDisabled() {
        return seconds < 0;
    }

    public boolean isIndefinite() {
        return seconds == 0;
    }

    /**
     * Whether entries with this ttl expire by themselves.
     */
    public boolean expires() {
        return seconds > 0;
    }

    public long seconds() {
        return seconds;
    }

    public Duration toDuration() {
        Preconditions.checkState(expires(), "ttl %s has no duration", this);
        return Duration.ofSeconds(seconds);
    }

    @JsonValue
    public Object jsonValue() {
        return isDisabled() ? Boolean.FALSE : (Object) seconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Ttl)) {
            return false;
        }
        return seconds == ((Ttl) o).seconds;
    }

    @Override
    public int hashCode() {
        return Objects.hash(seconds);
    }

    @Override
    public String toString() {
        if (isDisabled()) {
            return "disabled";
        }
        return isIndefinite() ? "indefinite" : seconds + "s";
    }
}
