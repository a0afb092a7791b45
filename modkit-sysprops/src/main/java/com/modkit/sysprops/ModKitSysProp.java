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

package com.modkit.sysprops;

import com.modkit.sysprops.parser.PropParser;
import lombok.extern.slf4j.Slf4j;

/**
 * The base class for the operator switches ModKit reads from JVM system properties.
 *
 * @param <T> the value type of the system property after parsing
 * @param <P> the parser type for the system property
 */
@Slf4j
public abstract class ModKitSysProp<T, P extends PropParser<T>> {
    private final String propKey;
    private final P parser;
    private final T defaultValue;
    private volatile T currentValue;

    protected ModKitSysProp(String propKey, T defaultValue, P parser) {
        this.propKey = propKey;
        this.defaultValue = defaultValue;
        this.parser = parser;
        resolve();
    }

    private String sysPropValue(String key) {
        try {
            return System.getProperty(key);
        } catch (SecurityException e) {
            log.warn("Failed to read system property '{}'", key, e);
            return null;
        }
    }

    /**
     * Re-read the property, falling back to the default when it is unset, blank or unparsable.
     */
    public final synchronized void resolve() {
        String value = sysPropValue(propKey);
        if (value == null || value.isBlank()) {
            currentValue = defaultValue;
            return;
        }
        value = value.trim().toLowerCase();
        try {
            currentValue = parser.parse(value);
        } catch (Throwable e) {
            log.warn("Failed to parse system prop '{}':{} - using the default value: {}", propKey, value, defaultValue);
            currentValue = defaultValue;
        }
    }

    public final String propKey() {
        return propKey;
    }

    public final T defaultValue() {
        return defaultValue;
    }

    public final T get() {
        return currentValue;
    }
}
