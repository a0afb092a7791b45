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

package com.modkit.dispatch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import java.util.Locale;

/**
 * Where an activity being processed came from, written {@code type[:identifier]}, e.g.
 * {@code poll}, {@code poll:newComm} or {@code dispatch:recheck}.
 *
 * @param identifier null when unspecified
 */
public record ActivitySource(ActivitySourceType type, String identifier) {
    public ActivitySource {
        Preconditions.checkNotNull(type, "source type");
    }

    public static ActivitySource of(ActivitySourceType type) {
        return new ActivitySource(type, null);
    }

    public static ActivitySource dispatch(String identifier) {
        return new ActivitySource(ActivitySourceType.DISPATCH, identifier);
    }

    @JsonCreator
    public static ActivitySource parse(String value) {
        Preconditions.checkArgument(value != null && !value.isBlank(), "empty activity source");
        String trimmed = value.trim();
        int sep = trimmed.indexOf(':');
        String type = sep < 0 ? trimmed : trimmed.substring(0, sep);
        String identifier = sep < 0 ? null : trimmed.substring(sep + 1).trim();
        ActivitySourceType sourceType;
        try {
            sourceType = ActivitySourceType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown activity source type: " + value, e);
        }
        return new ActivitySource(sourceType, identifier == null || identifier.isEmpty() ? null : identifier);
    }

    /**
     * Whether {@code other} is covered by this source used as a matcher: types must be equal and,
     * when this source names an identifier, {@code other} must carry the same one.
     */
    public boolean matches(ActivitySource other) {
        if (type != other.type) {
            return false;
        }
        if (identifier == null) {
            return true;
        }
        return other.identifier != null && identifier.equalsIgnoreCase(other.identifier);
    }

    @JsonValue
    @Override
    public String toString() {
        String name = type.name().toLowerCase(Locale.ROOT);
        return identifier == null ? name : name + ":" + identifier;
    }
}
