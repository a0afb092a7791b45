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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Matches the identifier of queued records.
 *
 * <p>An unconstrained filter matches every record. Otherwise a record without identifier only
 * matches when the filter explicitly accepts "no identifier", and a record with one matches
 * when the filter lists it.
 */
public final class IdentifierFilter {
    private static final IdentifierFilter ANY = new IdentifierFilter(true, false, Set.of());

    private final boolean any;
    private final boolean acceptMissing;
    private final Set<String> identifiers;

    private IdentifierFilter(boolean any, boolean acceptMissing, Set<String> identifiers) {
        this.any = any;
        this.acceptMissing = acceptMissing;
        this.identifiers = identifiers;
    }

    public static IdentifierFilter any() {
        return ANY;
    }

    /**
     * Collision matching for producers: no configured identifier collides with everything,
     * otherwise only records carrying exactly that identifier collide.
     */
    public static IdentifierFilter forCollision(String identifier) {
        return identifier == null ? ANY : new IdentifierFilter(false, false, Set.of(identifier));
    }

    /**
     * Cancel matching: a null list matches everything, a null element inside the list matches
     * records without identifier.
     */
    public static IdentifierFilter forCancel(List<String> identifiers) {
        if (identifiers == null) {
            return ANY;
        }
        Set<String> concrete = new HashSet<>();
        boolean acceptMissing = false;
        for (String identifier : identifiers) {
            if (identifier == null) {
                acceptMissing = true;
            } else {
                concrete.add(identifier);
            }
        }
        return new IdentifierFilter(false, acceptMissing, Collections.unmodifiableSet(concrete));
    }

    public boolean matches(String identifier) {
        if (any) {
            return true;
        }
        if (identifier == null) {
            return acceptMissing;
        }
        return identifiers.contains(identifier);
    }

    public boolean isAny() {
        return any;
    }

    /**
     * Renders the filter for action results, e.g. {@code No Identifier OR tagA, tagB}.
     */
    public String describe() {
        if (any) {
            return "Any";
        }
        List<String> hints = new ArrayList<>();
        if (acceptMissing) {
            hints.add("No Identifier");
        }
        if (!identifiers.isEmpty()) {
            List<String> sorted = new ArrayList<>(identifiers);
            Collections.sort(sorted);
            hints.add(String.join(", ", sorted));
        }
        return String.join(" OR ", hints);
    }
}
