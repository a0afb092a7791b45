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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Decides whether a queued record is dropped when the same activity shows up again from a
 * fresh, non-dispatch source.
 */
public final class CancelIfQueued {
    public static final CancelIfQueued NEVER = new CancelIfQueued(false, List.of());
    public static final CancelIfQueued ANY_SOURCE = new CancelIfQueued(true, List.of());

    private final boolean any;
    private final List<ActivitySource> sources;

    private CancelIfQueued(boolean any, List<ActivitySource> sources) {
        this.any = any;
        this.sources = sources;
    }

    public static CancelIfQueued of(boolean cancel) {
        return cancel ? ANY_SOURCE : NEVER;
    }

    public static CancelIfQueued of(List<ActivitySource> sources) {
        for (ActivitySource source : sources) {
            Preconditions.checkArgument(source.type() != ActivitySourceType.DISPATCH,
                "dispatch sources cannot cancel queued records: %s", source);
        }
        return sources.isEmpty() ? NEVER : new CancelIfQueued(false, ImmutableList.copyOf(sources));
    }

    public boolean shouldCancel(ActivitySource fresh) {
        if (fresh.type() == ActivitySourceType.DISPATCH) {
            return false;
        }
        if (any) {
            return true;
        }
        return sources.stream().anyMatch(matcher -> matcher.matches(fresh));
    }

    public List<ActivitySource> sources() {
        return sources;
    }

    public boolean isAny() {
        return any;
    }

    @Override
    public String toString() {
        return any ? "true" : sources.isEmpty() ? "false" : sources.toString();
    }
}
