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

package com.modkit.util;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CachePrefix {
    private static final Splitter SEGMENT_SPLITTER = Splitter.on(':').trimResults().omitEmptyStrings();
    private static final Joiner SEGMENT_JOINER = Joiner.on(':');

    /**
     * Joins prefix parts into a {@code a:b:c:} style key prefix. Each part may itself contain
     * {@code :} separated segments; blank segments and null parts are dropped. Returns the empty
     * string when nothing remains.
     */
    public static String build(String... parts) {
        List<String> segments = new ArrayList<>();
        for (String part : parts) {
            if (part != null) {
                SEGMENT_SPLITTER.split(part).forEach(segments::add);
            }
        }
        return segments.isEmpty() ? "" : SEGMENT_JOINER.join(segments) + ":";
    }
}
