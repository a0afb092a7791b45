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

package com.modkit.sysprops.parser;

import com.google.common.base.Preconditions;

/**
 * Parses a long within the half-open range {@code [lowBound, highBoundEx)}.
 */
public class LongParser implements PropParser<Long> {
    public static final LongParser POSITIVE = new LongParser(1, Long.MAX_VALUE);
    public static final LongParser NON_NEGATIVE = new LongParser(0, Long.MAX_VALUE);

    private final long lowBound;
    private final long highBoundEx;

    private LongParser(long lowBound, long highBoundEx) {
        this.lowBound = lowBound;
        this.highBoundEx = highBoundEx;
    }

    public static LongParser between(long lowBound, long highBoundEx) {
        Preconditions.checkArgument(lowBound < highBoundEx, "empty range [%s,%s)", lowBound, highBoundEx);
        return new LongParser(lowBound, highBoundEx);
    }

    @Override
    public Long parse(String value) {
        long val;
        try {
            val = Long.parseLong(value.replace("_", ""));
        } catch (NumberFormatException e) {
            throw new SysPropParseException(String.format("'%s' is not a number", value));
        }
        if (lowBound <= val && val < highBoundEx) {
            return val;
        }
        throw new SysPropParseException(String.format("%d is out of bound [%d,%d)", val, lowBound, highBoundEx));
    }
}
