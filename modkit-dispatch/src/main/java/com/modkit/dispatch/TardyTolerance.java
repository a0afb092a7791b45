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
import java.time.Duration;
import java.util.Objects;

/**
 * How late a dispatch may run before its re-evaluation is flagged tardy. A record that is not
 * tolerant still gets one scheduler tick of grace so ordinary tick jitter is not reported.
 */
public final class TardyTolerance {
    public static final TardyTolerance NOT_TOLERANT = new TardyTolerance(false, null);
    public static final TardyTolerance ALWAYS = new TardyTolerance(true, null);

    private final boolean tolerant;
    private final Duration tolerance;

    private TardyTolerance(boolean tolerant, Duration tolerance) {
        this.tolerant = tolerant;
        this.tolerance = tolerance;
    }

    public static TardyTolerance of(Duration tolerance) {
        Preconditions.checkArgument(!tolerance.isNegative(), "negative tardy tolerance %s", tolerance);
        return new TardyTolerance(true, tolerance);
    }

    public static TardyTolerance of(boolean tolerant) {
        return tolerant ? ALWAYS : NOT_TOLERANT;
    }

    /**
     * @param overdue time elapsed since the record became due
     * @param grace   allowance used when the record is not tolerant at all
     */
    public boolean isTardy(Duration overdue, Duration grace) {
        if (!tolerant) {
            return overdue.compareTo(grace) > 0;
        }
        return tolerance != null && overdue.compareTo(tolerance) > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TardyTolerance)) {
            return false;
        }
        TardyTolerance that = (TardyTolerance) o;
        return tolerant == that.tolerant && Objects.equals(tolerance, that.tolerance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tolerant, tolerance);
    }

    @Override
    public String toString() {
        if (tolerance != null) {
            return tolerance.toString();
        }
        return String.valueOf(tolerant);
    }
}
