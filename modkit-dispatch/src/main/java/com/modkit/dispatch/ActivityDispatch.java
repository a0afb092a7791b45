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
import java.time.Instant;
import java.util.UUID;
import lombok.Builder;
import lombok.Getter;

/**
 * One queued unit of delayed work. Everything but the processing flag is fixed at creation; the
 * flag is owned by {@link DispatchQueue} and only changes under its lock.
 */
@Getter
public final class ActivityDispatch {
    private final String id;
    private final ActivityRef activity;
    private final DispatchType type;
    private final Instant queuedAt;
    private final Duration delay;
    private final String identifier;
    private final String gotoTarget;
    private final OnExistingFound onExistingFound;
    private final TardyTolerance tardyTolerant;
    private final CancelIfQueued cancelIfQueued;
    private final String action;
    private final Boolean dryRun;
    private boolean processing;

    @Builder
    private ActivityDispatch(String id,
                             ActivityRef activity,
                             DispatchType type,
                             Instant queuedAt,
                             Duration delay,
                             String identifier,
                             String gotoTarget,
                             OnExistingFound onExistingFound,
                             TardyTolerance tardyTolerant,
                             CancelIfQueued cancelIfQueued,
                             String action,
                             Boolean dryRun) {
        this.id = id == null ? UUID.randomUUID().toString() : id;
        this.activity = Preconditions.checkNotNull(activity, "activity");
        this.type = type == null ? DispatchType.DISPATCH : type;
        this.queuedAt = Preconditions.checkNotNull(queuedAt, "queuedAt");
        this.delay = Preconditions.checkNotNull(delay, "delay");
        Preconditions.checkArgument(!delay.isNegative(), "negative delay %s", delay);
        this.identifier = identifier;
        this.gotoTarget = gotoTarget;
        this.onExistingFound = onExistingFound == null ? OnExistingFound.IGNORE : onExistingFound;
        this.tardyTolerant = tardyTolerant == null ? TardyTolerance.NOT_TOLERANT : tardyTolerant;
        this.cancelIfQueued = cancelIfQueued == null ? CancelIfQueued.NEVER : cancelIfQueued;
        this.action = action;
        this.dryRun = dryRun;
    }

    public Instant dueAt() {
        return queuedAt.plus(delay);
    }

    public boolean isDue(Instant now) {
        return !dueAt().isAfter(now);
    }

    public boolean isDryRun() {
        return Boolean.TRUE.equals(dryRun);
    }

    void setProcessing(boolean processing) {
        this.processing = processing;
    }

    @Override
    public String toString() {
        return "ActivityDispatch{id=" + id + ", activity=" + activity.id() + ", type=" + type.value()
            + ", identifier=" + identifier + ", action=" + action + ", dueAt=" + dueAt() + "}";
    }
}
