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

package com.modkit.dispatch.action;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.modkit.dispatch.ActivitySource;
import com.modkit.dispatch.CancelIfQueued;
import com.modkit.dispatch.DispatchTarget;
import com.modkit.dispatch.OnExistingFound;
import com.modkit.dispatch.TardyTolerance;
import com.modkit.util.DurationResolver;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * Configuration of a dispatch or rerun action as operators write it.
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class DispatchActionConfig {
    private String name;
    private Duration delay;
    private String identifier;
    @JsonProperty("goto")
    private String gotoTarget;
    private OnExistingFound onExistingFound = OnExistingFound.IGNORE;
    private TardyTolerance tardyTolerant = TardyTolerance.NOT_TOLERANT;
    private CancelIfQueued cancelIfQueued = CancelIfQueued.NEVER;
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<DispatchTarget> target = new ArrayList<>(List.of(DispatchTarget.SELF));
    private Boolean dryRun;

    /**
     * Accepts a {@link Duration}, shorthand text, ISO-8601 text or a map of unit fields.
     */
    public void setDelay(Object value) {
        this.delay = DurationResolver.resolve(value);
    }

    public void setTardyTolerant(Object value) {
        if (value == null) {
            this.tardyTolerant = TardyTolerance.NOT_TOLERANT;
        } else if (value instanceof TardyTolerance) {
            this.tardyTolerant = (TardyTolerance) value;
        } else if (value instanceof Boolean) {
            this.tardyTolerant = TardyTolerance.of((Boolean) value);
        } else {
            this.tardyTolerant = TardyTolerance.of(DurationResolver.resolve(value));
        }
    }

    public void setCancelIfQueued(Object value) {
        if (value == null) {
            this.cancelIfQueued = CancelIfQueued.NEVER;
        } else if (value instanceof CancelIfQueued) {
            this.cancelIfQueued = (CancelIfQueued) value;
        } else if (value instanceof Boolean) {
            this.cancelIfQueued = CancelIfQueued.of((Boolean) value);
        } else if (value instanceof List) {
            List<ActivitySource> sources = new ArrayList<>();
            for (Object source : (List<?>) value) {
                sources.add(ActivitySource.parse(String.valueOf(source)));
            }
            this.cancelIfQueued = CancelIfQueued.of(sources);
        } else {
            this.cancelIfQueued = CancelIfQueued.of(List.of(ActivitySource.parse(value.toString())));
        }
    }
}
