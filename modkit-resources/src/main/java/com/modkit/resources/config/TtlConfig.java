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

package com.modkit.resources.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.modkit.cache.Ttl;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * Per-kind cache lifetimes. Fields left unset inherit from the configuration this one is layered on.
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class TtlConfig {
    @JsonProperty("authorTTL")
    private Ttl authorTTL;
    @JsonProperty("userNotesTTL")
    private Ttl userNotesTTL;
    @JsonProperty("wikiTTL")
    private Ttl wikiTTL;
    @JsonProperty("submissionTTL")
    private Ttl submissionTTL;
    @JsonProperty("commentTTL")
    private Ttl commentTTL;
    @JsonProperty("filterCriteriaTTL")
    private Ttl filterCriteriaTTL;
    @JsonProperty("subredditTTL")
    private Ttl subredditTTL;

    public static TtlConfig defaults() {
        TtlConfig defaults = new TtlConfig();
        defaults.authorTTL = Ttl.ofSeconds(60);
        defaults.userNotesTTL = Ttl.ofSeconds(300);
        defaults.wikiTTL = Ttl.ofSeconds(300);
        defaults.submissionTTL = Ttl.ofSeconds(60);
        defaults.commentTTL = Ttl.ofSeconds(60);
        defaults.filterCriteriaTTL = Ttl.ofSeconds(60);
        defaults.subredditTTL = Ttl.ofSeconds(600);
        return defaults;
    }

    /**
     * A copy where every unset field is taken from {@code base}.
     */
    public TtlConfig withDefaults(TtlConfig base) {
        TtlConfig merged = new TtlConfig();
        merged.authorTTL = pick(authorTTL, base.authorTTL);
        merged.userNotesTTL = pick(userNotesTTL, base.userNotesTTL);
        merged.wikiTTL = pick(wikiTTL, base.wikiTTL);
        merged.submissionTTL = pick(submissionTTL, base.submissionTTL);
        merged.commentTTL = pick(commentTTL, base.commentTTL);
        merged.filterCriteriaTTL = pick(filterCriteriaTTL, base.filterCriteriaTTL);
        merged.subredditTTL = pick(subredditTTL, base.subredditTTL);
        return merged;
    }

    public List<Ttl> all() {
        return List.of(authorTTL, userNotesTTL, wikiTTL, submissionTTL, commentTTL, filterCriteriaTTL,
            subredditTTL);
    }

    private static Ttl pick(Ttl value, Ttl fallback) {
        return value != null ? value : fallback;
    }
}
