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
import com.fasterxml.jackson.annotation.JsonSetter;
import com.modkit.dispatch.DispatchTarget;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class CancelDispatchActionConfig {
    private String name;
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<DispatchTarget> target = new ArrayList<>(List.of(DispatchTarget.SELF));
    private Boolean dryRun;
    /**
     * Null when no identifier filter was given. A null element stands for "records without identifier".
     */
    private List<String> identifiers;

    /**
     * An explicit {@code identifier: null} is kept as a one element list holding null, which is
     * different from leaving the key out.
     */
    @JsonSetter("identifier")
    public void setIdentifier(Object value) {
        if (value == null) {
            this.identifiers = Collections.singletonList(null);
        } else if (value instanceof List) {
            List<String> parsed = new ArrayList<>();
            for (Object identifier : (List<?>) value) {
                parsed.add(identifier == null ? null : identifier.toString());
            }
            this.identifiers = parsed;
        } else {
            this.identifiers = Arrays.asList(value.toString());
        }
    }
}
