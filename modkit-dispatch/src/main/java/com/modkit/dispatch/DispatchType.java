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

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DispatchType {
    /**
     * Re-run the producing action's configured flow against the activity.
     */
    DISPATCH,
    /**
     * Re-run the whole check pipeline against the activity.
     */
    RERUN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
