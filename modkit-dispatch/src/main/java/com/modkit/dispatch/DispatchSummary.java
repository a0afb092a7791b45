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

import java.time.Instant;

public record DispatchSummary(String id,
                              String activityId,
                              String action,
                              String identifier,
                              DispatchType type,
                              Instant dueAt,
                              boolean processing) {
    static DispatchSummary of(ActivityDispatch dispatch) {
        return new DispatchSummary(dispatch.getId(), dispatch.getActivity().id(), dispatch.getAction(),
            dispatch.getIdentifier(), dispatch.getType(), dispatch.dueAt(), dispatch.isProcessing());
    }
}
