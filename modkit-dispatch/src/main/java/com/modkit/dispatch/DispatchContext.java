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

import java.time.Duration;

/**
 * What the pipeline is told when a queued record is re-injected.
 *
 * @param source     always a dispatch source, carrying the record identifier when it has one
 * @param gotoTarget pipeline location to resume at, may be null
 * @param tardy      whether the record ran later than its tolerance allows
 * @param overdue    how long after its due time the record started
 */
public record DispatchContext(String dispatchId,
                              String action,
                              DispatchType type,
                              ActivitySource source,
                              String gotoTarget,
                              boolean dryRun,
                              boolean tardy,
                              Duration overdue) {
}
