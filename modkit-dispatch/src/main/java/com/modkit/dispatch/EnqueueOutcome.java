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

import java.util.List;

/**
 * @param inserted  whether the candidate record was added
 * @param colliding the records that matched the candidate before the policy was applied
 * @param replaced  the colliding records removed by a replace policy
 */
public record EnqueueOutcome(boolean inserted, List<ActivityDispatch> colliding, List<ActivityDispatch> replaced) {
}
