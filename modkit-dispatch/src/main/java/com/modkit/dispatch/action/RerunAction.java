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

import com.modkit.dispatch.DispatchQueue;
import com.modkit.dispatch.DispatchType;
import com.modkit.dispatch.IActivityResolver;
import java.time.Clock;

/**
 * Queues the activity for a complete re-run of the check pipeline after a delay.
 */
public class RerunAction extends AbstractDispatchAction {
    public RerunAction(String name,
                       DispatchActionConfig config,
                       DispatchQueue queue,
                       IActivityResolver resolver,
                       Clock clock) {
        super(name, config, queue, resolver, clock);
    }

    @Override
    protected DispatchType dispatchType() {
        return DispatchType.RERUN;
    }
}
