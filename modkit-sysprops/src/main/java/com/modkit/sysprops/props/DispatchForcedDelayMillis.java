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

package com.modkit.sysprops.props;

import com.modkit.sysprops.ModKitSysProp;
import com.modkit.sysprops.parser.LongParser;

public final class DispatchForcedDelayMillis extends ModKitSysProp<Long, LongParser> {
    public static final DispatchForcedDelayMillis INSTANCE = new DispatchForcedDelayMillis();

    private DispatchForcedDelayMillis() {
        super("dispatch_forced_delay_millis", 1000L, LongParser.NON_NEGATIVE);
    }
}
