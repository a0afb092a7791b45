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

package com.modkit.sysprops.parser;

import java.util.Set;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class BooleanParser implements PropParser<Boolean> {
    public static final BooleanParser INSTANCE = new BooleanParser();

    private static final Set<String> TRUTHY = Set.of("true", "y", "yes", "on", "1");
    private static final Set<String> FALSY = Set.of("false", "n", "no", "off", "0");

    @Override
    public Boolean parse(String value) {
        if (TRUTHY.contains(value)) {
            return true;
        }
        if (FALSY.contains(value)) {
            return false;
        }
        throw new SysPropParseException(String.format("'%s' is not a boolean", value));
    }
}
