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

package com.modkit.util;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Redis-flavoured glob support: {@code *}, {@code ?}, {@code [abc]}, {@code [^a]}, {@code [a-z]}
 * and backslash escapes.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Globs {

    /**
     * Compiles a glob into an anchored, case-insensitive pattern.
     */
    public static Pattern toPattern(String glob) {
        try {
            return Pattern.compile(toRegex(glob), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException("Invalid glob: " + glob, e);
        }
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder("^");
        boolean inClass = false;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (inClass) {
                if (c == ']') {
                    inClass = false;
                    regex.append(']');
                } else if (c == '\\' || c == '[' || c == '&') {
                    regex.append('\\').append(c);
                } else {
                    regex.append(c);
                }
                continue;
            }
            switch (c) {
                case '*':
                    regex.append(".*");
                    break;
                case '?':
                    regex.append('.');
                    break;
                case '[':
                    if (glob.indexOf(']', i + 1) < 0) {
                        throw new InvalidPatternException("Unclosed character class in glob: " + glob);
                    }
                    inClass = true;
                    regex.append('[');
                    if (i + 1 < glob.length() && glob.charAt(i + 1) == '^') {
                        regex.append('^');
                        i++;
                    }
                    break;
                case '\\':
                    if (i + 1 < glob.length()) {
                        regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
                    } else {
                        regex.append("\\\\");
                    }
                    break;
                default:
                    regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.append('$').toString();
    }
}
