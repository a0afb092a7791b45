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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Parses {@code /pattern/flags} literals as written in operator configuration.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class RegexLiterals {
    private static final Pattern LITERAL = Pattern.compile("^/(.*)/([a-zA-Z]*)$", Pattern.DOTALL);

    public static boolean isLiteral(String value) {
        return value != null && LITERAL.matcher(value.trim()).matches();
    }

    /**
     * Compiles {@code value} when it is a regex literal.
     *
     * @param value        the candidate literal
     * @param defaultFlags flags applied when the literal carries none
     * @return the compiled pattern, or empty when {@code value} is not a literal
     * @throws InvalidPatternException if it is a literal whose body or flags are invalid
     */
    public static Optional<Pattern> parse(String value, String defaultFlags) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher literal = LITERAL.matcher(value.trim());
        if (!literal.matches()) {
            return Optional.empty();
        }
        String flags = literal.group(2).isEmpty() ? defaultFlags : literal.group(2);
        try {
            return Optional.of(Pattern.compile(literal.group(1), toJavaFlags(flags)));
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException("Invalid regular expression: " + value, e);
        }
    }

    static int toJavaFlags(String flags) {
        int javaFlags = 0;
        for (char flag : flags.toCharArray()) {
            switch (flag) {
                case 'i':
                    javaFlags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
                    break;
                case 'm':
                    javaFlags |= Pattern.MULTILINE;
                    break;
                case 's':
                    javaFlags |= Pattern.DOTALL;
                    break;
                case 'u':
                    javaFlags |= Pattern.UNICODE_CHARACTER_CLASS;
                    break;
                case 'x':
                    javaFlags |= Pattern.COMMENTS;
                    break;
                case 'g':
                case 'y':
                    // stateful matching flags, meaningless for a one-shot test
                    break;
                default:
                    throw new InvalidPatternException("Unsupported regular expression flag: " + flag);
            }
        }
        return javaFlags;
    }
}
