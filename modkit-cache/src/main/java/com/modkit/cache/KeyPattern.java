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

package com.modkit.cache;

import com.modkit.util.Globs;
import com.modkit.util.RegexLiterals;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A parsed key pattern: either a user supplied regular expression or a glob compiled to one.
 * Globs keep their source text so stores with native glob matching can use it directly.
 */
public final class KeyPattern {
    static final String DEFAULT_REGEX_FLAGS = "i";

    private final Pattern regex;
    private final String glob;

    private KeyPattern(Pattern regex, String glob) {
        this.regex = regex;
        this.glob = glob;
    }

    public static KeyPattern of(Pattern regex) {
        return new KeyPattern(regex, null);
    }

    /**
     * Parses {@code pattern} as a {@code /regex/flags} literal, or otherwise as a glob. A glob that
     * does not already mention {@code prefix} is anchored under it.
     */
    public static KeyPattern parse(String pattern, String prefix) {
        Optional<Pattern> regex = RegexLiterals.parse(pattern, DEFAULT_REGEX_FLAGS);
        if (regex.isPresent()) {
            return new KeyPattern(regex.get(), null);
        }
        String glob = pattern;
        if (prefix != null && !prefix.isEmpty() && !glob.contains(prefix)) {
            glob = prefix + glob;
        }
        return new KeyPattern(Globs.toPattern(glob), glob);
    }

    public boolean matches(String key) {
        return regex.matcher(key).find();
    }

    public Optional<String> glob() {
        return Optional.ofNullable(glob);
    }

    @Override
    public String toString() {
        return glob != null ? glob : "/" + regex.pattern() + "/";
    }
}
