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

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Resolves the duration forms operators write in configuration into a {@link Duration}.
 *
 * <p>Accepted inputs:
 * <ul>
 *     <li>shorthand: {@code "10 minutes"}, {@code "1 day"}, {@code "500milliseconds"}</li>
 *     <li>ISO-8601: {@code "PT1H30M"}, {@code "P1W"}, {@code "P1Y2M3DT4H"}</li>
 *     <li>structured: a map such as {@code {days: 1, hours: 2}}</li>
 *     <li>an existing {@link Duration}, returned unchanged</li>
 * </ul>
 * Calendar units are flattened: a month is 30 days and a year is 365 days.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DurationResolver {
    private static final Pattern SHORTHAND = Pattern.compile(
        "^\\s*(\\d+)\\s*(days?|weeks?|months?|years?|hours?|minutes?|seconds?|milliseconds?)\\s*$");
    private static final Pattern ISO8601 = Pattern.compile(
        "^\\s*(-?)P(?=\\d|T\\d)(?:(\\d+)Y)?(?:(\\d+)M)?(?:(\\d+)([DW]))?"
            + "(?:T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+(?:\\.\\d+)?)S)?)?\\s*$");

    public static Duration resolve(Object value) {
        if (value == null) {
            throw new InvalidDurationException("duration value is missing");
        }
        if (value instanceof Duration) {
            return (Duration) value;
        }
        if (value instanceof CharSequence) {
            return parse(value.toString());
        }
        if (value instanceof Map) {
            return fromFields((Map<?, ?>) value);
        }
        throw new InvalidDurationException("unsupported duration value type: " + value.getClass().getSimpleName());
    }

    public static Duration parse(String value) {
        Matcher shorthand = SHORTHAND.matcher(value);
        if (shorthand.matches()) {
            return of(Long.parseLong(shorthand.group(1)), shorthand.group(2));
        }
        Matcher iso = ISO8601.matcher(value);
        if (iso.matches()) {
            Duration duration = Duration.ZERO
                .plus(of(number(iso.group(2)), "years"))
                .plus(of(number(iso.group(3)), "months"))
                .plus(of(number(iso.group(4)), "W".equals(iso.group(5)) ? "weeks" : "days"))
                .plus(of(number(iso.group(6)), "hours"))
                .plus(of(number(iso.group(7)), "minutes"));
            if (iso.group(8) != null) {
                duration = duration.plus(Duration.ofNanos(Math.round(Double.parseDouble(iso.group(8)) * 1_000_000_000d)));
            }
            return "-".equals(iso.group(1)) ? duration.negated() : duration;
        }
        throw new InvalidDurationException(String.format(
            "duration value of '%s' could not be parsed as an ISO8601 duration or a shorthand like '10 minutes'",
            value));
    }

    private static Duration fromFields(Map<?, ?> fields) {
        Duration duration = Duration.ZERO;
        for (Map.Entry<?, ?> field : fields.entrySet()) {
            Object amount = field.getValue();
            if (amount == null) {
                continue;
            }
            long units;
            if (amount instanceof Number) {
                units = ((Number) amount).longValue();
            } else {
                try {
                    units = Long.parseLong(amount.toString().trim());
                } catch (NumberFormatException e) {
                    throw new InvalidDurationException(
                        String.format("'%s' is not a number for duration field '%s'", amount, field.getKey()));
                }
            }
            duration = duration.plus(of(units, String.valueOf(field.getKey())));
        }
        return duration;
    }

    private static long number(String group) {
        return group == null ? 0 : Long.parseLong(group);
    }

    private static Duration of(long amount, String unit) {
        String normalized = unit.toLowerCase(Locale.ROOT);
        if (!normalized.endsWith("s")) {
            normalized = normalized + "s";
        }
        switch (normalized) {
            case "milliseconds":
                return Duration.ofMillis(amount);
            case "seconds":
                return Duration.ofSeconds(amount);
            case "minutes":
                return Duration.ofMinutes(amount);
            case "hours":
                return Duration.ofHours(amount);
            case "days":
                return Duration.ofDays(amount);
            case "weeks":
                return Duration.ofDays(amount * 7);
            case "months":
                return Duration.ofDays(amount * 30);
            case "years":
                return Duration.ofDays(amount * 365);
            default:
                throw new InvalidDurationException("unknown duration unit: " + unit);
        }
    }

    /**
     * Renders a duration in its largest whole unit, e.g. {@code "2 minutes"} or {@code "90 seconds"}.
     */
    public static String humanize(Duration duration) {
        long millis = Math.abs(duration.toMillis());
        String sign = duration.isNegative() ? "-" : "";
        ChronoUnit[] units = {ChronoUnit.DAYS, ChronoUnit.HOURS, ChronoUnit.MINUTES, ChronoUnit.SECONDS};
        for (ChronoUnit unit : units) {
            long unitMillis = unit.getDuration().toMillis();
            if (millis >= unitMillis && millis % unitMillis == 0) {
                long amount = millis / unitMillis;
                String name = unit.name().toLowerCase(Locale.ROOT);
                return sign + amount + " " + (amount == 1 ? name.substring(0, name.length() - 1) : name);
            }
        }
        return sign + millis + " milliseconds";
    }
}
