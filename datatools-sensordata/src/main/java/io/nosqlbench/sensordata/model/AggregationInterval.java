package io.nosqlbench.sensordata.model;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// A fixed bucket width for aggregation, together with the label used in output file names.
///
/// Labels are accepted in the offset notation common to data-frame tooling (`30s`, `3min`,
/// `10T`, `2h`, `1d`) or as ISO-8601 durations (`PT3M`). The width must be a positive whole number
/// of seconds, since aligned timestamps carry no sub-second part.
///
/// @param label
///     the text the interval was given as, e.g. `3min`
/// @param duration
///     the bucket width
public record AggregationInterval(String label, Duration duration) {

    private static final Pattern OFFSET = Pattern.compile("^(\\d+)\\s*([a-zA-Z]+)$");

    public AggregationInterval {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Interval label cannot be null or blank");
        }
        Objects.requireNonNull(duration, "duration cannot be null");
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Interval '" + label + "' must be positive");
        }
        if (duration.getNano() != 0) {
            throw new IllegalArgumentException("Interval '" + label + "' must be a whole number of seconds");
        }
    }

    /// Parse an interval specification.
    ///
    /// @param spec
    ///     offset notation such as `3min`, or an ISO-8601 duration such as `PT3M`
    /// @return the parsed interval, labelled with the trimmed input text
    /// @throws IllegalArgumentException
    ///     if the specification is not understood
    public static AggregationInterval parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Interval specification cannot be empty");
        }
        String text = spec.trim();
        if (Character.toUpperCase(text.charAt(0)) == 'P') {
            try {
                return new AggregationInterval(text, Duration.parse(text));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid ISO-8601 interval '" + text + "'", e);
            }
        }

        Matcher matcher = OFFSET.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException(
                "Invalid interval '" + text + "', expected a form like 30s, 3min, 2h, 1d or PT3M");
        }
        long amount = Long.parseLong(matcher.group(1));
        Duration unit = unitOf(matcher.group(2), text);
        return new AggregationInterval(text, unit.multipliedBy(amount));
    }

    private static Duration unitOf(String unit, String spec) {
        switch (unit) {
            case "T":
                return Duration.ofMinutes(1);
            case "S":
                return Duration.ofSeconds(1);
            case "H":
                return Duration.ofHours(1);
            case "D":
                return Duration.ofDays(1);
            default:
                break;
        }
        switch (unit.toLowerCase(Locale.ROOT)) {
            case "s":
            case "sec":
            case "second":
            case "seconds":
                return Duration.ofSeconds(1);
            case "min":
            case "mins":
            case "minute":
            case "minutes":
                return Duration.ofMinutes(1);
            case "h":
            case "hr":
            case "hour":
            case "hours":
                return Duration.ofHours(1);
            case "d":
            case "day":
            case "days":
                return Duration.ofDays(1);
            default:
                throw new IllegalArgumentException("Unknown interval unit '" + unit + "' in '" + spec + "'");
        }
    }

    /// @return the bucket width in seconds
    public long seconds() {
        return duration.getSeconds();
    }

    /// @return the label with characters unsafe for file names replaced by `_`
    public String fileLabel() {
        return label.replaceAll("[^A-Za-z0-9_.-]", "_");
    }

    @Override
    public String toString() {
        return label;
    }
}
