package io.nosqlbench.sensordata.transform;

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

import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Parses degree-minute coordinates such as `5230.1234N` or `01324.5000E` into signed decimal
/// degrees.
///
/// The two integer digits before the decimal point, together with the fraction, are the minutes;
/// any digits ahead of them are the degrees. Southern and western hemispheres yield negative
/// values.
public final class DmsCoordinateParser {

    private static final Pattern COORDINATE = Pattern.compile("^(\\d{1,3})(\\d{2}(?:\\.\\d*)?)([NSEWnsew])$");

    private DmsCoordinateParser() {
    }

    /// @param text
    ///     the coordinate text; null or blank means no value
    /// @return the decimal degrees, or empty for a blank input
    /// @throws IllegalArgumentException
    ///     if the text is not a coordinate
    public static OptionalDouble parse(String text) {
        if (text == null || text.isBlank()) {
            return OptionalDouble.empty();
        }
        String trimmed = text.trim();
        Matcher matcher = COORDINATE.matcher(trimmed);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a degree-minute coordinate: '" + trimmed + "'");
        }
        double degrees = Double.parseDouble(matcher.group(1));
        double minutes = Double.parseDouble(matcher.group(2));
        if (minutes >= 60.0) {
            throw new IllegalArgumentException("Minutes must be below 60 in coordinate '" + trimmed + "'");
        }
        double decimal = degrees + minutes / 60.0;
        String hemisphere = matcher.group(3).toUpperCase(Locale.ROOT);
        if (hemisphere.equals("S") || hemisphere.equals("W")) {
            decimal = -decimal;
        }
        return OptionalDouble.of(decimal);
    }
}
