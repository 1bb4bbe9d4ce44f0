package io.nosqlbench.sensordata.command.common;

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

import io.nosqlbench.sensordata.model.AggregationInterval;
import picocli.CommandLine;

/**
 * Picocli type converter for aggregation intervals such as {@code 3min}, {@code 10T} or
 * {@code PT10M}.
 */
public class AggregationIntervalConverter implements CommandLine.ITypeConverter<AggregationInterval> {

    @Override
    public AggregationInterval convert(String value) {
        try {
            return AggregationInterval.parse(value);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.TypeConversionException(e.getMessage());
        }
    }
}
