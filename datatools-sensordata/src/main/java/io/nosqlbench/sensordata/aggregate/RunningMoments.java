package io.nosqlbench.sensordata.aggregate;

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

import java.util.OptionalDouble;

/// Single-pass mean and sample variance (Welford's update).
///
/// With no samples both mean and standard deviation are absent. With one sample the mean is
/// the sample itself and the standard deviation is absent, since the N-1 estimator is undefined.
public final class RunningMoments {

    private long count;
    private double mean;
    private double m2;

    public void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
    }

    public long count() {
        return count;
    }

    public OptionalDouble mean() {
        return count == 0 ? OptionalDouble.empty() : OptionalDouble.of(mean);
    }

    /// @return the variance with an N-1 denominator, absent below two samples
    public OptionalDouble sampleVariance() {
        return count < 2 ? OptionalDouble.empty() : OptionalDouble.of(Math.max(0.0, m2 / (count - 1)));
    }

    public OptionalDouble sampleStdDev() {
        OptionalDouble variance = sampleVariance();
        return variance.isPresent() ? OptionalDouble.of(Math.sqrt(variance.getAsDouble())) : OptionalDouble.empty();
    }
}
