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

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RunningMomentsTest {

    @Test
    void emptyHasNoMoments() {
        RunningMoments moments = new RunningMoments();
        assertThat(moments.count()).isZero();
        assertThat(moments.mean()).isEmpty();
        assertThat(moments.sampleStdDev()).isEmpty();
    }

    @Test
    void singleSampleHasMeanButNoDeviation() {
        RunningMoments moments = new RunningMoments();
        moments.add(4.25);
        assertThat(moments.mean()).hasValue(4.25);
        assertThat(moments.sampleStdDev()).isEmpty();
    }

    @Test
    void usesSampleDenominator() {
        RunningMoments moments = new RunningMoments();
        for (double v : new double[]{2, 4, 4, 4, 5, 5, 7, 9}) {
            moments.add(v);
        }
        assertThat(moments.mean().getAsDouble()).isEqualTo(5.0);
        assertThat(moments.sampleVariance().getAsDouble()).isCloseTo(32.0 / 7.0, within(1e-12));
    }

    @Test
    void matchesTwoPassComputation() {
        Random random = new Random(42);
        double[] values = new double[1000];
        RunningMoments moments = new RunningMoments();
        for (int i = 0; i < values.length; i++) {
            values[i] = 1e6 + random.nextGaussian() * 3.0;
            moments.add(values[i]);
        }
        double mean = 0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.length;
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        double std = Math.sqrt(squares / (values.length - 1));

        assertThat(moments.mean().getAsDouble()).isCloseTo(mean, within(1e-6));
        assertThat(moments.sampleStdDev().getAsDouble()).isCloseTo(std, within(1e-6));
    }
}
