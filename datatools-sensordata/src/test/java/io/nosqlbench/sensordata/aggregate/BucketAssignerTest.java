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

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BucketAssignerTest {

    @Test
    void alignsToStartOfDay() {
        BucketAssigner assigner = BucketAssigner.alignedToDayOf(
            Instant.parse("2020-03-04T10:07:30Z"), Duration.ofMinutes(3));

        assertThat(assigner.origin()).isEqualTo(Instant.parse("2020-03-04T00:00:00Z"));
        long index = assigner.bucketIndex(Instant.parse("2020-03-04T10:07:30Z"));
        assertThat(assigner.bucketStart(index)).isEqualTo(Instant.parse("2020-03-04T10:06:00Z"));
        assertThat(assigner.bucketEnd(index)).isEqualTo(Instant.parse("2020-03-04T10:09:00Z"));
    }

    @Test
    void bucketsAreLeftClosed() {
        BucketAssigner assigner = new BucketAssigner(Instant.EPOCH, Duration.ofSeconds(10));
        assertThat(assigner.bucketIndex(Instant.ofEpochSecond(0))).isEqualTo(0);
        assertThat(assigner.bucketIndex(Instant.ofEpochSecond(9))).isEqualTo(0);
        assertThat(assigner.bucketIndex(Instant.ofEpochSecond(10))).isEqualTo(1);
        assertThat(assigner.bucketIndex(Instant.ofEpochSecond(-1))).isEqualTo(-1);
    }

    @Test
    void everyInstantFallsInsideItsBucket() {
        BucketAssigner assigner = new BucketAssigner(Instant.parse("2020-01-01T00:00:00Z"), Duration.ofSeconds(7));
        for (long s = -50; s < 50; s++) {
            Instant instant = Instant.parse("2020-01-01T00:00:00Z").plusSeconds(s);
            long index = assigner.bucketIndex(instant);
            assertThat(assigner.bucketStart(index)).isBeforeOrEqualTo(instant);
            assertThat(assigner.bucketEnd(index)).isAfter(instant);
        }
    }

    @Test
    void rejectsInvalidWidths() {
        assertThatThrownBy(() -> new BucketAssigner(Instant.EPOCH, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BucketAssigner(Instant.EPOCH, Duration.ofMillis(500)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
