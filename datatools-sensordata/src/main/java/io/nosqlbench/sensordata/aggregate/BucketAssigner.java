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

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/// Maps instants to fixed-width, left-closed buckets counted from an origin.
///
/// Bucket `i` covers `[origin + i * width, origin + (i + 1) * width)`. Buckets are contiguous and
/// do not overlap, so every instant belongs to exactly one bucket. Indices before the origin are
/// negative.
public final class BucketAssigner {

    private final long originEpochSecond;
    private final long widthSeconds;

    public BucketAssigner(Instant origin, Duration width) {
        if (width.isNegative() || width.isZero() || width.getNano() != 0) {
            throw new IllegalArgumentException("Bucket width must be a positive whole number of seconds, got " + width);
        }
        if (origin.getNano() != 0) {
            throw new IllegalArgumentException("Bucket origin must fall on a whole second, got " + origin);
        }
        this.originEpochSecond = origin.getEpochSecond();
        this.widthSeconds = width.getSeconds();
    }

    /// Buckets aligned to midnight UTC of the day containing `first`.
    public static BucketAssigner alignedToDayOf(Instant first, Duration width) {
        return new BucketAssigner(first.truncatedTo(ChronoUnit.DAYS), width);
    }

    public long bucketIndex(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond() - originEpochSecond, widthSeconds);
    }

    public Instant bucketStart(long index) {
        return Instant.ofEpochSecond(Math.addExact(originEpochSecond, Math.multiplyExact(index, widthSeconds)));
    }

    public Instant bucketEnd(long index) {
        return bucketStart(index + 1);
    }

    public Instant origin() {
        return Instant.ofEpochSecond(originEpochSecond);
    }

    public Duration width() {
        return Duration.ofSeconds(widthSeconds);
    }
}
