/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.projections;

import java.time.Duration;

/**
 * Decides if and when a projection subscription is restarted after a transient drop.
 *
 * @param initialBackoff delay before the first restart
 * @param maxBackoff     upper bound of the delay
 * @param multiplier     growth factor of the delay for every consecutive restart
 * @param maxRestarts    number of consecutive restarts after which the projection halts, negative for no limit
 */
public record RestartPolicy(Duration initialBackoff, Duration maxBackoff, double multiplier, int maxRestarts) {
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(500);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);
    public static final double DEFAULT_MULTIPLIER = 2.0d;

    public RestartPolicy {
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff cannot be negative");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff cannot be smaller than initialBackoff");
        }
        if (multiplier < 1.0d) {
            throw new IllegalArgumentException("multiplier should be at least 1.0");
        }
    }

    public static RestartPolicy defaults() {
        return new RestartPolicy(DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF, DEFAULT_MULTIPLIER, -1);
    }

    /**
     * Restarts right away, without any limit.
     */
    public static RestartPolicy immediate() {
        return new RestartPolicy(Duration.ZERO, Duration.ZERO, 1.0d, -1);
    }

    public boolean allowsRestart(int attempt) {
        return maxRestarts < 0 || attempt <= maxRestarts;
    }

    public Duration backoff(int attempt) {
        if (attempt <= 1 || initialBackoff.isZero()) {
            return initialBackoff;
        }
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 1);
        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }
}
