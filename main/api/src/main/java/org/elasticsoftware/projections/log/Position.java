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

package org.elasticsoftware.projections.log;

import jakarta.annotation.Nonnull;

import java.util.Comparator;

/**
 * A position in the global event log.
 *
 * @param commitPosition  the position at which the record was committed
 * @param preparePosition the position at which the record was prepared, equal to the commit position for
 *                        logs that do not distinguish between the two
 */
public record Position(long commitPosition, long preparePosition) implements Comparable<Position> {
    private static final Comparator<Position> ORDER = Comparator.comparingLong(Position::commitPosition)
            .thenComparingLong(Position::preparePosition);

    public Position {
        if (commitPosition < 0 || preparePosition < 0) {
            throw new IllegalArgumentException("Position values cannot be negative: " + commitPosition + "/" + preparePosition);
        }
    }

    public static Position of(long position) {
        return new Position(position, position);
    }

    public boolean isAfter(@Nonnull Position other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(@Nonnull Position other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return commitPosition + "/" + preparePosition;
    }
}
