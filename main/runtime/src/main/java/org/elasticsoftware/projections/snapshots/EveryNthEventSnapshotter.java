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

package org.elasticsoftware.projections.snapshots;

import org.elasticsoftware.projections.log.RecordedEvent;

/**
 * Takes a snapshot of an aggregate of the given type after every {@code interval} events in its stream.
 */
public class EveryNthEventSnapshotter implements Snapshotter {
    private final Class<?> aggregateType;
    private final int interval;
    private final SnapshotWriter snapshotWriter;

    public EveryNthEventSnapshotter(Class<?> aggregateType, int interval, SnapshotWriter snapshotWriter) {
        if (interval <= 0) {
            throw new IllegalArgumentException("interval should be positive");
        }
        this.aggregateType = aggregateType;
        this.interval = interval;
        this.snapshotWriter = snapshotWriter;
    }

    @Override
    public boolean shouldTakeSnapshot(Class<?> type, RecordedEvent record) {
        // event numbers start at 0
        return aggregateType.isAssignableFrom(type) && record.eventNumber() >= 0 && (record.eventNumber() + 1) % interval == 0;
    }

    @Override
    public void take(String streamId) throws Exception {
        snapshotWriter.writeSnapshot(streamId);
    }

    @Override
    public String toString() {
        return "EveryNthEventSnapshotter{" + aggregateType.getSimpleName() + ", every " + interval + " events}";
    }
}
