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

public interface Snapshotter {
    /**
     * Pure predicate deciding whether the record should trigger a snapshot of its stream.
     *
     * @param aggregateType the aggregate class the record's stream belongs to
     * @param record        the record that was just projected
     */
    boolean shouldTakeSnapshot(Class<?> aggregateType, RecordedEvent record);

    /**
     * Writes a snapshot of the given stream. Implementations may append a record to the log, that record must
     * carry snapshot metadata so it does not trigger another snapshot.
     */
    void take(String streamId) throws Exception;
}
