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

package org.elasticsoftware.projections.checkpoint;

import org.elasticsoftware.projections.log.Position;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCheckpointStore implements CheckpointStore {
    private final Map<String, Position> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Optional<Position> getLastCheckpoint(String projectionName) {
        return Optional.ofNullable(checkpoints.get(projectionName));
    }

    @Override
    public void setLastCheckpoint(String projectionName, Position position) {
        checkpoints.put(projectionName, position);
    }

    public Map<String, Position> getCheckpoints() {
        return Map.copyOf(checkpoints);
    }
}
