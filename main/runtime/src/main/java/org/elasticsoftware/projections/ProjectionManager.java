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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.projections.checkpoint.CheckpointStore;
import org.elasticsoftware.projections.log.EventLogConnection;
import org.elasticsoftware.projections.metadata.AggregateTypeRegistry;
import org.elasticsoftware.projections.metadata.EventMetadataReader;
import org.elasticsoftware.projections.projection.ProjectionDefinition;
import org.elasticsoftware.projections.projection.ProjectionTargetFactory;
import org.elasticsoftware.projections.serialization.EventDeserializer;
import org.elasticsoftware.projections.snapshots.Snapshotter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.*;
import java.util.concurrent.*;

/**
 * Runs one {@link ProjectionSubscription} per registered {@link ProjectionDefinition}. Subscriptions are
 * independent: a projection that restarts or halts does not affect the others.
 *
 * @param <C> the type of the target handle the projectors write to
 */
public class ProjectionManager<C> implements AutoCloseable {
    public static final int DEFAULT_MAX_LIVE_QUEUE_SIZE = 10000;
    public static final int DEFAULT_READ_BATCH_SIZE = 500;
    private static final Logger logger = LoggerFactory.getLogger(ProjectionManager.class);
    private final Map<String, ProjectionSubscription<C>> subscriptions;
    private final ExecutorService executorService;
    private final ScheduledExecutorService restartScheduler;
    private CompletableFuture<Void> activation;

    private ProjectionManager(EventLogConnection connection,
                              EventDeserializer deserializer,
                              ProjectionTargetFactory<C> targetFactory,
                              CheckpointStore checkpointStore,
                              List<ProjectionDefinition> projections,
                              List<Snapshotter> snapshotters,
                              AggregateTypeRegistry aggregateTypeRegistry,
                              EventMetadataReader metadataReader,
                              int maxLiveQueueSize,
                              int readBatchSize,
                              RestartPolicy restartPolicy) {
        this.executorService = Executors.newCachedThreadPool(new CustomizableThreadFactory("ProjectionManagerThread-"));
        this.restartScheduler = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("ProjectionRestartThread-"));
        Map<String, ProjectionSubscription<C>> subscriptions = new LinkedHashMap<>();
        for (ProjectionDefinition projection : projections) {
            subscriptions.put(projection.getProjectionName(), new ProjectionSubscription<>(
                    projection.getProjectionName(),
                    projection.build(targetFactory.getTargetType()),
                    connection,
                    deserializer,
                    targetFactory,
                    checkpointStore,
                    snapshotters,
                    aggregateTypeRegistry,
                    metadataReader,
                    maxLiveQueueSize,
                    readBatchSize,
                    restartPolicy,
                    executorService,
                    restartScheduler));
        }
        this.subscriptions = Collections.unmodifiableMap(subscriptions);
    }

    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    /**
     * Starts the subscriptions of all projections concurrently.
     *
     * @return a future that completes once every projection has stopped or halted. It completes exceptionally
     * when at least one projection halted, and never completes while any projection is still running.
     */
    public synchronized CompletableFuture<Void> activate() {
        if (activation != null) {
            return activation;
        }
        logger.info("Activating {} projections: {}", subscriptions.size(), subscriptions.keySet());
        List<CompletableFuture<Void>> terminations = new ArrayList<>();
        for (ProjectionSubscription<C> subscription : subscriptions.values()) {
            terminations.add(subscription.getTermination());
            executorService.execute(subscription::start);
        }
        activation = CompletableFuture.allOf(terminations.toArray(CompletableFuture[]::new));
        activation.whenComplete((result, throwable) -> {
            if (throwable != null) {
                logger.error("All projections terminated, at least one of them halted", throwable);
            } else {
                logger.info("All projections stopped");
            }
        });
        return activation;
    }

    public Set<String> getProjectionNames() {
        return subscriptions.keySet();
    }

    public ProjectionSubscriptionState getState(String projectionName) {
        ProjectionSubscription<C> subscription = subscriptions.get(projectionName);
        if (subscription == null) {
            throw new IllegalArgumentException("Unknown projection " + projectionName);
        }
        return subscription.getState();
    }

    public Map<String, ProjectionSubscriptionState> getStates() {
        Map<String, ProjectionSubscriptionState> states = new LinkedHashMap<>();
        subscriptions.forEach((name, subscription) -> states.put(name, subscription.getState()));
        return states;
    }

    public boolean isLive() {
        return subscriptions.values().stream()
                .allMatch(subscription -> subscription.getState() == ProjectionSubscriptionState.LIVE);
    }

    @Override
    public void close() {
        logger.info("Shutting down ProjectionManager");
        subscriptions.values().forEach(ProjectionSubscription::stop);
        CompletableFuture<?>[] terminations = subscriptions.values().stream()
                .map(ProjectionSubscription::getTermination)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(terminations).get(10, TimeUnit.SECONDS);
            logger.info("ProjectionManager has been shutdown");
        } catch (TimeoutException e) {
            logger.warn("ProjectionManager did not shutdown within 10 seconds, states: {}", getStates());
        } catch (ExecutionException e) {
            // allOf completes exceptionally only after every projection terminated
            logger.warn("ProjectionManager has been shutdown, projections halted before the shutdown: {}", getStates(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            restartScheduler.shutdownNow();
            executorService.shutdown();
        }
    }

    public static class Builder<C> {
        private final List<ProjectionDefinition> projections = new ArrayList<>();
        private final List<Snapshotter> snapshotters = new ArrayList<>();
        private EventLogConnection connection;
        private EventDeserializer deserializer;
        private ProjectionTargetFactory<C> targetFactory;
        private CheckpointStore checkpointStore;
        private AggregateTypeRegistry aggregateTypeRegistry;
        private EventMetadataReader metadataReader;
        private Integer maxLiveQueueSize;
        private Integer readBatchSize;
        private RestartPolicy restartPolicy;

        public Builder<C> setConnection(EventLogConnection connection) {
            this.connection = connection;
            return this;
        }

        public Builder<C> setDeserializer(EventDeserializer deserializer) {
            this.deserializer = deserializer;
            return this;
        }

        public Builder<C> setTargetFactory(ProjectionTargetFactory<C> targetFactory) {
            this.targetFactory = targetFactory;
            return this;
        }

        public Builder<C> setCheckpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        public Builder<C> addProjection(ProjectionDefinition projection) {
            this.projections.add(Objects.requireNonNull(projection, "projection"));
            return this;
        }

        public Builder<C> addProjections(Collection<? extends ProjectionDefinition> projections) {
            projections.forEach(this::addProjection);
            return this;
        }

        /**
         * Snapshotters are consulted in the order they are added, only the first match takes a snapshot.
         */
        public Builder<C> addSnapshotter(Snapshotter snapshotter) {
            this.snapshotters.add(Objects.requireNonNull(snapshotter, "snapshotter"));
            return this;
        }

        public Builder<C> addSnapshotters(Collection<? extends Snapshotter> snapshotters) {
            snapshotters.forEach(this::addSnapshotter);
            return this;
        }

        public Builder<C> setAggregateTypeRegistry(AggregateTypeRegistry aggregateTypeRegistry) {
            this.aggregateTypeRegistry = aggregateTypeRegistry;
            return this;
        }

        public Builder<C> setMetadataReader(EventMetadataReader metadataReader) {
            this.metadataReader = metadataReader;
            return this;
        }

        public Builder<C> setMaxLiveQueueSize(Integer maxLiveQueueSize) {
            this.maxLiveQueueSize = maxLiveQueueSize;
            return this;
        }

        public Builder<C> setReadBatchSize(Integer readBatchSize) {
            this.readBatchSize = readBatchSize;
            return this;
        }

        public Builder<C> setRestartPolicy(RestartPolicy restartPolicy) {
            this.restartPolicy = restartPolicy;
            return this;
        }

        public ProjectionManager<C> build() {
            Objects.requireNonNull(connection, "connection");
            Objects.requireNonNull(deserializer, "deserializer");
            Objects.requireNonNull(targetFactory, "targetFactory");
            Objects.requireNonNull(checkpointStore, "checkpointStore");
            Set<String> names = new HashSet<>();
            for (ProjectionDefinition projection : projections) {
                if (!names.add(projection.getProjectionName())) {
                    throw new IllegalArgumentException("Duplicate projection name " + projection.getProjectionName());
                }
            }
            return new ProjectionManager<>(
                    connection,
                    deserializer,
                    targetFactory,
                    checkpointStore,
                    projections,
                    snapshotters,
                    aggregateTypeRegistry != null ? aggregateTypeRegistry : AggregateTypeRegistry.builder().build(),
                    metadataReader != null ? metadataReader : new EventMetadataReader(new ObjectMapper()),
                    maxLiveQueueSize != null ? maxLiveQueueSize : DEFAULT_MAX_LIVE_QUEUE_SIZE,
                    readBatchSize != null ? readBatchSize : DEFAULT_READ_BATCH_SIZE,
                    restartPolicy != null ? restartPolicy : RestartPolicy.defaults());
        }
    }
}
