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

import org.elasticsoftware.projections.checkpoint.CheckpointStore;
import org.elasticsoftware.projections.events.Envelope;
import org.elasticsoftware.projections.log.*;
import org.elasticsoftware.projections.metadata.AggregateTypeRegistry;
import org.elasticsoftware.projections.metadata.EventMetadataReader;
import org.elasticsoftware.projections.projection.ProjectionTargetFactory;
import org.elasticsoftware.projections.projection.Projector;
import org.elasticsoftware.projections.serialization.EventDeserializer;
import org.elasticsoftware.projections.snapshots.Snapshotter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.elasticsoftware.projections.ProjectionSubscriptionState.*;

/**
 * Drives the catch-up subscription of a single projection: resumes from the stored checkpoint, applies every
 * record to the projector, stores the checkpoint and restarts the subscription after transient drops.
 * <p>
 * Records are handled on the transport's subscription thread, one at a time, so there is never more than one
 * record in flight for a projection.
 */
public class ProjectionSubscription<C> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionSubscription.class);
    private final String projectionName;
    private final Projector<C> projector;
    private final EventLogConnection connection;
    private final EventDeserializer deserializer;
    private final ProjectionTargetFactory<C> targetFactory;
    private final CheckpointStore checkpointStore;
    private final List<Snapshotter> snapshotters;
    private final AggregateTypeRegistry aggregateTypeRegistry;
    private final EventMetadataReader metadataReader;
    private final int maxLiveQueueSize;
    private final int readBatchSize;
    private final RestartPolicy restartPolicy;
    private final ExecutorService executorService;
    private final ScheduledExecutorService restartScheduler;
    private final AtomicInteger consecutiveRestarts = new AtomicInteger();
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Object subscriptionLock = new Object();
    private volatile ProjectionSubscriptionState state = INITIALIZING;
    private volatile int generation = 0;
    private volatile CatchUpSubscription currentSubscription;
    // guarded by subscriptionLock
    private int droppedGeneration = 0;
    private volatile ScheduledFuture<?> pendingRestart;
    private volatile boolean stopRequested = false;

    public ProjectionSubscription(String projectionName,
                                  Projector<C> projector,
                                  EventLogConnection connection,
                                  EventDeserializer deserializer,
                                  ProjectionTargetFactory<C> targetFactory,
                                  CheckpointStore checkpointStore,
                                  List<Snapshotter> snapshotters,
                                  AggregateTypeRegistry aggregateTypeRegistry,
                                  EventMetadataReader metadataReader,
                                  int maxLiveQueueSize,
                                  int readBatchSize,
                                  RestartPolicy restartPolicy,
                                  ExecutorService executorService,
                                  ScheduledExecutorService restartScheduler) {
        this.projectionName = projectionName;
        this.projector = projector;
        this.connection = connection;
        this.deserializer = deserializer;
        this.targetFactory = targetFactory;
        this.checkpointStore = checkpointStore;
        this.snapshotters = List.copyOf(snapshotters);
        this.aggregateTypeRegistry = aggregateTypeRegistry;
        this.metadataReader = metadataReader;
        this.maxLiveQueueSize = maxLiveQueueSize;
        this.readBatchSize = readBatchSize;
        this.restartPolicy = restartPolicy;
        this.executorService = executorService;
        this.restartScheduler = restartScheduler;
    }

    public String getProjectionName() {
        return projectionName;
    }

    public ProjectionSubscriptionState getState() {
        return state;
    }

    /**
     * Completes when the subscription reaches a terminal state: normally when it was stopped on request,
     * exceptionally with a {@link ProjectionHaltedException} when it halted.
     */
    public CompletableFuture<Void> getTermination() {
        return termination;
    }

    public void start() {
        if (!started.compareAndSet(false, true) || stopRequested) {
            logger.warn("{} projection is {} and will not be started again", projectionName, state);
            return;
        }
        try {
            subscribe();
        } catch (Exception e) {
            logger.error("{} projection failed to start", projectionName, e);
            halt(new ProjectionHaltedException(projectionName, null, "Projection " + projectionName + " failed to start", e));
        }
    }

    /**
     * Requests a graceful stop. The projection reaches {@link ProjectionSubscriptionState#STOPPED} once the
     * open subscription reports its user initiated drop.
     */
    public void stop() {
        stopRequested = true;
        ScheduledFuture<?> restart = pendingRestart;
        if (restart != null && restart.cancel(false)) {
            logger.debug("{} projection stopped while waiting for a restart", projectionName);
            terminate(STOPPED);
            return;
        }
        CatchUpSubscription subscription = currentSubscription;
        if (subscription != null) {
            subscription.stop();
        } else if (!started.get()) {
            terminate(STOPPED);
        }
    }

    @Override
    public void close() {
        stop();
        try {
            termination.get(10, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            logger.warn("{} projection did not stop within 10 seconds", projectionName);
        } catch (ExecutionException e) {
            logger.debug("{} projection was halted before it was closed", projectionName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void subscribe() {
        Position lastCheckpoint = checkpointStore.getLastCheckpoint(projectionName).orElse(null);
        CatchUpSubscriptionSettings settings = new CatchUpSubscriptionSettings(
                maxLiveQueueSize,
                readBatchSize,
                logger.isTraceEnabled(),
                false,
                projectionName);
        final int subscriptionGeneration = ++generation;
        logger.info("Starting {} projection from {}", projectionName,
                lastCheckpoint != null ? "checkpoint " + lastCheckpoint : "the beginning of the log");
        // callbacks can arrive before subscribeToAllFrom returns
        state = CATCHING_UP;
        CatchUpSubscription subscription = connection.subscribeToAllFrom(
                lastCheckpoint,
                settings,
                (s, record) -> eventAppeared(subscriptionGeneration, record),
                s -> liveProcessingStarted(subscriptionGeneration),
                (s, reason, cause) -> subscriptionDropped(subscriptionGeneration, s, reason, cause));
        synchronized (subscriptionLock) {
            if (subscriptionGeneration == generation && droppedGeneration != subscriptionGeneration) {
                currentSubscription = subscription;
            }
        }
        if (stopRequested) {
            subscription.stop();
        }
    }

    private void eventAppeared(int subscriptionGeneration, RecordedEvent record) throws Exception {
        if (subscriptionGeneration != generation) {
            logger.debug("{} projection ignores {} from a previous subscription", projectionName, record.eventId());
            return;
        }
        if (record.isSystemEvent()) {
            return;
        }
        Envelope<?> envelope = Envelope.of(deserializer.deserialize(record), record.position().commitPosition());
        projector.project(targetFactory.get(), envelope);
        logger.debug("{} projected {}({})", projectionName, record.eventType(), record.eventId());
        // the checkpoint is stored after the apply, a crash in between replays this record
        checkpointStore.setLastCheckpoint(projectionName, record.position());
        consecutiveRestarts.set(0);
        takeSnapshotIfNeeded(record);
    }

    private void takeSnapshotIfNeeded(RecordedEvent record) throws Exception {
        if (snapshotters.isEmpty()) {
            return;
        }
        EventMetadata metadata = metadataReader.read(record.metadata());
        if (metadata.snapshot()) {
            return;
        }
        Class<?> aggregateType = aggregateTypeRegistry.resolve(metadata).orElse(null);
        if (aggregateType == null) {
            logger.trace("{} projection cannot resolve aggregate type of {}({})", projectionName, record.eventType(), record.eventId());
            return;
        }
        for (Snapshotter snapshotter : snapshotters) {
            if (snapshotter.shouldTakeSnapshot(aggregateType, record)) {
                snapshotter.take(record.streamId());
                logger.debug("Snapshot was taken for {} on event {}({}) at number {}",
                        metadata.aggregateType(), record.eventType(), record.eventId(), record.eventNumber());
                return;
            }
        }
    }

    private void liveProcessingStarted(int subscriptionGeneration) {
        if (subscriptionGeneration == generation && state == CATCHING_UP) {
            state = LIVE;
            logger.debug("{} projection has caught up, now processing live!", projectionName);
        }
    }

    private void subscriptionDropped(int subscriptionGeneration,
                                     CatchUpSubscription subscription,
                                     SubscriptionDropReason reason,
                                     Throwable cause) {
        subscription.stop();
        synchronized (subscriptionLock) {
            if (subscriptionGeneration != generation || state.isTerminal()) {
                logger.debug("{} projection ignores drop ({}) of a previous subscription", projectionName, reason);
                return;
            }
            droppedGeneration = subscriptionGeneration;
            currentSubscription = null;
        }
        switch (reason) {
            case USER_INITIATED -> {
                logger.debug("{} projection stopped gracefully.", projectionName);
                terminate(STOPPED);
            }
            case SUBSCRIBING_ERROR,
                    SERVER_ERROR,
                    CONNECTION_CLOSED,
                    CATCH_UP_ERROR,
                    PROCESSING_QUEUE_OVERFLOW,
                    EVENT_HANDLER_EXCEPTION -> {
                if (stopRequested) {
                    logger.info("{} projection dropped ({}) while stopping, it will not be restarted", projectionName, reason);
                    terminate(STOPPED);
                } else {
                    logger.error("{} projection stopped because of a transient error ({}). Attempting to restart...",
                            projectionName, reason, cause);
                    scheduleRestart(reason, cause);
                }
            }
            default -> {
                logger.error("{} projection stopped because of an internal error ({}). Please check your logs for details.",
                        projectionName, reason, cause);
                halt(new ProjectionHaltedException(projectionName, reason,
                        "Projection " + projectionName + " halted because of " + reason, cause));
            }
        }
    }

    private void scheduleRestart(SubscriptionDropReason reason, Throwable cause) {
        int attempt = consecutiveRestarts.incrementAndGet();
        if (!restartPolicy.allowsRestart(attempt)) {
            logger.error("{} projection failed {} times in a row, giving up", projectionName, attempt);
            halt(new ProjectionHaltedException(projectionName, reason,
                    "Projection " + projectionName + " exceeded " + restartPolicy.maxRestarts() + " consecutive restarts", cause));
            return;
        }
        Duration delay = restartPolicy.backoff(attempt);
        state = RESTARTING;
        logger.info("Restarting {} projection in {} ms (attempt {})", projectionName, delay.toMillis(), attempt);
        try {
            pendingRestart = restartScheduler.schedule(
                    () -> executorService.execute(this::restart),
                    delay.toMillis(),
                    TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // the manager is shutting down
            terminate(STOPPED);
        }
    }

    private void restart() {
        pendingRestart = null;
        if (stopRequested) {
            terminate(STOPPED);
            return;
        }
        try {
            subscribe();
        } catch (Exception e) {
            logger.error("{} projection could not be restarted", projectionName, e);
            scheduleRestart(SubscriptionDropReason.SUBSCRIBING_ERROR, e);
        }
    }

    private void halt(ProjectionHaltedException exception) {
        if (termination.completeExceptionally(exception)) {
            state = HALTED;
        }
    }

    private void terminate(ProjectionSubscriptionState terminalState) {
        if (termination.complete(null)) {
            state = terminalState;
        }
    }

    @Override
    public String toString() {
        return "ProjectionSubscription{" + projectionName + ", " + state + "}";
    }
}
