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

package org.elasticsoftware.projections.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.elasticsoftware.projections.ProjectionManager;
import org.elasticsoftware.projections.RestartPolicy;
import org.elasticsoftware.projections.annotations.DomainEventInfo;
import org.elasticsoftware.projections.checkpoint.CheckpointStore;
import org.elasticsoftware.projections.checkpoint.InMemoryCheckpointStore;
import org.elasticsoftware.projections.checkpoint.jdbc.JdbcCheckpointStore;
import org.elasticsoftware.projections.events.DomainEventType;
import org.elasticsoftware.projections.kafka.KafkaEventLogConnection;
import org.elasticsoftware.projections.log.EventLogConnection;
import org.elasticsoftware.projections.metadata.AggregateTypeRegistry;
import org.elasticsoftware.projections.metadata.EventMetadataReader;
import org.elasticsoftware.projections.projection.ProjectionDefinition;
import org.elasticsoftware.projections.projection.ProjectionTargetFactory;
import org.elasticsoftware.projections.serialization.EventDeserializer;
import org.elasticsoftware.projections.serialization.JacksonEventDeserializer;
import org.elasticsoftware.projections.snapshots.Snapshotter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Duration;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration",
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
        "org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration",
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration"})
@PropertySource("classpath:projections.properties")
public class ProjectionsAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JdbcTemplate.class)
    @ConditionalOnBean({JdbcTemplate.class, PlatformTransactionManager.class})
    static class JdbcCheckpointStoreConfiguration {
        @ConditionalOnMissingBean(CheckpointStore.class)
        @Bean(name = "projectionsCheckpointStore")
        public CheckpointStore jdbcCheckpointStore(PlatformTransactionManager transactionManager,
                                                   JdbcTemplate jdbcTemplate,
                                                   @Value("${projections.jdbc.table-name:projection_checkpoints}") String tableName) {
            return new JdbcCheckpointStore(transactionManager, jdbcTemplate, tableName);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(ConsumerFactory.class)
    @ConditionalOnProperty(name = "projections.kafka.enabled", havingValue = "true")
    static class KafkaEventLogConfiguration {
        @Bean(name = "projectionsConsumerFactory")
        public ConsumerFactory<String, byte[]> projectionsConsumerFactory(KafkaProperties properties) {
            return new DefaultKafkaConsumerFactory<>(
                    properties.buildConsumerProperties(null),
                    new StringDeserializer(),
                    new ByteArrayDeserializer());
        }

        @ConditionalOnMissingBean(EventLogConnection.class)
        @Bean(name = "projectionsEventLogConnection", destroyMethod = "close")
        public KafkaEventLogConnection kafkaEventLogConnection(
                @Qualifier("projectionsConsumerFactory") ConsumerFactory<String, byte[]> consumerFactory,
                @Value("${projections.kafka.topic:EventLog}") String topic) {
            return new KafkaEventLogConnection(consumerFactory, topic);
        }
    }

    @ConditionalOnMissingBean(EventMetadataReader.class)
    @Bean(name = "projectionsEventMetadataReader")
    public EventMetadataReader eventMetadataReader(ObjectProvider<ObjectMapper> objectMapper) {
        return new EventMetadataReader(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @ConditionalOnMissingBean(AggregateTypeRegistry.class)
    @Bean(name = "projectionsAggregateTypeRegistry")
    public AggregateTypeRegistry aggregateTypeRegistry() {
        return AggregateTypeRegistry.builder().build();
    }

    @ConditionalOnMissingBean(EventDeserializer.class)
    @Bean(name = "projectionsEventDeserializer")
    public EventDeserializer eventDeserializer(ObjectProvider<ObjectMapper> objectMapper,
                                               ObjectProvider<ProjectionDefinition> projections,
                                               ObjectProvider<DomainEventType<?>> domainEventTypes,
                                               @Value("${projections.ignore-unknown-event-types:true}") boolean ignoreUnknownEventTypes) {
        JacksonEventDeserializer.Builder builder = JacksonEventDeserializer.builder()
                .setObjectMapper(objectMapper.getIfAvailable(ObjectMapper::new))
                .setIgnoreUnknownEventTypes(ignoreUnknownEventTypes);
        projections.orderedStream()
                .flatMap(projection -> projection.getHandledEventTypes().stream())
                .filter(eventClass -> eventClass.isAnnotationPresent(DomainEventInfo.class))
                .forEach(builder::addDomainEventClass);
        domainEventTypes.orderedStream().forEach(builder::addDomainEventType);
        return builder.build();
    }

    @ConditionalOnMissingBean(CheckpointStore.class)
    @Bean(name = "projectionsCheckpointStore")
    public CheckpointStore inMemoryCheckpointStore() {
        return new InMemoryCheckpointStore();
    }

    @ConditionalOnMissingBean(RestartPolicy.class)
    @Bean(name = "projectionsRestartPolicy")
    public RestartPolicy restartPolicy(@Value("${projections.restart.initial-backoff-ms:500}") long initialBackoffMs,
                                       @Value("${projections.restart.max-backoff-ms:30000}") long maxBackoffMs,
                                       @Value("${projections.restart.multiplier:2.0}") double multiplier,
                                       @Value("${projections.restart.max-restarts:-1}") int maxRestarts) {
        return new RestartPolicy(Duration.ofMillis(initialBackoffMs), Duration.ofMillis(maxBackoffMs), multiplier, maxRestarts);
    }

    @ConditionalOnBean({EventLogConnection.class, ProjectionTargetFactory.class})
    @ConditionalOnMissingBean(ProjectionManager.class)
    @Bean(name = "projectionManager", initMethod = "activate", destroyMethod = "close")
    public ProjectionManager<?> projectionManager(EventLogConnection connection,
                                                  EventDeserializer deserializer,
                                                  ProjectionTargetFactory<?> targetFactory,
                                                  CheckpointStore checkpointStore,
                                                  ObjectProvider<ProjectionDefinition> projections,
                                                  ObjectProvider<Snapshotter> snapshotters,
                                                  AggregateTypeRegistry aggregateTypeRegistry,
                                                  EventMetadataReader metadataReader,
                                                  RestartPolicy restartPolicy,
                                                  @Value("${projections.max-live-queue-size:10000}") int maxLiveQueueSize,
                                                  @Value("${projections.read-batch-size:500}") int readBatchSize) {
        return createProjectionManager(targetFactory)
                .setConnection(connection)
                .setDeserializer(deserializer)
                .setCheckpointStore(checkpointStore)
                .addProjections(projections.orderedStream().toList())
                .addSnapshotters(snapshotters.orderedStream().toList())
                .setAggregateTypeRegistry(aggregateTypeRegistry)
                .setMetadataReader(metadataReader)
                .setRestartPolicy(restartPolicy)
                .setMaxLiveQueueSize(maxLiveQueueSize)
                .setReadBatchSize(readBatchSize)
                .build();
    }

    private static <C> ProjectionManager.Builder<C> createProjectionManager(ProjectionTargetFactory<C> targetFactory) {
        return ProjectionManager.<C>builder().setTargetFactory(targetFactory);
    }
}
