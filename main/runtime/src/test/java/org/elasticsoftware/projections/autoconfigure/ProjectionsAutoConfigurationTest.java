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

import org.elasticsoftware.projections.ProjectionManager;
import org.elasticsoftware.projections.RestartPolicy;
import org.elasticsoftware.projections.checkpoint.CheckpointStore;
import org.elasticsoftware.projections.checkpoint.InMemoryCheckpointStore;
import org.elasticsoftware.projections.checkpoint.jdbc.JdbcCheckpointStore;
import org.elasticsoftware.projections.kafka.KafkaEventLogConnection;
import org.elasticsoftware.projections.log.EventLogConnection;
import org.elasticsoftware.projections.log.Position;
import org.elasticsoftware.projections.log.memory.InMemoryEventLog;
import org.elasticsoftware.projections.metadata.EventMetadataReader;
import org.elasticsoftware.projections.projection.Projection;
import org.elasticsoftware.projections.projection.ProjectionTargetFactory;
import org.elasticsoftware.projections.serialization.EventDeserializer;
import org.elasticsoftware.projections.serialization.JacksonEventDeserializer;
import org.elasticsoftware.projections.wallet.WalletBalances;
import org.elasticsoftware.projections.wallet.WalletCreatedEvent;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.awaitility.Awaitility.await;
import static org.elasticsoftware.projections.wallet.WalletRecords.toJson;
import static org.elasticsoftware.projections.wallet.WalletRecords.walletMetadata;
import static org.junit.jupiter.api.Assertions.*;

class ProjectionsAutoConfigurationTest {
    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ProjectionsAutoConfiguration.class));

    @Configuration(proxyBeanMethods = false)
    static class WalletProjectionConfiguration {
        @Bean(destroyMethod = "close")
        public InMemoryEventLog eventLog() {
            return new InMemoryEventLog();
        }

        @Bean
        public WalletBalances walletBalances() {
            return new WalletBalances();
        }

        @Bean
        public ProjectionTargetFactory<WalletBalances> walletBalancesTargetFactory(WalletBalances walletBalances) {
            return ProjectionTargetFactory.singleton(WalletBalances.class, walletBalances);
        }

        @Bean
        public Projection<WalletBalances> walletBalancesProjection() {
            return WalletBalances.projection("WalletBalances");
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class JdbcConfiguration {
        @Bean(destroyMethod = "shutdown")
        public EmbeddedDatabase dataSource() {
            return new EmbeddedDatabaseBuilder()
                    .generateUniqueName(true)
                    .setType(EmbeddedDatabaseType.H2)
                    .addScript("classpath:org/elasticsoftware/projections/checkpoint/jdbc/schema.sql")
                    .build();
        }

        @Bean
        public JdbcTemplate jdbcTemplate(EmbeddedDatabase dataSource) {
            return new JdbcTemplate(dataSource);
        }

        @Bean
        public PlatformTransactionManager transactionManager(EmbeddedDatabase dataSource) {
            return new DataSourceTransactionManager(dataSource);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class KafkaConfiguration {
        @Bean
        public KafkaProperties kafkaProperties() {
            return new KafkaProperties();
        }
    }

    @Test
    void testDefaultsWithoutEventLog() {
        contextRunner.run(context -> {
            assertFalse(context.containsBean("projectionManager"));
            assertInstanceOf(InMemoryCheckpointStore.class, context.getBean(CheckpointStore.class));
            assertNotNull(context.getBean(EventMetadataReader.class));
            assertNotNull(context.getBean(EventDeserializer.class));
            assertEquals(RestartPolicy.defaults(), context.getBean(RestartPolicy.class));
            assertTrue(context.getBeansOfType(EventLogConnection.class).isEmpty());
        });
    }

    @Test
    void testProjectionManagerIsActivated() {
        contextRunner.withUserConfiguration(WalletProjectionConfiguration.class).run(context -> {
            ProjectionManager<?> manager = context.getBean(ProjectionManager.class);
            assertEquals(Set.of("WalletBalances"), manager.getProjectionNames());
            JacksonEventDeserializer deserializer = assertInstanceOf(JacksonEventDeserializer.class, context.getBean(EventDeserializer.class));
            assertEquals(Set.of("WalletCreated", "WalletCredited"), deserializer.getRegisteredEventTypes());

            await().atMost(5, SECONDS).until(manager::isLive);
            InMemoryEventLog eventLog = context.getBean(InMemoryEventLog.class);
            eventLog.append("wallet-1", "WalletCreated", toJson(new WalletCreatedEvent("wallet-1", "EUR")), walletMetadata(false));
            WalletBalances balances = context.getBean(WalletBalances.class);
            await().atMost(5, SECONDS).until(() -> Long.valueOf(0L).equals(balances.getBalance("wallet-1")));
            assertEquals(Optional.of(Position.of(1)), context.getBean(CheckpointStore.class).getLastCheckpoint("WalletBalances"));
        });
    }

    @Test
    void testJdbcCheckpointStore() {
        contextRunner.withUserConfiguration(JdbcConfiguration.class).run(context ->
                assertInstanceOf(JdbcCheckpointStore.class, context.getBean(CheckpointStore.class)));
    }

    @Test
    void testRestartPolicyProperties() {
        contextRunner
                .withPropertyValues(
                        "projections.restart.initial-backoff-ms=100",
                        "projections.restart.max-backoff-ms=1000",
                        "projections.restart.multiplier=3.0",
                        "projections.restart.max-restarts=5")
                .run(context -> assertEquals(
                        new RestartPolicy(Duration.ofMillis(100), Duration.ofSeconds(1), 3.0d, 5),
                        context.getBean(RestartPolicy.class)));
    }

    @Test
    void testKafkaEventLogConnection() {
        contextRunner
                .withUserConfiguration(KafkaConfiguration.class)
                .withPropertyValues("projections.kafka.enabled=true", "projections.kafka.topic=WalletEvents")
                .run(context -> {
                    KafkaEventLogConnection connection = context.getBean(KafkaEventLogConnection.class);
                    assertEquals("WalletEvents", connection.getTopicPartition().topic());
                    assertEquals(0, connection.getTopicPartition().partition());
                    assertFalse(context.containsBean("projectionManager"));
                });
    }
}
