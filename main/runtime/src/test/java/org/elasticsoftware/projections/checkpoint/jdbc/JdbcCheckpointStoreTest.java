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

package org.elasticsoftware.projections.checkpoint.jdbc;

import org.elasticsoftware.projections.log.Position;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcCheckpointStoreTest {
    private EmbeddedDatabase database;
    private JdbcCheckpointStore checkpointStore;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("classpath:org/elasticsoftware/projections/checkpoint/jdbc/schema.sql")
                .build();
        checkpointStore = new JdbcCheckpointStore(new DataSourceTransactionManager(database), new JdbcTemplate(database));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void testAbsentCheckpoint() {
        assertEquals(Optional.empty(), checkpointStore.getLastCheckpoint("WalletBalances"));
    }

    @Test
    void testSetAndOverwriteCheckpoint() {
        checkpointStore.setLastCheckpoint("WalletBalances", new Position(10, 9));
        assertEquals(Optional.of(new Position(10, 9)), checkpointStore.getLastCheckpoint("WalletBalances"));

        checkpointStore.setLastCheckpoint("WalletBalances", Position.of(30));
        assertEquals(Optional.of(Position.of(30)), checkpointStore.getLastCheckpoint("WalletBalances"));
    }

    @Test
    void testCheckpointsAreKeyedByProjection() {
        checkpointStore.setLastCheckpoint("WalletBalances", Position.of(20));
        checkpointStore.setLastCheckpoint("WalletAudit", Position.of(40));
        assertEquals(Optional.of(Position.of(20)), checkpointStore.getLastCheckpoint("WalletBalances"));
        assertEquals(Optional.of(Position.of(40)), checkpointStore.getLastCheckpoint("WalletAudit"));
        assertEquals(2, new JdbcTemplate(database).queryForObject("SELECT COUNT(*) FROM projection_checkpoints", Integer.class));
    }

    @Test
    void testUpsertDialects() {
        assertTrue(checkpointStore.getUpsertSql("postgresql").contains("ON CONFLICT (projection_name)"));
        assertTrue(checkpointStore.getUpsertSql("mariadb").contains("ON DUPLICATE KEY UPDATE"));
        assertTrue(checkpointStore.getUpsertSql("oracle").contains("FROM dual"));
        assertTrue(checkpointStore.getUpsertSql("microsoft sql server").contains("USING (VALUES (?, ?, ?))"));
        assertThrows(UnsupportedOperationException.class, () -> checkpointStore.getUpsertSql("sqlite"));
    }
}
