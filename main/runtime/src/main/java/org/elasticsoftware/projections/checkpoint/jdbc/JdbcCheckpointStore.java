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

import org.elasticsoftware.projections.checkpoint.CheckpointStore;
import org.elasticsoftware.projections.log.Position;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Stores checkpoints in a single table, one row per projection. The schema is shipped as
 * {@code org/elasticsoftware/projections/checkpoint/jdbc/schema.sql}.
 */
public class JdbcCheckpointStore implements CheckpointStore {
    public static final String DEFAULT_TABLE_NAME = "projection_checkpoints";
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final String tableName;
    private volatile String upsertSql;

    public JdbcCheckpointStore(PlatformTransactionManager transactionManager, JdbcTemplate jdbcTemplate) {
        this(transactionManager, jdbcTemplate, DEFAULT_TABLE_NAME);
    }

    public JdbcCheckpointStore(PlatformTransactionManager transactionManager, JdbcTemplate jdbcTemplate, String tableName) {
        this.jdbcTemplate = jdbcTemplate;
        this.tableName = tableName;
        DefaultTransactionDefinition transactionDefinition = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRED);
        transactionDefinition.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate = new TransactionTemplate(transactionManager, transactionDefinition);
    }

    @Override
    public Optional<Position> getLastCheckpoint(String projectionName) {
        List<Position> positions = transactionTemplate.execute(status -> jdbcTemplate.query(
                "SELECT commit_position, prepare_position FROM %s WHERE projection_name = ?".formatted(tableName),
                (rs, rowNum) -> new Position(rs.getLong("commit_position"), rs.getLong("prepare_position")),
                projectionName));
        return positions == null || positions.isEmpty() ? Optional.empty() : Optional.of(positions.get(0));
    }

    @Override
    public void setLastCheckpoint(String projectionName, Position position) {
        String sql = getUpsertSql();
        transactionTemplate.executeWithoutResult(status -> jdbcTemplate.update(sql,
                projectionName,
                position.commitPosition(),
                position.preparePosition()));
    }

    private String getUpsertSql() {
        if (upsertSql == null) {
            upsertSql = getUpsertSql(detectDatabaseType());
        }
        return upsertSql;
    }

    private String detectDatabaseType() {
        if (jdbcTemplate.getDataSource() == null) {
            throw new IllegalStateException("JdbcTemplate has no DataSource");
        }
        try (Connection connection = jdbcTemplate.getDataSource().getConnection()) {
            return connection.getMetaData().getDatabaseProductName().toLowerCase();
        } catch (SQLException e) {
            throw new IllegalStateException("Unable to detect database type", e);
        }
    }

    String getUpsertSql(String databaseType) {
        return switch (databaseType) {
            case "postgresql" -> """
                INSERT INTO %s (projection_name, commit_position, prepare_position)
                VALUES (?, ?, ?)
                ON CONFLICT (projection_name) DO UPDATE
                SET commit_position = EXCLUDED.commit_position, prepare_position = EXCLUDED.prepare_position
                """.formatted(tableName);

            case "mysql", "mariadb" -> """
                INSERT INTO %s (projection_name, commit_position, prepare_position)
                VALUES (?, ?, ?)
                ON DUPLICATE KEY UPDATE
                commit_position = VALUES(commit_position), prepare_position = VALUES(prepare_position)
                """.formatted(tableName);

            case "oracle" -> """
                MERGE INTO %s target
                USING (SELECT ? AS projection_name, ? AS commit_position, ? AS prepare_position FROM dual) source
                ON (target.projection_name = source.projection_name)
                WHEN MATCHED THEN
                    UPDATE SET commit_position = source.commit_position, prepare_position = source.prepare_position
                WHEN NOT MATCHED THEN
                    INSERT (projection_name, commit_position, prepare_position)
                    VALUES (source.projection_name, source.commit_position, source.prepare_position)
                """.formatted(tableName);

            case "microsoft sql server" -> """
                MERGE INTO %s AS target
                USING (VALUES (?, ?, ?)) AS source (projection_name, commit_position, prepare_position)
                ON target.projection_name = source.projection_name
                WHEN MATCHED THEN
                    UPDATE SET commit_position = source.commit_position, prepare_position = source.prepare_position
                WHEN NOT MATCHED THEN
                    INSERT (projection_name, commit_position, prepare_position)
                    VALUES (source.projection_name, source.commit_position, source.prepare_position);
                """.formatted(tableName);

            case "h2" -> """
                MERGE INTO %s (projection_name, commit_position, prepare_position)
                KEY (projection_name)
                VALUES (?, ?, ?)
                """.formatted(tableName);

            default -> throw new UnsupportedOperationException("Unsupported database: " + databaseType);
        };
    }
}
