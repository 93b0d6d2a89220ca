/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ferry.controller.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dev.mars.ferry.core.FailureCategory;
import dev.mars.ferry.core.FailureReason;
import dev.mars.ferry.core.TransferRecord;
import dev.mars.ferry.core.TransferState;
import dev.mars.ferry.core.exceptions.InvalidTransitionException;
import dev.mars.ferry.core.exceptions.RecordStoreException;
import dev.mars.ferry.core.message.MessageCodec;
import dev.mars.ferry.store.TransferRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@link TransferRecordStore} over a JDBC database, H2 by default, driven through Spring's
 * {@link JdbcTemplate} on a pooled {@link DataSource}.
 *
 * <p>One row per transfer in the {@code transfers} table. {@link #update} runs in its own
 * transaction and locks the row with {@code SELECT ... FOR UPDATE}, so concurrent updates
 * of one transfer serialize in the database, including across controller instances that
 * share it.</p>
 *
 * <p>Every call blocks on the database. Callers on a Vert.x event loop go through a
 * {@code StoreExecutor}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class JdbcTransferRecordStore implements TransferRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcTransferRecordStore.class);

    private static final String COLUMNS = "id, agent_id, object_key, display_name, status, size_bytes, digest, "
            + "credential_expiry, failure_category, failure_detail, meta, created_at, updated_at";

    private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS transfers ("
            + "id VARCHAR(64) PRIMARY KEY, "
            + "agent_id VARCHAR(128) NOT NULL, "
            + "object_key VARCHAR(1024) NOT NULL, "
            + "display_name VARCHAR(1024), "
            + "status VARCHAR(16) NOT NULL, "
            + "size_bytes BIGINT, "
            + "digest VARCHAR(128), "
            + "credential_expiry TIMESTAMP(9) WITH TIME ZONE, "
            + "failure_category VARCHAR(32), "
            + "failure_detail VARCHAR(4096), "
            + "meta CLOB, "
            + "created_at TIMESTAMP(9) WITH TIME ZONE NOT NULL, "
            + "updated_at TIMESTAMP(9) WITH TIME ZONE NOT NULL)";

    private static final String CREATE_AGENT_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_transfers_agent ON transfers(agent_id)";
    private static final String CREATE_STATUS_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_transfers_status ON transfers(status)";

    private static final String INSERT = "INSERT INTO transfers (" + COLUMNS + ") "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    private static final String SELECT_BY_ID = "SELECT " + COLUMNS + " FROM transfers WHERE id = ?";
    private static final String SELECT_BY_ID_FOR_UPDATE = SELECT_BY_ID + " FOR UPDATE";
    private static final String SELECT_BY_AGENT = "SELECT " + COLUMNS
            + " FROM transfers WHERE agent_id = ? ORDER BY created_at DESC, id ASC";
    private static final String SELECT_BY_STATUS = "SELECT " + COLUMNS
            + " FROM transfers WHERE status = ? ORDER BY created_at DESC, id ASC";
    private static final String UPDATE = "UPDATE transfers SET display_name = ?, status = ?, size_bytes = ?, "
            + "digest = ?, credential_expiry = ?, failure_category = ?, failure_detail = ?, meta = ?, "
            + "updated_at = ? WHERE id = ?";

    private static final RowMapper<TransferRecord> ROW_MAPPER = (rs, rowNum) -> mapRow(rs);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JdbcTransferRecordStore(DataSource dataSource, Clock clock) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.clock = clock;
    }

    /**
     * Opens a HikariCP pool for the record store. The caller owns the pool and closes it.
     */
    public static HikariDataSource createDataSource(String jdbcUrl, String user, String password, int maxPoolSize) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("ferry-store");
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(user);
        config.setPassword(password);
        config.setMaximumPoolSize(maxPoolSize);
        return new HikariDataSource(config);
    }

    /**
     * Creates the table and its indexes when they do not exist yet.
     */
    public void initializeSchema() {
        try {
            jdbcTemplate.execute(CREATE_TABLE);
            jdbcTemplate.execute(CREATE_AGENT_INDEX);
            jdbcTemplate.execute(CREATE_STATUS_INDEX);
            logger.info("Transfer record schema ready");
        } catch (DataAccessException e) {
            throw new RecordStoreException("Error creating transfers table", e);
        }
    }

    @Override
    public void create(TransferRecord record) {
        try {
            jdbcTemplate.update(INSERT, insert -> {
                insert.setString(1, record.getId());
                insert.setString(2, record.getAgentId());
                insert.setString(3, record.getObjectKey());
                insert.setString(4, record.getDisplayName().orElse(null));
                insert.setString(5, record.getStatus().name());
                setNullableLong(insert, 6, record.getSize().orElse(null));
                insert.setString(7, record.getDigest().orElse(null));
                insert.setObject(8, toTimestamp(record.getCredentialExpiry().orElse(null)));
                insert.setString(9, record.getFailureReason().map(r -> r.category().name()).orElse(null));
                insert.setString(10, record.getFailureReason().map(FailureReason::detail).orElse(null));
                insert.setString(11, MessageCodec.encodeMeta(record.getMeta()));
                insert.setObject(12, toTimestamp(record.getCreatedAt()));
                insert.setObject(13, toTimestamp(record.getUpdatedAt()));
            });
            logger.debug("Created transfer record {} ({})", record.getId(), record.getStatus().name());
        } catch (DataIntegrityViolationException e) {
            if (isDuplicateKey(e)) {
                throw new IllegalStateException("Transfer record already exists: " + record.getId(), e);
            }
            throw new RecordStoreException("Error creating transfer record " + record.getId(), e);
        } catch (DataAccessException e) {
            throw new RecordStoreException("Error creating transfer record " + record.getId(), e);
        }
    }

    @Override
    public Optional<TransferRecord> get(String id) {
        try {
            return jdbcTemplate.query(SELECT_BY_ID, ROW_MAPPER, id).stream().findFirst();
        } catch (DataAccessException e) {
            throw new RecordStoreException("Error reading transfer record " + id, e);
        }
    }

    @Override
    public Optional<TransferRecord> update(String id, TransferState target, Consumer<TransferRecord.Builder> changes)
            throws InvalidTransitionException {
        try {
            return transactionTemplate.execute(tx -> {
                List<TransferRecord> locked = jdbcTemplate.query(SELECT_BY_ID_FOR_UPDATE, ROW_MAPPER, id);
                if (locked.isEmpty()) {
                    return Optional.<TransferRecord>empty();
                }
                TransferRecord current = locked.get(0);
                if (!current.getStatus().canTransitionTo(target)) {
                    throw new RejectedTransition(new InvalidTransitionException(id, current.getStatus(), target));
                }

                TransferRecord updated = TransferRecordStore.applyTransition(current, target, changes, clock.instant());
                jdbcTemplate.update(UPDATE, update -> {
                    update.setString(1, updated.getDisplayName().orElse(null));
                    update.setString(2, updated.getStatus().name());
                    setNullableLong(update, 3, updated.getSize().orElse(null));
                    update.setString(4, updated.getDigest().orElse(null));
                    update.setObject(5, toTimestamp(updated.getCredentialExpiry().orElse(null)));
                    update.setString(6, updated.getFailureReason().map(r -> r.category().name()).orElse(null));
                    update.setString(7, updated.getFailureReason().map(FailureReason::detail).orElse(null));
                    update.setString(8, MessageCodec.encodeMeta(updated.getMeta()));
                    update.setObject(9, toTimestamp(updated.getUpdatedAt()));
                    update.setString(10, id);
                });
                logger.debug("Transfer {} moved {} -> {}", id, current.getStatus().name(), target.name());
                return Optional.of(updated);
            });
        } catch (RejectedTransition e) {
            throw e.rejection;
        } catch (DataAccessException | TransactionException e) {
            throw new RecordStoreException("Error updating transfer record " + id, e);
        }
    }

    @Override
    public List<TransferRecord> listByAgent(String agentId) {
        return query(SELECT_BY_AGENT, agentId, "Error listing transfers for agent " + agentId);
    }

    @Override
    public List<TransferRecord> listByStatus(TransferState status) {
        return query(SELECT_BY_STATUS, status.name(), "Error listing transfers in state " + status.name());
    }

    private List<TransferRecord> query(String sql, String parameter, String errorMessage) {
        try {
            return jdbcTemplate.query(sql, ROW_MAPPER, parameter);
        } catch (DataAccessException e) {
            throw new RecordStoreException(errorMessage, e);
        }
    }

    private static TransferRecord mapRow(ResultSet rs) throws SQLException {
        String failureCategory = rs.getString("failure_category");
        FailureReason failureReason = failureCategory == null
                ? null
                : FailureReason.of(FailureCategory.fromName(failureCategory).orElse(FailureCategory.AGENT_REPORTED),
                        rs.getString("failure_detail"));
        long size = rs.getLong("size_bytes");
        Long sizeValue = rs.wasNull() ? null : size;

        return TransferRecord.builder()
                .id(rs.getString("id"))
                .agentId(rs.getString("agent_id"))
                .objectKey(rs.getString("object_key"))
                .displayName(rs.getString("display_name"))
                .status(TransferState.valueOf(rs.getString("status")))
                .size(sizeValue)
                .digest(rs.getString("digest"))
                .credentialExpiry(toInstant(rs.getObject("credential_expiry", OffsetDateTime.class)))
                .failureReason(failureReason)
                .meta(MessageCodec.decodeMeta(rs.getString("meta")))
                .createdAt(toInstant(rs.getObject("created_at", OffsetDateTime.class)))
                .updatedAt(toInstant(rs.getObject("updated_at", OffsetDateTime.class)))
                .build();
    }

    private static void setNullableLong(PreparedStatement statement, int index, Long value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.BIGINT);
        } else {
            statement.setLong(index, value);
        }
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static boolean isDuplicateKey(DataIntegrityViolationException e) {
        if (e instanceof DuplicateKeyException) {
            return true;
        }
        Throwable cause = e.getMostSpecificCause();
        return cause instanceof SQLException sql && "23505".equals(sql.getSQLState());
    }

    /**
     * Carries a rejected transition out of the transaction callback, rolling the transaction back.
     */
    private static final class RejectedTransition extends RuntimeException {

        private final InvalidTransitionException rejection;

        RejectedTransition(InvalidTransitionException rejection) {
            super(rejection.getMessage(), rejection, false, false);
            this.rejection = rejection;
        }
    }
}
