package com.newsinsight.refresh.persistence;

import com.newsinsight.refresh.entity.SourceStatus;
import com.newsinsight.refresh.exception.HealthPersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;

/**
 * JDBC 기반 소스 상태 저장소.
 * 핸들마다 풀에서 커넥션 하나를 빌려 닫을 때까지 점유한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcSourceHealthStore implements SourceHealthStore {

    static final String UPDATE_HEALTH_SQL = """
            UPDATE news_sources
               SET status = ?,
                   last_error = ?,
                   last_checked_time = ?,
                   consecutive_error_count = ?,
                   updated_at = ?
             WHERE id = ?
            """;

    private final DataSource dataSource;

    @Override
    public SourceHealthHandle open() {
        try {
            Connection connection = dataSource.getConnection();
            connection.setAutoCommit(true);
            return new JdbcHandle(connection);
        } catch (SQLException e) {
            throw new HealthPersistenceException("Could not open health store connection: " + e.getMessage(), e);
        }
    }

    private static final class JdbcHandle implements SourceHealthHandle {

        private final Connection connection;
        private final JdbcTemplate jdbcTemplate;

        private JdbcHandle(Connection connection) {
            this.connection = connection;
            // suppressClose: the handle owns the connection lifecycle
            this.jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
        }

        @Override
        public void updateSourceHealth(Long sourceId, SourceStatus status, String lastError,
                                       LocalDateTime checkedAt, int consecutiveErrors) {
            if (sourceId == null) {
                throw new HealthPersistenceException("Source has no id, health not stored");
            }
            int updated;
            try {
                updated = jdbcTemplate.update(UPDATE_HEALTH_SQL,
                        status.name(),
                        lastError,
                        checkedAt != null ? Timestamp.valueOf(checkedAt) : null,
                        consecutiveErrors,
                        Timestamp.valueOf(LocalDateTime.now()),
                        sourceId);
            } catch (DataAccessException e) {
                throw new HealthPersistenceException("Failed to update health of source " + sourceId + ": " + e.getMessage(), e);
            }
            if (updated == 0) {
                throw new HealthPersistenceException("Source " + sourceId + " no longer exists");
            }
            log.debug("Stored health for source {}: {} (errors={})", sourceId, status, consecutiveErrors);
        }

        @Override
        public void close() {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Failed to close health store connection: {}", e.getMessage());
            }
        }
    }
}
