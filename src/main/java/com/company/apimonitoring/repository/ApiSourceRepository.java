package com.company.apimonitoring.repository;

import com.company.apimonitoring.domain.ApiSource;
import com.company.apimonitoring.domain.enums.Environment;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class ApiSourceRepository {

    private static final String SELECT_COLUMNS = """
            SELECT id, name, description, base_url, environment, type, is_active,
                   sampling_rate, timeout_seconds, created_at, updated_at
            FROM api_sources
            """;

    private final JdbcTemplate jdbcTemplate;

    public List<ApiSource> findActive() {
        String sql = SELECT_COLUMNS + " WHERE is_active = true ORDER BY id";
        return jdbcTemplate.query(sql, new ApiSourceRowMapper());
    }

    /**
     * Active sources changed after the given instant.
     */
    public List<ApiSource> findUpdatedSince(Instant since) {
        String sql = SELECT_COLUMNS + " WHERE is_active = true AND updated_at > ? ORDER BY id";
        return jdbcTemplate.query(sql, new ApiSourceRowMapper(), Timestamp.from(since));
    }

    private static class ApiSourceRowMapper implements RowMapper<ApiSource> {
        @Override
        public ApiSource mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp createdAt = rs.getTimestamp("created_at");
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            return ApiSource.builder()
                    .id(rs.getString("id"))
                    .name(rs.getString("name"))
                    .description(rs.getString("description"))
                    .baseUrl(rs.getString("base_url"))
                    .environment(Environment.fromString(rs.getString("environment")))
                    .type(rs.getString("type"))
                    .active(rs.getBoolean("is_active"))
                    .samplingRate(rs.getObject("sampling_rate", Double.class))
                    .timeoutSeconds(rs.getObject("timeout_seconds", Integer.class))
                    .createdAt(createdAt != null ? createdAt.toInstant() : null)
                    .updatedAt(updatedAt != null ? updatedAt.toInstant() : null)
                    .build();
        }
    }
}
