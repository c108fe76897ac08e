package com.company.apimonitoring.repository;

import com.company.apimonitoring.domain.ApiMetric;
import com.company.apimonitoring.domain.enums.Environment;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Read side of the metric store filled by the collectors.
 */
@Repository
@RequiredArgsConstructor
public class ApiMetricRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * The most recent {@code limit} samples in [start, end), returned oldest first.
     * Null filters are not applied; a null apiId queries all APIs.
     */
    public List<ApiMetric> findMetrics(String apiId, Instant start, Instant end, Environment environment,
                                       String endpoint, String method, int limit) {
        StringBuilder sql = new StringBuilder("""
                SELECT id, api_id, endpoint, method, environment, timestamp,
                       response_time, status_code, success, error_message
                FROM api_metrics
                WHERE timestamp >= ? AND timestamp < ?
                """);
        List<Object> args = new ArrayList<>();
        args.add(Timestamp.from(start));
        args.add(Timestamp.from(end));

        if (apiId != null) {
            sql.append(" AND api_id = ?");
            args.add(apiId);
        }
        if (environment != null) {
            sql.append(" AND environment = ?");
            args.add(environment.getValue());
        }
        if (endpoint != null) {
            sql.append(" AND endpoint = ?");
            args.add(endpoint);
        }
        if (method != null) {
            sql.append(" AND method = ?");
            args.add(method);
        }
        sql.append(" ORDER BY timestamp DESC LIMIT ?");
        args.add(limit);

        String query = "SELECT * FROM (" + sql + ") recent ORDER BY timestamp ASC";
        return jdbcTemplate.query(query, new ApiMetricRowMapper(), args.toArray());
    }

    private static class ApiMetricRowMapper implements RowMapper<ApiMetric> {
        @Override
        public ApiMetric mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ApiMetric.builder()
                    .id(rs.getString("id"))
                    .apiId(rs.getString("api_id"))
                    .endpoint(rs.getString("endpoint"))
                    .method(rs.getString("method"))
                    .environment(Environment.fromString(rs.getString("environment")))
                    .timestamp(rs.getTimestamp("timestamp").toInstant())
                    .responseTime(rs.getObject("response_time", Double.class))
                    .statusCode(rs.getObject("status_code", Integer.class))
                    .success(rs.getBoolean("success"))
                    .errorMessage(rs.getString("error_message"))
                    .build();
        }
    }
}
