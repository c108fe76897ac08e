package com.company.apimonitoring.repository;

import com.company.apimonitoring.domain.Anomaly;
import com.company.apimonitoring.domain.enums.Environment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Repository
@RequiredArgsConstructor
@Slf4j
public class AnomalyRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    /**
     * Re-inserting an existing id is ignored.
     */
    public void saveAll(List<Anomaly> anomalies) {
        if (anomalies.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO anomalies (
                id, api_id, type, severity, timestamp, description, metric_value,
                expected_value, threshold, environment, context, related_anomalies, processed
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), CAST(? AS jsonb), ?)
            ON CONFLICT (id) DO NOTHING
            """;

        List<Object[]> batch = new ArrayList<>(anomalies.size());
        for (Anomaly anomaly : anomalies) {
            batch.add(new Object[]{
                    anomaly.getId(),
                    anomaly.getApiId(),
                    anomaly.getType(),
                    anomaly.getSeverity(),
                    Timestamp.from(anomaly.getTimestamp()),
                    anomaly.getDescription(),
                    anomaly.getMetricValue(),
                    anomaly.getExpectedValue(),
                    anomaly.getThreshold(),
                    anomaly.getEnvironment().getValue(),
                    json.write(anomaly.getContext()),
                    json.write(anomaly.getRelatedAnomalies()),
                    anomaly.isProcessed()
            });
        }
        jdbcTemplate.batchUpdate(sql, batch);
        log.debug("Stored {} anomalies", anomalies.size());
    }

    public List<Anomaly> findUnprocessed(int limit) {
        String sql = """
            SELECT id, api_id, type, severity, timestamp, description, metric_value,
                   expected_value, threshold, environment, context, related_anomalies, processed
            FROM anomalies
            WHERE processed = false
            ORDER BY timestamp ASC
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, new AnomalyRowMapper(), limit);
    }

    public int markProcessed(List<String> anomalyIds) {
        if (anomalyIds.isEmpty()) {
            return 0;
        }
        String sql = "UPDATE anomalies SET processed = true WHERE id = ANY (?)";
        return jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql);
            ps.setArray(1, connection.createArrayOf("varchar", anomalyIds.toArray()));
            return ps;
        });
    }

    public long countSince(Instant since, String apiId, Environment environment) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM anomalies WHERE timestamp >= ?");
        List<Object> args = new ArrayList<>();
        args.add(Timestamp.from(since));
        if (apiId != null) {
            sql.append(" AND api_id = ?");
            args.add(apiId);
        }
        if (environment != null) {
            sql.append(" AND environment = ?");
            args.add(environment.getValue());
        }
        Long count = jdbcTemplate.queryForObject(sql.toString(), Long.class, args.toArray());
        return count != null ? count : 0L;
    }

    private class AnomalyRowMapper implements RowMapper<Anomaly> {
        @Override
        public Anomaly mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Anomaly.builder()
                    .id(rs.getString("id"))
                    .apiId(rs.getString("api_id"))
                    .type(rs.getString("type"))
                    .severity(rs.getDouble("severity"))
                    .timestamp(rs.getTimestamp("timestamp").toInstant())
                    .description(rs.getString("description"))
                    .metricValue(rs.getDouble("metric_value"))
                    .expectedValue(rs.getObject("expected_value", Double.class))
                    .threshold(rs.getObject("threshold", Double.class))
                    .environment(Environment.fromString(rs.getString("environment")))
                    .context(json.readMap(rs.getString("context")))
                    .relatedAnomalies(json.readList(rs.getString("related_anomalies")))
                    .processed(rs.getBoolean("processed"))
                    .build();
        }
    }
}
