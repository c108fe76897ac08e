package com.company.apimonitoring.repository;

import com.company.apimonitoring.domain.Alert;
import com.company.apimonitoring.domain.enums.AlertSeverity;
import com.company.apimonitoring.domain.enums.AlertStatus;
import com.company.apimonitoring.domain.enums.Environment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
@RequiredArgsConstructor
@Slf4j
public class AlertRepository {

    private static final String SELECT_COLUMNS = """
            SELECT id, title, description, severity, status, created_at, updated_at,
                   anomalies, apis, environments, tags, metadata
            FROM alerts
            """;

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    /**
     * Alert ids are derived from their anomalies, so regenerating a batch is a no-op here.
     */
    public void saveAll(List<Alert> alerts) {
        if (alerts.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO alerts (
                id, title, description, severity, status, created_at, updated_at,
                anomalies, apis, environments, tags, metadata
            ) VALUES (?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), CAST(? AS jsonb),
                      CAST(? AS jsonb), CAST(? AS jsonb), CAST(? AS jsonb))
            ON CONFLICT (id) DO NOTHING
            """;

        List<Object[]> batch = new ArrayList<>(alerts.size());
        for (Alert alert : alerts) {
            batch.add(new Object[]{
                    alert.getId(),
                    alert.getTitle(),
                    alert.getDescription(),
                    alert.getSeverity().getValue(),
                    alert.getStatus().getValue(),
                    Timestamp.from(alert.getCreatedAt()),
                    Timestamp.from(alert.getUpdatedAt()),
                    json.write(alert.getAnomalies()),
                    json.write(alert.getApis()),
                    json.write(environmentValues(alert.getEnvironments())),
                    json.write(alert.getTags()),
                    json.write(alert.getMetadata())
            });
        }
        jdbcTemplate.batchUpdate(sql, batch);
        log.debug("Stored {} alerts", alerts.size());
    }

    public Optional<Alert> findById(String alertId) {
        List<Alert> results = jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", new AlertRowMapper(), alertId);
        return results.stream().findFirst();
    }

    /**
     * Newest first. Null filters are not applied.
     */
    public List<Alert> findAlerts(Collection<AlertStatus> statuses, String apiId, Environment environment,
                                  AlertSeverity severity, int limit) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append(" WHERE 1 = 1");
        List<Object> args = new ArrayList<>();

        if (statuses != null && !statuses.isEmpty()) {
            sql.append(" AND status IN (")
                    .append(statuses.stream().map(s -> "?").collect(Collectors.joining(", ")))
                    .append(')');
            statuses.forEach(s -> args.add(s.getValue()));
        }
        if (apiId != null) {
            sql.append(" AND apis @> CAST(? AS jsonb)");
            args.add(json.write(List.of(apiId)));
        }
        if (environment != null) {
            sql.append(" AND environments @> CAST(? AS jsonb)");
            args.add(json.write(List.of(environment.getValue())));
        }
        if (severity != null) {
            sql.append(" AND severity = ?");
            args.add(severity.getValue());
        }
        sql.append(" ORDER BY created_at DESC LIMIT ?");
        args.add(limit);

        return jdbcTemplate.query(sql.toString(), new AlertRowMapper(), args.toArray());
    }

    /**
     * Writes the mutable part of an alert: status, metadata and update time.
     */
    public int updateStatus(Alert alert) {
        String sql = """
            UPDATE alerts
            SET status = ?,
                metadata = CAST(? AS jsonb),
                updated_at = ?
            WHERE id = ?
            """;
        return jdbcTemplate.update(sql,
                alert.getStatus().getValue(),
                json.write(alert.getMetadata()),
                Timestamp.from(alert.getUpdatedAt()),
                alert.getId());
    }

    private static List<String> environmentValues(List<Environment> environments) {
        return environments.stream().map(Environment::getValue).collect(Collectors.toList());
    }

    private class AlertRowMapper implements RowMapper<Alert> {
        @Override
        public Alert mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            return Alert.builder()
                    .id(rs.getString("id"))
                    .title(rs.getString("title"))
                    .description(rs.getString("description"))
                    .severity(AlertSeverity.fromString(rs.getString("severity")))
                    .status(AlertStatus.fromString(rs.getString("status")))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .updatedAt(updatedAt != null ? updatedAt.toInstant() : null)
                    .anomalies(json.readList(rs.getString("anomalies")))
                    .apis(json.readList(rs.getString("apis")))
                    .environments(json.readList(rs.getString("environments")).stream()
                            .map(Environment::fromString)
                            .distinct()
                            .collect(Collectors.toList()))
                    .tags(json.readList(rs.getString("tags")))
                    .metadata(json.readMap(rs.getString("metadata")))
                    .build();
        }
    }
}
