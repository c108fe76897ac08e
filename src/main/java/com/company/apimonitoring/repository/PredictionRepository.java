package com.company.apimonitoring.repository;

import com.company.apimonitoring.domain.Prediction;
import com.company.apimonitoring.domain.enums.Environment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Repository
@RequiredArgsConstructor
@Slf4j
public class PredictionRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public void saveAll(List<Prediction> predictions) {
        if (predictions.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO predictions (
                id, api_id, type, confidence, created_at, predicted_for, description,
                predicted_value, current_value, trend, environment, context
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb))
            ON CONFLICT (id) DO NOTHING
            """;

        List<Object[]> batch = new ArrayList<>(predictions.size());
        for (Prediction prediction : predictions) {
            batch.add(new Object[]{
                    prediction.getId(),
                    prediction.getApiId(),
                    prediction.getType(),
                    prediction.getConfidence(),
                    Timestamp.from(prediction.getCreatedAt()),
                    Timestamp.from(prediction.getPredictedFor()),
                    prediction.getDescription(),
                    prediction.getPredictedValue(),
                    prediction.getCurrentValue(),
                    prediction.getTrend().getValue(),
                    prediction.getEnvironment().getValue(),
                    json.write(prediction.getContext())
            });
        }
        jdbcTemplate.batchUpdate(sql, batch);
        log.debug("Stored {} predictions", predictions.size());
    }

    /**
     * Predictions due in [from, to] with at least the given confidence.
     */
    public long countUpcoming(Instant from, Instant to, double minConfidence, String apiId, Environment environment) {
        StringBuilder sql = new StringBuilder("""
                SELECT COUNT(*) FROM predictions
                WHERE predicted_for >= ? AND predicted_for <= ? AND confidence >= ?
                """);
        List<Object> args = new ArrayList<>();
        args.add(Timestamp.from(from));
        args.add(Timestamp.from(to));
        args.add(minConfidence);
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
}
