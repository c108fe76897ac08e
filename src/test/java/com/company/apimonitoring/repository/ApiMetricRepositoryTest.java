package com.company.apimonitoring.repository;

import com.company.apimonitoring.domain.enums.Environment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ApiMetricRepositoryTest {

    private static final Instant END = Instant.parse("2024-01-15T12:00:00Z");
    private static final Instant START = END.minusSeconds(3600);

    @Mock
    private JdbcTemplate jdbcTemplate;

    private ApiMetricRepository repository;

    @BeforeEach
    void setUp() {
        repository = new ApiMetricRepository(jdbcTemplate);
    }

    @Test
    void findMetrics_Limited_KeepsNewestRowsInAscendingOrder() {
        // When
        repository.findMetrics("payments", START, END, Environment.AWS, null, null, 500);

        // Then
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Object[]> args = ArgumentCaptor.forClass(Object[].class);
        verify(jdbcTemplate).query(sql.capture(), any(RowMapper.class), args.capture());

        String query = sql.getValue();
        int inner = query.indexOf("ORDER BY timestamp DESC LIMIT ?");
        int outer = query.lastIndexOf("ORDER BY timestamp ASC");
        assertTrue(inner > 0, query);
        assertTrue(outer > inner, query);
        assertTrue(query.trim().endsWith("ORDER BY timestamp ASC"), query);
        assertFalse(query.contains("ASC LIMIT"), query);

        Object[] values = args.getValue();
        assertEquals(5, values.length);
        assertEquals("payments", values[2]);
        assertEquals("aws", values[3]);
        assertEquals(500, values[4]);
    }
}
