package com.company.apimonitoring.analysis.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class AutoregressiveForecasterTest {

    private final AutoregressiveForecaster forecaster = new AutoregressiveForecaster();

    @Test
    void forecast_ConstantSeries_StaysFlat() {
        double[] series = new double[20];
        Arrays.fill(series, 50.0);

        double[] forecast = forecaster.forecast(series, 10);

        assertEquals(10, forecast.length);
        for (double value : forecast) {
            assertEquals(50.0, value, 1e-9);
        }
    }

    @Test
    void forecast_LinearSeries_ContinuesTheSlope() {
        double[] series = new double[25];
        for (int i = 0; i < series.length; i++) {
            series[i] = 10.0 + 2.0 * i;
        }

        double[] forecast = forecaster.forecast(series, 5);

        assertEquals(60.0, forecast[0], 1e-6);
        assertEquals(68.0, forecast[4], 1e-6);
    }

    @Test
    void forecast_NoisySeries_FiniteValuesNearRecentLevel() {
        // Given
        Random random = new Random(7);
        double[] series = new double[60];
        for (int i = 0; i < series.length; i++) {
            series[i] = 200.0 + random.nextGaussian() * 5.0;
        }

        // When
        double[] forecast = forecaster.forecast(series, 30);

        // Then
        for (double value : forecast) {
            assertTrue(Double.isFinite(value));
            assertTrue(value > 100.0 && value < 300.0, "forecast drifted to " + value);
        }
    }

    @Test
    void forecast_SinglePoint_RepeatsIt() {
        double[] forecast = forecaster.forecast(new double[]{42.0}, 3);

        assertArrayEquals(new double[]{42.0, 42.0, 42.0}, forecast, 0.0);
    }

    @Test
    void forecast_EmptySeries_Throws() {
        assertThrows(IllegalArgumentException.class, () -> forecaster.forecast(new double[0], 3));
    }
}
