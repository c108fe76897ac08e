package com.company.apimonitoring.analysis.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IsolationForestTest {

    @Test
    void fit_ClusterWithOutlier_OutlierScoresAboveThreshold() {
        // Given
        double[][] data = new double[50][];
        for (int i = 0; i < 49; i++) {
            data[i] = new double[]{100.0 + (i % 7), 12.0};
        }
        data[49] = new double[]{900.0, 3.0};

        // When
        IsolationForest model = new IsolationForest(0.05).fit(data);

        // Then
        double outlier = model.score(data[49]);
        assertTrue(model.isOutlier(outlier));
        assertTrue(outlier > model.score(data[0]));
        assertTrue(outlier > 0.5);
    }

    @Test
    void fit_SameSeed_SameScores() {
        double[][] data = new double[30][];
        for (int i = 0; i < data.length; i++) {
            data[i] = new double[]{i * 1.5, i % 4};
        }

        double[] first = new IsolationForest(0.1).fit(data).score(data);
        double[] second = new IsolationForest(0.1).fit(data).score(data);

        assertArrayEquals(first, second, 0.0);
    }

    @Test
    void score_BeforeFit_Throws() {
        IsolationForest model = new IsolationForest(0.1);

        assertThrows(IllegalStateException.class, () -> model.score(new double[]{1.0}));
    }

    @Test
    void constructor_ContaminationOutOfRange_Throws() {
        assertThrows(IllegalArgumentException.class, () -> new IsolationForest(0.0));
        assertThrows(IllegalArgumentException.class, () -> new IsolationForest(0.5));
    }

    @Test
    void averagePathLength_KnownValues() {
        assertEquals(0.0, IsolationForest.averagePathLength(1), 1e-12);
        assertEquals(1.0, IsolationForest.averagePathLength(2), 1e-12);
        assertTrue(IsolationForest.averagePathLength(256) > IsolationForest.averagePathLength(64));
    }
}
