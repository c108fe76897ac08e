package com.company.apimonitoring.analysis.model;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.util.Arrays;

/**
 * Autoregressive model on first differences: d(t) = sum(phi_i * d(t - i)), i = 1..order.
 * Forecasts are produced by iterating the fitted recurrence and integrating back.
 * <p>
 * Short series reduce the order so the regression stays over-determined. When the fit
 * is not possible (constant differences, singular design) the forecast degrades to a
 * drift model: last value plus the mean step.
 */
@Slf4j
public class AutoregressiveForecaster {

    public static final int DEFAULT_ORDER = 5;

    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private final int maxOrder;

    public AutoregressiveForecaster() {
        this(DEFAULT_ORDER);
    }

    public AutoregressiveForecaster(int maxOrder) {
        if (maxOrder < 1) {
            throw new IllegalArgumentException("order must be positive: " + maxOrder);
        }
        this.maxOrder = maxOrder;
    }

    /**
     * @return forecast values for steps 1..steps after the last observation
     */
    public double[] forecast(double[] series, int steps) {
        if (series.length == 0) {
            throw new IllegalArgumentException("Cannot forecast an empty series");
        }
        double[] result = new double[steps];
        double last = series[series.length - 1];
        if (series.length < 2) {
            Arrays.fill(result, last);
            return result;
        }

        double[] diffs = new double[series.length - 1];
        for (int i = 1; i < series.length; i++) {
            diffs[i - 1] = series[i] - series[i - 1];
        }

        int order = effectiveOrder(diffs.length);
        double[] coefficients = order > 0 ? fit(diffs, order) : null;
        if (coefficients == null) {
            return drift(last, diffs, steps);
        }

        double[] window = new double[diffs.length + steps];
        System.arraycopy(diffs, 0, window, 0, diffs.length);
        double level = last;
        for (int s = 0; s < steps; s++) {
            int t = diffs.length + s;
            double next = 0.0;
            for (int lag = 1; lag <= order; lag++) {
                next += coefficients[lag - 1] * window[t - lag];
            }
            window[t] = next;
            level += next;
            result[s] = level;
        }
        if (!Double.isFinite(level)) {
            log.debug("Autoregressive forecast diverged, using drift");
            return drift(last, diffs, steps);
        }
        return result;
    }

    private static double[] drift(double last, double[] diffs, int steps) {
        double step = mean(diffs);
        double[] result = new double[steps];
        for (int s = 0; s < steps; s++) {
            result[s] = last + step * (s + 1);
        }
        return result;
    }

    private int effectiveOrder(int diffCount) {
        int order = maxOrder;
        // observations (diffCount - order) must exceed regressors (order)
        while (order > 0 && diffCount - order <= order) {
            order--;
        }
        return order;
    }

    private double[] fit(double[] diffs, int order) {
        int observations = diffs.length - order;
        double[] y = new double[observations];
        double[][] x = new double[observations][order];
        for (int row = 0; row < observations; row++) {
            int t = row + order;
            y[row] = diffs[t];
            for (int lag = 1; lag <= order; lag++) {
                x[row][lag - 1] = diffs[t - lag];
            }
        }
        try {
            OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
            regression.setNoIntercept(true);
            regression.newSampleData(y, x);
            double[] parameters = regression.estimateRegressionParameters();
            for (double parameter : parameters) {
                if (Double.isNaN(parameter) || Double.isInfinite(parameter)) {
                    return null;
                }
            }
            return parameters;
        } catch (MathIllegalArgumentException e) {
            log.debug("Autoregressive fit of order {} not possible, using drift: {}", order, e.getMessage());
            return null;
        }
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return values.length == 0 ? 0.0 : sum / values.length;
    }
}
