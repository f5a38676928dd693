package com.chicu.ecorisk.ai.ml.model;

import org.apache.commons.math3.stat.StatUtils;

import java.io.Serializable;

/**
 * Стандартизация (x - mean) / std, std по генеральной совокупности.
 * Колонка с нулевой дисперсией получает scale = 1.
 */
public final class FeatureScaler implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double[] mean;
    private final double[] scale;

    private FeatureScaler(double[] mean, double[] scale) {
        this.mean = mean;
        this.scale = scale;
    }

    public static FeatureScaler fit(double[][] X) {
        if (X == null || X.length == 0) {
            throw new IllegalArgumentException("scaler: пустая матрица");
        }
        int f = X[0].length;
        double[] mean = new double[f];
        double[] scale = new double[f];

        double[] column = new double[X.length];
        for (int j = 0; j < f; j++) {
            for (int i = 0; i < X.length; i++) {
                column[i] = X[i][j];
            }
            mean[j] = StatUtils.mean(column);
            double std = Math.sqrt(StatUtils.populationVariance(column, mean[j]));
            scale[j] = std > 0 ? std : 1.0;
        }
        return new FeatureScaler(mean, scale);
    }

    public int featureCount() {
        return mean.length;
    }

    public double[] transform(double[] x) {
        if (x == null || x.length != mean.length) {
            throw new IllegalArgumentException("scaler ждёт " + mean.length + " фич, пришло "
                    + (x == null ? "null" : x.length));
        }
        double[] out = new double[x.length];
        for (int j = 0; j < x.length; j++) {
            out[j] = (x[j] - mean[j]) / scale[j];
        }
        return out;
    }

    public double[][] transform(double[][] X) {
        double[][] out = new double[X.length][];
        for (int i = 0; i < X.length; i++) {
            out[i] = transform(X[i]);
        }
        return out;
    }
}
