package com.chicu.ecorisk.ai.ml.model;

import com.chicu.ecorisk.ai.ml.features.FeatureSchema;
import com.chicu.ecorisk.ai.ml.risk.RiskFactor;
import smile.classification.RandomForest;
import smile.data.DataFrame;
import smile.data.Tuple;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Обученная пара (классификатор, скейлер) как одно неизменяемое значение.
 * Скейлер никогда не живёт отдельно от леса, под который он был обучен.
 */
public final class CollapseModel implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String MODEL_TYPE = "collapse_predictor";
    public static final String VERSION = "1.0";

    private final RandomForest classifier;
    private final FeatureScaler scaler;
    private final FeatureSchema schema;
    private final double[] importance;
    private final Instant trainedAt;

    public CollapseModel(RandomForest classifier, FeatureScaler scaler, FeatureSchema schema, Instant trainedAt) {
        if (classifier == null || scaler == null || schema == null) {
            throw new IllegalArgumentException("classifier/scaler/schema обязательны");
        }
        if (scaler.featureCount() != schema.size()) {
            throw new IllegalArgumentException("scaler обучен на " + scaler.featureCount()
                    + " фичах, schema=" + schema.size());
        }
        this.classifier = classifier;
        this.scaler = scaler;
        this.schema = schema;
        this.importance = normalize(classifier.importance());
        this.trainedAt = trainedAt;
    }

    public FeatureSchema schema() {
        return schema;
    }

    public String schemaHash() {
        return schema.schemaHash();
    }

    public Instant trainedAt() {
        return trainedAt;
    }

    public String version() {
        return VERSION;
    }

    /**
     * @param rawFeatures вектор до скейлинга
     * @return [P(норма), P(коллапс)]
     */
    public double[] posteriori(double[] rawFeatures) {
        double[] scaled = scaler.transform(rawFeatures);
        double[] p = new double[2];
        classifier.predict(row(scaled), p);
        return p;
    }

    /**
     * Класс по уже отскейленному вектору (для accuracy на split'ах).
     */
    int predictScaled(double[] scaled) {
        return classifier.predict(row(scaled));
    }

    /**
     * Топ-k фич по глобальной важности (сумма важностей = 1), по убыванию.
     */
    public List<RiskFactor> topFactors(int k) {
        Integer[] order = new Integer[importance.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> importance[i]).reversed());

        List<RiskFactor> out = new ArrayList<>(k);
        for (int i = 0; i < Math.min(k, order.length); i++) {
            int idx = order[i];
            out.add(new RiskFactor(schema.name(idx), importance[idx]));
        }
        return out;
    }

    public double[] importance() {
        return importance.clone();
    }

    private Tuple row(double[] scaled) {
        DataFrame df = CollapseClassifierFactory.frame(new double[][]{scaled}, new int[]{0}, schema.featureNames());
        return df.get(0);
    }

    private static double[] normalize(double[] raw) {
        double[] out = raw.clone();
        double sum = 0;
        for (double v : out) sum += v;
        if (sum > 0) {
            for (int i = 0; i < out.length; i++) out[i] /= sum;
        }
        return out;
    }
}
