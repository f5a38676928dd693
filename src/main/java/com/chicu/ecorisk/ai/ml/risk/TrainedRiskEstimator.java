package com.chicu.ecorisk.ai.ml.risk;

import com.chicu.ecorisk.ai.ml.features.FeatureExtractor;
import com.chicu.ecorisk.ai.ml.model.CollapseModel;
import com.chicu.ecorisk.common.error.InferenceFailureException;
import com.chicu.ecorisk.common.error.InsufficientDataException;
import com.chicu.ecorisk.domain.PopulationSnapshot;

import java.util.List;

/**
 * Оценка обученным лесом. Живёт ровно один запрос: держит ту модель,
 * которая была резидентной в момент его начала.
 */
public class TrainedRiskEstimator implements RiskEstimator {

    static final int TOP_FACTORS = 5;

    private final CollapseModel model;
    private final FeatureExtractor extractor;

    public TrainedRiskEstimator(CollapseModel model, FeatureExtractor extractor) {
        this.model = model;
        this.extractor = extractor;
    }

    /**
     * @throws InsufficientDataException меньше 5 снапшотов
     * @throws InferenceFailureException  schema не совпала или лес упал
     */
    @Override
    public RiskResult estimate(List<PopulationSnapshot> recent, int stepsAhead) {
        if (!extractor.schema().schemaHash().equals(model.schemaHash())) {
            throw new InferenceFailureException("model schema " + model.schemaHash()
                    + " != extractor schema " + extractor.schema().schemaHash());
        }

        double[] x = extractor.extractLatest(recent);

        double[] p;
        try {
            p = model.posteriori(x);
        } catch (RuntimeException e) {
            throw new InferenceFailureException("collapse model inference failed: " + e.getMessage(), e);
        }

        double risk = p[1];
        double confidence = Math.max(p[0], p[1]);

        return RiskResult.builder()
                .success(true)
                .risk(risk)
                .confidence(confidence)
                .factors(model.topFactors(TOP_FACTORS))
                .modelVersion(model.version())
                .riskLevel(RiskLevel.of(risk))
                .stepsAhead(stepsAhead)
                .build();
    }
}
