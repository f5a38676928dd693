package com.chicu.ecorisk.ai.ml;

import com.chicu.ecorisk.ai.ml.features.FeatureExtractor;
import com.chicu.ecorisk.ai.ml.model.CollapseModel;
import com.chicu.ecorisk.ai.ml.risk.HeuristicRiskEstimator;
import com.chicu.ecorisk.ai.ml.risk.RiskEstimator;
import com.chicu.ecorisk.ai.ml.risk.RiskResult;
import com.chicu.ecorisk.ai.ml.risk.TrainedRiskEstimator;
import com.chicu.ecorisk.domain.PopulationSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class MlPredictionService {

    public static final int DEFAULT_STEPS_AHEAD = 5;

    private final CollapseModelContext context;
    private final FeatureExtractor extractor;
    private final HeuristicRiskEstimator heuristic;

    public RiskResult predictRisk(List<PopulationSnapshot> recent) {
        return predictRisk(recent, DEFAULT_STEPS_AHEAD);
    }

    /**
     * Лес, если модель резидентна; иначе (и при любом сбое леса) — эвристика.
     */
    public RiskResult predictRisk(List<PopulationSnapshot> recent, int stepsAhead) {
        RiskEstimator estimator = select();

        if (estimator == heuristic) {
            return fallback(recent, stepsAhead);
        }

        try {
            RiskResult r = estimator.estimate(recent, stepsAhead);
            log.debug("🧠 PREDICT OK risk={} confidence={} ver={}", r.getRisk(), r.getConfidence(), r.getModelVersion());
            return r;
        } catch (Exception e) {
            log.warn("🧠 PREDICT FAIL, fallback to heuristic: {}", e.getMessage());
            return fallback(recent, stepsAhead);
        }
    }

    /**
     * Последний рубеж: эвристика тоже не должна выпускать исключение наружу.
     */
    private RiskResult fallback(List<PopulationSnapshot> recent, int stepsAhead) {
        try {
            return heuristic.estimate(recent, stepsAhead);
        } catch (Exception e) {
            log.error("🧠 HEURISTIC FAIL: {}", e.getMessage(), e);
            return RiskResult.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Модель читается один раз на запрос — конкурирующее обучение не может подменить её посреди расчёта.
     */
    RiskEstimator select() {
        Optional<CollapseModel> model = context.current();
        return model.<RiskEstimator>map(m -> new TrainedRiskEstimator(m, extractor)).orElse(heuristic);
    }
}
