package com.chicu.ecorisk.ai.ml.risk;

import com.chicu.ecorisk.domain.PopulationSnapshot;

import java.util.List;

/**
 * Оценка риска коллапса по последним снапшотам.
 * Реализации: {@link TrainedRiskEstimator} (лес) и {@link HeuristicRiskEstimator} (правила).
 */
public interface RiskEstimator {

    RiskResult estimate(List<PopulationSnapshot> recent, int stepsAhead);
}
