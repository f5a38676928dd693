package com.chicu.ecorisk.ai.ml.risk;

import com.chicu.ecorisk.domain.PopulationSnapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Правила без модели. Используется пока модель не обучена
 * и как fallback при любом сбое инференса.
 */
@Component
public class HeuristicRiskEstimator implements RiskEstimator {

    public static final String VERSION = "heuristic";
    public static final double CONFIDENCE = 0.6;

    static final int TREND_POINTS = 3;

    @Override
    public RiskResult estimate(List<PopulationSnapshot> recent, int stepsAhead) {
        if (recent == null || recent.isEmpty()) {
            return RiskResult.fail("No data provided");
        }
        if (recent.stream().anyMatch(Objects::isNull)) {
            return RiskResult.fail("Invalid features format");
        }

        PopulationSnapshot latest = recent.get(recent.size() - 1);
        List<RiskFactor> factors = new ArrayList<>();
        double risk = 0.0;

        if (latest.plants() < 10) {
            risk += add(factors, "critically_low_plants", 0.4);
        } else if (latest.plants() < 30) {
            risk += add(factors, "low_plants", 0.2);
        }

        if (latest.herbivores() < 3) {
            risk += add(factors, "critically_low_herbivores", 0.3);
        }

        if (latest.carnivores() > latest.herbivores() * 1.5) {
            risk += add(factors, "predator_overload", 0.2);
        }

        if (recent.size() >= TREND_POINTS) {
            PopulationSnapshot first = recent.get(recent.size() - TREND_POINTS);
            double plantTrend = (latest.plants() - first.plants()) / TREND_POINTS;
            if (plantTrend < -5) {
                risk += add(factors, "declining_plant_trend", 0.15);
            }
        }

        risk = Math.max(0.0, Math.min(risk, 1.0));

        return RiskResult.builder()
                .success(true)
                .risk(risk)
                .confidence(CONFIDENCE)
                .factors(factors)
                .modelVersion(VERSION)
                .riskLevel(RiskLevel.of(risk))
                .stepsAhead(stepsAhead)
                .build();
    }

    private static double add(List<RiskFactor> factors, String name, double weight) {
        factors.add(new RiskFactor(name, weight));
        return weight;
    }
}
