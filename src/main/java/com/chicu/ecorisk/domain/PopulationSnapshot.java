package com.chicu.ecorisk.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Одно наблюдение симуляции на шаге step.
 * Отрицательные значения не валидируем — расчёты обязаны их переживать.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PopulationSnapshot(
        int step,
        double plants,
        double herbivores,
        double carnivores
) {

    public static PopulationSnapshot of(int step, double plants, double herbivores, double carnivores) {
        return new PopulationSnapshot(step, plants, herbivores, carnivores);
    }

    public double value(Species species) {
        return switch (species) {
            case PLANTS -> plants;
            case HERBIVORES -> herbivores;
            case CARNIVORES -> carnivores;
        };
    }
}
