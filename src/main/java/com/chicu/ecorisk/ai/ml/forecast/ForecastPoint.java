package com.chicu.ecorisk.ai.ml.forecast;

public record ForecastPoint(int step, int plants, int herbivores, int carnivores) {
}
