package com.chicu.ecorisk.ai.ml.model;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ml.training")
public class TrainingProperties {

    /** Кол-во деревьев в лесу */
    private int trees = 100;

    private int maxDepth = 10;

    /** Узел с меньшим числом примеров не делится (в smile уходит как nodeSize = split / 2) */
    private int minSamplesSplit = 5;

    private long seed = 42L;

    /** Доля test в split */
    private double testFraction = 0.2;

    /** Минимум обучающих примеров (окон) */
    private int minExamples = 20;
}
