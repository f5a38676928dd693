package com.chicu.ecorisk.ai.ml.features;

import com.chicu.ecorisk.common.error.InsufficientDataException;
import com.chicu.ecorisk.domain.PopulationSnapshot;

import java.util.List;

/**
 * Один и тот же extractor используется и в обучении, и в инференсе,
 * поэтому семантика фич не может разъехаться.
 */
public interface FeatureExtractor {

    FeatureSchema schema();

    /** Длина lookback-окна. */
    int window();

    /**
     * @param window ровно {@link #window()} снапшотов в порядке шагов
     * @return вектор длины schema().size()
     */
    double[] extract(List<PopulationSnapshot> window);

    /**
     * Вектор по последним {@link #window()} снапшотам истории.
     */
    default double[] extractLatest(List<PopulationSnapshot> history) {
        int w = window();
        if (history == null || history.size() < w) {
            throw new InsufficientDataException("Need at least " + w + " recent data points");
        }
        return extract(history.subList(history.size() - w, history.size()));
    }
}
