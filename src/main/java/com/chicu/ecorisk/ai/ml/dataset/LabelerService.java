package com.chicu.ecorisk.ai.ml.dataset;

import com.chicu.ecorisk.domain.PopulationSnapshot;

public interface LabelerService {

    /**
     * true = коллапс (label 1), false = норма (label 0)
     */
    boolean isCollapse(PopulationSnapshot snapshot);

    default int label(PopulationSnapshot snapshot) {
        return isCollapse(snapshot) ? 1 : 0;
    }
}
