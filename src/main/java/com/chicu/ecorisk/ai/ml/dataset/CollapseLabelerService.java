package com.chicu.ecorisk.ai.ml.dataset;

import com.chicu.ecorisk.domain.PopulationSnapshot;
import org.springframework.stereotype.Service;

/**
 * Коллапс: растений меньше 5 или вымер любой из животных видов.
 */
@Service
public class CollapseLabelerService implements LabelerService {

    static final double MIN_PLANTS = 5.0;

    @Override
    public boolean isCollapse(PopulationSnapshot s) {
        return s.plants() < MIN_PLANTS
                || s.herbivores() == 0
                || s.carnivores() == 0;
    }
}
