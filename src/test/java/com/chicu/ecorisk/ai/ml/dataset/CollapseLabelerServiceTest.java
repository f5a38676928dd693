package com.chicu.ecorisk.ai.ml.dataset;

import com.chicu.ecorisk.domain.PopulationSnapshot;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CollapseLabelerServiceTest {

    private final CollapseLabelerService labeler = new CollapseLabelerService();

    @Test
    void plantsBoundary_shouldBeAtFive() {
        assertTrue(labeler.isCollapse(PopulationSnapshot.of(0, 4, 1, 1)));
        assertFalse(labeler.isCollapse(PopulationSnapshot.of(0, 5, 1, 1)));
    }

    @Test
    void extinctAnimals_shouldBeCollapse() {
        assertTrue(labeler.isCollapse(PopulationSnapshot.of(0, 100, 0, 3)));
        assertTrue(labeler.isCollapse(PopulationSnapshot.of(0, 100, 3, 0)));
        assertEquals(1, labeler.label(PopulationSnapshot.of(0, 100, 3, 0)));
        assertEquals(0, labeler.label(PopulationSnapshot.of(0, 100, 3, 2)));
    }
}
