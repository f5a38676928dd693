package com.chicu.ecorisk.ai.ml.dataset;

import com.chicu.ecorisk.ai.ml.Histories;
import com.chicu.ecorisk.ai.ml.features.PopulationWindowFeatureExtractor;
import com.chicu.ecorisk.common.error.InsufficientDataException;
import com.chicu.ecorisk.domain.PopulationSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrainingDatasetBuilderTest {

    private final PopulationWindowFeatureExtractor extractor = new PopulationWindowFeatureExtractor();
    private final TrainingDatasetBuilder builder = new TrainingDatasetBuilder(extractor, new CollapseLabelerService());

    @Test
    void fromHistory_shouldProduceOneRowPerIndexAfterWindow() {
        List<PopulationSnapshot> history = Histories.mixed(25);

        TrainingDatasetBuilder.Dataset ds = builder.build(builder.fromHistory(history));

        assertEquals(20, ds.samples());
        assertEquals(19, ds.features());

        // row 0: окно history[0..5), метка по history[5] (5 % 3 == 2 -> коллапс)
        assertArrayEquals(extractor.extract(history.subList(0, 5)), ds.X()[0]);
        assertEquals(1, ds.y()[0]);
        // row 1: метка по history[6] — норма
        assertArrayEquals(extractor.extract(history.subList(1, 6)), ds.X()[1]);
        assertEquals(0, ds.y()[1]);
    }

    @Test
    void fromHistory_shouldRequireTenPoints() {
        InsufficientDataException e = assertThrows(InsufficientDataException.class,
                () -> builder.fromHistory(Histories.mixed(9)));
        assertTrue(e.getMessage().contains("need at least 10 data points"));

        assertEquals(5, builder.fromHistory(Histories.mixed(10)).Xrows().size());
    }

    @Test
    void split_shouldBeDeterministicAndDisjoint() {
        TrainingDatasetBuilder.Dataset ds = builder.build(builder.fromHistory(Histories.mixed(25)));

        TrainingDatasetBuilder.Split a = builder.split(ds, 0.2, 42L);
        TrainingDatasetBuilder.Split b = builder.split(ds, 0.2, 42L);

        assertEquals(16, a.train().samples());
        assertEquals(4, a.test().samples());
        assertArrayEquals(a.train().y(), b.train().y());
        assertArrayEquals(a.test().X()[0], b.test().X()[0]);

        assertEquals(sum(ds.y()), sum(a.train().y()) + sum(a.test().y()));
    }

    @Test
    void build_shouldRejectNonBinaryLabels() {
        TrainingDatasetBuilder.Rows rows = TrainingDatasetBuilder.Rows.empty();
        rows.Xrows().add(new double[]{1, 2});
        rows.y().add(2);

        assertThrows(IllegalArgumentException.class, () -> builder.build(rows));
    }

    private static int sum(int[] y) {
        int s = 0;
        for (int v : y) s += v;
        return s;
    }
}
