package com.chicu.ecorisk.ai.ml.model;

import com.chicu.ecorisk.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.ecorisk.ai.ml.features.FeatureSchema;
import com.chicu.ecorisk.ai.ml.features.PopulationWindowFeatureExtractor;
import com.chicu.ecorisk.common.error.TrainingFailureException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CollapseClassifierFactoryTest {

    private final FeatureSchema schema = new PopulationWindowFeatureExtractor().schema();
    private final CollapseClassifierFactory factory = new CollapseClassifierFactory(new TrainingProperties());

    private double[] row(double v) {
        double[] r = new double[schema.size()];
        Arrays.fill(r, v);
        return r;
    }

    private TrainingDatasetBuilder.Dataset dataset(String id, double[][] X, int[] y) {
        return new TrainingDatasetBuilder.Dataset(id, X, y, y.length, schema.size());
    }

    @Test
    void nodeSize_shouldLetMinSamplesSplitNodesBeSplit() {
        assertEquals(2, CollapseClassifierFactory.nodeSize(5));
        assertEquals(2, CollapseClassifierFactory.nodeSize(4));
        assertEquals(1, CollapseClassifierFactory.nodeSize(2));
        assertEquals(1, CollapseClassifierFactory.nodeSize(1));
    }

    @Test
    void smallSeparableSplit_shouldBeSeparated() {
        // 4 коллапса далеко от 5 нормальных по всем фичам
        double[][] X = {
                row(100), row(110), row(120), row(130),
                row(0), row(2), row(4), row(6), row(8)
        };
        int[] y = {1, 1, 1, 1, 0, 0, 0, 0, 0};
        TrainingDatasetBuilder.Dataset train = dataset("train", X, y);
        TrainingDatasetBuilder.Dataset test = dataset("test",
                new double[][]{row(115), row(3)}, new int[]{1, 0});

        CollapseClassifierFactory.Fitted fitted = factory.fit(new TrainingDatasetBuilder.Split(train, test), schema);

        assertEquals(1.0, fitted.trainAccuracy(), 1e-12);
        assertEquals(1.0, fitted.testAccuracy(), 1e-12);
        assertTrue(fitted.model().posteriori(row(125))[1] > 0.5);
        assertTrue(fitted.model().posteriori(row(1))[1] < 0.5);
    }

    @Test
    void singleClassSplit_shouldBeRejected() {
        TrainingDatasetBuilder.Dataset train = dataset("train",
                new double[][]{row(1), row(2), row(3)}, new int[]{0, 0, 0});
        TrainingDatasetBuilder.Dataset test = dataset("test", new double[][]{row(4)}, new int[]{0});

        assertThrows(TrainingFailureException.class,
                () -> factory.fit(new TrainingDatasetBuilder.Split(train, test), schema));
    }
}
