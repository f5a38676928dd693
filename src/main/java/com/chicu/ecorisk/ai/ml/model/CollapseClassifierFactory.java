package com.chicu.ecorisk.ai.ml.model;

import com.chicu.ecorisk.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.ecorisk.ai.ml.features.FeatureSchema;
import com.chicu.ecorisk.common.error.TrainingFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import smile.base.cart.SplitRule;
import smile.classification.RandomForest;
import smile.data.DataFrame;
import smile.data.formula.Formula;
import smile.data.vector.IntVector;

import java.time.Instant;
import java.util.stream.LongStream;

/**
 * Обучение пары скейлер + random forest (smile) на train-части split'а.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CollapseClassifierFactory {

    static final String LABEL = "collapse";

    private final TrainingProperties props;

    public record Fitted(CollapseModel model, double trainAccuracy, double testAccuracy) {}

    public Fitted fit(TrainingDatasetBuilder.Split split, FeatureSchema schema) {
        TrainingDatasetBuilder.Dataset train = split.train();
        TrainingDatasetBuilder.Dataset test = split.test();

        if (train.features() != schema.size()) {
            throw new TrainingFailureException("dataset features=" + train.features() + " schema=" + schema.size());
        }
        if (distinct(train.y()) < 2) {
            throw new TrainingFailureException("training split contains a single class, collapse model needs both");
        }

        FeatureScaler scaler = FeatureScaler.fit(train.X());
        double[][] trainScaled = scaler.transform(train.X());
        double[][] testScaled = scaler.transform(test.X());

        int p = schema.size();
        int mtry = Math.max(1, (int) Math.floor(Math.sqrt(p)));
        int maxNodes = Math.max(2, train.samples());
        int nodeSize = nodeSize(props.getMinSamplesSplit());

        DataFrame df = frame(trainScaled, train.y(), schema.featureNames());
        RandomForest forest = RandomForest.fit(
                Formula.lhs(LABEL),
                df,
                props.getTrees(),
                mtry,
                SplitRule.GINI,
                props.getMaxDepth(),
                maxNodes,
                nodeSize,
                1.0,
                null,
                LongStream.range(props.getSeed(), props.getSeed() + props.getTrees())
        );

        CollapseModel model = new CollapseModel(forest, scaler, schema, Instant.now());

        double trainAcc = accuracy(model, trainScaled, train.y());
        double testAcc = accuracy(model, testScaled, test.y());

        log.debug("🌲 forest fitted: trees={} depth={} mtry={} samples={}",
                props.getTrees(), props.getMaxDepth(), mtry, train.samples());

        return new Fitted(model, trainAcc, testAcc);
    }

    /**
     * В smile nodeSize это минимальный размер листа: узел делится, только если в нём >= 2 * nodeSize примеров.
     * Поэтому min-samples-split переводится в nodeSize = split / 2 (не меньше 1).
     */
    static int nodeSize(int minSamplesSplit) {
        return Math.max(1, minSamplesSplit / 2);
    }

    static DataFrame frame(double[][] X, int[] y, String[] names) {
        return DataFrame.of(X, names).merge(IntVector.of(LABEL, y));
    }

    private static double accuracy(CollapseModel model, double[][] scaled, int[] y) {
        if (y.length == 0) return 0.0;
        int hit = 0;
        for (int i = 0; i < y.length; i++) {
            if (model.predictScaled(scaled[i]) == y[i]) hit++;
        }
        return (double) hit / y.length;
    }

    private static int distinct(int[] y) {
        boolean zero = false, one = false;
        for (int v : y) {
            if (v == 0) zero = true;
            else one = true;
        }
        return (zero ? 1 : 0) + (one ? 1 : 0);
    }
}
