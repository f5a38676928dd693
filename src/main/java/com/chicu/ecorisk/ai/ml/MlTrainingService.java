package com.chicu.ecorisk.ai.ml;

import com.chicu.ecorisk.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.ecorisk.ai.ml.features.FeatureExtractor;
import com.chicu.ecorisk.ai.ml.model.CollapseClassifierFactory;
import com.chicu.ecorisk.ai.ml.model.CollapseModel;
import com.chicu.ecorisk.ai.ml.model.TrainingProperties;
import com.chicu.ecorisk.common.error.InsufficientDataException;
import com.chicu.ecorisk.domain.PopulationSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class MlTrainingService {

    private final TrainingDatasetBuilder datasetBuilder;
    private final CollapseClassifierFactory classifierFactory;
    private final FeatureExtractor extractor;
    private final CollapseModelContext context;
    private final TrainingProperties props;

    /**
     * Обучение collapse-модели. Никогда не бросает: любой сбой -> {success:false, error}.
     */
    public TrainingReport train(List<PopulationSnapshot> history) {
        try {
            log.info("🧠 Training collapse prediction model... points={}", history == null ? 0 : history.size());

            TrainingReport report = context.retrain(() -> fitNewModel(history));

            log.info("🧠 TRAIN OK train_accuracy={} test_accuracy={} samples={}",
                    fmt(report.getTrainAccuracy()), fmt(report.getTestAccuracy()), report.getTrainingSamples());
            return report;

        } catch (Exception e) {
            log.error("🧠 TRAIN FAIL: {}", e.getMessage());
            return TrainingReport.fail(e.getMessage());
        }
    }

    private CollapseModelContext.Trained<TrainingReport> fitNewModel(List<PopulationSnapshot> history) {
        TrainingDatasetBuilder.Dataset ds = datasetBuilder.build(datasetBuilder.fromHistory(history));

        if (ds.samples() < props.getMinExamples()) {
            // сообщение историческое: порог по окнам 20, а в тексте 30
            throw new InsufficientDataException("Insufficient training data (need at least 30 data points)");
        }

        TrainingDatasetBuilder.Split split = datasetBuilder.split(ds, props.getTestFraction(), props.getSeed());
        CollapseClassifierFactory.Fitted fitted = classifierFactory.fit(split, extractor.schema());

        TrainingReport report = TrainingReport.builder()
                .success(true)
                .modelType(CollapseModel.MODEL_TYPE)
                .trainAccuracy(fitted.trainAccuracy())
                .testAccuracy(fitted.testAccuracy())
                .trainingSamples(split.train().samples())
                .featureCount(split.train().features())
                .build();

        return new CollapseModelContext.Trained<>(fitted.model(), report);
    }

    private static String fmt(Double v) {
        return v == null ? "n/a" : String.format("%.3f", v);
    }
}
