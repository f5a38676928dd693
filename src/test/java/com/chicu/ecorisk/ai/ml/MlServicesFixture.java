package com.chicu.ecorisk.ai.ml;

import com.chicu.ecorisk.ai.ml.dataset.CollapseLabelerService;
import com.chicu.ecorisk.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.ecorisk.ai.ml.features.PopulationWindowFeatureExtractor;
import com.chicu.ecorisk.ai.ml.model.CollapseClassifierFactory;
import com.chicu.ecorisk.ai.ml.model.TrainingProperties;
import com.chicu.ecorisk.ai.ml.risk.HeuristicRiskEstimator;
import com.chicu.ecorisk.ai.persistence.ModelStore;

/**
 * Сборка сервисов без Spring-контекста.
 */
final class MlServicesFixture {

    final PopulationWindowFeatureExtractor extractor = new PopulationWindowFeatureExtractor();
    final TrainingProperties props = new TrainingProperties();
    final CollapseModelContext context;
    final MlTrainingService training;
    final MlPredictionService prediction;

    MlServicesFixture(ModelStore store) {
        TrainingDatasetBuilder builder = new TrainingDatasetBuilder(extractor, new CollapseLabelerService());
        this.context = new CollapseModelContext(store);
        this.training = new MlTrainingService(builder, new CollapseClassifierFactory(props), extractor, context, props);
        this.prediction = new MlPredictionService(context, extractor, new HeuristicRiskEstimator());
    }
}
