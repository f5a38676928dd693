package com.chicu.ecorisk.ai.persistence;

import com.chicu.ecorisk.ai.ml.Histories;
import com.chicu.ecorisk.ai.ml.dataset.CollapseLabelerService;
import com.chicu.ecorisk.ai.ml.dataset.TrainingDatasetBuilder;
import com.chicu.ecorisk.ai.ml.features.PopulationWindowFeatureExtractor;
import com.chicu.ecorisk.ai.ml.model.CollapseClassifierFactory;
import com.chicu.ecorisk.ai.ml.model.CollapseModel;
import com.chicu.ecorisk.ai.ml.model.TrainingProperties;
import com.chicu.ecorisk.domain.PopulationSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileModelStoreTest {

    @TempDir
    Path dir;

    private FileModelStore store;
    private final PopulationWindowFeatureExtractor extractor = new PopulationWindowFeatureExtractor();

    @BeforeEach
    void setUp() {
        MlStorageProperties props = new MlStorageProperties();
        props.setModelsDir(dir.resolve("models").toString());
        store = new FileModelStore(props);
    }

    private CollapseModel trainModel() {
        TrainingDatasetBuilder builder = new TrainingDatasetBuilder(extractor, new CollapseLabelerService());
        TrainingDatasetBuilder.Dataset ds = builder.build(builder.fromHistory(Histories.mixed(40)));
        TrainingProperties props = new TrainingProperties();
        return new CollapseClassifierFactory(props)
                .fit(builder.split(ds, props.getTestFraction(), props.getSeed()), extractor.schema())
                .model();
    }

    @Test
    void load_withoutArtifact_shouldBeEmpty() {
        assertTrue(store.load().isEmpty());
    }

    @Test
    void saveThenLoad_shouldGiveIdenticalInference() {
        CollapseModel model = trainModel();
        List<PopulationSnapshot> recent = Histories.mixed(40).subList(33, 38);
        double[] x = extractor.extract(recent);

        store.save(model);
        Optional<CollapseModel> loaded = store.load();

        assertTrue(loaded.isPresent());
        assertArrayEquals(model.posteriori(x), loaded.get().posteriori(x), 0.0);
        assertArrayEquals(model.importance(), loaded.get().importance(), 0.0);
        assertEquals(model.schemaHash(), loaded.get().schemaHash());
    }

    @Test
    void save_shouldOverwritePreviousArtifactWithoutLeavingTempFiles() throws Exception {
        store.save(trainModel());
        store.save(trainModel());

        try (var files = Files.list(dir.resolve("models"))) {
            assertEquals(List.of("collapse_model.bin"),
                    files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void corruptArtifact_shouldBeTreatedAsAbsent() throws Exception {
        Files.createDirectories(store.modelPath().getParent());
        Files.writeString(store.modelPath(), "not a model");

        assertTrue(store.load().isEmpty());
    }
}
