package com.chicu.ecorisk.ai.ml;

import com.chicu.ecorisk.ai.ml.model.CollapseModel;
import com.chicu.ecorisk.ai.persistence.ModelStore;
import com.chicu.ecorisk.domain.PopulationSnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MlTrainingServiceTest {

    private final InMemoryModelStore store = new InMemoryModelStore();
    private final MlServicesFixture f = new MlServicesFixture(store);

    @Test
    void train_on25Points_shouldSucceedAndInstallModel() {
        TrainingReport report = f.training.train(Histories.mixed(25));

        assertTrue(report.isSuccess(), () -> "error=" + report.getError());
        assertEquals("collapse_predictor", report.getModelType());
        assertEquals(16, report.getTrainingSamples());
        assertEquals(19, report.getFeatureCount());
        assertTrue(report.getTrainAccuracy() >= 0 && report.getTrainAccuracy() <= 1);
        assertTrue(report.getTestAccuracy() >= 0 && report.getTestAccuracy() <= 1);

        assertTrue(f.context.current().isPresent());
        assertEquals(1, store.saves.get());
        assertSame(f.context.current().get(), store.load().orElseThrow());
    }

    @Test
    void train_withFewerThanTenPoints_shouldFailInBand() {
        TrainingReport report = f.training.train(Histories.mixed(9));

        assertFalse(report.isSuccess());
        assertTrue(report.getError().contains("need at least 10 data points"));
        assertTrue(f.context.current().isEmpty());
    }

    @Test
    void train_withFewerThanTwentyWindows_shouldKeepHistoricalMessage() {
        TrainingReport report = f.training.train(Histories.mixed(24));

        assertFalse(report.isSuccess());
        assertEquals("Insufficient training data (need at least 30 data points)", report.getError());
    }

    @Test
    void failedTraining_shouldNotReplaceResidentModel() {
        assertTrue(f.training.train(Histories.mixed(40)).isSuccess());
        CollapseModel before = f.context.current().orElseThrow();

        assertFalse(f.training.train(Histories.mixed(12)).isSuccess());
        assertFalse(f.training.train(null).isSuccess());
        assertFalse(f.training.train(Histories.flat(40, 80, 15, 5)).isSuccess(), "single class");

        assertSame(before, f.context.current().orElseThrow());
        assertEquals(1, store.saves.get());
    }

    @Test
    void failedSave_shouldNotInstallModel() {
        ModelStore broken = mock(ModelStore.class);
        doThrow(new IllegalStateException("disk full")).when(broken).save(any());
        when(broken.load()).thenReturn(Optional.empty());

        MlServicesFixture fx = new MlServicesFixture(broken);
        TrainingReport report = fx.training.train(Histories.mixed(30));

        assertFalse(report.isSuccess());
        assertEquals("disk full", report.getError());
        assertTrue(fx.context.current().isEmpty());
    }

    @Test
    void nullSnapshotInHistory_shouldNotEscape() {
        List<PopulationSnapshot> history = new ArrayList<>(Histories.mixed(30));
        history.set(12, null);

        assertDoesNotThrow(() -> f.training.train(history));
        assertFalse(f.training.train(history).isSuccess());
    }
}
