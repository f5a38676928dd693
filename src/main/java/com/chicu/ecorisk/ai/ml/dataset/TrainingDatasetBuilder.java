package com.chicu.ecorisk.ai.ml.dataset;

import com.chicu.ecorisk.ai.ml.features.FeatureExtractor;
import com.chicu.ecorisk.common.error.InsufficientDataException;
import com.chicu.ecorisk.domain.PopulationSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * TrainingDatasetBuilder
 * ======================
 * История снапшотов -> датасет для обучения:
 * - X: double[][] (окно history[i-5, i) через FeatureExtractor)
 * - y: int[]      (метка по history[i] через LabelerService)
 *
 * Плюс детерминированный train/test split.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingDatasetBuilder {

    public static final int MIN_HISTORY = 10;

    private final FeatureExtractor extractor;
    private final LabelerService labeler;

    /**
     * Сырые строки датасета до сборки.
     */
    public record Rows(
            String datasetId,
            List<double[]> Xrows,
            List<Integer> y
    ) {
        public static Rows empty() {
            return new Rows(UUID.randomUUID().toString(), new ArrayList<>(), new ArrayList<>());
        }
    }

    /**
     * Готовый датасет.
     * X: матрица [n_samples][n_features]
     * y: массив меток [n_samples]
     */
    public record Dataset(
            String datasetId,
            double[][] X,
            int[] y,
            int samples,
            int features
    ) {}

    public record Split(Dataset train, Dataset test) {}

    /**
     * Одна пара (фичи, метка) на каждый индекс i в [window, n).
     */
    public Rows fromHistory(List<PopulationSnapshot> history) {
        if (history == null || history.size() < MIN_HISTORY) {
            throw new InsufficientDataException(
                    "Insufficient data for prediction (need at least " + MIN_HISTORY + " data points)");
        }

        int w = extractor.window();
        Rows rows = Rows.empty();

        for (int i = w; i < history.size(); i++) {
            rows.Xrows().add(extractor.extract(history.subList(i - w, i)));
            rows.y().add(labeler.label(history.get(i)));
        }
        return rows;
    }

    public Dataset build(Rows rows) {
        if (rows == null) throw new IllegalArgumentException("rows=null");

        List<double[]> Xrows = rows.Xrows();
        List<Integer> yList = rows.y();

        if (Xrows == null || yList == null) {
            throw new IllegalArgumentException("rows.Xrows/rows.y is null");
        }
        if (Xrows.isEmpty()) {
            throw new IllegalArgumentException("dataset пустой (Xrows=0)");
        }
        if (Xrows.size() != yList.size()) {
            throw new IllegalArgumentException("размеры не совпадают: Xrows=" + Xrows.size() + " y=" + yList.size());
        }

        int n = Xrows.size();
        int f = -1;

        for (int i = 0; i < n; i++) {
            double[] r = Xrows.get(i);
            if (r == null) throw new IllegalArgumentException("Xrows[" + i + "]=null");
            if (f < 0) f = r.length;
            if (r.length != f) {
                throw new IllegalArgumentException("разная длина фич: row=" + i + " len=" + r.length + " expected=" + f);
            }
            Integer lbl = yList.get(i);
            if (lbl == null) throw new IllegalArgumentException("y[" + i + "]=null");
            if (lbl != 0 && lbl != 1) {
                throw new IllegalArgumentException("y[" + i + "] должен быть 0/1, а пришло: " + lbl);
            }
        }

        double[][] X = new double[n][f];
        int[] y = new int[n];

        for (int i = 0; i < n; i++) {
            System.arraycopy(Xrows.get(i), 0, X[i], 0, f);
            y[i] = yList.get(i);
        }

        String id = (rows.datasetId() == null || rows.datasetId().isBlank())
                ? UUID.randomUUID().toString()
                : rows.datasetId().trim();

        log.info("📦 Dataset built: id={} samples={} features={}", id, n, f);

        return new Dataset(id, X, y, n, f);
    }

    /**
     * Перемешивание индексов с фиксированным seed, test = ceil(n * testFraction).
     */
    public Split split(Dataset ds, double testFraction, long seed) {
        if (testFraction <= 0 || testFraction >= 1) {
            throw new IllegalArgumentException("testFraction должен быть в (0, 1): " + testFraction);
        }

        int n = ds.samples();
        int testSize = (int) Math.ceil(n * testFraction);
        if (testSize >= n) {
            throw new InsufficientDataException("слишком мало примеров для split: " + n);
        }

        List<Integer> idx = new ArrayList<>(n);
        for (int i = 0; i < n; i++) idx.add(i);
        Collections.shuffle(idx, new Random(seed));

        Dataset test = subset(ds, idx.subList(0, testSize), "test");
        Dataset train = subset(ds, idx.subList(testSize, n), "train");

        return new Split(train, test);
    }

    private static Dataset subset(Dataset ds, List<Integer> idx, String suffix) {
        double[][] X = new double[idx.size()][];
        int[] y = new int[idx.size()];
        for (int i = 0; i < idx.size(); i++) {
            int k = idx.get(i);
            X[i] = ds.X()[k].clone();
            y[i] = ds.y()[k];
        }
        return new Dataset(ds.datasetId() + "-" + suffix, X, y, idx.size(), ds.features());
    }
}
