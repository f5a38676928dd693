package com.chicu.ecorisk.ai.ml.forecast;

import com.chicu.ecorisk.common.error.InsufficientDataException;
import com.chicu.ecorisk.domain.PopulationSnapshot;
import com.chicu.ecorisk.domain.Species;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Прогноз популяций линейным трендом (OLS по индексу окна) для каждого вида отдельно.
 * Шум N(0, 0.1 * s * |pred|) растёт с горизонтом s и величиной прогноза.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PopulationForecaster {

    public static final int DEFAULT_STEPS = 7;
    public static final int MIN_POINTS = 5;

    static final double BASE_CONFIDENCE = 0.8;
    static final double CONFIDENCE_DECAY = 0.9;
    static final double NOISE_PER_STEP = 0.1;
    static final int TREND_POINTS = 5;

    private final ForecastProperties props;

    public ForecastResult forecast(List<PopulationSnapshot> history) {
        return forecast(history, DEFAULT_STEPS);
    }

    public ForecastResult forecast(List<PopulationSnapshot> history, int steps) {
        try {
            if (history == null || history.size() < MIN_POINTS) {
                throw new InsufficientDataException("Need at least " + MIN_POINTS + " data points for forecasting");
            }
            if (steps < 1) {
                throw new IllegalArgumentException("steps должен быть >= 1, пришло: " + steps);
            }

            int w = Math.min(Math.max(2, props.getTrendWindow()), history.size());
            List<PopulationSnapshot> window = history.subList(history.size() - w, history.size());

            Map<Species, SimpleRegression> lines = new EnumMap<>(Species.class);
            for (Species sp : Species.values()) {
                lines.put(sp, fit(window, sp));
            }

            RandomGenerator rnd = props.getSeed() != null ? new Well19937c(props.getSeed()) : new Well19937c();
            int lastStep = history.get(history.size() - 1).step();

            List<ForecastPoint> predictions = new ArrayList<>(steps);
            for (int s = 1; s <= steps; s++) {
                double x = window.size() + s - 1;
                predictions.add(new ForecastPoint(
                        lastStep + s,
                        noisy(lines.get(Species.PLANTS).predict(x), s, rnd),
                        noisy(lines.get(Species.HERBIVORES).predict(x), s, rnd),
                        noisy(lines.get(Species.CARNIVORES).predict(x), s, rnd)
                ));
            }

            return ForecastResult.builder()
                    .success(true)
                    .predictions(predictions)
                    .confidence(confidence(steps))
                    .trends(trends(history))
                    .forecastHorizon(steps)
                    .build();

        } catch (Exception e) {
            log.error("Error forecasting populations: {}", e.getMessage());
            return ForecastResult.fail(e.getMessage());
        }
    }

    public static double confidence(int steps) {
        return BASE_CONFIDENCE * Math.pow(CONFIDENCE_DECAY, steps);
    }

    /**
     * Тренд по наклону линии через последние 5 точек.
     */
    Map<String, Trend> trends(List<PopulationSnapshot> history) {
        List<PopulationSnapshot> last = history.subList(history.size() - TREND_POINTS, history.size());
        Map<String, Trend> out = new LinkedHashMap<>();
        for (Species sp : Species.values()) {
            out.put(sp.key(), Trend.ofSlope(fit(last, sp).getSlope()));
        }
        return out;
    }

    private static SimpleRegression fit(List<PopulationSnapshot> points, Species species) {
        SimpleRegression r = new SimpleRegression();
        for (int i = 0; i < points.size(); i++) {
            r.addData(i, points.get(i).value(species));
        }
        return r;
    }

    // |pred| вместо pred: отрицательная экстраполяция не валит весь прогноз, а обрезается до 0 ниже
    private static int noisy(double predicted, int step, RandomGenerator rnd) {
        double sd = NOISE_PER_STEP * step * Math.abs(predicted);
        double v = predicted + rnd.nextGaussian() * sd;
        return Math.max(0, (int) v);
    }
}
