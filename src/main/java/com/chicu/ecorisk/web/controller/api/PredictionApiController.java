package com.chicu.ecorisk.web.controller.api;

import com.chicu.ecorisk.ai.ml.CollapseModelContext;
import com.chicu.ecorisk.ai.ml.MlPredictionService;
import com.chicu.ecorisk.ai.ml.MlTrainingService;
import com.chicu.ecorisk.ai.ml.TrainingReport;
import com.chicu.ecorisk.ai.ml.forecast.ForecastResult;
import com.chicu.ecorisk.ai.ml.forecast.PopulationForecaster;
import com.chicu.ecorisk.ai.ml.risk.RiskResult;
import com.chicu.ecorisk.common.error.InvalidInputException;
import com.chicu.ecorisk.domain.PopulationSnapshot;
import com.chicu.ecorisk.web.dto.ApiResponse;
import com.chicu.ecorisk.web.dto.CollapsePredictRequest;
import com.chicu.ecorisk.web.dto.HealthResponse;
import com.chicu.ecorisk.web.dto.PopulationForecastRequest;
import com.chicu.ecorisk.web.dto.TrainRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class PredictionApiController {

    public static final int MIN_TRAINING_POINTS = 50;
    static final String INVALID_FEATURES = "Invalid features format";

    private final MlPredictionService predictionService;
    private final MlTrainingService trainingService;
    private final PopulationForecaster forecaster;
    private final CollapseModelContext modelContext;

    @GetMapping("/health")
    public HealthResponse health() {
        return HealthResponse.healthy(modelContext.modelsLoaded(), LocalDateTime.now().toString());
    }

    /**
     * Риск коллапса. Пример тела:
     * { "features": { "current": { "plants": 8, "herbivores": 2, "carnivores": 5 } }, "steps": 5 }
     */
    @PostMapping("/predict/collapse")
    public ResponseEntity<?> predictCollapse(@RequestBody(required = false) CollapsePredictRequest req) {
        List<PopulationSnapshot> recent;
        try {
            recent = toRecent(req);
        } catch (InvalidInputException e) {
            log.info("/predict/collapse rejected: {}", e.getMessage());
            return ResponseEntity.ok(ApiResponse.fail(e.getMessage()));
        }

        int steps = req.getSteps() != null ? req.getSteps() : MlPredictionService.DEFAULT_STEPS_AHEAD;
        RiskResult result = predictionService.predictRisk(recent, steps);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/predict/populations")
    public ForecastResult predictPopulations(@RequestBody(required = false) PopulationForecastRequest req) {
        List<PopulationSnapshot> series = req != null && req.getTimeSeries() != null ? req.getTimeSeries() : List.of();
        int steps = req != null && req.getSteps() != null ? req.getSteps() : PopulationForecaster.DEFAULT_STEPS;
        return forecaster.forecast(series, steps);
    }

    @PostMapping("/train")
    public ResponseEntity<?> train(@RequestBody(required = false) TrainRequest req) {
        List<PopulationSnapshot> data = req != null && req.getEcosystemData() != null ? req.getEcosystemData() : List.of();

        if (data.size() < MIN_TRAINING_POINTS) {
            log.info("📦 /train rejected: {} points < {}", data.size(), MIN_TRAINING_POINTS);
            return ResponseEntity.ok(ApiResponse.fail("Need at least " + MIN_TRAINING_POINTS + " data points for training"));
        }

        TrainingReport report = trainingService.train(data);
        return ResponseEntity.ok(report);
    }

    /**
     * features.current -> последний снапшот (step 0 если history нет), history идёт перед ним.
     */
    private static List<PopulationSnapshot> toRecent(CollapsePredictRequest req) {
        if (req == null || req.getFeatures() == null) {
            throw new InvalidInputException(INVALID_FEATURES);
        }

        CollapsePredictRequest.Current c = req.getFeatures().getCurrent();
        if (c == null || c.getPlants() == null || c.getHerbivores() == null || c.getCarnivores() == null) {
            throw new InvalidInputException(INVALID_FEATURES);
        }

        List<PopulationSnapshot> history = req.getFeatures().getHistory();
        List<PopulationSnapshot> recent = new ArrayList<>();
        if (history != null) {
            for (PopulationSnapshot s : history) {
                if (s != null) recent.add(s);
            }
        }

        int step = recent.isEmpty() ? 0 : recent.get(recent.size() - 1).step() + 1;
        recent.add(PopulationSnapshot.of(step, c.getPlants(), c.getHerbivores(), c.getCarnivores()));
        return recent;
    }
}
