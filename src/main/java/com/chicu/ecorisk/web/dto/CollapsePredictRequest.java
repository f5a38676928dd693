package com.chicu.ecorisk.web.dto;

import com.chicu.ecorisk.domain.PopulationSnapshot;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * POST /predict/collapse
 * { "features": { "current": {plants, herbivores, carnivores}, "history": [...] }, "steps": 5 }
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CollapsePredictRequest {

    private Features features;

    private Integer steps;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Features {

        private Current current;

        /** Необязательно: снапшоты до current, по возрастанию шага */
        private List<PopulationSnapshot> history;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Current {
        private Double plants;
        private Double herbivores;
        private Double carnivores;
    }
}
