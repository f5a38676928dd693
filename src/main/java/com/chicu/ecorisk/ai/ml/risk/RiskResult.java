package com.chicu.ecorisk.ai.ml.risk;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RiskResult {

    private boolean success;

    /** вероятность коллапса, [0, 1] */
    private Double risk;

    private Double confidence;

    private List<RiskFactor> factors;

    /** "1.0" — обученная модель, "heuristic" — правила */
    @JsonProperty("model_version")
    private String modelVersion;

    @JsonProperty("risk_level")
    private RiskLevel riskLevel;

    @JsonProperty("steps_ahead")
    private Integer stepsAhead;

    private String error;

    public static RiskResult fail(String error) {
        return RiskResult.builder()
                .success(false)
                .error(error)
                .build();
    }
}
