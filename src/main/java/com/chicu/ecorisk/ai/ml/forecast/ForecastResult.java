package com.chicu.ecorisk.ai.ml.forecast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastResult {

    private boolean success;

    private List<ForecastPoint> predictions;

    /** 0.8 * 0.9^steps */
    private Double confidence;

    /** plants/herbivores/carnivores -> тренд по последним 5 точкам */
    private Map<String, Trend> trends;

    @JsonProperty("forecast_horizon")
    private Integer forecastHorizon;

    private String error;

    public static ForecastResult fail(String error) {
        return ForecastResult.builder()
                .success(false)
                .error(error)
                .build();
    }
}
