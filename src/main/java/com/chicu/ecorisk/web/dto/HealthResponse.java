package com.chicu.ecorisk.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class HealthResponse {

    private String status;
    private String service;

    @JsonProperty("models_loaded")
    private List<String> modelsLoaded;

    /** ISO-8601 */
    private String timestamp;

    public static HealthResponse healthy(List<String> modelsLoaded, String timestamp) {
        return new HealthResponse("healthy", "ML Prediction Service", modelsLoaded, timestamp);
    }
}
