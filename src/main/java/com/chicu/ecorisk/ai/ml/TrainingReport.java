package com.chicu.ecorisk.ai.ml;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrainingReport {

    private boolean success;

    @JsonProperty("model_type")
    private String modelType;

    @JsonProperty("train_accuracy")
    private Double trainAccuracy;

    @JsonProperty("test_accuracy")
    private Double testAccuracy;

    @JsonProperty("training_samples")
    private Integer trainingSamples;

    @JsonProperty("feature_count")
    private Integer featureCount;

    private String error;

    public static TrainingReport fail(String error) {
        return TrainingReport.builder()
                .success(false)
                .error(error)
                .build();
    }
}
