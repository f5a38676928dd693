package com.chicu.ecorisk.web.dto;

import com.chicu.ecorisk.domain.PopulationSnapshot;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrainRequest {

    @JsonProperty("ecosystem_data")
    private List<PopulationSnapshot> ecosystemData;
}
