package com.chicu.ecorisk.ai.ml;

import com.chicu.ecorisk.ai.ml.forecast.ForecastProperties;
import com.chicu.ecorisk.ai.ml.model.TrainingProperties;
import com.chicu.ecorisk.ai.persistence.MlStorageProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        MlStorageProperties.class,
        TrainingProperties.class,
        ForecastProperties.class
})
public class MlConfig {
}
