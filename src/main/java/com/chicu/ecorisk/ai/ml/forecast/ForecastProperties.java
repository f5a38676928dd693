package com.chicu.ecorisk.ai.ml.forecast;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ml.forecast")
public class ForecastProperties {

    /**
     * Seed генератора шума. null — каждый прогноз со случайным шумом.
     */
    private Long seed;

    /** Сколько последних точек берём для линии тренда */
    private int trendWindow = 10;
}
