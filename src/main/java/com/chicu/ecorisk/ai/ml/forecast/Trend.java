package com.chicu.ecorisk.ai.ml.forecast;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Trend {

    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    /** |slope| на шаг, выше которого тренд не stable */
    static final double SLOPE_THRESHOLD = 2.0;

    private final String code;

    Trend(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static Trend ofSlope(double slope) {
        if (slope > SLOPE_THRESHOLD) return INCREASING;
        if (slope < -SLOPE_THRESHOLD) return DECREASING;
        return STABLE;
    }
}
