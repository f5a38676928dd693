package com.chicu.ecorisk.ai.ml.risk;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {

    CRITICAL("critical"),
    HIGH("high"),
    MODERATE("moderate"),
    LOW("low"),
    MINIMAL("minimal");

    private final String code;

    RiskLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static RiskLevel of(double risk) {
        if (risk > 0.8) return CRITICAL;
        if (risk > 0.6) return HIGH;
        if (risk > 0.4) return MODERATE;
        if (risk > 0.2) return LOW;
        return MINIMAL;
    }
}
