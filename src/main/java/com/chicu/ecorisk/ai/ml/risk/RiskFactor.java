package com.chicu.ecorisk.ai.ml.risk;

import java.io.Serializable;

public record RiskFactor(String factor, double importance) implements Serializable {
}
