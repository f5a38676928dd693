package com.chicu.ecorisk.common.error;

/**
 * Сбой при скейлинге/предикте обученной модели.
 * Наружу не уходит: MlPredictionService переключается на эвристику.
 */
public class InferenceFailureException extends IllegalStateException {

    public InferenceFailureException(String message) {
        super(message);
    }

    public InferenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
