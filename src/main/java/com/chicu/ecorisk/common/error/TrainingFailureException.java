package com.chicu.ecorisk.common.error;

/**
 * Сбой обучения. Резидентная модель при этом не меняется.
 */
public class TrainingFailureException extends IllegalStateException {

    public TrainingFailureException(String message) {
        super(message);
    }

    public TrainingFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
