package com.chicu.ecorisk.common.error;

/**
 * Слишком мало снапшотов для операции (окно, обучение, прогноз).
 */
public class InsufficientDataException extends IllegalArgumentException {

    public InsufficientDataException(String message) {
        super(message);
    }
}
