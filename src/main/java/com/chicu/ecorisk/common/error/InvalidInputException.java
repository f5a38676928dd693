package com.chicu.ecorisk.common.error;

/**
 * Запрос пришёл в неверной форме.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
