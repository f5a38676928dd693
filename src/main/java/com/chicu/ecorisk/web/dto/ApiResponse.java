package com.chicu.ecorisk.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * In-band ошибка: HTTP 200 (или 500 из ApiErrorHandler) с { success: false, error }.
 */
@Data
@AllArgsConstructor
public class ApiResponse {
    private boolean success;
    private String error;

    public static ApiResponse fail(String error) {
        return new ApiResponse(false, error);
    }
}
