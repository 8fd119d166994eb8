package com.RetailCore.pos_backend.dto.response;

import com.RetailCore.pos_backend.enums.ErrorType;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a guarded operation: either success with an optional payload, or a
 * failure carrying the reason the operation was refused.
 */
@Getter
@ToString
@AllArgsConstructor
public class OperationResult<T> {
    private final boolean success;
    private final String message;
    private final ErrorType errorType;
    private final T data;

    public static <T> OperationResult<T> ok(String message) {
        return new OperationResult<>(true, message, null, null);
    }

    public static <T> OperationResult<T> ok(T data, String message) {
        return new OperationResult<>(true, message, null, data);
    }

    public static <T> OperationResult<T> failure(ErrorType errorType, String message) {
        return new OperationResult<>(false, message, errorType, null);
    }
}
