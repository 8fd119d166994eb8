package com.RetailCore.pos_backend.controller;

import com.RetailCore.pos_backend.dto.response.ApiResponse;
import com.RetailCore.pos_backend.dto.response.OperationResult;
import org.springframework.http.ResponseEntity;

/**
 * Turns an {@link OperationResult} into the HTTP response for it.
 */
final class ResultResponses {

    private ResultResponses() {
        // Utility class, no instantiation
    }

    static <T> ResponseEntity<ApiResponse<T>> toResponse(OperationResult<T> result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(ApiResponse.success(result.getData(), result.getMessage()));
        }
        ApiResponse<T> body = ApiResponse.error(result.getMessage(), result.getErrorType().name());
        body.setData(result.getData());
        return ResponseEntity.status(result.getErrorType().getStatus()).body(body);
    }
}
