package com.RetailCore.pos_backend.enums;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorType {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    ACCESS_DENIED(HttpStatus.FORBIDDEN),
    PRECONDITION_FAILED(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    NO_ACTIVE_SHIFT(HttpStatus.CONFLICT);

    private final HttpStatus status;

    ErrorType(HttpStatus status) {
        this.status = status;
    }
}
