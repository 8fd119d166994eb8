package com.RetailCore.pos_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised when an entity belongs to a different workspace than the caller's.
 */
public class WorkspaceAccessException extends ApiException {
    public WorkspaceAccessException(String resourceName) {
        super("Access denied to " + resourceName, HttpStatus.FORBIDDEN, "ACCESS_DENIED");
    }
}
