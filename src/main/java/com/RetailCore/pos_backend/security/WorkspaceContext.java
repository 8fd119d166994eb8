package com.RetailCore.pos_backend.security;

/**
 * Identity and tenant scope of the current caller. Every read and write is
 * filtered by {@link #getWorkspaceId()}.
 */
public interface WorkspaceContext {

    String getWorkspaceId();

    Actor getCurrentActor();

    default boolean owns(String entityWorkspaceId) {
        return getWorkspaceId() != null && getWorkspaceId().equals(entityWorkspaceId);
    }
}
