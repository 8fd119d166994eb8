package com.RetailCore.pos_backend.security;

import com.RetailCore.pos_backend.exception.ApiException;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

@Component
public class SecurityWorkspaceContext implements WorkspaceContext {

    @Override
    public String getWorkspaceId() {
        return getCurrentUser().getWorkspaceId();
    }

    @Override
    public Actor getCurrentActor() {
        WorkspaceUser user = getCurrentUser();
        return new Actor(user.getActorId(), user.getUsername());
    }

    private WorkspaceUser getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof WorkspaceUser)) {
            throw new ApiException("User not authenticated", HttpStatus.UNAUTHORIZED, "UNAUTHORIZED");
        }
        return (WorkspaceUser) authentication.getPrincipal();
    }
}
