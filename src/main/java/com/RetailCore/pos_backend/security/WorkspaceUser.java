package com.RetailCore.pos_backend.security;

import lombok.Getter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.userdetails.User;

import java.util.Collection;
import java.util.UUID;

@Getter
public class WorkspaceUser extends User {

    private final UUID actorId;
    private final String workspaceId;

    public WorkspaceUser(UUID actorId, String username, String password, String workspaceId,
                         Collection<? extends GrantedAuthority> authorities) {
        super(username, password, authorities);
        this.actorId = actorId;
        this.workspaceId = workspaceId;
    }
}
