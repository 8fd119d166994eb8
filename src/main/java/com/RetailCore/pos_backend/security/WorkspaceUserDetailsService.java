package com.RetailCore.pos_backend.security;

import com.RetailCore.pos_backend.config.WorkspaceAccountsConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class WorkspaceUserDetailsService implements UserDetailsService {

    private final WorkspaceAccountsConfig accountsConfig;

    @Override
    public UserDetails loadUserByUsername(String username) throws UsernameNotFoundException {
        WorkspaceAccountsConfig.Account account = accountsConfig.getAccounts().stream()
                .filter(a -> a.getUsername().equalsIgnoreCase(username))
                .findFirst()
                .orElseThrow(() -> new UsernameNotFoundException("User not found: " + username));

        UUID actorId = UUID.nameUUIDFromBytes(
                (account.getWorkspaceId() + ":" + account.getUsername()).getBytes(StandardCharsets.UTF_8));

        log.debug("Loaded account {} for workspace {}", account.getUsername(), account.getWorkspaceId());

        return new WorkspaceUser(
                actorId,
                account.getUsername(),
                account.getPassword(),
                account.getWorkspaceId(),
                List.of(new SimpleGrantedAuthority("ROLE_" + account.getRole().name())));
    }
}
