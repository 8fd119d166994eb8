package com.RetailCore.pos_backend.config;

import com.RetailCore.pos_backend.enums.Role;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "retailcore.security")
@Data
public class WorkspaceAccountsConfig {

    private List<Account> accounts = new ArrayList<>();

    @Data
    public static class Account {
        private String username;
        // Encoded with a {id} prefix, e.g. {bcrypt}
        private String password;
        private String workspaceId;
        private Role role = Role.CASHIER;
    }
}
