package com.RetailCore.pos_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    ADMIN,
    MANAGER,
    CASHIER;

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }
}
