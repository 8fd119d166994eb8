package com.RetailCore.pos_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PaymentType {
    CASH,
    CARD,
    OTHER;

    @JsonCreator
    public static PaymentType fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            // Accept both uppercase and lowercase
            return PaymentType.valueOf(value.toUpperCase());
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }

    @JsonValue
    public String toValue() {
        return this.name();
    }
}
