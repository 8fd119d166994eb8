package com.RetailCore.pos_backend.enums;

public enum SaleStatus {
    COMPLETED,
    PARTIALLY_REFUNDED,
    REFUNDED
}
