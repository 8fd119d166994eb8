package com.RetailCore.pos_backend.enums;

public enum PurchaseOrderStatus {
    PENDING,
    PARTIAL,
    RECEIVED;

    public String getLabel() {
        return name().charAt(0) + name().substring(1).toLowerCase();
    }
}
