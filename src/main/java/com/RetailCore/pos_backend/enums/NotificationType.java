package com.RetailCore.pos_backend.enums;

public enum NotificationType {
    STOCK,
    PO,
    USER
}
