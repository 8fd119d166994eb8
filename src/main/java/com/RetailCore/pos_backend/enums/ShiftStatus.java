package com.RetailCore.pos_backend.enums;

public enum ShiftStatus {
    OPEN,
    CLOSED
}
