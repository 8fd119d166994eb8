package com.RetailCore.pos_backend.enums;

public enum PriceType {
    RETAIL,
    COST
}
