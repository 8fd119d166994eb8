package com.RetailCore.pos_backend.enums;

public enum SaleType {
    SALE,
    RETURN
}
