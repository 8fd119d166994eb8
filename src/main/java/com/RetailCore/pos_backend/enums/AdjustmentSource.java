package com.RetailCore.pos_backend.enums;

/**
 * What caused a ledger entry. Entries tagged SALE or PURCHASE_ORDER also carry
 * the id of the owning transaction.
 */
public enum AdjustmentSource {
    MANUAL,
    STOCK_RECEIVED,
    SALE,
    PURCHASE_ORDER
}
