package com.RetailCore.pos_backend.util;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Reason texts written to the stock ledger, and the older texts that identified
 * a transaction before ledger rows carried a source reference.
 */
public final class LedgerReasons {

    public static final String STOCK_RECEIVED = "Stock Received";

    private LedgerReasons() {
        // Utility class, no instantiation
    }

    public static String forSale(String publicId) {
        return "Sale #" + publicId;
    }

    public static String forPurchaseOrder(String publicId) {
        return "Received from PO #" + publicId;
    }

    /**
     * Every reason text under which a ledger row for the given sale may have been
     * written: by receipt number, or by internal id for rows older than receipt numbers.
     */
    public static Set<String> legacySaleReasons(UUID saleId, String publicId) {
        Set<String> reasons = new LinkedHashSet<>();
        if (publicId != null) {
            reasons.add(forSale(publicId));
        }
        reasons.add(forSale(saleId.toString()));
        return reasons;
    }
}
