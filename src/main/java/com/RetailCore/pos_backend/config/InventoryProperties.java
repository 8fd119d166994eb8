package com.RetailCore.pos_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "retailcore.inventory")
@Data
public class InventoryProperties {
    private String restoredCategoryName = "Restored";
    private int saleIdLength = 8;
    private int purchaseOrderIdLength = 6;
    private int supplierIdLength = 6;
    private int heldOrderIdLength = 4;
    private int defaultLowStockThreshold = 5;
}
