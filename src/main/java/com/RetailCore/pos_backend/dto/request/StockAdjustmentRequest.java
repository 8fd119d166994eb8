package com.RetailCore.pos_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StockAdjustmentRequest {

    @NotNull(message = "Product ID is required")
    private UUID productId;

    private UUID variantId;

    private int newStockLevel; // Absolute level, the ledger records the difference

    @NotBlank(message = "Reason is required")
    private String reason;
}
