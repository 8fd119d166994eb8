package com.RetailCore.pos_backend.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PurchaseOrderRequest {

    // Takes precedence over supplierName when set
    private UUID supplierId;

    private String supplierName;

    private LocalDate dateExpected;

    private String notes;

    @NotNull(message = "Items are required")
    @Size(min = 1, message = "Purchase order must have at least one item")
    @Valid
    private List<PurchaseOrderItemRequest> items;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PurchaseOrderItemRequest {

        @NotNull(message = "Product ID is required")
        private UUID productId;

        private UUID variantId;

        @NotBlank(message = "Product name is required")
        private String productName;

        @Min(value = 1, message = "Quantity ordered must be at least 1")
        private int quantityOrdered;

        @NotNull(message = "Cost price is required")
        @DecimalMin(value = "0.0", message = "Cost price cannot be negative")
        private BigDecimal costPrice;
    }
}
