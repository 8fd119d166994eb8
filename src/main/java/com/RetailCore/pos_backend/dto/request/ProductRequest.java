package com.RetailCore.pos_backend.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductRequest {

    @NotBlank(message = "SKU is required")
    private String sku;

    @NotBlank(message = "Product name is required")
    private String name;

    @NotNull(message = "Retail price is required")
    @DecimalMin(value = "0.0", message = "Retail price cannot be negative")
    private BigDecimal retailPrice;

    @NotNull(message = "Cost price is required")
    @DecimalMin(value = "0.0", message = "Cost price cannot be negative")
    private BigDecimal costPrice;

    // Only honoured on import; otherwise stock moves through the ledger
    @Min(value = 0, message = "Stock cannot be negative")
    private Integer stock;

    @Min(value = 0, message = "Low stock threshold cannot be negative")
    private Integer lowStockThreshold;

    @Valid
    @Builder.Default
    private List<VariantRequest> variants = new ArrayList<>();

    @Builder.Default
    private List<UUID> categoryIds = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VariantRequest {

        // Present when updating an existing variant
        private UUID id;

        private String sku;

        @Builder.Default
        private Map<String, String> options = new LinkedHashMap<>();

        @Min(value = 0, message = "Variant stock cannot be negative")
        private int stock;

        @NotNull(message = "Variant cost price is required")
        @DecimalMin(value = "0.0", message = "Variant cost price cannot be negative")
        private BigDecimal costPrice;

        @NotNull(message = "Variant retail price is required")
        @DecimalMin(value = "0.0", message = "Variant retail price cannot be negative")
        private BigDecimal retailPrice;
    }
}
