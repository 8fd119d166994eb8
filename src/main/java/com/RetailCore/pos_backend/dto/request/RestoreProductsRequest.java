package com.RetailCore.pos_backend.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Sale line snapshots of products that no longer exist in the catalogue.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RestoreProductsRequest {

    @NotEmpty(message = "At least one item is required")
    @Valid
    private List<RestoreItem> items;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RestoreItem {

        @NotNull(message = "Product ID is required")
        private UUID productId;

        private UUID variantId;

        @NotBlank(message = "Product name is required")
        private String productName;

        private String sku;

        private String variantLabel;

        private BigDecimal costPrice;

        private BigDecimal retailPrice;
    }
}
