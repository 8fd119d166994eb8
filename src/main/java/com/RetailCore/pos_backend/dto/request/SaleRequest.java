package com.RetailCore.pos_backend.dto.request;

import com.RetailCore.pos_backend.enums.PaymentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SaleRequest {

    @NotNull(message = "Items are required")
    @Size(min = 1, message = "At least one item must be included in the sale")
    @Valid
    private List<SaleItemRequest> items;

    @Valid
    @Builder.Default
    private List<PaymentRequest> payments = new ArrayList<>();

    private BigDecimal subtotal;

    private BigDecimal tax;

    // Negative for a refund
    @NotNull(message = "Total is required")
    private BigDecimal total;

    private UUID originalSaleId;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SaleItemRequest {

        @NotNull(message = "Product ID is required")
        private UUID productId;

        private UUID variantId;

        @NotBlank(message = "Product name is required")
        private String productName;

        private String sku;

        private String variantLabel;

        // Negative for a returned line
        private int quantity;

        private BigDecimal costPrice;

        private BigDecimal retailPrice;

        private UUID originalSaleId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PaymentRequest {

        @NotNull(message = "Payment type is required")
        private PaymentType type;

        @NotNull(message = "Payment amount is required")
        private BigDecimal amount;
    }
}
