package com.RetailCore.pos_backend.dto.response;

import com.RetailCore.pos_backend.enums.PaymentType;
import com.RetailCore.pos_backend.enums.SaleStatus;
import com.RetailCore.pos_backend.enums.SaleType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SaleResponse {
    private UUID id;
    private String publicId;
    private SaleType type;
    private SaleStatus status;
    private UUID originalSaleId;
    private String originalSalePublicId;
    private BigDecimal subtotal;
    private BigDecimal tax;
    private BigDecimal total;
    private BigDecimal costOfGoodsSold;
    private BigDecimal profit;
    private List<SaleItemResponse> items = new ArrayList<>();
    private List<PaymentResponse> payments = new ArrayList<>();
    private UUID cashierId;
    private String cashierName;
    private LocalDateTime createdAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SaleItemResponse {
        private UUID id;
        private UUID productId;
        private UUID variantId;
        private String productName;
        private String sku;
        private String variantLabel;
        private int quantity;
        private BigDecimal costPrice;
        private BigDecimal retailPrice;
        private int returnedQuantity;
        private UUID originalSaleId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PaymentResponse {
        private PaymentType type;
        private BigDecimal amount;
    }
}
