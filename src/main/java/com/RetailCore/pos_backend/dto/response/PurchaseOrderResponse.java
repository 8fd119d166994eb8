package com.RetailCore.pos_backend.dto.response;

import com.RetailCore.pos_backend.enums.PurchaseOrderStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PurchaseOrderResponse {
    private UUID id;
    private String publicId;
    private UUID supplierId;
    private String supplierName;
    private LocalDateTime dateCreated;
    private LocalDate dateExpected;
    private List<PurchaseOrderItemResponse> items = new ArrayList<>();
    private BigDecimal totalCost;
    private String notes;
    private PurchaseOrderStatus status;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PurchaseOrderItemResponse {
        private UUID id;
        private UUID productId;
        private UUID variantId;
        private String productName;
        private int quantityOrdered;
        private int quantityReceived;
        private BigDecimal costPrice;
    }
}
