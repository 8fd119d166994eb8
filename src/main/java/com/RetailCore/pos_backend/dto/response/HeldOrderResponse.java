package com.RetailCore.pos_backend.dto.response;

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
public class HeldOrderResponse {
    private UUID id;
    private String publicId;
    private String note;
    private List<LineResponse> lines = new ArrayList<>();
    private BigDecimal total;
    private String heldByName;
    private LocalDateTime createdAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LineResponse {
        private UUID productId;
        private UUID variantId;
        private String productName;
        private String sku;
        private String variantLabel;
        private int quantity;
        private BigDecimal costPrice;
        private BigDecimal retailPrice;
    }
}
