package com.RetailCore.pos_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProductResponse {
    private UUID id;
    private String sku;
    private String name;
    private BigDecimal retailPrice;
    private BigDecimal costPrice;
    private int stock;
    private int lowStockThreshold;
    private List<PriceHistoryResponse> priceHistory = new ArrayList<>();
    private List<VariantResponse> variants = new ArrayList<>();
    private List<UUID> categoryIds = new ArrayList<>();
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VariantResponse {
        private UUID id;
        private String sku;
        private Map<String, String> options;
        private String label;
        private int stock;
        private BigDecimal costPrice;
        private BigDecimal retailPrice;
        private List<PriceHistoryResponse> priceHistory = new ArrayList<>();
    }
}
