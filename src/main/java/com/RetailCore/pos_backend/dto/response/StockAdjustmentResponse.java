package com.RetailCore.pos_backend.dto.response;

import com.RetailCore.pos_backend.enums.AdjustmentSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockAdjustmentResponse {
    private UUID id;
    private UUID productId;
    private UUID variantId;
    private int quantity;
    private int previousStock;
    private int newStock;
    private String reason;
    private AdjustmentSource sourceType;
    private UUID sourceId;
    private UUID performedById;
    private String performedByName;
    private LocalDateTime createdAt;
}
