package com.RetailCore.pos_backend.dto.response;

import com.RetailCore.pos_backend.enums.PriceType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PriceHistoryResponse {
    private LocalDateTime changedAt;
    private PriceType priceType;
    private BigDecimal oldValue;
    private BigDecimal newValue;
    private UUID actorId;
    private String actorName;
}
