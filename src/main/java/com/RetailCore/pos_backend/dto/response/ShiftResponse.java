package com.RetailCore.pos_backend.dto.response;

import com.RetailCore.pos_backend.enums.ShiftStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ShiftResponse {
    private UUID id;
    private UUID openedById;
    private String openedByName;
    private LocalDateTime startTime;
    private BigDecimal startFloat;
    private BigDecimal cashSales;
    private BigDecimal cashRefunds;
    private ShiftStatus status;
    private UUID closedById;
    private String closedByName;
    private LocalDateTime endTime;
    private BigDecimal expectedCash;
    private BigDecimal actualCash;
    private BigDecimal difference;
    private String notes;
}
