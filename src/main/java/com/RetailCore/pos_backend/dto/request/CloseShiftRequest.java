package com.RetailCore.pos_backend.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CloseShiftRequest {

    @NotNull(message = "Counted cash is required")
    @DecimalMin(value = "0.0", message = "Counted cash cannot be negative")
    private BigDecimal actualCash;

    private String notes;
}
