package com.RetailCore.pos_backend.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HoldOrderRequest {

    // Same line shape as a sale so a resumed cart can be posted unchanged
    @NotNull(message = "Items are required")
    @Size(min = 1, message = "A held order must contain at least one item")
    @Valid
    private List<SaleRequest.SaleItemRequest> items;

    @Size(max = 500, message = "Note must not exceed 500 characters")
    private String note;
}
