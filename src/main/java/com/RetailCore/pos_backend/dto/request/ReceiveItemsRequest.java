package com.RetailCore.pos_backend.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReceiveItemsRequest {

    @NotNull(message = "Items are required")
    @Valid
    private List<ReceivedItem> items;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReceivedItem {

        @NotNull(message = "Product ID is required")
        private UUID productId;

        private UUID variantId;

        @Min(value = 0, message = "Received quantity cannot be negative")
        private int quantity;
    }
}
