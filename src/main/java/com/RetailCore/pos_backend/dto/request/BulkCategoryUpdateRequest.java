package com.RetailCore.pos_backend.dto.request;

import com.RetailCore.pos_backend.enums.CategoryAction;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkCategoryUpdateRequest {

    @NotEmpty(message = "At least one product is required")
    private List<UUID> productIds;

    @NotNull(message = "Category IDs are required")
    private List<UUID> categoryIds;

    @NotNull(message = "Action is required")
    private CategoryAction action;
}
