package com.RetailCore.pos_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkDeleteResult {
    private int deletedCount;
    private int skippedCount;
    private List<UUID> skippedIds = new ArrayList<>();
}
