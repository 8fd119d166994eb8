package com.RetailCore.pos_backend.controller;

import com.RetailCore.pos_backend.dto.request.StockAdjustmentRequest;
import com.RetailCore.pos_backend.dto.request.StockReceiptRequest;
import com.RetailCore.pos_backend.dto.response.ApiResponse;
import com.RetailCore.pos_backend.dto.response.StockAdjustmentResponse;
import com.RetailCore.pos_backend.service.StockService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RestController
@RequestMapping("/api/stock")
@RequiredArgsConstructor
public class StockController {

    private final StockService stockService;

    @GetMapping("/history/{productId}")
    public ResponseEntity<ApiResponse<List<StockAdjustmentResponse>>> getStockHistory(@PathVariable UUID productId) {
        return ResponseEntity.ok(ApiResponse.success(stockService.getStockHistory(productId)));
    }

    @PostMapping("/adjust")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<StockAdjustmentResponse>> adjustStock(
            @Valid @RequestBody StockAdjustmentRequest request) {
        return toResponse(stockService.adjustStock(request), "Stock adjusted successfully");
    }

    @PostMapping("/receive")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<StockAdjustmentResponse>> receiveStock(
            @Valid @RequestBody StockReceiptRequest request) {
        return toResponse(stockService.receiveStock(request), "Stock received successfully");
    }

    @DeleteMapping("/history")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Integer>> pruneStockHistory(@RequestParam int olderThanDays) {
        return ResultResponses.toResponse(stockService.pruneStockHistory(olderThanDays));
    }

    private ResponseEntity<ApiResponse<StockAdjustmentResponse>> toResponse(
            Optional<StockAdjustmentResponse> adjustment, String message) {
        return adjustment
                .map(a -> ResponseEntity.ok(ApiResponse.success(a, message)))
                .orElseGet(() -> ResponseEntity.ok(ApiResponse.success(null, "Stock level unchanged")));
    }
}
