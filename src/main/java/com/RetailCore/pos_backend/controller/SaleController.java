package com.RetailCore.pos_backend.controller;

import com.RetailCore.pos_backend.dto.request.SaleRequest;
import com.RetailCore.pos_backend.dto.response.ApiResponse;
import com.RetailCore.pos_backend.dto.response.SaleResponse;
import com.RetailCore.pos_backend.enums.SaleStatus;
import com.RetailCore.pos_backend.service.SaleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/sales")
@RequiredArgsConstructor
public class SaleController {

    private final SaleService saleService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<SaleResponse>>> getSales() {
        return ResponseEntity.ok(ApiResponse.success(saleService.getSales()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<SaleResponse>> getSale(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(saleService.getSale(id)));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'CASHIER')")
    public ResponseEntity<ApiResponse<SaleResponse>> processSale(@Valid @RequestBody SaleRequest request) {
        SaleResponse sale = saleService.processSale(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(sale, "Transaction " + sale.getPublicId() + " recorded"));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<Void>> deleteSale(@PathVariable UUID id) {
        return ResultResponses.toResponse(saleService.deleteSale(id));
    }

    @DeleteMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Integer>> clearSales(@RequestParam(required = false) List<SaleStatus> statuses) {
        return ResultResponses.toResponse(saleService.clearSales(statuses));
    }

    @DeleteMapping("/prune")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Integer>> pruneSales(
            @RequestParam int olderThanDays,
            @RequestParam(required = false) List<SaleStatus> statuses) {
        return ResultResponses.toResponse(saleService.pruneSales(olderThanDays, statuses));
    }
}
