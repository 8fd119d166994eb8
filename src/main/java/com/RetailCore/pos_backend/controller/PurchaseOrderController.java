package com.RetailCore.pos_backend.controller;

import com.RetailCore.pos_backend.dto.request.PurchaseOrderRequest;
import com.RetailCore.pos_backend.dto.request.ReceiveItemsRequest;
import com.RetailCore.pos_backend.dto.response.ApiResponse;
import com.RetailCore.pos_backend.dto.response.PurchaseOrderResponse;
import com.RetailCore.pos_backend.enums.PurchaseOrderStatus;
import com.RetailCore.pos_backend.service.PurchaseOrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/purchase-orders")
@RequiredArgsConstructor
public class PurchaseOrderController {

    private final PurchaseOrderService purchaseOrderService;

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<List<PurchaseOrderResponse>>> getPurchaseOrders() {
        return ResponseEntity.ok(ApiResponse.success(purchaseOrderService.getPurchaseOrders()));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<PurchaseOrderResponse>> getPurchaseOrder(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(purchaseOrderService.getPurchaseOrder(id)));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<PurchaseOrderResponse>> addPurchaseOrder(
            @Valid @RequestBody PurchaseOrderRequest request) {

        PurchaseOrderResponse order = purchaseOrderService.addPurchaseOrder(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(order, "Purchase order created successfully"));
    }

    @PostMapping("/{id}/receive")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<PurchaseOrderResponse>> receiveItems(
            @PathVariable UUID id,
            @Valid @RequestBody ReceiveItemsRequest request) {

        PurchaseOrderResponse order = purchaseOrderService.receivePOItems(id, request);
        return ResponseEntity.ok(ApiResponse.success(order, "Items received successfully"));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<Void>> deletePurchaseOrder(@PathVariable UUID id) {
        return ResultResponses.toResponse(purchaseOrderService.deletePurchaseOrder(id));
    }

    @DeleteMapping("/prune")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<Integer>> prunePurchaseOrders(@RequestParam int olderThanDays) {
        return ResultResponses.toResponse(purchaseOrderService.prunePurchaseOrders(olderThanDays));
    }

    @GetMapping("/stats")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<Map<PurchaseOrderStatus, Long>>> getPurchaseOrderStats() {
        Map<PurchaseOrderStatus, Long> stats = new EnumMap<>(PurchaseOrderStatus.class);
        for (PurchaseOrderStatus status : PurchaseOrderStatus.values()) {
            stats.put(status, purchaseOrderService.countPurchaseOrdersByStatus(status));
        }
        return ResponseEntity.ok(ApiResponse.success(stats));
    }
}
