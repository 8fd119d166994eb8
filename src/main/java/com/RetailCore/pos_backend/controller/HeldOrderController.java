package com.RetailCore.pos_backend.controller;

import com.RetailCore.pos_backend.dto.request.HoldOrderRequest;
import com.RetailCore.pos_backend.dto.response.ApiResponse;
import com.RetailCore.pos_backend.dto.response.HeldOrderResponse;
import com.RetailCore.pos_backend.service.HeldOrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/held-orders")
@RequiredArgsConstructor
public class HeldOrderController {

    private final HeldOrderService heldOrderService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<HeldOrderResponse>>> getHeldOrders() {
        return ResponseEntity.ok(ApiResponse.success(heldOrderService.getHeldOrders()));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<HeldOrderResponse>> holdOrder(@Valid @RequestBody HoldOrderRequest request) {
        HeldOrderResponse heldOrder = heldOrderService.holdOrder(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(heldOrder, "Order held as " + heldOrder.getPublicId()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteHeldOrder(@PathVariable UUID id) {
        return ResultResponses.toResponse(heldOrderService.deleteHeldOrder(id));
    }
}
