package com.RetailCore.pos_backend.controller;

import com.RetailCore.pos_backend.dto.request.CloseShiftRequest;
import com.RetailCore.pos_backend.dto.request.OpenShiftRequest;
import com.RetailCore.pos_backend.dto.response.ApiResponse;
import com.RetailCore.pos_backend.dto.response.ShiftResponse;
import com.RetailCore.pos_backend.service.ShiftService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/shifts")
@RequiredArgsConstructor
public class ShiftController {

    private final ShiftService shiftService;

    @GetMapping("/current")
    public ResponseEntity<ApiResponse<ShiftResponse>> getCurrentShift() {
        return shiftService.getCurrentShift()
                .map(shift -> ResponseEntity.ok(ApiResponse.success(shift)))
                .orElseGet(() -> ResponseEntity.ok(ApiResponse.success(null, "No active shift")));
    }

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<List<ShiftResponse>>> getShiftHistory() {
        return ResponseEntity.ok(ApiResponse.success(shiftService.getShiftHistory()));
    }

    @PostMapping("/open")
    public ResponseEntity<ApiResponse<ShiftResponse>> openShift(@Valid @RequestBody OpenShiftRequest request) {
        ShiftResponse shift = shiftService.openShift(request.getStartFloat());
        return ResponseEntity.ok(ApiResponse.success(shift, "Shift open"));
    }

    @PostMapping("/close")
    public ResponseEntity<ApiResponse<ShiftResponse>> closeShift(@Valid @RequestBody CloseShiftRequest request) {
        return ResultResponses.toResponse(shiftService.closeShift(request.getActualCash(), request.getNotes()));
    }
}
