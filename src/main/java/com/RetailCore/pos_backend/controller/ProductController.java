package com.RetailCore.pos_backend.controller;

import com.RetailCore.pos_backend.dto.request.BulkCategoryUpdateRequest;
import com.RetailCore.pos_backend.dto.request.BulkDeleteRequest;
import com.RetailCore.pos_backend.dto.request.ProductRequest;
import com.RetailCore.pos_backend.dto.request.RestoreProductsRequest;
import com.RetailCore.pos_backend.dto.response.ApiResponse;
import com.RetailCore.pos_backend.dto.response.BulkDeleteResult;
import com.RetailCore.pos_backend.dto.response.ProductResponse;
import com.RetailCore.pos_backend.service.ProductDeletionService;
import com.RetailCore.pos_backend.service.ProductService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService productService;
    private final ProductDeletionService productDeletionService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<ProductResponse>>> getProducts() {
        return ResponseEntity.ok(ApiResponse.success(productService.getProducts()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ProductResponse>> getProduct(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(productService.getProduct(id)));
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<ProductResponse>> addProduct(@Valid @RequestBody ProductRequest request) {
        ProductResponse product = productService.addProduct(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(product, "Product created successfully"));
    }

    @PutMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<ProductResponse>> updateProduct(
            @PathVariable UUID id,
            @Valid @RequestBody ProductRequest request) {

        ProductResponse product = productService.updateProduct(id, request);
        return ResponseEntity.ok(ApiResponse.success(product, "Product updated successfully"));
    }

    @PostMapping("/import")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<Integer>> importProducts(@RequestBody List<ProductRequest> requests) {
        return ResultResponses.toResponse(productService.importProducts(requests));
    }

    @PatchMapping("/categories")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<Integer>> bulkUpdateCategories(
            @Valid @RequestBody BulkCategoryUpdateRequest request) {
        return ResultResponses.toResponse(productService.bulkUpdateProductCategories(request));
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<Void>> deleteProduct(
            @PathVariable UUID id,
            @RequestParam(defaultValue = "false") boolean force) {
        return ResultResponses.toResponse(productDeletionService.deleteProduct(id, force));
    }

    @DeleteMapping("/{id}/variants/{variantId}")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<Void>> deleteVariant(
            @PathVariable UUID id,
            @PathVariable UUID variantId,
            @RequestParam(defaultValue = "false") boolean force) {
        return ResultResponses.toResponse(productDeletionService.deleteVariant(id, variantId, force));
    }

    @PostMapping("/bulk-delete")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<BulkDeleteResult>> bulkDeleteProducts(@Valid @RequestBody BulkDeleteRequest request) {
        return ResultResponses.toResponse(productDeletionService.bulkDeleteProducts(request.getProductIds()));
    }

    @PostMapping("/restore")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER')")
    public ResponseEntity<ApiResponse<Integer>> restoreDeletedProducts(@Valid @RequestBody RestoreProductsRequest request) {
        return ResultResponses.toResponse(productDeletionService.restoreDeletedProducts(request.getItems()));
    }
}
