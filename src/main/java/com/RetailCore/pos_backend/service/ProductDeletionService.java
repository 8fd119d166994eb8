package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.config.InventoryProperties;
import com.RetailCore.pos_backend.dto.request.RestoreProductsRequest;
import com.RetailCore.pos_backend.dto.response.BulkDeleteResult;
import com.RetailCore.pos_backend.dto.response.OperationResult;
import com.RetailCore.pos_backend.enums.ErrorType;
import com.RetailCore.pos_backend.model.Category;
import com.RetailCore.pos_backend.model.DeletionRecord;
import com.RetailCore.pos_backend.model.Notification;
import com.RetailCore.pos_backend.model.Product;
import com.RetailCore.pos_backend.model.ProductVariant;
import com.RetailCore.pos_backend.repository.CategoryRepository;
import com.RetailCore.pos_backend.repository.DeletionRecordRepository;
import com.RetailCore.pos_backend.repository.NotificationRepository;
import com.RetailCore.pos_backend.repository.ProductRepository;
import com.RetailCore.pos_backend.repository.StockAdjustmentRepository;
import com.RetailCore.pos_backend.security.WorkspaceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Guards product and variant deletion against losing stock on hand, and cascades
 * the ledger and notifications that belong to whatever is removed.
 * <p>
 * Sales history is not consulted here; callers refuse to delete products that
 * appear on a sale.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProductDeletionService {

    private final ProductRepository productRepository;
    private final StockAdjustmentRepository stockAdjustmentRepository;
    private final NotificationRepository notificationRepository;
    private final DeletionRecordRepository deletionRecordRepository;
    private final CategoryRepository categoryRepository;
    private final DeletionUnitOfWorkFactory deletionUnitOfWorkFactory;
    private final WorkspaceContext workspaceContext;
    private final InventoryProperties inventoryProperties;

    @Transactional
    public OperationResult<Void> deleteProduct(UUID productId, boolean force) {
        Optional<Product> found = productRepository.findById(productId);
        if (found.isEmpty()) {
            return OperationResult.failure(ErrorType.NOT_FOUND, "Product not found.");
        }

        Product product = found.get();
        if (!workspaceContext.owns(product.getWorkspaceId())) {
            return OperationResult.failure(ErrorType.ACCESS_DENIED, "You do not have access to this product.");
        }

        if (!force) {
            if (product.hasVariants()) {
                return OperationResult.failure(ErrorType.PRECONDITION_FAILED,
                        "Product has variants. Delete its variants first.");
            }
            if (product.getTotalStock() > 0) {
                return OperationResult.failure(ErrorType.PRECONDITION_FAILED,
                        "Cannot delete a product with stock on hand (" + product.getTotalStock() + " units).");
            }
        }

        int removed = planProductDeletion(deletionUnitOfWorkFactory.begin(product.getWorkspaceId()), product)
                .execute();

        log.info("Product deleted: {} ({} rows removed, force={})", product.getName(), removed, force);
        return OperationResult.ok("Product '" + product.getName() + "' deleted.");
    }

    @Transactional
    public OperationResult<Void> deleteVariant(UUID productId, UUID variantId, boolean force) {
        Optional<Product> found = productRepository.findById(productId);
        if (found.isEmpty()) {
            return OperationResult.failure(ErrorType.NOT_FOUND, "Product not found.");
        }

        Product product = found.get();
        if (!workspaceContext.owns(product.getWorkspaceId())) {
            return OperationResult.failure(ErrorType.ACCESS_DENIED, "You do not have access to this product.");
        }

        Optional<ProductVariant> foundVariant = product.findVariant(variantId);
        if (foundVariant.isEmpty()) {
            return OperationResult.failure(ErrorType.NOT_FOUND, "Variant not found.");
        }

        ProductVariant variant = foundVariant.get();
        if (!force && variant.getStock() > 0) {
            return OperationResult.failure(ErrorType.PRECONDITION_FAILED,
                    "Cannot delete a variant with stock on hand (" + variant.getStock() + " units).");
        }

        deletionUnitOfWorkFactory.begin(product.getWorkspaceId())
                .deleteAdjustments(stockAdjustmentRepository.findByVariantId(variantId))
                .deleteNotifications(notificationRepository.findByRelatedIdIn(List.of(variantId)))
                .deleteVariant(variant)
                .execute();

        log.info("Variant {} of product {} deleted (force={})", variant.getLabel(), product.getName(), force);
        return OperationResult.ok("Variant deleted.");
    }

    /**
     * Deletes every selected product that has no stock on hand and skips the rest.
     */
    @Transactional
    public OperationResult<BulkDeleteResult> bulkDeleteProducts(List<UUID> productIds) {
        String workspaceId = workspaceContext.getWorkspaceId();
        Set<UUID> requested = new LinkedHashSet<>(productIds);
        List<Product> products = productRepository.findByWorkspaceIdAndIdIn(workspaceId, requested);

        Map<Boolean, List<Product>> partitioned = products.stream()
                .collect(Collectors.partitioningBy(p -> p.getTotalStock() <= 0));
        List<Product> deletable = partitioned.get(true);

        Set<UUID> deletedIds = deletable.stream().map(Product::getId).collect(Collectors.toSet());
        List<UUID> skippedIds = requested.stream()
                .filter(id -> !deletedIds.contains(id))
                .collect(Collectors.toList());

        if (!deletable.isEmpty()) {
            DeletionUnitOfWork unitOfWork = deletionUnitOfWorkFactory.begin(workspaceId);
            deletable.forEach(p -> planProductDeletion(unitOfWork, p));
            unitOfWork.execute();
        }

        BulkDeleteResult result = new BulkDeleteResult(deletable.size(), skippedIds.size(), skippedIds);
        log.info("Bulk delete in workspace {}: {} deleted, {} skipped", workspaceId, deletable.size(), skippedIds.size());

        if (deletable.isEmpty()) {
            return new OperationResult<>(false, "No products were deleted. Products with stock on hand are skipped.",
                    ErrorType.PRECONDITION_FAILED, result);
        }
        return OperationResult.ok(result, "Deleted " + deletable.size() + " products"
                + (skippedIds.isEmpty() ? "." : ", skipped " + skippedIds.size() + " with stock on hand."));
    }

    /**
     * Recreates products that were deleted while still referenced by sales, from the
     * snapshots on their sale lines. Restored products start with no stock and are
     * filed under the restored category.
     */
    @Transactional
    public OperationResult<Integer> restoreDeletedProducts(List<RestoreProductsRequest.RestoreItem> items) {
        String workspaceId = workspaceContext.getWorkspaceId();

        Map<UUID, List<RestoreProductsRequest.RestoreItem>> byProduct = items.stream()
                .collect(Collectors.groupingBy(RestoreProductsRequest.RestoreItem::getProductId,
                        LinkedHashMap::new, Collectors.toList()));

        Category restoredCategory = null;
        int restored = 0;

        for (Map.Entry<UUID, List<RestoreProductsRequest.RestoreItem>> entry : byProduct.entrySet()) {
            UUID originalId = entry.getKey();
            Optional<Product> existing = productRepository.findById(originalId);
            if (existing.isPresent() && workspaceContext.owns(existing.get().getWorkspaceId())) {
                log.debug("Product {} still exists, nothing to restore", originalId);
                continue;
            }
            UUID productId = existing.isPresent() ? UUID.randomUUID() : originalId;

            if (restoredCategory == null) {
                restoredCategory = findOrCreateRestoredCategory(workspaceId);
            }

            List<RestoreProductsRequest.RestoreItem> lines = entry.getValue();
            RestoreProductsRequest.RestoreItem template = lines.stream()
                    .filter(i -> i.getVariantId() == null)
                    .findFirst()
                    .orElse(lines.get(0));

            Product product = Product.builder()
                    .id(productId)
                    .workspaceId(workspaceId)
                    .sku(resolveSku(workspaceId, template.getSku(), productId))
                    .name(template.getProductName())
                    .retailPrice(orZero(template.getRetailPrice()))
                    .costPrice(orZero(template.getCostPrice()))
                    .stock(0)
                    .lowStockThreshold(inventoryProperties.getDefaultLowStockThreshold())
                    .categoryIds(new ArrayList<>(List.of(restoredCategory.getId())))
                    .build();

            Set<UUID> recordIds = new LinkedHashSet<>();
            recordIds.add(originalId);
            lines.stream()
                    .filter(i -> i.getVariantId() != null)
                    .collect(Collectors.toMap(RestoreProductsRequest.RestoreItem::getVariantId, i -> i,
                            (first, second) -> first, LinkedHashMap::new))
                    .values()
                    .forEach(line -> {
                        recordIds.add(line.getVariantId());
                        product.addVariant(restoreVariant(line));
                    });
            product.recalculateStock();

            purgeOrphans(recordIds);
            productRepository.save(product);
            restored++;

            log.info("Restored product {} as {}", template.getProductName(), productId);
        }

        if (restored == 0) {
            return OperationResult.failure(ErrorType.PRECONDITION_FAILED, "No deleted products to restore.");
        }
        return OperationResult.ok(restored, "Restored " + restored + " products.");
    }

    private DeletionUnitOfWork planProductDeletion(DeletionUnitOfWork unitOfWork, Product product) {
        Set<UUID> relatedIds = new LinkedHashSet<>();
        relatedIds.add(product.getId());
        product.getVariants().forEach(v -> relatedIds.add(v.getId()));

        return unitOfWork
                .deleteAdjustments(stockAdjustmentRepository.findByProductId(product.getId()))
                .deleteNotifications(notificationRepository.findByRelatedIdIn(relatedIds))
                .deleteProduct(product);
    }

    // Rows left behind for these ids by an earlier delete, and the tombstones of that delete
    private void purgeOrphans(Set<UUID> recordIds) {
        stockAdjustmentRepository.deleteAll(stockAdjustmentRepository.findByProductIdIn(recordIds));
        for (UUID recordId : recordIds) {
            stockAdjustmentRepository.deleteAll(stockAdjustmentRepository.findByVariantId(recordId));
            List<DeletionRecord> tombstones = deletionRecordRepository.findByRecordId(recordId);
            deletionRecordRepository.deleteAll(tombstones);
        }
        List<Notification> notifications = notificationRepository.findByRelatedIdIn(recordIds);
        notificationRepository.deleteAll(notifications);
    }

    private Category findOrCreateRestoredCategory(String workspaceId) {
        String name = inventoryProperties.getRestoredCategoryName();
        return categoryRepository.findByWorkspaceIdAndNameAndParentIdIsNull(workspaceId, name)
                .orElseGet(() -> {
                    log.info("Creating category '{}' for restored products", name);
                    return categoryRepository.save(Category.builder()
                            .workspaceId(workspaceId)
                            .name(name)
                            .build());
                });
    }

    private String resolveSku(String workspaceId, String sku, UUID productId) {
        if (sku != null && !sku.isBlank() && !productRepository.existsByWorkspaceIdAndSku(workspaceId, sku)) {
            return sku;
        }
        return "RESTORED-" + productId.toString().substring(0, 8).toUpperCase();
    }

    private ProductVariant restoreVariant(RestoreProductsRequest.RestoreItem line) {
        Map<String, String> options = new LinkedHashMap<>();
        if (line.getVariantLabel() != null && !line.getVariantLabel().isBlank()) {
            options.put("Variant", line.getVariantLabel());
        }
        return ProductVariant.builder()
                .id(line.getVariantId())
                .sku(line.getSku())
                .options(options)
                .stock(0)
                .costPrice(orZero(line.getCostPrice()))
                .retailPrice(orZero(line.getRetailPrice()))
                .build();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
