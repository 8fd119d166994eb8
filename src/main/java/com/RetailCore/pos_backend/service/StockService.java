package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.dto.request.StockAdjustmentRequest;
import com.RetailCore.pos_backend.dto.request.StockReceiptRequest;
import com.RetailCore.pos_backend.dto.response.OperationResult;
import com.RetailCore.pos_backend.dto.response.StockAdjustmentResponse;
import com.RetailCore.pos_backend.enums.AdjustmentSource;
import com.RetailCore.pos_backend.enums.ErrorType;
import com.RetailCore.pos_backend.enums.NotificationType;
import com.RetailCore.pos_backend.exception.ValidationException;
import com.RetailCore.pos_backend.exception.WorkspaceAccessException;
import com.RetailCore.pos_backend.model.Product;
import com.RetailCore.pos_backend.model.ProductVariant;
import com.RetailCore.pos_backend.model.StockAdjustment;
import com.RetailCore.pos_backend.repository.ProductRepository;
import com.RetailCore.pos_backend.repository.StockAdjustmentRepository;
import com.RetailCore.pos_backend.security.Actor;
import com.RetailCore.pos_backend.security.WorkspaceContext;
import com.RetailCore.pos_backend.util.LedgerReasons;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Owns every stock level change. Each change is written to the ledger as a
 * {@link StockAdjustment} in the same transaction as the new level.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StockService {

    private final ProductRepository productRepository;
    private final StockAdjustmentRepository stockAdjustmentRepository;
    private final NotificationService notificationService;
    private final DeletionUnitOfWorkFactory deletionUnitOfWorkFactory;
    private final WorkspaceContext workspaceContext;
    private final ModelMapper modelMapper;

    /**
     * Manual adjustment to an absolute level.
     */
    @Transactional
    public Optional<StockAdjustmentResponse> adjustStock(StockAdjustmentRequest request) {
        return adjustStock(request.getProductId(), request.getVariantId(), request.getNewStockLevel(),
                request.getReason(), AdjustmentSource.MANUAL, null)
                .map(this::mapToResponse);
    }

    @Transactional
    public Optional<StockAdjustmentResponse> receiveStock(StockReceiptRequest request) {
        return adjustStockBy(request.getProductId(), request.getVariantId(), request.getQuantity(),
                LedgerReasons.STOCK_RECEIVED, AdjustmentSource.STOCK_RECEIVED, null)
                .map(this::mapToResponse);
    }

    /**
     * Moves a product, or one of its variants, to {@code newLevel}.
     *
     * @return the ledger row, or empty when the level did not change or the target no longer exists
     */
    @Transactional
    public Optional<StockAdjustment> adjustStock(UUID productId, UUID variantId, int newLevel, String reason,
                                                 AdjustmentSource sourceType, UUID sourceId) {
        Optional<Product> found = productRepository.findById(productId);
        if (found.isEmpty()) {
            log.warn("Stock adjustment skipped, product {} not found", productId);
            return Optional.empty();
        }

        Product product = found.get();
        if (!workspaceContext.owns(product.getWorkspaceId())) {
            throw new WorkspaceAccessException("product");
        }

        ProductVariant variant = null;
        int previousStock;
        if (variantId != null) {
            Optional<ProductVariant> foundVariant = product.findVariant(variantId);
            if (foundVariant.isEmpty()) {
                log.warn("Stock adjustment skipped, variant {} not found on product {}", variantId, productId);
                return Optional.empty();
            }
            variant = foundVariant.get();
            previousStock = variant.getStock();
        } else {
            if (product.hasVariants()) {
                throw new ValidationException("Stock of product '" + product.getName()
                        + "' is tracked per variant, a variant must be given");
            }
            previousStock = product.getStock();
        }

        int delta = newLevel - previousStock;
        if (delta == 0) {
            log.debug("Stock of {} already at {}, nothing to adjust", product.getName(), newLevel);
            return Optional.empty();
        }

        if (variant != null) {
            variant.setStock(newLevel);
            product.recalculateStock();
        } else {
            product.setStock(newLevel);
        }
        productRepository.save(product);

        Actor actor = workspaceContext.getCurrentActor();
        StockAdjustment adjustment = StockAdjustment.builder()
                .workspaceId(product.getWorkspaceId())
                .productId(product.getId())
                .variantId(variantId)
                .quantity(delta)
                .previousStock(previousStock)
                .newStock(newLevel)
                .reason(reason)
                .sourceType(sourceType)
                .sourceId(sourceId)
                .performedById(actor.getId())
                .performedByName(actor.getName())
                .build();
        StockAdjustment saved = stockAdjustmentRepository.save(adjustment);

        log.info("Stock of {} moved {} -> {} ({})", product.getName(), previousStock, newLevel, reason);

        notifyOnThreshold(product, variant, previousStock, newLevel);
        return Optional.of(saved);
    }

    /**
     * Moves the current level by a signed {@code delta}.
     */
    @Transactional
    public Optional<StockAdjustment> adjustStockBy(UUID productId, UUID variantId, int delta, String reason,
                                                   AdjustmentSource sourceType, UUID sourceId) {
        Optional<Integer> currentLevel = getCurrentLevel(productId, variantId);
        if (currentLevel.isEmpty()) {
            log.warn("Stock adjustment skipped, {} {} not found",
                    variantId != null ? "variant" : "product", variantId != null ? variantId : productId);
            return Optional.empty();
        }
        return adjustStock(productId, variantId, currentLevel.get() + delta, reason, sourceType, sourceId);
    }

    @Transactional(readOnly = true)
    public Optional<Integer> getCurrentLevel(UUID productId, UUID variantId) {
        Optional<Product> found = productRepository.findById(productId);
        if (found.isPresent() && !workspaceContext.owns(found.get().getWorkspaceId())) {
            throw new WorkspaceAccessException("product");
        }
        return found
                .flatMap(product -> variantId != null
                        ? product.findVariant(variantId).map(ProductVariant::getStock)
                        : Optional.of(product.getStock()));
    }

    @Transactional(readOnly = true)
    public List<StockAdjustmentResponse> getStockHistory(UUID productId) {
        return stockAdjustmentRepository
                .findByWorkspaceIdAndProductIdOrderByCreatedAtDesc(workspaceContext.getWorkspaceId(), productId)
                .stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    /**
     * Removes ledger rows older than {@code days} days.
     */
    @Transactional
    public OperationResult<Integer> pruneStockHistory(int days) {
        if (days <= 0) {
            return OperationResult.failure(ErrorType.VALIDATION_ERROR, "Retention period must be at least one day.");
        }

        String workspaceId = workspaceContext.getWorkspaceId();
        LocalDateTime cutoff = LocalDateTime.now().minusDays(days);
        List<StockAdjustment> stale = stockAdjustmentRepository.findByWorkspaceIdAndCreatedAtBefore(workspaceId, cutoff);

        if (stale.isEmpty()) {
            return OperationResult.ok(0, "No stock history older than " + days + " days.");
        }

        deletionUnitOfWorkFactory.begin(workspaceId)
                .deleteAdjustments(stale)
                .execute();

        log.info("Pruned {} stock history rows older than {} days in workspace {}", stale.size(), days, workspaceId);
        return OperationResult.ok(stale.size(), "Removed " + stale.size() + " stock history entries.");
    }

    private void notifyOnThreshold(Product product, ProductVariant variant, int previousStock, int newStock) {
        String name = variant != null
                ? product.getName() + " (" + variant.getLabel() + ")"
                : product.getName();
        UUID relatedId = variant != null ? variant.getId() : product.getId();
        int threshold = product.getLowStockThreshold();

        if (previousStock > 0 && newStock <= 0) {
            notificationService.addNotification("Out of Stock: " + name, NotificationType.STOCK, relatedId);
        } else if (previousStock > threshold && newStock <= threshold) {
            notificationService.addNotification("Low Stock Warning: " + name + " (" + newStock + " left)",
                    NotificationType.STOCK, relatedId);
        }
    }

    private StockAdjustmentResponse mapToResponse(StockAdjustment adjustment) {
        return modelMapper.map(adjustment, StockAdjustmentResponse.class);
    }
}
