package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.model.DeletionRecord;
import com.RetailCore.pos_backend.model.Notification;
import com.RetailCore.pos_backend.model.Product;
import com.RetailCore.pos_backend.model.ProductVariant;
import com.RetailCore.pos_backend.model.PurchaseOrder;
import com.RetailCore.pos_backend.model.Sale;
import com.RetailCore.pos_backend.model.StockAdjustment;
import com.RetailCore.pos_backend.repository.DeletionRecordRepository;
import com.RetailCore.pos_backend.repository.NotificationRepository;
import com.RetailCore.pos_backend.repository.ProductRepository;
import com.RetailCore.pos_backend.repository.PurchaseOrderRepository;
import com.RetailCore.pos_backend.repository.SaleRepository;
import com.RetailCore.pos_backend.repository.StockAdjustmentRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Collects every row a cascading delete will remove, then removes them together and
 * writes one {@link DeletionRecord} per row. Callers run {@link #execute()} inside
 * their own transaction.
 * <p>
 * Obtain instances from {@link DeletionUnitOfWorkFactory}.
 */
@Slf4j
public class DeletionUnitOfWork {

    private final String workspaceId;
    private final ProductRepository productRepository;
    private final StockAdjustmentRepository stockAdjustmentRepository;
    private final NotificationRepository notificationRepository;
    private final SaleRepository saleRepository;
    private final PurchaseOrderRepository purchaseOrderRepository;
    private final DeletionRecordRepository deletionRecordRepository;

    // Keyed by id so a row planned twice is only deleted once
    private final Map<UUID, StockAdjustment> adjustments = new LinkedHashMap<>();
    private final Map<UUID, Notification> notifications = new LinkedHashMap<>();
    private final Map<UUID, Sale> sales = new LinkedHashMap<>();
    private final Map<UUID, PurchaseOrder> purchaseOrders = new LinkedHashMap<>();
    private final Map<UUID, ProductVariant> variants = new LinkedHashMap<>();
    private final Map<UUID, Product> products = new LinkedHashMap<>();

    private boolean executed;

    DeletionUnitOfWork(String workspaceId,
                       ProductRepository productRepository,
                       StockAdjustmentRepository stockAdjustmentRepository,
                       NotificationRepository notificationRepository,
                       SaleRepository saleRepository,
                       PurchaseOrderRepository purchaseOrderRepository,
                       DeletionRecordRepository deletionRecordRepository) {
        this.workspaceId = workspaceId;
        this.productRepository = productRepository;
        this.stockAdjustmentRepository = stockAdjustmentRepository;
        this.notificationRepository = notificationRepository;
        this.saleRepository = saleRepository;
        this.purchaseOrderRepository = purchaseOrderRepository;
        this.deletionRecordRepository = deletionRecordRepository;
    }

    public DeletionUnitOfWork deleteAdjustments(Collection<StockAdjustment> rows) {
        rows.forEach(row -> adjustments.put(row.getId(), row));
        return this;
    }

    public DeletionUnitOfWork deleteNotifications(Collection<Notification> rows) {
        rows.forEach(row -> notifications.put(row.getId(), row));
        return this;
    }

    public DeletionUnitOfWork deleteSale(Sale sale) {
        sales.put(sale.getId(), sale);
        return this;
    }

    public DeletionUnitOfWork deletePurchaseOrder(PurchaseOrder purchaseOrder) {
        purchaseOrders.put(purchaseOrder.getId(), purchaseOrder);
        return this;
    }

    /**
     * Removes a single variant from its product. The product stays and its stock is
     * recomputed from the remaining variants.
     */
    public DeletionUnitOfWork deleteVariant(ProductVariant variant) {
        variants.put(variant.getId(), variant);
        return this;
    }

    /**
     * Removes the product together with all of its variants.
     */
    public DeletionUnitOfWork deleteProduct(Product product) {
        products.put(product.getId(), product);
        return this;
    }

    /**
     * Deletes everything planned and appends the tombstones.
     *
     * @return number of rows removed
     */
    public int execute() {
        if (executed) {
            throw new IllegalStateException("Deletion unit of work already executed");
        }
        executed = true;

        LocalDateTime deletedAt = LocalDateTime.now();
        List<DeletionRecord> tombstones = new ArrayList<>();

        adjustments.keySet().forEach(id -> tombstones.add(tombstone(id, DeletionRecord.STOCK_ADJUSTMENTS, deletedAt)));
        notifications.keySet().forEach(id -> tombstones.add(tombstone(id, DeletionRecord.NOTIFICATIONS, deletedAt)));
        sales.keySet().forEach(id -> tombstones.add(tombstone(id, DeletionRecord.SALES, deletedAt)));
        purchaseOrders.keySet().forEach(id -> tombstones.add(tombstone(id, DeletionRecord.PURCHASE_ORDERS, deletedAt)));
        variants.keySet().forEach(id -> tombstones.add(tombstone(id, DeletionRecord.PRODUCT_VARIANTS, deletedAt)));
        for (Product product : products.values()) {
            product.getVariants().forEach(v -> tombstones.add(tombstone(v.getId(), DeletionRecord.PRODUCT_VARIANTS, deletedAt)));
            tombstones.add(tombstone(product.getId(), DeletionRecord.PRODUCTS, deletedAt));
        }

        stockAdjustmentRepository.deleteAll(adjustments.values());
        notificationRepository.deleteAll(notifications.values());
        saleRepository.deleteAll(sales.values());
        purchaseOrderRepository.deleteAll(purchaseOrders.values());

        for (ProductVariant variant : variants.values()) {
            Product parent = variant.getProduct();
            if (parent == null || products.containsKey(parent.getId())) {
                continue;
            }
            parent.getVariants().removeIf(v -> v.getId().equals(variant.getId()));
            // Zero once the last variant is gone
            parent.setStock(parent.getVariants().stream().mapToInt(ProductVariant::getStock).sum());
            productRepository.save(parent);
        }
        productRepository.deleteAll(products.values());

        deletionRecordRepository.saveAll(tombstones);

        log.debug("Deletion unit of work removed {} rows in workspace {}", tombstones.size(), workspaceId);
        return tombstones.size();
    }

    private DeletionRecord tombstone(UUID recordId, String tableName, LocalDateTime deletedAt) {
        return DeletionRecord.builder()
                .workspaceId(workspaceId)
                .recordId(recordId)
                .tableName(tableName)
                .deletedAt(deletedAt)
                .build();
    }
}
