package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.config.InventoryProperties;
import com.RetailCore.pos_backend.dto.request.PurchaseOrderRequest;
import com.RetailCore.pos_backend.dto.request.ReceiveItemsRequest;
import com.RetailCore.pos_backend.dto.response.OperationResult;
import com.RetailCore.pos_backend.dto.response.PurchaseOrderResponse;
import com.RetailCore.pos_backend.enums.AdjustmentSource;
import com.RetailCore.pos_backend.enums.ErrorType;
import com.RetailCore.pos_backend.enums.NotificationType;
import com.RetailCore.pos_backend.enums.PurchaseOrderStatus;
import com.RetailCore.pos_backend.exception.ResourceNotFoundException;
import com.RetailCore.pos_backend.exception.ValidationException;
import com.RetailCore.pos_backend.exception.WorkspaceAccessException;
import com.RetailCore.pos_backend.model.PurchaseOrder;
import com.RetailCore.pos_backend.model.PurchaseOrderItem;
import com.RetailCore.pos_backend.model.Supplier;
import com.RetailCore.pos_backend.repository.PurchaseOrderRepository;
import com.RetailCore.pos_backend.security.WorkspaceContext;
import com.RetailCore.pos_backend.util.LedgerReasons;
import com.RetailCore.pos_backend.util.PublicIdGenerator;
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

@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseOrderService {

    private static final String PO_PREFIX = "PO-";

    private final PurchaseOrderRepository purchaseOrderRepository;
    private final StockService stockService;
    private final NotificationService notificationService;
    private final SupplierService supplierService;
    private final DeletionUnitOfWorkFactory deletionUnitOfWorkFactory;
    private final WorkspaceContext workspaceContext;
    private final InventoryProperties inventoryProperties;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public List<PurchaseOrderResponse> getPurchaseOrders() {
        return purchaseOrderRepository.findByWorkspaceIdOrderByDateCreatedDesc(workspaceContext.getWorkspaceId())
                .stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public PurchaseOrderResponse getPurchaseOrder(UUID id) {
        return mapToResponse(findOwnedPurchaseOrder(id));
    }

    @Transactional(readOnly = true)
    public long countPurchaseOrdersByStatus(PurchaseOrderStatus status) {
        return purchaseOrderRepository.countByWorkspaceIdAndStatus(workspaceContext.getWorkspaceId(), status);
    }

    @Transactional
    public PurchaseOrderResponse addPurchaseOrder(PurchaseOrderRequest request) {
        String supplierName = request.getSupplierName();
        if (request.getSupplierId() != null) {
            Supplier supplier = supplierService.findOrderableSupplier(request.getSupplierId());
            supplierName = supplier.getName();
        } else if (supplierName == null || supplierName.isBlank()) {
            throw new ValidationException("Supplier is required");
        }

        String publicId = PublicIdGenerator.generateUnique(PO_PREFIX,
                inventoryProperties.getPurchaseOrderIdLength(),
                purchaseOrderRepository::existsByPublicId);

        PurchaseOrder purchaseOrder = PurchaseOrder.builder()
                .workspaceId(workspaceContext.getWorkspaceId())
                .publicId(publicId)
                .supplierId(request.getSupplierId())
                .supplierName(supplierName)
                .dateExpected(request.getDateExpected())
                .notes(request.getNotes())
                .status(PurchaseOrderStatus.PENDING)
                .build();

        for (PurchaseOrderRequest.PurchaseOrderItemRequest itemRequest : request.getItems()) {
            purchaseOrder.addItem(PurchaseOrderItem.builder()
                    .productId(itemRequest.getProductId())
                    .variantId(itemRequest.getVariantId())
                    .productName(itemRequest.getProductName())
                    .quantityOrdered(itemRequest.getQuantityOrdered())
                    .quantityReceived(0)
                    .costPrice(itemRequest.getCostPrice())
                    .build());
        }
        purchaseOrder.recalculateTotalCost();

        PurchaseOrder saved = purchaseOrderRepository.save(purchaseOrder);

        notificationService.addNotification("New PO #" + publicId + " created for " + supplierName + ".",
                NotificationType.PO, saved.getId());

        log.info("Purchase order {} created for {} with {} items, total {}",
                publicId, supplierName, saved.getItems().size(), saved.getTotalCost());
        return mapToResponse(saved);
    }

    /**
     * Books received quantities into stock and onto the order lines. Quantities are
     * expected to be validated by the caller against what is still outstanding.
     */
    @Transactional
    public PurchaseOrderResponse receivePOItems(UUID purchaseOrderId, ReceiveItemsRequest request) {
        PurchaseOrder purchaseOrder = findOwnedPurchaseOrder(purchaseOrderId);
        String reason = LedgerReasons.forPurchaseOrder(purchaseOrder.getPublicId());

        for (ReceiveItemsRequest.ReceivedItem received : request.getItems()) {
            if (received.getQuantity() <= 0) {
                continue;
            }

            stockService.adjustStockBy(received.getProductId(), received.getVariantId(), received.getQuantity(),
                    reason, AdjustmentSource.PURCHASE_ORDER, purchaseOrder.getId());

            Optional<PurchaseOrderItem> line = purchaseOrder.getItems().stream()
                    .filter(i -> i.matches(received.getProductId(), received.getVariantId()))
                    .findFirst();
            if (line.isEmpty()) {
                log.warn("Received product {} is not on PO {}", received.getProductId(), purchaseOrder.getPublicId());
                continue;
            }
            PurchaseOrderItem item = line.get();
            item.setQuantityReceived(item.getQuantityReceived() + received.getQuantity());
            log.debug("PO {} line {}: {}/{} received", purchaseOrder.getPublicId(), item.getProductName(),
                    item.getQuantityReceived(), item.getQuantityOrdered());
        }

        PurchaseOrderStatus previous = purchaseOrder.getStatus();
        PurchaseOrderStatus status = purchaseOrder.recalculateStatus();
        PurchaseOrder saved = purchaseOrderRepository.save(purchaseOrder);

        if (status != previous) {
            notificationService.addNotification("PO #" + saved.getPublicId() + " is now " + status.getLabel() + ".",
                    NotificationType.PO, saved.getId());
        }

        log.info("Items received on PO {}, status {}", saved.getPublicId(), status);
        return mapToResponse(saved);
    }

    @Transactional
    public OperationResult<Void> deletePurchaseOrder(UUID id) {
        Optional<PurchaseOrder> found = purchaseOrderRepository.findById(id);
        if (found.isEmpty()) {
            return OperationResult.failure(ErrorType.NOT_FOUND, "Purchase order not found.");
        }

        PurchaseOrder purchaseOrder = found.get();
        if (!workspaceContext.owns(purchaseOrder.getWorkspaceId())) {
            return OperationResult.failure(ErrorType.ACCESS_DENIED, "You do not have access to this purchase order.");
        }
        if (purchaseOrder.getStatus() != PurchaseOrderStatus.PENDING) {
            return OperationResult.failure(ErrorType.PRECONDITION_FAILED, "Only POs with Pending status can be deleted.");
        }

        deletionUnitOfWorkFactory.begin(purchaseOrder.getWorkspaceId())
                .deletePurchaseOrder(purchaseOrder)
                .execute();

        log.info("Purchase order {} deleted", purchaseOrder.getPublicId());
        return OperationResult.ok("PO #" + purchaseOrder.getPublicId() + " deleted.");
    }

    /**
     * Deletes purchase orders created more than {@code days} days ago, whatever their status.
     * Stock already received stays on the products and in the ledger.
     */
    @Transactional
    public OperationResult<Integer> prunePurchaseOrders(int days) {
        if (days <= 0) {
            return OperationResult.failure(ErrorType.VALIDATION_ERROR, "Retention period must be at least one day.");
        }

        String workspaceId = workspaceContext.getWorkspaceId();
        LocalDateTime cutoff = LocalDateTime.now().minusDays(days);
        List<PurchaseOrder> stale = purchaseOrderRepository.findByWorkspaceIdAndDateCreatedBefore(workspaceId, cutoff);

        if (stale.isEmpty()) {
            return OperationResult.ok(0, "No purchase orders older than " + days + " days.");
        }

        DeletionUnitOfWork unitOfWork = deletionUnitOfWorkFactory.begin(workspaceId);
        stale.forEach(unitOfWork::deletePurchaseOrder);
        unitOfWork.execute();

        log.info("Pruned {} purchase orders older than {} days in workspace {}", stale.size(), days, workspaceId);
        return OperationResult.ok(stale.size(), "Removed " + stale.size() + " purchase orders.");
    }

    private PurchaseOrder findOwnedPurchaseOrder(UUID id) {
        PurchaseOrder purchaseOrder = purchaseOrderRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Purchase order", "id", id));
        if (!workspaceContext.owns(purchaseOrder.getWorkspaceId())) {
            throw new WorkspaceAccessException("purchase order");
        }
        return purchaseOrder;
    }

    private PurchaseOrderResponse mapToResponse(PurchaseOrder purchaseOrder) {
        return modelMapper.map(purchaseOrder, PurchaseOrderResponse.class);
    }
}
