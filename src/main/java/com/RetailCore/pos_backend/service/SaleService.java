package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.config.InventoryProperties;
import com.RetailCore.pos_backend.dto.request.SaleRequest;
import com.RetailCore.pos_backend.dto.response.OperationResult;
import com.RetailCore.pos_backend.dto.response.SaleResponse;
import com.RetailCore.pos_backend.enums.AdjustmentSource;
import com.RetailCore.pos_backend.enums.ErrorType;
import com.RetailCore.pos_backend.enums.SaleStatus;
import com.RetailCore.pos_backend.enums.SaleType;
import com.RetailCore.pos_backend.exception.ResourceNotFoundException;
import com.RetailCore.pos_backend.exception.WorkspaceAccessException;
import com.RetailCore.pos_backend.model.Sale;
import com.RetailCore.pos_backend.model.SaleItem;
import com.RetailCore.pos_backend.model.SalePayment;
import com.RetailCore.pos_backend.model.StockAdjustment;
import com.RetailCore.pos_backend.repository.SaleRepository;
import com.RetailCore.pos_backend.repository.StockAdjustmentRepository;
import com.RetailCore.pos_backend.security.Actor;
import com.RetailCore.pos_backend.security.WorkspaceContext;
import com.RetailCore.pos_backend.util.LedgerReasons;
import com.RetailCore.pos_backend.util.PublicIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Records sales and returns. Every line moves stock through {@link StockService},
 * returned lines are linked back to the sale they came from, and cash is routed to
 * the open shift, all in one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SaleService {

    private static final String SALE_PREFIX = "TRX-";
    private static final String RETURN_PREFIX = "RET-";

    private final SaleRepository saleRepository;
    private final StockAdjustmentRepository stockAdjustmentRepository;
    private final StockService stockService;
    private final ShiftService shiftService;
    private final DeletionUnitOfWorkFactory deletionUnitOfWorkFactory;
    private final WorkspaceContext workspaceContext;
    private final InventoryProperties inventoryProperties;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public List<SaleResponse> getSales() {
        return saleRepository.findByWorkspaceIdOrderByCreatedAtDesc(workspaceContext.getWorkspaceId())
                .stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public SaleResponse getSale(UUID id) {
        Sale sale = saleRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Sale", "id", id));
        if (!workspaceContext.owns(sale.getWorkspaceId())) {
            throw new WorkspaceAccessException("sale");
        }
        return mapToResponse(sale);
    }

    @Transactional
    public SaleResponse processSale(SaleRequest request) {
        String workspaceId = workspaceContext.getWorkspaceId();
        Actor cashier = workspaceContext.getCurrentActor();

        // Net-positive exchanges are sales even when they carry returned lines
        SaleType type = request.getTotal().signum() >= 0 ? SaleType.SALE : SaleType.RETURN;
        String publicId = PublicIdGenerator.generateUnique(
                type == SaleType.SALE ? SALE_PREFIX : RETURN_PREFIX,
                inventoryProperties.getSaleIdLength(),
                saleRepository::existsByPublicId);

        log.info("Processing {} {}: {} items, total {}", type, publicId, request.getItems().size(), request.getTotal());

        Sale sale = Sale.builder()
                .workspaceId(workspaceId)
                .publicId(publicId)
                .type(type)
                .status(SaleStatus.COMPLETED)
                .subtotal(request.getSubtotal() != null ? request.getSubtotal() : BigDecimal.ZERO)
                .tax(request.getTax() != null ? request.getTax() : BigDecimal.ZERO)
                .total(request.getTotal())
                .cashierId(cashier.getId())
                .cashierName(cashier.getName())
                .build();

        BigDecimal costOfGoodsSold = BigDecimal.ZERO;
        for (SaleRequest.SaleItemRequest itemRequest : request.getItems()) {
            UUID originalSaleId = itemRequest.getOriginalSaleId();
            if (originalSaleId == null && itemRequest.getQuantity() < 0) {
                originalSaleId = request.getOriginalSaleId();
            }

            SaleItem item = SaleItem.builder()
                    .productId(itemRequest.getProductId())
                    .variantId(itemRequest.getVariantId())
                    .productName(itemRequest.getProductName())
                    .sku(itemRequest.getSku())
                    .variantLabel(itemRequest.getVariantLabel())
                    .quantity(itemRequest.getQuantity())
                    .costPrice(itemRequest.getCostPrice() != null ? itemRequest.getCostPrice() : BigDecimal.ZERO)
                    .retailPrice(itemRequest.getRetailPrice() != null ? itemRequest.getRetailPrice() : BigDecimal.ZERO)
                    .originalSaleId(originalSaleId)
                    .build();
            sale.addItem(item);
            costOfGoodsSold = costOfGoodsSold.add(item.calculateCostOfGoodsSold());
        }
        sale.setCostOfGoodsSold(costOfGoodsSold);

        if (request.getPayments() != null) {
            request.getPayments().forEach(p -> sale.getPayments().add(new SalePayment(p.getType(), p.getAmount())));
        }

        resolveOriginalSale(sale, request.getOriginalSaleId());

        Sale savedSale = saleRepository.save(sale);
        log.debug("Sale {} saved with id {}", publicId, savedSale.getId());

        String reason = LedgerReasons.forSale(publicId);
        for (SaleItem item : savedSale.getItems()) {
            stockService.adjustStockBy(item.getProductId(), item.getVariantId(), -item.getQuantity(),
                    reason, AdjustmentSource.SALE, savedSale.getId());
        }

        linkReturnedItems(savedSale);

        shiftService.recordCashMovement(savedSale.getCashAmount());

        log.info("{} {} completed. Total: {}, COGS: {}, Profit: {}",
                type, publicId, savedSale.getTotal(), costOfGoodsSold, savedSale.calculateProfit());
        return mapToResponse(savedSale);
    }

    /**
     * Deletes a sale together with its returns and every ledger row either of them wrote.
     * Returns cannot be deleted on their own.
     */
    @Transactional
    public OperationResult<Void> deleteSale(UUID id) {
        Optional<Sale> found = saleRepository.findById(id);
        if (found.isEmpty()) {
            return OperationResult.failure(ErrorType.NOT_FOUND, "Sale not found.");
        }

        Sale sale = found.get();
        if (!workspaceContext.owns(sale.getWorkspaceId())) {
            return OperationResult.failure(ErrorType.ACCESS_DENIED, "You do not have access to this sale.");
        }
        if (sale.getType() == SaleType.RETURN) {
            return OperationResult.failure(ErrorType.PRECONDITION_FAILED,
                    "Returns cannot be deleted directly. Delete the original sale instead.");
        }

        DeletionUnitOfWork unitOfWork = deletionUnitOfWorkFactory.begin(sale.getWorkspaceId());
        int returns = planSaleDeletion(unitOfWork, sale);
        int removed = unitOfWork.execute();

        log.info("Sale {} deleted with {} returns ({} rows removed)", sale.getPublicId(), returns, removed);
        return OperationResult.ok("Sale " + sale.getPublicId() + " deleted.");
    }

    /**
     * Deletes every sale, optionally only those in the given statuses, with their returns.
     */
    @Transactional
    public OperationResult<Integer> clearSales(Collection<SaleStatus> statuses) {
        String workspaceId = workspaceContext.getWorkspaceId();
        List<Sale> sales = filterByStatus(saleRepository.findByWorkspaceIdAndType(workspaceId, SaleType.SALE), statuses);
        return deleteSales(workspaceId, sales, "Cleared");
    }

    /**
     * Deletes sales older than {@code days} days, optionally only those in the given statuses.
     */
    @Transactional
    public OperationResult<Integer> pruneSales(int days, Collection<SaleStatus> statuses) {
        if (days <= 0) {
            return OperationResult.failure(ErrorType.VALIDATION_ERROR, "Retention period must be at least one day.");
        }

        String workspaceId = workspaceContext.getWorkspaceId();
        LocalDateTime cutoff = LocalDateTime.now().minusDays(days);
        List<Sale> sales = filterByStatus(
                saleRepository.findByWorkspaceIdAndTypeAndCreatedAtBefore(workspaceId, SaleType.SALE, cutoff), statuses);
        return deleteSales(workspaceId, sales, "Pruned");
    }

    private OperationResult<Integer> deleteSales(String workspaceId, List<Sale> sales, String verb) {
        if (sales.isEmpty()) {
            return OperationResult.ok(0, "No sales to delete.");
        }

        DeletionUnitOfWork unitOfWork = deletionUnitOfWorkFactory.begin(workspaceId);
        sales.forEach(sale -> planSaleDeletion(unitOfWork, sale));
        unitOfWork.execute();

        log.info("{} {} sales in workspace {}", verb, sales.size(), workspaceId);
        return OperationResult.ok(sales.size(), verb + " " + sales.size() + " sales.");
    }

    private int planSaleDeletion(DeletionUnitOfWork unitOfWork, Sale sale) {
        Map<UUID, Sale> returns = new LinkedHashMap<>();
        saleRepository.findByOriginalSaleIdAndType(sale.getId(), SaleType.RETURN)
                .forEach(r -> returns.put(r.getId(), r));
        saleRepository.findDistinctByTypeAndItemsOriginalSaleId(SaleType.RETURN, sale.getId())
                .forEach(r -> returns.putIfAbsent(r.getId(), r));

        unitOfWork.deleteSale(sale).deleteAdjustments(findLedgerRows(sale));
        for (Sale saleReturn : returns.values()) {
            unitOfWork.deleteSale(saleReturn).deleteAdjustments(findLedgerRows(saleReturn));
        }
        return returns.size();
    }

    private List<StockAdjustment> findLedgerRows(Sale sale) {
        Set<String> legacyReasons = LedgerReasons.legacySaleReasons(sale.getId(), sale.getPublicId());
        return stockAdjustmentRepository.findOwnedBySource(sale.getWorkspaceId(), AdjustmentSource.SALE,
                sale.getId(), legacyReasons);
    }

    private List<Sale> filterByStatus(List<Sale> sales, Collection<SaleStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return sales;
        }
        return sales.stream()
                .filter(s -> statuses.contains(s.getStatus()))
                .collect(Collectors.toList());
    }

    /**
     * Sets the sale-level link to the original sale: the requested one, or the single
     * sale that all returned lines point at.
     */
    private void resolveOriginalSale(Sale sale, UUID requestedOriginalId) {
        UUID originalId = requestedOriginalId;
        if (originalId == null) {
            Set<UUID> referenced = sale.getItems().stream()
                    .filter(i -> i.getQuantity() < 0 && i.getOriginalSaleId() != null)
                    .map(SaleItem::getOriginalSaleId)
                    .collect(Collectors.toSet());
            if (referenced.size() == 1) {
                originalId = referenced.iterator().next();
            }
        }
        if (originalId == null) {
            return;
        }

        sale.setOriginalSaleId(originalId);
        saleRepository.findById(originalId)
                .filter(original -> workspaceContext.owns(original.getWorkspaceId()))
                .ifPresent(original -> sale.setOriginalSalePublicId(original.getPublicId()));
    }

    private void linkReturnedItems(Sale sale) {
        Map<UUID, List<SaleItem>> returnedByOriginal = sale.getItems().stream()
                .filter(i -> i.getQuantity() < 0 && i.getOriginalSaleId() != null)
                .collect(Collectors.groupingBy(SaleItem::getOriginalSaleId, LinkedHashMap::new, Collectors.toList()));

        for (Map.Entry<UUID, List<SaleItem>> entry : returnedByOriginal.entrySet()) {
            Optional<Sale> found = saleRepository.findById(entry.getKey());
            if (found.isEmpty() || !workspaceContext.owns(found.get().getWorkspaceId())) {
                log.warn("Original sale {} not found, returned lines left unlinked", entry.getKey());
                continue;
            }

            Sale original = found.get();
            for (SaleItem returned : entry.getValue()) {
                Optional<SaleItem> target = original.getItems().stream()
                        .filter(i -> i.matches(returned.getProductId(), returned.getVariantId()))
                        .filter(i -> !i.isFullyReturned())
                        .findFirst()
                        .or(() -> original.getItems().stream()
                                .filter(i -> i.matches(returned.getProductId(), returned.getVariantId()))
                                .findFirst());

                if (target.isEmpty()) {
                    log.warn("Returned product {} is not on original sale {}",
                            returned.getProductId(), original.getPublicId());
                    continue;
                }
                SaleItem originalItem = target.get();
                originalItem.setReturnedQuantity(originalItem.getReturnedQuantity() + Math.abs(returned.getQuantity()));
            }

            SaleStatus previous = original.getStatus();
            SaleStatus status = original.recalculateRefundStatus();
            saleRepository.save(original);

            log.debug("Original sale {} status {} -> {}", original.getPublicId(), previous, status);
        }
    }

    private SaleResponse mapToResponse(Sale sale) {
        SaleResponse response = modelMapper.map(sale, SaleResponse.class);
        response.setProfit(sale.calculateProfit());
        return response;
    }
}
