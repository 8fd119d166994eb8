package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.dto.request.ProductRequest;
import com.RetailCore.pos_backend.dto.request.PurchaseOrderRequest;
import com.RetailCore.pos_backend.dto.request.ReceiveItemsRequest;
import com.RetailCore.pos_backend.dto.request.SaleRequest;
import com.RetailCore.pos_backend.dto.request.StockAdjustmentRequest;
import com.RetailCore.pos_backend.dto.request.StockReceiptRequest;
import com.RetailCore.pos_backend.dto.response.OperationResult;
import com.RetailCore.pos_backend.dto.response.ProductResponse;
import com.RetailCore.pos_backend.dto.response.PurchaseOrderResponse;
import com.RetailCore.pos_backend.dto.response.SaleResponse;
import com.RetailCore.pos_backend.dto.response.ShiftResponse;
import com.RetailCore.pos_backend.enums.PaymentType;
import com.RetailCore.pos_backend.enums.PurchaseOrderStatus;
import com.RetailCore.pos_backend.enums.SaleStatus;
import com.RetailCore.pos_backend.model.DeletionRecord;
import com.RetailCore.pos_backend.model.StockAdjustment;
import com.RetailCore.pos_backend.repository.DeletionRecordRepository;
import com.RetailCore.pos_backend.repository.NotificationRepository;
import com.RetailCore.pos_backend.repository.ProductRepository;
import com.RetailCore.pos_backend.repository.SaleRepository;
import com.RetailCore.pos_backend.repository.StockAdjustmentRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.security.test.context.support.WithUserDetails;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Transactional
@WithUserDetails("test-admin")
class InventoryFlowIntegrationTest {

    private static final String WORKSPACE = "test-workspace";

    @Autowired
    private ProductService productService;
    @Autowired
    private StockService stockService;
    @Autowired
    private SaleService saleService;
    @Autowired
    private PurchaseOrderService purchaseOrderService;
    @Autowired
    private ShiftService shiftService;
    @Autowired
    private ProductDeletionService productDeletionService;

    @Autowired
    private ProductRepository productRepository;
    @Autowired
    private StockAdjustmentRepository stockAdjustmentRepository;
    @Autowired
    private SaleRepository saleRepository;
    @Autowired
    private NotificationRepository notificationRepository;
    @Autowired
    private DeletionRecordRepository deletionRecordRepository;

    private ProductResponse createProduct(String sku, int stock) {
        ProductResponse product = productService.addProduct(ProductRequest.builder()
                .sku(sku)
                .name("Product " + sku)
                .retailPrice(new BigDecimal("10.00"))
                .costPrice(new BigDecimal("4.00"))
                .build());
        if (stock > 0) {
            stockService.receiveStock(new StockReceiptRequest(product.getId(), null, stock));
        }
        return product;
    }

    private SaleRequest saleOf(UUID productId, int quantity, String cash, UUID originalSaleId) {
        return SaleRequest.builder()
                .items(List.of(SaleRequest.SaleItemRequest.builder()
                        .productId(productId)
                        .productName("Product")
                        .quantity(quantity)
                        .costPrice(new BigDecimal("4.00"))
                        .retailPrice(new BigDecimal("10.00"))
                        .originalSaleId(originalSaleId)
                        .build()))
                .payments(List.of(SaleRequest.PaymentRequest.builder()
                        .type(PaymentType.CASH).amount(new BigDecimal(cash)).build()))
                .total(new BigDecimal(cash))
                .build();
    }

    @Test
    void sale_ShouldLowerStockWithExactlyOneLedgerRow() {
        ProductResponse product = createProduct("INT-SALE", 10);

        SaleResponse sale = saleService.processSale(saleOf(product.getId(), 3, "30.00", null));

        assertEquals(7, productRepository.findById(product.getId()).orElseThrow().getStock());
        List<StockAdjustment> saleRows = stockAdjustmentRepository.findByProductId(product.getId()).stream()
                .filter(r -> sale.getId().equals(r.getSourceId()))
                .collect(Collectors.toList());
        assertEquals(1, saleRows.size());
        assertEquals(-3, saleRows.get(0).getQuantity());
        assertEquals("Sale #" + sale.getPublicId(), saleRows.get(0).getReason());
        assertEquals("test-admin", saleRows.get(0).getPerformedByName());
    }

    @Test
    void deleteSale_ShouldRemoveReturnsAndLegacyLedgerRows() {
        ProductResponse product = createProduct("INT-DEL", 10);
        SaleResponse sale = saleService.processSale(saleOf(product.getId(), 2, "20.00", null));
        SaleResponse saleReturn = saleService.processSale(saleOf(product.getId(), -1, "-10.00", sale.getId()));

        assertEquals(SaleStatus.PARTIALLY_REFUNDED, saleRepository.findById(sale.getId()).orElseThrow().getStatus());

        StockAdjustment legacy = stockAdjustmentRepository.save(StockAdjustment.builder()
                .workspaceId(WORKSPACE)
                .productId(product.getId())
                .quantity(0)
                .previousStock(9)
                .newStock(9)
                .reason("Sale #" + sale.getId())
                .build());

        OperationResult<Void> rejected = saleService.deleteSale(saleReturn.getId());
        assertFalse(rejected.isSuccess());

        OperationResult<Void> result = saleService.deleteSale(sale.getId());

        assertTrue(result.isSuccess());
        assertTrue(saleRepository.findById(sale.getId()).isEmpty());
        assertTrue(saleRepository.findById(saleReturn.getId()).isEmpty());
        assertTrue(stockAdjustmentRepository.findById(legacy.getId()).isEmpty());
        assertTrue(stockAdjustmentRepository.findByProductId(product.getId()).stream()
                .allMatch(r -> r.getSourceId() == null || !r.getSourceId().equals(sale.getId())));
        assertEquals(2, deletionRecordRepository.findByWorkspaceIdAndTableName(WORKSPACE, DeletionRecord.SALES).size());
        assertEquals(3, deletionRecordRepository.findByWorkspaceIdAndTableName(WORKSPACE, DeletionRecord.STOCK_ADJUSTMENTS).size());
    }

    @Test
    void deleteSale_ShouldRemoveReturnSpanningTwoSales() {
        ProductResponse first = createProduct("INT-SPLIT-A", 10);
        ProductResponse second = createProduct("INT-SPLIT-B", 10);
        SaleResponse firstSale = saleService.processSale(saleOf(first.getId(), 2, "20.00", null));
        SaleResponse secondSale = saleService.processSale(saleOf(second.getId(), 2, "20.00", null));

        SaleRequest combinedReturn = SaleRequest.builder()
                .items(List.of(
                        SaleRequest.SaleItemRequest.builder().productId(first.getId()).productName("A")
                                .quantity(-1).originalSaleId(firstSale.getId()).build(),
                        SaleRequest.SaleItemRequest.builder().productId(second.getId()).productName("B")
                                .quantity(-1).originalSaleId(secondSale.getId()).build()))
                .total(new BigDecimal("-20.00"))
                .build();
        SaleResponse saleReturn = saleService.processSale(combinedReturn);
        assertNull(saleRepository.findById(saleReturn.getId()).orElseThrow().getOriginalSaleId());

        OperationResult<Void> result = saleService.deleteSale(firstSale.getId());

        assertTrue(result.isSuccess());
        assertTrue(saleRepository.findById(saleReturn.getId()).isEmpty());
        assertTrue(stockAdjustmentRepository.findByProductId(second.getId()).stream()
                .noneMatch(r -> saleReturn.getId().equals(r.getSourceId())));
        assertTrue(saleRepository.findById(secondSale.getId()).isPresent());
    }

    @Test
    void forcedDeleteOfLastVariant_ShouldLeaveParentEmptyAndDeletable() {
        ProductResponse product = productService.addProduct(ProductRequest.builder()
                .sku("INT-VAR")
                .name("Product INT-VAR")
                .retailPrice(new BigDecimal("10.00"))
                .costPrice(new BigDecimal("4.00"))
                .variants(List.of(ProductRequest.VariantRequest.builder()
                        .sku("INT-VAR-RED")
                        .options(new LinkedHashMap<>(Map.of("Color", "Red")))
                        .stock(5)
                        .build()))
                .build());
        UUID variantId = productRepository.findById(product.getId()).orElseThrow().getVariants().get(0).getId();
        assertEquals(5, productRepository.findById(product.getId()).orElseThrow().getStock());

        assertTrue(productDeletionService.deleteVariant(product.getId(), variantId, true).isSuccess());

        assertEquals(0, productRepository.findById(product.getId()).orElseThrow().getStock());
        OperationResult<Void> plainDelete = productDeletionService.deleteProduct(product.getId(), false);
        assertTrue(plainDelete.isSuccess(), plainDelete.getMessage());
    }

    @Test
    void forcedProductDelete_ShouldCascadeLedgerAndNotifications() {
        ProductResponse product = createProduct("INT-FORCE", 6);
        stockService.adjustStock(new StockAdjustmentRequest(
                product.getId(), null, 2, "Damaged"));

        assertFalse(notificationRepository.findByRelatedIdIn(List.of(product.getId())).isEmpty());
        assertFalse(productDeletionService.deleteProduct(product.getId(), false).isSuccess());

        OperationResult<Void> result = productDeletionService.deleteProduct(product.getId(), true);

        assertTrue(result.isSuccess());
        assertTrue(productRepository.findById(product.getId()).isEmpty());
        assertTrue(stockAdjustmentRepository.findByProductId(product.getId()).isEmpty());
        assertTrue(notificationRepository.findByRelatedIdIn(List.of(product.getId())).isEmpty());
        assertEquals(1, deletionRecordRepository.findByRecordId(product.getId()).size());
    }

    @Test
    void purchaseOrderReceipt_ShouldBookStockAndCompleteOrder() {
        ProductResponse product = createProduct("INT-PO", 0);
        PurchaseOrderResponse po = purchaseOrderService.addPurchaseOrder(PurchaseOrderRequest.builder()
                .supplierName("Acme Supply")
                .items(List.of(PurchaseOrderRequest.PurchaseOrderItemRequest.builder()
                        .productId(product.getId())
                        .productName(product.getName())
                        .quantityOrdered(8)
                        .costPrice(new BigDecimal("4.00"))
                        .build()))
                .build());

        PurchaseOrderResponse partial = purchaseOrderService.receivePOItems(po.getId(), new ReceiveItemsRequest(List.of(
                ReceiveItemsRequest.ReceivedItem.builder().productId(product.getId()).quantity(5).build())));
        assertEquals(PurchaseOrderStatus.PARTIAL, partial.getStatus());

        PurchaseOrderResponse received = purchaseOrderService.receivePOItems(po.getId(), new ReceiveItemsRequest(List.of(
                ReceiveItemsRequest.ReceivedItem.builder().productId(product.getId()).quantity(3).build())));

        assertEquals(PurchaseOrderStatus.RECEIVED, received.getStatus());
        assertEquals(8, productRepository.findById(product.getId()).orElseThrow().getStock());
        assertFalse(purchaseOrderService.deletePurchaseOrder(po.getId()).isSuccess());
    }

    @Test
    void shift_ShouldReconcileCashFromSalesAndReturns() {
        ProductResponse product = createProduct("INT-SHIFT", 10);
        shiftService.openShift(new BigDecimal("100.00"));

        SaleResponse sale = saleService.processSale(saleOf(product.getId(), 3, "30.00", null));
        saleService.processSale(saleOf(product.getId(), -1, "-10.00", sale.getId()));

        OperationResult<ShiftResponse> closed = shiftService.closeShift(new BigDecimal("118.00"), null);

        assertTrue(closed.isSuccess());
        assertEquals(0, new BigDecimal("120.00").compareTo(closed.getData().getExpectedCash()));
        assertEquals(0, new BigDecimal("-2.00").compareTo(closed.getData().getDifference()));
        assertTrue(shiftService.getCurrentShift().isEmpty());
    }
}
