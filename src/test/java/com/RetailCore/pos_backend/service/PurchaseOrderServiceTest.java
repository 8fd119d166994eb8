package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.config.InventoryProperties;
import com.RetailCore.pos_backend.config.ModelMapperConfig;
import com.RetailCore.pos_backend.dto.request.PurchaseOrderRequest;
import com.RetailCore.pos_backend.dto.request.ReceiveItemsRequest;
import com.RetailCore.pos_backend.dto.response.OperationResult;
import com.RetailCore.pos_backend.dto.response.PurchaseOrderResponse;
import com.RetailCore.pos_backend.enums.AdjustmentSource;
import com.RetailCore.pos_backend.enums.ErrorType;
import com.RetailCore.pos_backend.enums.NotificationType;
import com.RetailCore.pos_backend.enums.PurchaseOrderStatus;
import com.RetailCore.pos_backend.exception.ValidationException;
import com.RetailCore.pos_backend.exception.WorkspaceAccessException;
import com.RetailCore.pos_backend.model.DeletionRecord;
import com.RetailCore.pos_backend.model.PurchaseOrder;
import com.RetailCore.pos_backend.model.PurchaseOrderItem;
import com.RetailCore.pos_backend.model.Supplier;
import com.RetailCore.pos_backend.repository.DeletionRecordRepository;
import com.RetailCore.pos_backend.repository.NotificationRepository;
import com.RetailCore.pos_backend.repository.ProductRepository;
import com.RetailCore.pos_backend.repository.PurchaseOrderRepository;
import com.RetailCore.pos_backend.repository.SaleRepository;
import com.RetailCore.pos_backend.repository.StockAdjustmentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PurchaseOrderServiceTest {

    @Mock
    private PurchaseOrderRepository purchaseOrderRepository;
    @Mock
    private StockService stockService;
    @Mock
    private NotificationService notificationService;
    @Mock
    private SupplierService supplierService;
    @Mock
    private ProductRepository productRepository;
    @Mock
    private StockAdjustmentRepository stockAdjustmentRepository;
    @Mock
    private NotificationRepository notificationRepository;
    @Mock
    private SaleRepository saleRepository;
    @Mock
    private DeletionRecordRepository deletionRecordRepository;

    private PurchaseOrderService purchaseOrderService;

    private final UUID beansId = UUID.randomUUID();
    private final UUID filtersId = UUID.randomUUID();
    private PurchaseOrder purchaseOrder;

    @BeforeEach
    void setUp() {
        DeletionUnitOfWorkFactory factory = new DeletionUnitOfWorkFactory(productRepository, stockAdjustmentRepository,
                notificationRepository, saleRepository, purchaseOrderRepository, deletionRecordRepository);
        purchaseOrderService = new PurchaseOrderService(purchaseOrderRepository, stockService, notificationService,
                supplierService, factory, new FixedWorkspaceContext(), new InventoryProperties(), new ModelMapperConfig().modelMapper());

        purchaseOrder = PurchaseOrder.builder()
                .id(UUID.randomUUID())
                .workspaceId(FixedWorkspaceContext.WORKSPACE)
                .publicId("PO-ABC234")
                .supplierName("Roastery Co")
                .status(PurchaseOrderStatus.PENDING)
                .build();
        purchaseOrder.addItem(PurchaseOrderItem.builder()
                .productId(beansId).productName("Beans").quantityOrdered(10).costPrice(new BigDecimal("3.00")).build());
        purchaseOrder.addItem(PurchaseOrderItem.builder()
                .productId(filtersId).productName("Filters").quantityOrdered(5).costPrice(new BigDecimal("1.50")).build());
    }

    private void stubPoLookupAndSave() {
        when(purchaseOrderRepository.findById(purchaseOrder.getId())).thenReturn(Optional.of(purchaseOrder));
        when(purchaseOrderRepository.save(any(PurchaseOrder.class))).thenAnswer(i -> i.getArgument(0));
    }

    private ReceiveItemsRequest receive(ReceiveItemsRequest.ReceivedItem... items) {
        return new ReceiveItemsRequest(List.of(items));
    }

    private ReceiveItemsRequest.ReceivedItem item(UUID productId, int quantity) {
        return ReceiveItemsRequest.ReceivedItem.builder().productId(productId).quantity(quantity).build();
    }

    @Test
    void addPurchaseOrder_ShouldTotalLinesAndNotify() {
        when(purchaseOrderRepository.save(any(PurchaseOrder.class))).thenAnswer(i -> {
            PurchaseOrder po = i.getArgument(0);
            po.setId(UUID.randomUUID());
            return po;
        });

        PurchaseOrderRequest request = PurchaseOrderRequest.builder()
                .supplierName("Roastery Co")
                .items(List.of(
                        PurchaseOrderRequest.PurchaseOrderItemRequest.builder()
                                .productId(beansId).productName("Beans").quantityOrdered(10).costPrice(new BigDecimal("3.00")).build(),
                        PurchaseOrderRequest.PurchaseOrderItemRequest.builder()
                                .productId(filtersId).productName("Filters").quantityOrdered(4).costPrice(new BigDecimal("1.25")).build()))
                .build();

        PurchaseOrderResponse response = purchaseOrderService.addPurchaseOrder(request);

        assertEquals(PurchaseOrderStatus.PENDING, response.getStatus());
        assertEquals(0, new BigDecimal("35.00").compareTo(response.getTotalCost()));
        assertTrue(response.getPublicId().matches("PO-[0-9A-Z]{6}"));
        verify(notificationService).addNotification("New PO #" + response.getPublicId() + " created for Roastery Co.",
                NotificationType.PO, response.getId());
    }

    @Test
    void addPurchaseOrder_ShouldTakeNameFromRegisteredSupplier() {
        Supplier supplier = Supplier.builder()
                .id(UUID.randomUUID())
                .workspaceId(FixedWorkspaceContext.WORKSPACE)
                .publicId("SUP-ABC234")
                .name("Roastery Co")
                .build();
        when(supplierService.findOrderableSupplier(supplier.getId())).thenReturn(supplier);
        when(purchaseOrderRepository.save(any(PurchaseOrder.class))).thenAnswer(i -> i.getArgument(0));

        PurchaseOrderResponse response = purchaseOrderService.addPurchaseOrder(PurchaseOrderRequest.builder()
                .supplierId(supplier.getId())
                .supplierName("typed by hand")
                .items(List.of(PurchaseOrderRequest.PurchaseOrderItemRequest.builder()
                        .productId(beansId).productName("Beans").quantityOrdered(1).costPrice(new BigDecimal("3.00")).build()))
                .build());

        assertEquals("Roastery Co", response.getSupplierName());
        assertEquals(supplier.getId(), response.getSupplierId());
    }

    @Test
    void addPurchaseOrder_ShouldRequireSupplier() {
        PurchaseOrderRequest request = PurchaseOrderRequest.builder()
                .items(List.of(PurchaseOrderRequest.PurchaseOrderItemRequest.builder()
                        .productId(beansId).productName("Beans").quantityOrdered(1).costPrice(new BigDecimal("3.00")).build()))
                .build();

        assertThrows(ValidationException.class, () -> purchaseOrderService.addPurchaseOrder(request));
        verify(purchaseOrderRepository, never()).save(any());
    }

    @Test
    void receivePOItems_ShouldMoveToPartialThenReceived() {
        stubPoLookupAndSave();

        purchaseOrderService.receivePOItems(purchaseOrder.getId(), receive(item(beansId, 10)));

        assertEquals(PurchaseOrderStatus.PARTIAL, purchaseOrder.getStatus());
        verify(stockService).adjustStockBy(beansId, null, 10, "Received from PO #PO-ABC234",
                AdjustmentSource.PURCHASE_ORDER, purchaseOrder.getId());
        verify(notificationService).addNotification("PO #PO-ABC234 is now Partial.", NotificationType.PO, purchaseOrder.getId());

        purchaseOrderService.receivePOItems(purchaseOrder.getId(), receive(item(filtersId, 2), item(filtersId, 3)));

        assertEquals(5, purchaseOrder.getItems().get(1).getQuantityReceived());
        assertEquals(PurchaseOrderStatus.RECEIVED, purchaseOrder.getStatus());
        verify(notificationService).addNotification("PO #PO-ABC234 is now Received.", NotificationType.PO, purchaseOrder.getId());
    }

    @Test
    void receivePOItems_ShouldStayPendingWhenNothingArrives() {
        stubPoLookupAndSave();

        purchaseOrderService.receivePOItems(purchaseOrder.getId(), receive(item(beansId, 0)));

        assertEquals(PurchaseOrderStatus.PENDING, purchaseOrder.getStatus());
        verifyNoInteractions(stockService, notificationService);
    }

    @Test
    void receivePOItems_ShouldNotNotifyWithoutStatusChange() {
        purchaseOrder.getItems().get(0).setQuantityReceived(2);
        purchaseOrder.setStatus(PurchaseOrderStatus.PARTIAL);
        stubPoLookupAndSave();

        purchaseOrderService.receivePOItems(purchaseOrder.getId(), receive(item(beansId, 3)));

        assertEquals(5, purchaseOrder.getItems().get(0).getQuantityReceived());
        assertEquals(PurchaseOrderStatus.PARTIAL, purchaseOrder.getStatus());
        verifyNoInteractions(notificationService);
    }

    @Test
    void receivePOItems_ShouldRejectOrderFromAnotherWorkspace() {
        purchaseOrder.setWorkspaceId("ws-other");
        when(purchaseOrderRepository.findById(purchaseOrder.getId())).thenReturn(Optional.of(purchaseOrder));

        assertThrows(WorkspaceAccessException.class,
                () -> purchaseOrderService.receivePOItems(purchaseOrder.getId(), receive(item(beansId, 1))));
        verifyNoInteractions(stockService);
    }

    @Test
    void deletePurchaseOrder_ShouldOnlyAllowPending() {
        purchaseOrder.setStatus(PurchaseOrderStatus.PARTIAL);
        when(purchaseOrderRepository.findById(purchaseOrder.getId())).thenReturn(Optional.of(purchaseOrder));

        OperationResult<Void> result = purchaseOrderService.deletePurchaseOrder(purchaseOrder.getId());

        assertFalse(result.isSuccess());
        assertEquals(ErrorType.PRECONDITION_FAILED, result.getErrorType());
        assertEquals("Only POs with Pending status can be deleted.", result.getMessage());
        verify(purchaseOrderRepository, never()).deleteAll(any());
    }

    @Test
    void deletePurchaseOrder_ShouldRemovePendingOrderWithTombstone() {
        when(purchaseOrderRepository.findById(purchaseOrder.getId())).thenReturn(Optional.of(purchaseOrder));

        OperationResult<Void> result = purchaseOrderService.deletePurchaseOrder(purchaseOrder.getId());

        assertTrue(result.isSuccess());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DeletionRecord>> tombstones = ArgumentCaptor.forClass(List.class);
        verify(deletionRecordRepository).saveAll(tombstones.capture());
        assertEquals(1, tombstones.getValue().size());
        assertEquals(purchaseOrder.getId(), tombstones.getValue().get(0).getRecordId());
        assertEquals(DeletionRecord.PURCHASE_ORDERS, tombstones.getValue().get(0).getTableName());
    }
}
