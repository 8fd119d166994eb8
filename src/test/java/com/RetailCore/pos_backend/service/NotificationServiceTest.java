package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.config.ModelMapperConfig;
import com.RetailCore.pos_backend.dto.response.NotificationResponse;
import com.RetailCore.pos_backend.enums.NotificationType;
import com.RetailCore.pos_backend.exception.WorkspaceAccessException;
import com.RetailCore.pos_backend.model.DeletionRecord;
import com.RetailCore.pos_backend.model.Notification;
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

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private NotificationRepository notificationRepository;
    @Mock
    private DeletionRecordRepository deletionRecordRepository;
    @Mock
    private ProductRepository productRepository;
    @Mock
    private StockAdjustmentRepository stockAdjustmentRepository;
    @Mock
    private SaleRepository saleRepository;
    @Mock
    private PurchaseOrderRepository purchaseOrderRepository;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        DeletionUnitOfWorkFactory factory = new DeletionUnitOfWorkFactory(productRepository, stockAdjustmentRepository,
                notificationRepository, saleRepository, purchaseOrderRepository, deletionRecordRepository);
        notificationService = new NotificationService(notificationRepository, factory, new FixedWorkspaceContext(),
                new ModelMapperConfig().modelMapper());
    }

    private Notification notification(String workspaceId, boolean read) {
        return Notification.builder()
                .id(UUID.randomUUID())
                .workspaceId(workspaceId)
                .message("Low stock: Cola (3 left)")
                .type(NotificationType.STOCK)
                .read(read)
                .build();
    }

    @Test
    void addNotification_ShouldStampWorkspaceAndStartUnread() {
        UUID productId = UUID.randomUUID();
        when(notificationRepository.save(any(Notification.class))).thenAnswer(i -> i.getArgument(0));

        Notification saved = notificationService.addNotification("PO #PO-1 is now Received.", NotificationType.PO, productId);

        assertEquals(FixedWorkspaceContext.WORKSPACE, saved.getWorkspaceId());
        assertEquals(productId, saved.getRelatedId());
        assertFalse(saved.isRead());
    }

    @Test
    void markAsRead_ShouldRejectOtherWorkspace() {
        Notification foreign = notification("ws-other", false);
        when(notificationRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

        assertThrows(WorkspaceAccessException.class, () -> notificationService.markAsRead(foreign.getId()));
        verify(notificationRepository, never()).save(any());
    }

    @Test
    void markAsRead_ShouldFlagNotification() {
        Notification own = notification(FixedWorkspaceContext.WORKSPACE, false);
        when(notificationRepository.findById(own.getId())).thenReturn(Optional.of(own));
        when(notificationRepository.save(own)).thenReturn(own);

        NotificationResponse response = notificationService.markAsRead(own.getId());

        assertTrue(response.isRead());
    }

    @Test
    void markAllAsRead_ShouldReturnUpdatedCount() {
        List<Notification> unread = List.of(
                notification(FixedWorkspaceContext.WORKSPACE, false),
                notification(FixedWorkspaceContext.WORKSPACE, false));
        when(notificationRepository.findByWorkspaceIdAndReadFalse(FixedWorkspaceContext.WORKSPACE)).thenReturn(unread);

        assertEquals(2, notificationService.markAllAsRead());
        assertTrue(unread.stream().allMatch(Notification::isRead));
    }

    @Test
    @SuppressWarnings("unchecked")
    void clearNotifications_ShouldLeaveTombstones() {
        List<Notification> all = List.of(
                notification(FixedWorkspaceContext.WORKSPACE, true),
                notification(FixedWorkspaceContext.WORKSPACE, false));
        when(notificationRepository.findByWorkspaceIdOrderByCreatedAtDesc(FixedWorkspaceContext.WORKSPACE)).thenReturn(all);

        int cleared = notificationService.clearNotifications();

        assertEquals(2, cleared);
        ArgumentCaptor<Collection<Notification>> deleted = ArgumentCaptor.forClass(Collection.class);
        verify(notificationRepository).deleteAll(deleted.capture());
        assertEquals(2, deleted.getValue().size());
        ArgumentCaptor<List<DeletionRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(deletionRecordRepository).saveAll(captor.capture());
        assertEquals(2, captor.getValue().size());
        assertTrue(captor.getValue().stream().allMatch(r -> DeletionRecord.NOTIFICATIONS.equals(r.getTableName())));
    }
}
