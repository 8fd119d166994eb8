package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.config.InventoryProperties;
import com.RetailCore.pos_backend.config.ModelMapperConfig;
import com.RetailCore.pos_backend.dto.request.HoldOrderRequest;
import com.RetailCore.pos_backend.dto.request.SaleRequest;
import com.RetailCore.pos_backend.dto.response.HeldOrderResponse;
import com.RetailCore.pos_backend.dto.response.OperationResult;
import com.RetailCore.pos_backend.enums.ErrorType;
import com.RetailCore.pos_backend.model.HeldOrder;
import com.RetailCore.pos_backend.repository.HeldOrderRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.modelmapper.ModelMapper;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HeldOrderServiceTest {

    @Mock
    private HeldOrderRepository heldOrderRepository;
    @Spy
    private FixedWorkspaceContext workspaceContext = new FixedWorkspaceContext();
    @Spy
    private InventoryProperties inventoryProperties = new InventoryProperties();
    @Spy
    private ModelMapper modelMapper = new ModelMapperConfig().modelMapper();

    @InjectMocks
    private HeldOrderService heldOrderService;

    private SaleRequest.SaleItemRequest line(String name, int quantity, String price) {
        return SaleRequest.SaleItemRequest.builder()
                .productId(UUID.randomUUID())
                .productName(name)
                .quantity(quantity)
                .retailPrice(new BigDecimal(price))
                .build();
    }

    @Test
    void holdOrder_ShouldKeepLinesUnderHeldPublicId() {
        when(heldOrderRepository.save(any(HeldOrder.class))).thenAnswer(i -> i.getArgument(0));

        HeldOrderResponse response = heldOrderService.holdOrder(HoldOrderRequest.builder()
                .items(List.of(line("Latte", 2, "4.50"), line("Muffin", 1, "3.00")))
                .note("Table 4")
                .build());

        assertTrue(response.getPublicId().matches("HLD-[0-9A-Z]{4}"));
        assertEquals(2, response.getLines().size());
        assertEquals("Latte", response.getLines().get(0).getProductName());
        assertEquals(0, new BigDecimal("12.00").compareTo(response.getTotal()));
        assertEquals("Alice", response.getHeldByName());
    }

    @Test
    void deleteHeldOrder_ShouldRejectOtherWorkspace() {
        HeldOrder foreign = HeldOrder.builder().id(UUID.randomUUID()).workspaceId("ws-other").publicId("HLD-AB23").build();
        when(heldOrderRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

        OperationResult<Void> result = heldOrderService.deleteHeldOrder(foreign.getId());

        assertFalse(result.isSuccess());
        assertEquals(ErrorType.ACCESS_DENIED, result.getErrorType());
        verify(heldOrderRepository, never()).delete(any());
    }

    @Test
    void deleteHeldOrder_ShouldRemoveOwnOrder() {
        HeldOrder own = HeldOrder.builder()
                .id(UUID.randomUUID())
                .workspaceId(FixedWorkspaceContext.WORKSPACE)
                .publicId("HLD-CD45")
                .build();
        when(heldOrderRepository.findById(own.getId())).thenReturn(Optional.of(own));

        OperationResult<Void> result = heldOrderService.deleteHeldOrder(own.getId());

        assertTrue(result.isSuccess());
        verify(heldOrderRepository).delete(own);
    }

    @Test
    void deleteHeldOrder_ShouldReportMissingOrder() {
        UUID id = UUID.randomUUID();
        when(heldOrderRepository.findById(id)).thenReturn(Optional.empty());

        assertEquals(ErrorType.NOT_FOUND, heldOrderService.deleteHeldOrder(id).getErrorType());
    }
}
