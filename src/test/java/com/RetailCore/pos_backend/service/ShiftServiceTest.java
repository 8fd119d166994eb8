package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.config.ModelMapperConfig;
import com.RetailCore.pos_backend.dto.response.OperationResult;
import com.RetailCore.pos_backend.dto.response.ShiftResponse;
import com.RetailCore.pos_backend.enums.ErrorType;
import com.RetailCore.pos_backend.enums.NotificationType;
import com.RetailCore.pos_backend.enums.ShiftStatus;
import com.RetailCore.pos_backend.model.Shift;
import com.RetailCore.pos_backend.repository.ShiftRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.modelmapper.ModelMapper;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ShiftServiceTest {

    @Mock
    private ShiftRepository shiftRepository;
    @Mock
    private NotificationService notificationService;
    @Spy
    private FixedWorkspaceContext workspaceContext = new FixedWorkspaceContext();
    @Spy
    private ModelMapper modelMapper = new ModelMapperConfig().modelMapper();

    @InjectMocks
    private ShiftService shiftService;

    private Shift openShift(String startFloat) {
        return Shift.builder()
                .id(UUID.randomUUID())
                .workspaceId(FixedWorkspaceContext.WORKSPACE)
                .openedByName("Alice")
                .startTime(LocalDateTime.now().minusHours(4))
                .startFloat(new BigDecimal(startFloat))
                .status(ShiftStatus.OPEN)
                .build();
    }

    @Test
    void openShift_ShouldStartWithEmptyAccumulators() {
        when(shiftRepository.findFirstByWorkspaceIdAndStatus(FixedWorkspaceContext.WORKSPACE, ShiftStatus.OPEN))
                .thenReturn(Optional.empty());
        when(shiftRepository.save(any(Shift.class))).thenAnswer(i -> i.getArgument(0));

        ShiftResponse response = shiftService.openShift(new BigDecimal("100.00"));

        assertEquals(ShiftStatus.OPEN, response.getStatus());
        assertEquals(0, BigDecimal.ZERO.compareTo(response.getCashSales()));
        assertEquals(0, BigDecimal.ZERO.compareTo(response.getCashRefunds()));
        assertEquals("Alice", response.getOpenedByName());
        verify(notificationService).addNotification(startsWith("Shift opened by Alice"), eq(NotificationType.USER), any());
    }

    @Test
    void openShift_ShouldKeepExistingOpenShift() {
        Shift existing = openShift("50.00");
        when(shiftRepository.findFirstByWorkspaceIdAndStatus(FixedWorkspaceContext.WORKSPACE, ShiftStatus.OPEN))
                .thenReturn(Optional.of(existing));

        ShiftResponse response = shiftService.openShift(new BigDecimal("100.00"));

        assertEquals(existing.getId(), response.getId());
        assertEquals(0, new BigDecimal("50.00").compareTo(response.getStartFloat()));
        verify(shiftRepository, never()).save(any());
        verifyNoInteractions(notificationService);
    }

    @Test
    void closeShift_ShouldReconcileCountedCash() {
        Shift shift = openShift("100.00");
        shift.setCashSales(new BigDecimal("50.00"));
        shift.setCashRefunds(new BigDecimal("10.00"));
        when(shiftRepository.findFirstByWorkspaceIdAndStatus(FixedWorkspaceContext.WORKSPACE, ShiftStatus.OPEN))
                .thenReturn(Optional.of(shift));
        when(shiftRepository.save(any(Shift.class))).thenAnswer(i -> i.getArgument(0));

        OperationResult<ShiftResponse> result = shiftService.closeShift(new BigDecimal("135.00"), "Short a fiver");

        assertTrue(result.isSuccess());
        ShiftResponse closed = result.getData();
        assertEquals(ShiftStatus.CLOSED, closed.getStatus());
        assertEquals(0, new BigDecimal("140.00").compareTo(closed.getExpectedCash()));
        assertEquals(0, new BigDecimal("-5.00").compareTo(closed.getDifference()));
        assertEquals("Short a fiver", closed.getNotes());
        assertEquals("Alice", closed.getClosedByName());
        assertNotNull(closed.getEndTime());
        verify(notificationService).addNotification(startsWith("Shift closed by Alice"), eq(NotificationType.USER), eq(shift.getId()));
    }

    @Test
    void closeShift_ShouldFailWithoutOpenShift() {
        when(shiftRepository.findFirstByWorkspaceIdAndStatus(FixedWorkspaceContext.WORKSPACE, ShiftStatus.OPEN))
                .thenReturn(Optional.empty());

        OperationResult<ShiftResponse> result = shiftService.closeShift(new BigDecimal("10.00"), null);

        assertFalse(result.isSuccess());
        assertEquals(ErrorType.NO_ACTIVE_SHIFT, result.getErrorType());
    }

    @Test
    void recordCashMovement_ShouldSplitSalesAndRefunds() {
        Shift shift = openShift("0.00");
        when(shiftRepository.findFirstByWorkspaceIdAndStatus(FixedWorkspaceContext.WORKSPACE, ShiftStatus.OPEN))
                .thenReturn(Optional.of(shift));

        shiftService.recordCashMovement(new BigDecimal("25.00"));
        shiftService.recordCashMovement(new BigDecimal("-7.50"));

        assertEquals(0, new BigDecimal("25.00").compareTo(shift.getCashSales()));
        assertEquals(0, new BigDecimal("7.50").compareTo(shift.getCashRefunds()));
        verify(shiftRepository, times(2)).save(shift);
    }

    @Test
    void recordCashMovement_ShouldIgnoreMissingShift() {
        when(shiftRepository.findFirstByWorkspaceIdAndStatus(FixedWorkspaceContext.WORKSPACE, ShiftStatus.OPEN))
                .thenReturn(Optional.empty());

        shiftService.recordCashMovement(new BigDecimal("25.00"));

        verify(shiftRepository, never()).save(any());
    }
}
