package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.dto.response.OperationResult;
import com.RetailCore.pos_backend.dto.response.ShiftResponse;
import com.RetailCore.pos_backend.enums.ErrorType;
import com.RetailCore.pos_backend.enums.NotificationType;
import com.RetailCore.pos_backend.enums.ShiftStatus;
import com.RetailCore.pos_backend.model.Shift;
import com.RetailCore.pos_backend.repository.ShiftRepository;
import com.RetailCore.pos_backend.security.Actor;
import com.RetailCore.pos_backend.security.WorkspaceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Cash drawer shifts. A workspace has at most one open shift, looked up by status.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShiftService {

    private final ShiftRepository shiftRepository;
    private final NotificationService notificationService;
    private final WorkspaceContext workspaceContext;
    private final ModelMapper modelMapper;

    /**
     * Opens a shift with the given float. When one is already open it is returned unchanged.
     */
    @Transactional
    public ShiftResponse openShift(BigDecimal startFloat) {
        String workspaceId = workspaceContext.getWorkspaceId();
        Optional<Shift> current = shiftRepository.findFirstByWorkspaceIdAndStatus(workspaceId, ShiftStatus.OPEN);
        if (current.isPresent()) {
            log.warn("Shift already open in workspace {}, ignoring open request", workspaceId);
            return mapToResponse(current.get());
        }

        Actor actor = workspaceContext.getCurrentActor();
        Shift shift = Shift.builder()
                .workspaceId(workspaceId)
                .openedById(actor.getId())
                .openedByName(actor.getName())
                .startTime(LocalDateTime.now())
                .startFloat(startFloat)
                .cashSales(BigDecimal.ZERO)
                .cashRefunds(BigDecimal.ZERO)
                .status(ShiftStatus.OPEN)
                .build();
        Shift saved = shiftRepository.save(shift);

        notificationService.addNotification("Shift opened by " + actor.getName() + " with a float of " + startFloat + ".",
                NotificationType.USER, saved.getId());

        log.info("Shift opened by {} with float {}", actor.getName(), startFloat);
        return mapToResponse(saved);
    }

    @Transactional
    public OperationResult<ShiftResponse> closeShift(BigDecimal actualCash, String notes) {
        String workspaceId = workspaceContext.getWorkspaceId();
        Optional<Shift> current = shiftRepository.findFirstByWorkspaceIdAndStatus(workspaceId, ShiftStatus.OPEN);
        if (current.isEmpty()) {
            return OperationResult.failure(ErrorType.NO_ACTIVE_SHIFT, "No active shift to close.");
        }

        Shift shift = current.get();
        Actor actor = workspaceContext.getCurrentActor();
        BigDecimal expected = shift.calculateExpectedCash();
        BigDecimal difference = actualCash.subtract(expected);

        shift.setExpectedCash(expected);
        shift.setActualCash(actualCash);
        shift.setDifference(difference);
        shift.setNotes(notes);
        shift.setClosedById(actor.getId());
        shift.setClosedByName(actor.getName());
        shift.setEndTime(LocalDateTime.now());
        shift.setStatus(ShiftStatus.CLOSED);
        Shift saved = shiftRepository.save(shift);

        notificationService.addNotification("Shift closed by " + actor.getName() + ". Difference: " + difference + ".",
                NotificationType.USER, saved.getId());

        log.info("Shift closed by {}: expected {}, counted {}, difference {}", actor.getName(), expected, actualCash, difference);
        return OperationResult.ok(mapToResponse(saved), "Shift closed.");
    }

    /**
     * Adds a sale's cash to the open shift: positive amounts as cash sales, negative
     * amounts as cash refunds. Without an open shift nothing is recorded.
     */
    @Transactional
    public void recordCashMovement(BigDecimal cashAmount) {
        if (cashAmount == null || cashAmount.signum() == 0) {
            return;
        }

        Optional<Shift> current = shiftRepository.findFirstByWorkspaceIdAndStatus(
                workspaceContext.getWorkspaceId(), ShiftStatus.OPEN);
        if (current.isEmpty()) {
            log.debug("No open shift, cash movement of {} not recorded", cashAmount);
            return;
        }

        Shift shift = current.get();
        if (cashAmount.signum() > 0) {
            shift.setCashSales(shift.getCashSales().add(cashAmount));
        } else {
            shift.setCashRefunds(shift.getCashRefunds().add(cashAmount.abs()));
        }
        shiftRepository.save(shift);
    }

    @Transactional(readOnly = true)
    public Optional<ShiftResponse> getCurrentShift() {
        return shiftRepository.findFirstByWorkspaceIdAndStatus(workspaceContext.getWorkspaceId(), ShiftStatus.OPEN)
                .map(this::mapToResponse);
    }

    @Transactional(readOnly = true)
    public List<ShiftResponse> getShiftHistory() {
        return shiftRepository.findByWorkspaceIdOrderByStartTimeDesc(workspaceContext.getWorkspaceId())
                .stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    private ShiftResponse mapToResponse(Shift shift) {
        return modelMapper.map(shift, ShiftResponse.class);
    }
}
