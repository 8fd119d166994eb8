package com.RetailCore.pos_backend.model;

import com.RetailCore.pos_backend.enums.ShiftStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "shifts", indexes = @Index(name = "idx_shift_status", columnList = "workspace_id, status"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Shift {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    private UUID openedById;

    private String openedByName;

    @Column(nullable = false)
    private LocalDateTime startTime;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal startFloat;

    @Column(nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal cashSales = BigDecimal.ZERO;

    @Column(nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal cashRefunds = BigDecimal.ZERO;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private ShiftStatus status = ShiftStatus.OPEN;

    private UUID closedById;

    private String closedByName;

    private LocalDateTime endTime;

    @Column(precision = 12, scale = 2)
    private BigDecimal expectedCash;

    @Column(precision = 12, scale = 2)
    private BigDecimal actualCash;

    @Column(precision = 12, scale = 2)
    private BigDecimal difference;

    @Column(columnDefinition = "TEXT")
    private String notes;

    public BigDecimal calculateExpectedCash() {
        return startFloat.add(cashSales).subtract(cashRefunds);
    }
}
