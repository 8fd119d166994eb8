package com.RetailCore.pos_backend.model;

import com.RetailCore.pos_backend.enums.PurchaseOrderStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "purchase_orders")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PurchaseOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    @Column(name = "public_id", unique = true, nullable = false, updatable = false)
    private String publicId;

    private UUID supplierId;

    private String supplierName;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime dateCreated;

    private LocalDate dateExpected;

    @OneToMany(mappedBy = "purchaseOrder", cascade = CascadeType.ALL, orphanRemoval = true)
    @Builder.Default
    private List<PurchaseOrderItem> items = new ArrayList<>();

    @Column(nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal totalCost = BigDecimal.ZERO;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private PurchaseOrderStatus status = PurchaseOrderStatus.PENDING;

    public void addItem(PurchaseOrderItem item) {
        item.setPurchaseOrder(this);
        items.add(item);
    }

    public BigDecimal recalculateTotalCost() {
        totalCost = items.stream()
                .map(PurchaseOrderItem::getLineCost)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return totalCost;
    }

    /**
     * RECEIVED once every line is fully received, PARTIAL once anything has arrived.
     * Never moves backwards.
     */
    public PurchaseOrderStatus recalculateStatus() {
        if (status == PurchaseOrderStatus.RECEIVED) {
            return status;
        }
        boolean allReceived = items.stream().allMatch(PurchaseOrderItem::isFullyReceived);
        boolean anyReceived = items.stream().anyMatch(i -> i.getQuantityReceived() > 0);

        if (allReceived && anyReceived) {
            status = PurchaseOrderStatus.RECEIVED;
        } else if (anyReceived) {
            status = PurchaseOrderStatus.PARTIAL;
        }
        return status;
    }
}
