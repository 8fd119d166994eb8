package com.RetailCore.pos_backend.model;

import com.RetailCore.pos_backend.enums.PaymentType;
import com.RetailCore.pos_backend.enums.SaleStatus;
import com.RetailCore.pos_backend.enums.SaleType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "sales")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Sale {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    // Human-facing receipt number, TRX-XXXXXXXX or RET-XXXXXXXX
    @Column(name = "public_id", unique = true, nullable = false, updatable = false)
    private String publicId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SaleType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private SaleStatus status = SaleStatus.COMPLETED;

    @Column(name = "original_sale_id")
    private UUID originalSaleId;

    @Column(name = "original_sale_public_id")
    private String originalSalePublicId;

    @Column(precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal subtotal = BigDecimal.ZERO;

    @Column(precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal tax = BigDecimal.ZERO;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal total;

    @Column(precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal costOfGoodsSold = BigDecimal.ZERO;

    @OneToMany(mappedBy = "sale", cascade = CascadeType.ALL, orphanRemoval = true)
    @Builder.Default
    private List<SaleItem> items = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "sale_payments", joinColumns = @JoinColumn(name = "sale_id"))
    @Builder.Default
    private List<SalePayment> payments = new ArrayList<>();

    private UUID cashierId;

    private String cashierName;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    public void addItem(SaleItem item) {
        item.setSale(this);
        items.add(item);
    }

    public BigDecimal getCashAmount() {
        if (payments == null) {
            return BigDecimal.ZERO;
        }
        return payments.stream()
                .filter(p -> p.getType() == PaymentType.CASH && p.getAmount() != null)
                .map(SalePayment::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Re-derives the refund status from the items' returned quantities.
     * A sale that has reached REFUNDED stays there.
     */
    public SaleStatus recalculateRefundStatus() {
        if (status == SaleStatus.REFUNDED) {
            return status;
        }
        boolean anyReturned = items.stream().anyMatch(i -> i.getReturnedQuantity() > 0);
        if (!anyReturned) {
            return status;
        }
        boolean allReturned = items.stream().allMatch(SaleItem::isFullyReturned);
        status = allReturned ? SaleStatus.REFUNDED : SaleStatus.PARTIALLY_REFUNDED;
        return status;
    }

    public BigDecimal calculateProfit() {
        if (total != null && costOfGoodsSold != null) {
            return total.subtract(costOfGoodsSold);
        }
        return BigDecimal.ZERO;
    }
}
