package com.RetailCore.pos_backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "purchase_order_items")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PurchaseOrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "purchase_order_id", nullable = false)
    private PurchaseOrder purchaseOrder;

    @Column(name = "product_id", nullable = false)
    private UUID productId;

    @Column(name = "variant_id")
    private UUID variantId;

    @Column(nullable = false)
    private String productName;

    @Column(nullable = false)
    private int quantityOrdered;

    @Builder.Default
    private int quantityReceived = 0;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal costPrice;

    public boolean matches(UUID productId, UUID variantId) {
        return Objects.equals(this.productId, productId) && Objects.equals(this.variantId, variantId);
    }

    public boolean isFullyReceived() {
        return quantityReceived >= quantityOrdered;
    }

    public BigDecimal getLineCost() {
        if (costPrice == null) {
            return BigDecimal.ZERO;
        }
        return costPrice.multiply(BigDecimal.valueOf(quantityOrdered));
    }
}
