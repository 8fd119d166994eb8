package com.RetailCore.pos_backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "sale_items")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SaleItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "sale_id", nullable = false)
    private Sale sale;

    @Column(name = "product_id", nullable = false)
    private UUID productId;

    @Column(name = "variant_id")
    private UUID variantId;

    // Snapshot of the product at the time of sale
    @Column(nullable = false)
    private String productName;

    private String sku;

    private String variantLabel;

    // Negative for a returned line
    @Column(nullable = false)
    private int quantity;

    @Column(precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal costPrice = BigDecimal.ZERO;

    @Column(precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal retailPrice = BigDecimal.ZERO;

    @Builder.Default
    private int returnedQuantity = 0;

    @Column(name = "original_sale_id")
    private UUID originalSaleId;

    public boolean matches(UUID productId, UUID variantId) {
        return Objects.equals(this.productId, productId) && Objects.equals(this.variantId, variantId);
    }

    public boolean isFullyReturned() {
        return returnedQuantity >= quantity;
    }

    public BigDecimal calculateCostOfGoodsSold() {
        if (costPrice != null) {
            return costPrice.multiply(BigDecimal.valueOf(quantity));
        }
        return BigDecimal.ZERO;
    }
}
