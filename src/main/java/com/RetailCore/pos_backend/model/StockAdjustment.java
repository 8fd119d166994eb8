package com.RetailCore.pos_backend.model;

import com.RetailCore.pos_backend.enums.AdjustmentSource;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One immutable ledger row: a signed stock delta against a product or one of its variants.
 */
@Entity
@Table(name = "stock_adjustments", indexes = {
        @Index(name = "idx_adjustment_product", columnList = "product_id"),
        @Index(name = "idx_adjustment_source", columnList = "source_type, source_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StockAdjustment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    // Plain ids rather than associations: rows may outlive a product until cleanup
    @Column(name = "product_id", nullable = false)
    private UUID productId;

    @Column(name = "variant_id")
    private UUID variantId;

    @Column(nullable = false)
    private int quantity;

    @Column(nullable = false)
    private int previousStock;

    @Column(nullable = false)
    private int newStock;

    @Column(nullable = false)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type")
    private AdjustmentSource sourceType;

    @Column(name = "source_id")
    private UUID sourceId;

    private UUID performedById;

    private String performedByName;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
