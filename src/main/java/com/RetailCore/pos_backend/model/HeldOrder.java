package com.RetailCore.pos_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A cart parked at the till so it can be picked up again later. Holding an order
 * reserves no stock.
 */
@Entity
@Table(name = "held_orders", indexes = @Index(name = "idx_held_order_workspace", columnList = "workspace_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HeldOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    @Column(name = "public_id", nullable = false, unique = true)
    private String publicId;

    @Column(length = 500)
    private String note;

    @ElementCollection
    @CollectionTable(name = "held_order_lines", joinColumns = @JoinColumn(name = "held_order_id"))
    @Builder.Default
    private List<HeldOrderLine> lines = new ArrayList<>();

    private UUID heldById;

    private String heldByName;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    public BigDecimal getTotal() {
        return lines.stream()
                .filter(l -> l.getRetailPrice() != null)
                .map(l -> l.getRetailPrice().multiply(BigDecimal.valueOf(l.getQuantity())))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
