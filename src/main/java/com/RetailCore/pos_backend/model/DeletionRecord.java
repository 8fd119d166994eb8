package com.RetailCore.pos_backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Tombstone left behind for every deleted row so downstream sync can replay the delete.
 */
@Entity
@Table(name = "deletion_records", indexes = @Index(name = "idx_deletion_record", columnList = "record_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeletionRecord {

    public static final String PRODUCTS = "products";
    public static final String PRODUCT_VARIANTS = "product_variants";
    public static final String STOCK_ADJUSTMENTS = "stock_adjustments";
    public static final String NOTIFICATIONS = "notifications";
    public static final String SALES = "sales";
    public static final String PURCHASE_ORDERS = "purchase_orders";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    @Column(name = "record_id", nullable = false)
    private UUID recordId;

    @Column(name = "table_name", nullable = false)
    private String tableName;

    @Column(nullable = false)
    private LocalDateTime deletedAt;
}
