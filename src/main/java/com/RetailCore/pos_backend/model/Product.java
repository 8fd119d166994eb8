package com.RetailCore.pos_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Entity
@Table(name = "products",
        uniqueConstraints = @UniqueConstraint(columnNames = {"workspace_id", "sku"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Product {

    // Assigned by the service layer so a deleted product can be restored under its old id
    @Id
    private UUID id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    @Column(nullable = false)
    private String sku;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal retailPrice = BigDecimal.ZERO;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal costPrice = BigDecimal.ZERO;

    @Builder.Default
    private int stock = 0;

    @Builder.Default
    private int lowStockThreshold = 5;

    @ElementCollection
    @CollectionTable(name = "product_price_history", joinColumns = @JoinColumn(name = "product_id"))
    @OrderColumn(name = "entry_index")
    @Builder.Default
    private List<PriceHistoryEntry> priceHistory = new ArrayList<>();

    @OneToMany(mappedBy = "product", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt ASC")
    @Builder.Default
    private List<ProductVariant> variants = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "product_categories", joinColumns = @JoinColumn(name = "product_id"))
    @Column(name = "category_id")
    @Builder.Default
    private List<UUID> categoryIds = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean hasVariants() {
        return variants != null && !variants.isEmpty();
    }

    public Optional<ProductVariant> findVariant(UUID variantId) {
        if (variantId == null || variants == null) {
            return Optional.empty();
        }
        return variants.stream()
                .filter(v -> variantId.equals(v.getId()))
                .findFirst();
    }

    public void addVariant(ProductVariant variant) {
        variant.setProduct(this);
        variants.add(variant);
    }

    /**
     * Keeps {@code stock} equal to the variant sum whenever variants exist.
     */
    public int recalculateStock() {
        if (hasVariants()) {
            stock = variants.stream().mapToInt(ProductVariant::getStock).sum();
        }
        return stock;
    }

    public int getTotalStock() {
        return hasVariants()
                ? variants.stream().mapToInt(ProductVariant::getStock).sum()
                : stock;
    }

    @Override
    public String toString() {
        return "Product{" +
                "id=" + id +
                ", sku='" + sku + '\'' +
                ", name='" + name + '\'' +
                ", stock=" + stock +
                ", variants=" + (variants != null ? variants.size() : 0) +
                '}';
    }
}
