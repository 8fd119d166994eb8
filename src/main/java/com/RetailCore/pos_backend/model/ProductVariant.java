package com.RetailCore.pos_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "product_variants")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProductVariant {

    @Id
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    private String sku;

    // e.g. {"Size": "M", "Color": "Blue"}
    @ElementCollection
    @CollectionTable(name = "product_variant_options", joinColumns = @JoinColumn(name = "variant_id"))
    @MapKeyColumn(name = "option_name")
    @Column(name = "option_value")
    @Builder.Default
    private Map<String, String> options = new LinkedHashMap<>();

    @Builder.Default
    private int stock = 0;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal costPrice = BigDecimal.ZERO;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal retailPrice = BigDecimal.ZERO;

    @ElementCollection
    @CollectionTable(name = "variant_price_history", joinColumns = @JoinColumn(name = "variant_id"))
    @OrderColumn(name = "entry_index")
    @Builder.Default
    private List<PriceHistoryEntry> priceHistory = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public String getLabel() {
        return options == null || options.isEmpty() ? "" : String.join(" / ", options.values());
    }
}
