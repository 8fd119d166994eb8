package com.RetailCore.pos_backend.repository;

import com.RetailCore.pos_backend.enums.AdjustmentSource;
import com.RetailCore.pos_backend.model.StockAdjustment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface StockAdjustmentRepository extends JpaRepository<StockAdjustment, UUID> {

    List<StockAdjustment> findByWorkspaceIdAndProductIdOrderByCreatedAtDesc(String workspaceId, UUID productId);

    List<StockAdjustment> findByProductId(UUID productId);

    List<StockAdjustment> findByProductIdIn(Collection<UUID> productIds);

    List<StockAdjustment> findByVariantId(UUID variantId);

    List<StockAdjustment> findByWorkspaceIdAndCreatedAtBefore(String workspaceId, LocalDateTime cutoff);

    /**
     * Ledger rows owned by a transaction: tagged with a structured source reference,
     * or written before the reference existed and only identifiable by their reason text.
     */
    @Query("SELECT sa FROM StockAdjustment sa WHERE sa.workspaceId = :workspaceId AND (" +
            "(sa.sourceType = :sourceType AND sa.sourceId = :sourceId) OR " +
            "(sa.sourceId IS NULL AND sa.reason IN :legacyReasons))")
    List<StockAdjustment> findOwnedBySource(@Param("workspaceId") String workspaceId,
                                            @Param("sourceType") AdjustmentSource sourceType,
                                            @Param("sourceId") UUID sourceId,
                                            @Param("legacyReasons") Collection<String> legacyReasons);
}
