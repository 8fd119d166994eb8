package com.RetailCore.pos_backend.repository;

import com.RetailCore.pos_backend.enums.SaleType;
import com.RetailCore.pos_backend.model.Sale;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface SaleRepository extends JpaRepository<Sale, UUID> {

    List<Sale> findByWorkspaceIdOrderByCreatedAtDesc(String workspaceId);

    List<Sale> findByWorkspaceIdAndType(String workspaceId, SaleType type);

    List<Sale> findByWorkspaceIdAndTypeAndCreatedAtBefore(String workspaceId, SaleType type, LocalDateTime cutoff);

    List<Sale> findByOriginalSaleIdAndType(UUID originalSaleId, SaleType type);

    // Returns linked to the sale only through one of their lines
    List<Sale> findDistinctByTypeAndItemsOriginalSaleId(SaleType type, UUID originalSaleId);

    boolean existsByPublicId(String publicId);
}
