package com.RetailCore.pos_backend.repository;

import com.RetailCore.pos_backend.enums.PurchaseOrderStatus;
import com.RetailCore.pos_backend.model.PurchaseOrder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface PurchaseOrderRepository extends JpaRepository<PurchaseOrder, UUID> {

    List<PurchaseOrder> findByWorkspaceIdOrderByDateCreatedDesc(String workspaceId);

    List<PurchaseOrder> findByWorkspaceIdAndDateCreatedBefore(String workspaceId, LocalDateTime cutoff);

    long countByWorkspaceIdAndStatus(String workspaceId, PurchaseOrderStatus status);

    boolean existsByPublicId(String publicId);
}
