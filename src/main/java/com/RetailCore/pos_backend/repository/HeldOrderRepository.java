package com.RetailCore.pos_backend.repository;

import com.RetailCore.pos_backend.model.HeldOrder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface HeldOrderRepository extends JpaRepository<HeldOrder, UUID> {

    List<HeldOrder> findByWorkspaceIdOrderByCreatedAtDesc(String workspaceId);

    boolean existsByPublicId(String publicId);
}
