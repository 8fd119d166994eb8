package com.RetailCore.pos_backend.repository;

import com.RetailCore.pos_backend.model.Supplier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SupplierRepository extends JpaRepository<Supplier, UUID> {

    List<Supplier> findByWorkspaceIdOrderByNameAsc(String workspaceId);

    List<Supplier> findByWorkspaceIdAndActiveTrueOrderByNameAsc(String workspaceId);

    boolean existsByWorkspaceIdAndNameIgnoreCase(String workspaceId, String name);

    boolean existsByWorkspaceIdAndNameIgnoreCaseAndIdNot(String workspaceId, String name, UUID id);

    boolean existsByPublicId(String publicId);
}
