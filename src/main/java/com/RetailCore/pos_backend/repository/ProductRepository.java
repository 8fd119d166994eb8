package com.RetailCore.pos_backend.repository;

import com.RetailCore.pos_backend.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ProductRepository extends JpaRepository<Product, UUID> {

    List<Product> findByWorkspaceIdOrderByNameAsc(String workspaceId);

    List<Product> findByWorkspaceIdAndIdIn(String workspaceId, Collection<UUID> ids);

    boolean existsByWorkspaceIdAndSku(String workspaceId, String sku);

    List<Product> findByWorkspaceIdAndSkuIn(String workspaceId, Collection<String> skus);
}
