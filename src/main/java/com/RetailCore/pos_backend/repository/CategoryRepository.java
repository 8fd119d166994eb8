package com.RetailCore.pos_backend.repository;

import com.RetailCore.pos_backend.model.Category;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CategoryRepository extends JpaRepository<Category, UUID> {

    Optional<Category> findByWorkspaceIdAndNameAndParentIdIsNull(String workspaceId, String name);
}
