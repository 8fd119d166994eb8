package com.RetailCore.pos_backend.repository;

import com.RetailCore.pos_backend.model.DeletionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DeletionRecordRepository extends JpaRepository<DeletionRecord, UUID> {

    List<DeletionRecord> findByRecordId(UUID recordId);

    List<DeletionRecord> findByWorkspaceIdAndTableName(String workspaceId, String tableName);
}
