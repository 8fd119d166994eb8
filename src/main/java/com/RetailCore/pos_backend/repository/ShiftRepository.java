package com.RetailCore.pos_backend.repository;

import com.RetailCore.pos_backend.enums.ShiftStatus;
import com.RetailCore.pos_backend.model.Shift;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ShiftRepository extends JpaRepository<Shift, UUID> {

    Optional<Shift> findFirstByWorkspaceIdAndStatus(String workspaceId, ShiftStatus status);

    List<Shift> findByWorkspaceIdOrderByStartTimeDesc(String workspaceId);
}
