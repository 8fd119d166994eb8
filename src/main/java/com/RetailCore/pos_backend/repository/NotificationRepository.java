package com.RetailCore.pos_backend.repository;

import com.RetailCore.pos_backend.model.Notification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    List<Notification> findByWorkspaceIdOrderByCreatedAtDesc(String workspaceId);

    List<Notification> findByWorkspaceIdAndReadFalse(String workspaceId);

    List<Notification> findByRelatedIdIn(Collection<UUID> relatedIds);
}
