package com.RetailCore.pos_backend.service;

import com.RetailCore.pos_backend.dto.response.NotificationResponse;
import com.RetailCore.pos_backend.enums.NotificationType;
import com.RetailCore.pos_backend.exception.ResourceNotFoundException;
import com.RetailCore.pos_backend.exception.WorkspaceAccessException;
import com.RetailCore.pos_backend.model.Notification;
import com.RetailCore.pos_backend.repository.NotificationRepository;
import com.RetailCore.pos_backend.security.WorkspaceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final DeletionUnitOfWorkFactory deletionUnitOfWorkFactory;
    private final WorkspaceContext workspaceContext;
    private final ModelMapper modelMapper;

    @Transactional
    public Notification addNotification(String message, NotificationType type, UUID relatedId) {
        Notification notification = Notification.builder()
                .workspaceId(workspaceContext.getWorkspaceId())
                .message(message)
                .type(type)
                .relatedId(relatedId)
                .build();

        Notification saved = notificationRepository.save(notification);
        log.debug("{} notification added: {}", type, message);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<NotificationResponse> getNotifications() {
        return notificationRepository.findByWorkspaceIdOrderByCreatedAtDesc(workspaceContext.getWorkspaceId())
                .stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public NotificationResponse markAsRead(UUID id) {
        Notification notification = notificationRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Notification", "id", id));

        if (!workspaceContext.owns(notification.getWorkspaceId())) {
            throw new WorkspaceAccessException("notification");
        }

        notification.setRead(true);
        return mapToResponse(notificationRepository.save(notification));
    }

    @Transactional
    public int markAllAsRead() {
        List<Notification> unread = notificationRepository.findByWorkspaceIdAndReadFalse(workspaceContext.getWorkspaceId());
        unread.forEach(n -> n.setRead(true));
        notificationRepository.saveAll(unread);
        return unread.size();
    }

    @Transactional
    public int clearNotifications() {
        String workspaceId = workspaceContext.getWorkspaceId();
        List<Notification> notifications = notificationRepository.findByWorkspaceIdOrderByCreatedAtDesc(workspaceId);

        deletionUnitOfWorkFactory.begin(workspaceId)
                .deleteNotifications(notifications)
                .execute();

        log.info("Cleared {} notifications in workspace {}", notifications.size(), workspaceId);
        return notifications.size();
    }

    private NotificationResponse mapToResponse(Notification notification) {
        return modelMapper.map(notification, NotificationResponse.class);
    }
}
