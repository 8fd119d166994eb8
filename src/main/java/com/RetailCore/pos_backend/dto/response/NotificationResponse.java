package com.RetailCore.pos_backend.dto.response;

import com.RetailCore.pos_backend.enums.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationResponse {
    private UUID id;
    private String message;
    private NotificationType type;
    private UUID relatedId;
    private boolean read;
    private LocalDateTime createdAt;
}
