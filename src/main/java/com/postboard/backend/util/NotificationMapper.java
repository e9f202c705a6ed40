package com.postboard.backend.util;

import com.postboard.backend.dto.NotificationDto;
import com.postboard.backend.models.Notification;

import java.util.List;
import java.util.stream.Collectors;

public class NotificationMapper {

    public static NotificationDto toDTO(Notification notification) {
        return NotificationDto.builder()
                .id(notification.getId())
                .message(notification.getMessage())
                .read(notification.isRead())
                .createdAt(notification.getCreatedAt())
                .postId(notification.getPost().getId())
                .build();
    }

    public static List<NotificationDto> toDTOList(List<Notification> notifications) {
        return notifications.stream()
                .map(NotificationMapper::toDTO)
                .collect(Collectors.toList());
    }
}
