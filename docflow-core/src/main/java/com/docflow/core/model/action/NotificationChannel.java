package com.docflow.core.model.action;

public enum NotificationChannel {
    EMAIL,
    SMS,
    IN_APP,
    WEBHOOK,
    CHAT
}
