package com.docflow.action.sink;

import com.docflow.action.ActionException;

/**
 * Delivery channel for notifications and escalations (mail, chat, in-app inbox).
 * Implementations should treat a repeated idempotency key as already delivered.
 */
public interface NotificationSink {

    void send(Notification notification) throws ActionException;

    void escalate(EscalationNotice notice) throws ActionException;
}
