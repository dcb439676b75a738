package com.docflow.action.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sink that only logs. Used when no delivery channel is configured.
 */
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void send(Notification notification) {
        log.info("Notify [{}] {} -> {} (instance {}, node {})",
            notification.channel(), notification.template(), notification.recipients(),
            notification.instanceId(), notification.nodeId());
    }

    @Override
    public void escalate(EscalationNotice notice) {
        log.info("Escalate to {}: {} (instance {}, node {})",
            notice.targets(), notice.reason(), notice.instanceId(), notice.nodeId());
    }
}
