package com.yizhaoqi.filevault.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default sink: writes the message to the log instead of delivering it.
 */
@Component
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void send(String recipient, String subject, String htmlBody) {
        logger.info("Notification to {}: subject='{}', body={}", recipient, subject, htmlBody);
    }
}
