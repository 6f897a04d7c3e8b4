package com.yizhaoqi.filevault.service;

/**
 * Outbound message delivery. Implementations throw when the message could
 * not be handed off.
 */
public interface NotificationSink {

    void send(String recipient, String subject, String htmlBody);
}
