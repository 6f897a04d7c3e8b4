package com.yizhaoqi.filevault.config;

import com.yizhaoqi.filevault.exception.FatalJobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Job queue wiring. Each job family has its own topic and consumer group;
 * producer and consumers both read the names from here.
 */
@Configuration
public class KafkaConfig {

    private static final Logger logger = LoggerFactory.getLogger(KafkaConfig.class);

    @Value("${jobs.thumbnail.topic:thumbnail-generation}")
    private String thumbnailTopic;

    @Value("${jobs.thumbnail.group-id:thumbnail-workers}")
    private String thumbnailGroupId;

    @Value("${jobs.welcome.topic:email-sending}")
    private String welcomeTopic;

    @Value("${jobs.welcome.group-id:email-workers}")
    private String welcomeGroupId;

    @Value("${jobs.partitions:3}")
    private int partitions;

    @Value("${jobs.retry.interval-ms:5000}")
    private long retryIntervalMs;

    @Value("${jobs.retry.max-attempts:10}")
    private long retryMaxAttempts;


    @Bean
    public NewTopic thumbnailTopic() {
        return TopicBuilder.name(thumbnailTopic).partitions(partitions).replicas(1).build();
    }

    @Bean
    public NewTopic welcomeTopic() {
        return TopicBuilder.name(welcomeTopic).partitions(partitions).replicas(1).build();
    }


    /**
     * Retryable failures are redelivered with a fixed back-off until the
     * attempt limit; fatal ones are logged and skipped immediately.
     */
    @Bean
    public DefaultErrorHandler jobErrorHandler() {
        DefaultErrorHandler handler = new DefaultErrorHandler(
                (record, e) -> logger.error("Job dropped after failure, topic={}, key={}, value={}",
                        record.topic(), record.key(), record.value(), e),
                new FixedBackOff(retryIntervalMs, retryMaxAttempts));
        handler.addNotRetryableExceptions(FatalJobException.class);
        return handler;
    }

    public String getThumbnailTopic() {
        return thumbnailTopic;
    }

    public String getThumbnailGroupId() {
        return thumbnailGroupId;
    }

    public String getWelcomeTopic() {
        return welcomeTopic;
    }

    public String getWelcomeGroupId() {
        return welcomeGroupId;
    }
}
