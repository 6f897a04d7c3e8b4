package com.yizhaoqi.filevault.service;

import com.yizhaoqi.filevault.config.KafkaConfig;
import com.yizhaoqi.filevault.exception.JobException;
import com.yizhaoqi.filevault.model.ThumbnailTask;
import com.yizhaoqi.filevault.model.WelcomeTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Producer side of the job queue. Enqueue blocks until the broker has
 * acknowledged the record, so a returned call means the job is durable.
 */
@Service
public class JobQueueService {

    private static final Logger logger = LoggerFactory.getLogger(JobQueueService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaConfig kafkaConfig;

    @Value("${jobs.enqueue-timeout-ms:10000}")
    private long enqueueTimeoutMs = 10000;

    public JobQueueService(KafkaTemplate<String, Object> kafkaTemplate, KafkaConfig kafkaConfig) {
        this.kafkaTemplate = kafkaTemplate;
        this.kafkaConfig = kafkaConfig;
    }


    public void enqueueThumbnails(ThumbnailTask task) {
        send(kafkaConfig.getThumbnailTopic(), String.valueOf(task.getFileId()), task);
    }

    public void enqueueWelcome(WelcomeTask task) {
        send(kafkaConfig.getWelcomeTopic(), String.valueOf(task.getUserId()), task);
    }


    private void send(String topic, String key, Object task) {
        try {
            kafkaTemplate.send(topic, key, task).get(enqueueTimeoutMs, TimeUnit.MILLISECONDS);
            logger.info("Job enqueued, topic={}, task={}", topic, task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobException("Interrupted while enqueuing job on " + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            logger.error("Failed to enqueue job, topic={}, task={}", topic, task, e);
            throw new JobException("Failed to enqueue job on " + topic, e);
        }
    }
}
