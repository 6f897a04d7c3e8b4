package com.yizhaoqi.filevault.consumer;

import com.yizhaoqi.filevault.model.ThumbnailTask;
import com.yizhaoqi.filevault.service.ThumbnailService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Thumbnail worker. The record offset is committed only after this method
 * returns, so a crash mid-task leads to redelivery.
 */
@Service
@Slf4j
public class ThumbnailConsumer {

    private final ThumbnailService thumbnailService;

    public ThumbnailConsumer(ThumbnailService thumbnailService) {
        this.thumbnailService = thumbnailService;
    }

    @KafkaListener(topics = "#{kafkaConfig.getThumbnailTopic()}", groupId = "#{kafkaConfig.getThumbnailGroupId()}")
    public void processTask(ThumbnailTask task) {
        log.info("Received thumbnail task: {}", task);
        try {
            thumbnailService.generate(task);
            log.info("Thumbnail task completed: {}", task);
        } catch (RuntimeException e) {
            log.error("Thumbnail task failed: {}", task, e);
            throw e;
        }
    }
}
