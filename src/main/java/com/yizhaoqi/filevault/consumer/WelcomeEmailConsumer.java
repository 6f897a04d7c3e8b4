package com.yizhaoqi.filevault.consumer;

import com.yizhaoqi.filevault.model.WelcomeTask;
import com.yizhaoqi.filevault.service.WelcomeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class WelcomeEmailConsumer {

    private final WelcomeService welcomeService;

    public WelcomeEmailConsumer(WelcomeService welcomeService) {
        this.welcomeService = welcomeService;
    }

    @KafkaListener(topics = "#{kafkaConfig.getWelcomeTopic()}", groupId = "#{kafkaConfig.getWelcomeGroupId()}")
    public void processTask(WelcomeTask task) {
        log.info("Received welcome task: {}", task);
        try {
            welcomeService.sendWelcome(task);
        } catch (RuntimeException e) {
            log.error("Welcome task failed: {}", task, e);
            throw e;
        }
    }
}
