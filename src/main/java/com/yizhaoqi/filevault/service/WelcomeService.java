package com.yizhaoqi.filevault.service;

import com.yizhaoqi.filevault.exception.FatalJobException;
import com.yizhaoqi.filevault.exception.JobException;
import com.yizhaoqi.filevault.model.User;
import com.yizhaoqi.filevault.model.WelcomeTask;
import com.yizhaoqi.filevault.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;


@Service
public class WelcomeService {

    private static final Logger logger = LoggerFactory.getLogger(WelcomeService.class);

    private final UserRepository userRepository;
    private final NotificationSink notificationSink;

    @Value("${notifications.welcome.subject:Welcome to FileVault}")
    private String subject = "Welcome to FileVault";

    public WelcomeService(UserRepository userRepository, NotificationSink notificationSink) {
        this.userRepository = userRepository;
        this.notificationSink = notificationSink;
    }


    public void sendWelcome(WelcomeTask task) {
        if (task == null || task.getUserId() == null) {
            throw new FatalJobException("Missing userId");
        }
        User user = userRepository.findById(task.getUserId())
                .orElseThrow(() -> new FatalJobException("User not found"));

        logger.info("Welcome {}!", user.getEmail());
        try {
            notificationSink.send(user.getEmail(), subject, buildBody(user));
        } catch (RuntimeException e) {
            throw new JobException("Failed to send welcome message to user " + user.getId(), e);
        }
    }


    String buildBody(User user) {
        return "<div>"
                + "<h3>Hello " + user.getEmail() + ",</h3>"
                + "Welcome to FileVault, your personal file storage. "
                + "Upload files and images, organize them in folders and share them when you want to."
                + "</div>";
    }
}
