package com.yizhaoqi.filevault.service;

import com.yizhaoqi.filevault.exception.CustomException;
import com.yizhaoqi.filevault.exception.JobException;
import com.yizhaoqi.filevault.model.User;
import com.yizhaoqi.filevault.model.WelcomeTask;
import com.yizhaoqi.filevault.repository.UserRepository;
import com.yizhaoqi.filevault.utils.PasswordUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.Optional;


@Service
public class UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private JobQueueService jobQueueService;


    /**
     * Registers a user and queues the welcome notification. A failure to
     * queue is logged; the account itself is already created.
     */
    public User registerUser(String email, String password) {
        if (email == null || email.isEmpty()) {
            throw CustomException.badRequest("Missing email");
        }
        if (password == null || password.isEmpty()) {
            throw CustomException.badRequest("Missing password");
        }
        if (userRepository.existsByEmail(email)) {
            throw new CustomException("Already exist", HttpStatus.BAD_REQUEST);
        }

        User user = new User();
        user.setEmail(email);
        user.setPassword(PasswordUtil.encode(password));
        User saved = userRepository.save(user);
        logger.info("User registered: {}", email);

        try {
            jobQueueService.enqueueWelcome(new WelcomeTask(saved.getId()));
        } catch (JobException e) {
            logger.error("Failed to queue welcome message for user {}", saved.getId(), e);
        }
        return saved;
    }


    public User authenticateUser(String email, String password) {
        User user = userRepository.findByEmail(email)
                .orElseThrow(CustomException::unauthorized);
        if (!PasswordUtil.matches(password, user.getPassword())) {
            throw CustomException.unauthorized();
        }
        return user;
    }


    public Optional<User> findById(Long userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return userRepository.findById(userId);
    }
}
