package com.yizhaoqi.filevault.service;

import com.yizhaoqi.filevault.repository.FileDocumentRepository;
import com.yizhaoqi.filevault.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Liveness of the backing stores and record counts for the status endpoints.
 */
@Service
public class StatusService {

    private static final Logger logger = LoggerFactory.getLogger(StatusService.class);

    @Autowired
    private RedisTemplate<String, Object> redisTemplate;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private FileDocumentRepository fileDocumentRepository;


    public boolean isRedisAlive() {
        try (RedisConnection connection = redisTemplate.getRequiredConnectionFactory().getConnection()) {
            return "PONG".equalsIgnoreCase(connection.ping());
        } catch (Exception e) {
            logger.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    public boolean isDbAlive() {
        try {
            userRepository.count();
            return true;
        } catch (Exception e) {
            logger.warn("Database check failed: {}", e.getMessage());
            return false;
        }
    }

    public long countUsers() {
        return userRepository.count();
    }

    public long countFiles() {
        return fileDocumentRepository.count();
    }
}
