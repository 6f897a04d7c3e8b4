package com.yizhaoqi.filevault.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Opaque session tokens kept in Redis. Expiry is left to the key TTL.
 */
@Service
public class SessionService {

    private static final Logger logger = LoggerFactory.getLogger(SessionService.class);

    private static final String TOKEN_PREFIX = "auth_";

    @Autowired
    private RedisTemplate<String, Object> redisTemplate;

    @Value("${session.ttl-seconds:86400}")
    private long ttlSeconds;


    public String createSession(long userId) {
        String token = UUID.randomUUID().toString();
        redisTemplate.opsForValue().set(TOKEN_PREFIX + token, String.valueOf(userId), ttlSeconds, TimeUnit.SECONDS);
        logger.debug("Session created for user: {}", userId);
        return token;
    }


    /**
     * Unknown, expired or blank tokens resolve to empty. A Redis failure is
     * logged and also resolves to empty, so callers see an authentication
     * failure rather than a server error.
     */
    public Optional<Long> resolve(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Object value = redisTemplate.opsForValue().get(TOKEN_PREFIX + token);
            if (value == null) {
                return Optional.empty();
            }
            return Optional.of(Long.parseLong(value.toString()));
        } catch (NumberFormatException e) {
            logger.warn("Session {} holds a malformed user id", token);
            return Optional.empty();
        } catch (Exception e) {
            logger.error("Failed to resolve session: {}", token, e);
            return Optional.empty();
        }
    }


    public void revoke(String token) {
        if (token == null || token.isBlank()) {
            return;
        }
        redisTemplate.delete(TOKEN_PREFIX + token);
        logger.debug("Session revoked: {}", token);
    }
}
