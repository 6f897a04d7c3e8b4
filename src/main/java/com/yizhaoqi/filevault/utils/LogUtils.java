package com.yizhaoqi.filevault.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured log lines shared by controllers, interceptors and workers.
 * Each category goes to its own logger so it can be routed separately in
 * logback-spring.xml.
 */
public final class LogUtils {

    private static final Logger BUSINESS_LOGGER = LoggerFactory.getLogger("business");
    private static final Logger USER_OPERATION_LOGGER = LoggerFactory.getLogger("user-operation");
    private static final Logger FILE_OPERATION_LOGGER = LoggerFactory.getLogger("file-operation");
    private static final Logger API_LOGGER = LoggerFactory.getLogger("api");
    private static final Logger PERFORMANCE_LOGGER = LoggerFactory.getLogger("performance");

    public static final String REQUEST_ID = "requestId";
    public static final String USER_ID = "userId";

    private LogUtils() {
    }

    public static void setRequestContext(String requestId, String userId) {
        MDC.put(REQUEST_ID, requestId);
        MDC.put(USER_ID, userId != null ? userId : "anonymous");
    }

    public static void clearRequestContext() {
        MDC.remove(REQUEST_ID);
        MDC.remove(USER_ID);
    }

    public static void logBusiness(String operation, String userId, String format, Object... args) {
        BUSINESS_LOGGER.info("[{}] [user:{}] {}", operation, userId, String.format(format, args));
    }

    public static void logBusinessError(String operation, String userId, String format, Throwable error, Object... args) {
        BUSINESS_LOGGER.error("[{}] [user:{}] {}", operation, userId, String.format(format, args), error);
    }

    public static void logUserOperation(String userId, String operation, String resource, String result) {
        USER_OPERATION_LOGGER.info("[user:{}] [{}] resource={} result={}", userId, operation, resource, result);
    }

    public static void logFileOperation(String userId, String operation, String fileName, String fileId, String result) {
        FILE_OPERATION_LOGGER.info("[user:{}] [{}] file={} id={} result={}", userId, operation, fileName, fileId, result);
    }

    public static void logApiCall(String method, String path, String userId, int status, long durationMs) {
        API_LOGGER.info("[{}] {} user={} status={} duration={}ms", method, path, userId, status, durationMs);
    }

    public static void logPerformance(String operation, long durationMs, String details) {
        PERFORMANCE_LOGGER.warn("[{}] {}ms {}", operation, durationMs, details);
    }

    public static PerformanceMonitor startPerformanceMonitor(String operation) {
        return new PerformanceMonitor(operation);
    }

    public static final class PerformanceMonitor {

        private final String operation;
        private final long startTime;

        private PerformanceMonitor(String operation) {
            this.operation = operation;
            this.startTime = System.currentTimeMillis();
        }

        public long end(String result) {
            long duration = System.currentTimeMillis() - startTime;
            PERFORMANCE_LOGGER.debug("[{}] {} in {}ms", operation, result, duration);
            return duration;
        }
    }
}
