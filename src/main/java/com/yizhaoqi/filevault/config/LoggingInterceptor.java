package com.yizhaoqi.filevault.config;

import com.yizhaoqi.filevault.utils.IdCodec;
import com.yizhaoqi.filevault.utils.LogUtils;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;


@Component
public class LoggingInterceptor implements HandlerInterceptor {

    private static final String START_TIME_ATTRIBUTE = "startTime";
    private static final String REQUEST_ID_ATTRIBUTE = "requestId";
    private static final long SLOW_REQUEST_MS = 3000;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {

        request.setAttribute(START_TIME_ATTRIBUTE, System.currentTimeMillis());

        String requestId = UUID.randomUUID().toString().substring(0, 8);
        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);

        String userId = extractUserId(request);
        LogUtils.setRequestContext(requestId, userId);

        LogUtils.logBusiness("REQUEST_START", userId, "[%s] %s", request.getMethod(), request.getRequestURI());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                              Object handler, Exception ex) {
        try {

            Long startTime = (Long) request.getAttribute(START_TIME_ATTRIBUTE);
            if (startTime != null) {
                long duration = System.currentTimeMillis() - startTime;
                String userId = extractUserId(request);
                String path = request.getRequestURI();

                LogUtils.logApiCall(request.getMethod(), path, userId, response.getStatus(), duration);

                if (ex != null) {
                    LogUtils.logBusinessError("REQUEST_ERROR", userId, "[%s] %s", ex, request.getMethod(), path);
                }

                if (duration > SLOW_REQUEST_MS) {
                    LogUtils.logPerformance("SLOW_REQUEST", duration,
                        String.format("[%s] %s [user:%s]", request.getMethod(), path, userId));
                }
            }
        } finally {

            LogUtils.clearRequestContext();
        }
    }


    // Set by SessionAuthenticationFilter, which runs before any interceptor.
    private String extractUserId(HttpServletRequest request) {
        Object userId = request.getAttribute(SessionAuthenticationFilter.USER_ID_ATTRIBUTE);
        return userId instanceof Long id ? IdCodec.toHex(id) : "anonymous";
    }
}
