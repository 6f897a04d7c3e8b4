package com.yizhaoqi.filevault.controller;

import com.yizhaoqi.filevault.config.SessionAuthenticationFilter;
import com.yizhaoqi.filevault.exception.CustomException;
import com.yizhaoqi.filevault.model.User;
import com.yizhaoqi.filevault.service.SessionService;
import com.yizhaoqi.filevault.service.UserService;
import com.yizhaoqi.filevault.utils.IdCodec;
import com.yizhaoqi.filevault.utils.LogUtils;
import org.apache.commons.codec.binary.Base64;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.Map;

@RestController
public class AuthController {

    private static final String BASIC_PREFIX = "Basic ";

    @Autowired
    private UserService userService;

    @Autowired
    private SessionService sessionService;


    /**
     * Signs in with HTTP Basic credentials ({@code base64(email:password)})
     * and returns a new session token.
     */
    @GetMapping("/connect")
    public ResponseEntity<?> connect(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        LogUtils.PerformanceMonitor monitor = LogUtils.startPerformanceMonitor("USER_LOGIN");
        String email = null;
        try {
            String[] credentials = decodeBasicCredentials(authorization);
            email = credentials[0];
            User user = userService.authenticateUser(credentials[0], credentials[1]);

            String token = sessionService.createSession(user.getId());
            LogUtils.logUserOperation(IdCodec.toHex(user.getId()), "LOGIN", "session_creation", "SUCCESS");
            monitor.end("signed in");
            return ResponseEntity.ok(Map.of("token", token));
        } catch (CustomException e) {
            LogUtils.logUserOperation("anonymous", "LOGIN", "authentication", "FAILED_INVALID_CREDENTIALS");
            monitor.end("rejected");
            return ResponseEntity.status(e.getStatus()).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            LogUtils.logBusinessError("USER_LOGIN", "anonymous", "Sign-in failed for %s", e, email);
            monitor.end("failed: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", "Internal server error"));
        }
    }


    @GetMapping("/disconnect")
    public ResponseEntity<?> disconnect(@RequestAttribute(SessionAuthenticationFilter.TOKEN_ATTRIBUTE) String token,
                                        @RequestAttribute(SessionAuthenticationFilter.USER_ID_ATTRIBUTE) Long userId) {
        try {
            sessionService.revoke(token);
            LogUtils.logUserOperation(IdCodec.toHex(userId), "LOGOUT", "session_revocation", "SUCCESS");
            return ResponseEntity.noContent().build();
        } catch (Exception e) {
            LogUtils.logBusinessError("USER_LOGOUT", IdCodec.toHex(userId), "Sign-out failed: %s", e, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", "Internal server error"));
        }
    }


    private String[] decodeBasicCredentials(String authorization) {
        if (authorization == null || !authorization.startsWith(BASIC_PREFIX)) {
            throw CustomException.unauthorized();
        }
        String encoded = authorization.substring(BASIC_PREFIX.length()).trim();
        if (!Base64.isBase64(encoded)) {
            throw CustomException.unauthorized();
        }
        String decoded = new String(Base64.decodeBase64(encoded), StandardCharsets.UTF_8);
        int separator = decoded.indexOf(':');
        if (separator <= 0 || separator == decoded.length() - 1) {
            throw CustomException.unauthorized();
        }
        return new String[]{decoded.substring(0, separator), decoded.substring(separator + 1)};
    }
}
