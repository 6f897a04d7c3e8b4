package com.yizhaoqi.filevault.controller;

import com.yizhaoqi.filevault.exception.CustomException;
import com.yizhaoqi.filevault.model.User;
import com.yizhaoqi.filevault.service.UserService;
import com.yizhaoqi.filevault.utils.IdCodec;
import com.yizhaoqi.filevault.utils.LogUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/users")
public class UserController {

    @Autowired
    private UserService userService;


    @PostMapping
    public ResponseEntity<?> register(@RequestBody(required = false) UserRequest request) {
        LogUtils.PerformanceMonitor monitor = LogUtils.startPerformanceMonitor("USER_REGISTER");
        String email = request != null ? request.email() : null;
        try {
            User user = userService.registerUser(email, request != null ? request.password() : null);
            LogUtils.logUserOperation(IdCodec.toHex(user.getId()), "REGISTER", "user_creation", "SUCCESS");
            monitor.end("registered");
            return ResponseEntity.status(HttpStatus.CREATED).body(toBody(user));
        } catch (CustomException e) {
            LogUtils.logUserOperation("anonymous", "REGISTER", "validation", "FAILED: " + e.getMessage());
            monitor.end("rejected: " + e.getMessage());
            return ResponseEntity.status(e.getStatus()).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            LogUtils.logBusinessError("USER_REGISTER", "anonymous", "Registration failed for %s", e, email);
            monitor.end("failed: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", "Internal server error"));
        }
    }


    @GetMapping("/me")
    public ResponseEntity<?> getCurrentUser(@RequestAttribute("userId") Long userId) {
        try {
            User user = userService.findById(userId).orElseThrow(CustomException::unauthorized);
            return ResponseEntity.ok(toBody(user));
        } catch (CustomException e) {
            return ResponseEntity.status(e.getStatus()).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            LogUtils.logBusinessError("GET_USER_INFO", IdCodec.toHex(userId), "Failed to load user: %s", e, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", "Internal server error"));
        }
    }


    private Map<String, Object> toBody(User user) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", IdCodec.toHex(user.getId()));
        body.put("email", user.getEmail());
        return body;
    }
}


record UserRequest(String email, String password) {}
