package com.yizhaoqi.filevault.controller;

import com.yizhaoqi.filevault.service.StatusService;
import com.yizhaoqi.filevault.utils.LogUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class AppController {

    @Autowired
    private StatusService statusService;


    @GetMapping("/status")
    public ResponseEntity<?> getStatus() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("redis", statusService.isRedisAlive());
        data.put("db", statusService.isDbAlive());
        return ResponseEntity.ok(data);
    }


    @GetMapping("/stats")
    public ResponseEntity<?> getStats() {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("users", statusService.countUsers());
            data.put("files", statusService.countFiles());
            return ResponseEntity.ok(data);
        } catch (Exception e) {
            LogUtils.logBusinessError("GET_STATS", "anonymous", "Failed to count records: %s", e, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", "Internal server error"));
        }
    }
}
