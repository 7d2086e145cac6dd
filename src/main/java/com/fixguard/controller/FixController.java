package com.fixguard.controller;

import com.fixguard.core.fix.FixAttemptController;
import com.fixguard.core.fix.FixResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for fix requests. Passes on the same test file are serialized here,
 * since a pass snapshots, edits and restores the file in place.
 */
@RestController
@RequestMapping("/api")
public class FixController {

    private static final Logger log = LoggerFactory.getLogger(FixController.class);

    private final FixAttemptController fixAttemptController;

    private final Map<String, ReentrantLock> fileLocks = new ConcurrentHashMap<>();

    public FixController(FixAttemptController fixAttemptController) {
        this.fixAttemptController = fixAttemptController;
    }

    /**
     * Body: {"test_path": ..., "error_message": ..., "task_id"?: ..., "feature"?: ...}
     */
    @PostMapping("/fix")
    public ResponseEntity<FixResult> fix(
            @RequestBody Map<String, String> request
    ) {

        String testPath = request.get("test_path");

        if (testPath == null || testPath.trim().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }

        log.info("[FixController] POST /api/fix {}", testPath);

        ReentrantLock lock = fileLocks.computeIfAbsent(lockKey(testPath.trim()), k -> new ReentrantLock());
        lock.lock();
        try {
            FixResult result = fixAttemptController.attemptFix(
                    testPath.trim(),
                    request.getOrDefault("error_message", ""),
                    request.get("task_id"),
                    request.get("feature")
            );
            return ResponseEntity.ok(result);
        } finally {
            lock.unlock();
        }
    }

    static String lockKey(String testPath) {
        try {
            return Paths.get(testPath).normalize().toString();
        } catch (InvalidPathException e) {
            return testPath;
        }
    }
}
