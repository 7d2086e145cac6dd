package com.fixguard.controller;

import com.fixguard.core.escalation.Annotation;
import com.fixguard.core.escalation.EscalationItem;
import com.fixguard.core.escalation.EscalationQueue;
import com.fixguard.core.escalation.QueueStats;
import com.fixguard.core.learning.AnnotationMatch;
import com.fixguard.core.learning.LearningStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Reviewer-facing API over the escalation queue.
 */
@RestController
@RequestMapping("/api/escalations")
public class EscalationController {

    private static final Logger log = LoggerFactory.getLogger(EscalationController.class);

    private final EscalationQueue escalationQueue;
    private final LearningStore   learningStore;

    public EscalationController(EscalationQueue escalationQueue, LearningStore learningStore) {
        this.escalationQueue = escalationQueue;
        this.learningStore   = learningStore;
    }

    @GetMapping
    public List<EscalationItem> list(
            @RequestParam(name = "include_resolved", defaultValue = "false") boolean includeResolved,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return escalationQueue.list(includeResolved, limit);
    }

    @GetMapping("/stats")
    public QueueStats stats() {
        return escalationQueue.stats();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean up = escalationQueue.ping();
        return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                             .body(Map.of("store", up ? "up" : "down"));
    }

    /** Past human resolutions whose feature text resembles the query. */
    @GetMapping("/similar")
    public List<AnnotationMatch> similar(
            @RequestParam(name = "query") String query,
            @RequestParam(name = "limit", defaultValue = "5") int limit
    ) {
        return learningStore.searchAnnotations(query, limit);
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<EscalationItem> get(@PathVariable String taskId) {
        EscalationItem item = escalationQueue.get(taskId);
        return item != null ? ResponseEntity.ok(item) : ResponseEntity.notFound().build();
    }

    /**
     * 404 for an unknown task, 409 when it was already resolved.
     */
    @PostMapping("/{taskId}/resolve")
    public ResponseEntity<EscalationItem> resolve(
            @PathVariable String taskId,
            @RequestBody Annotation annotation
    ) {
        EscalationItem existing = escalationQueue.get(taskId);
        if (existing == null) {
            return ResponseEntity.notFound().build();
        }

        if (!escalationQueue.resolve(taskId, annotation)) {
            log.warn("[EscalationController] {} already resolved", taskId);
            return ResponseEntity.status(HttpStatus.CONFLICT).body(existing);
        }

        return ResponseEntity.ok(escalationQueue.get(taskId));
    }
}
