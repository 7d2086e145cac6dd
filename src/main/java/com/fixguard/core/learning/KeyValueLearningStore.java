package com.fixguard.core.learning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixguard.core.escalation.Annotation;
import com.fixguard.core.store.KeyValueStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * LearningStore kept in the same key-value store as the queue, without expiry.
 *
 *   learning:annotation:{id}  : AnnotationMatch JSON
 *   learning:annotations      : list of ids in insertion order
 *
 * Search ranks by token overlap (Jaccard) between the query and each stored description.
 */
@Component
public class KeyValueLearningStore implements LearningStore {

    private static final Logger log = LoggerFactory.getLogger(KeyValueLearningStore.class);

    static final String ANNOTATION_KEY_PREFIX = "learning:annotation:";
    static final String ANNOTATION_INDEX      = "learning:annotations";

    private final KeyValueStore store;
    private final ObjectMapper  objectMapper;
    private final Clock         clock;

    public KeyValueLearningStore(KeyValueStore store, ObjectMapper objectMapper, Clock clock) {
        this.store        = store;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    @Override
    public boolean storeAnnotation(String annotationId, String description, Annotation annotation) {
        AnnotationMatch record = new AnnotationMatch(annotationId, description, annotation, clock.instant(), 0.0);
        try {
            store.set(ANNOTATION_KEY_PREFIX + annotationId, objectMapper.writeValueAsString(record), null);
        } catch (JsonProcessingException e) {
            log.error("[Learning] Cannot serialize annotation {}: {}", annotationId, e.getOriginalMessage());
            return false;
        }
        store.listAppend(ANNOTATION_INDEX, annotationId, null);
        log.info("[Learning] Stored annotation {} for '{}'", annotationId, description);
        return true;
    }

    @Override
    public List<AnnotationMatch> searchAnnotations(String query, int limit) {
        Set<String> queryTokens = tokens(query);
        if (queryTokens.isEmpty() || limit <= 0) return List.of();

        List<AnnotationMatch> matches = new ArrayList<>();
        for (String id : store.listRange(ANNOTATION_INDEX)) {
            AnnotationMatch stored = load(id);
            if (stored == null) continue;
            double score = similarity(queryTokens, tokens(stored.getDescription()));
            if (score > 0.0) matches.add(stored.withScore(score));
        }

        matches.sort((a, b) -> Double.compare(b.getScore(), a.getScore()));
        log.debug("[Learning] '{}' matched {} annotation(s)", query, matches.size());
        return matches.size() > limit ? new ArrayList<>(matches.subList(0, limit)) : matches;
    }

    private AnnotationMatch load(String id) {
        String json = store.get(ANNOTATION_KEY_PREFIX + id);
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, AnnotationMatch.class);
        } catch (JsonProcessingException e) {
            log.warn("[Learning] Skipping unreadable annotation {}: {}", id, e.getOriginalMessage());
            return null;
        }
    }

    static Set<String> tokens(String text) {
        if (text == null || text.isBlank()) return Set.of();
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                     .filter(t -> !t.isEmpty())
                     .collect(Collectors.toSet());
    }

    static double similarity(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        Set<String> common = new HashSet<>(a);
        common.retainAll(b);
        return (double) common.size() / union.size();
    }
}
