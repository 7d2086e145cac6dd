package com.fixguard.core.learning;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fixguard.core.escalation.Annotation;

import java.time.Instant;

/**
 * A stored human resolution, with its similarity to the query it was found by
 * (0 as stored, before any search).
 */
public final class AnnotationMatch {

    private final String     annotationId;
    private final String     description;
    private final Annotation annotation;
    private final Instant    storedAt;
    private final double     score;

    @JsonCreator
    public AnnotationMatch(
            @JsonProperty("annotation_id") String     annotationId,
            @JsonProperty("description")   String     description,
            @JsonProperty("annotation")    Annotation annotation,
            @JsonProperty("stored_at")     Instant    storedAt,
            @JsonProperty("score")         double     score
    ) {
        this.annotationId = annotationId;
        this.description  = description != null ? description : "";
        this.annotation   = annotation;
        this.storedAt     = storedAt;
        this.score        = score;
    }

    AnnotationMatch withScore(double newScore) {
        return new AnnotationMatch(annotationId, description, annotation, storedAt, newScore);
    }

    public String     getAnnotationId() { return annotationId; }
    public String     getDescription()  { return description; }
    public Annotation getAnnotation()   { return annotation; }
    public Instant    getStoredAt()     { return storedAt; }
    public double     getScore()        { return score; }
}
