package com.fixguard.core.learning;

import com.fixguard.core.escalation.Annotation;

import java.util.List;

/**
 * Long-lived memory of human resolutions, searchable by the feature they were about.
 */
public interface LearningStore {

    /**
     * @param annotationId fresh id, unique per resolution
     * @param description  the escalated item's feature text, used for similarity search
     * @return true when the annotation was stored
     */
    boolean storeAnnotation(String annotationId, String description, Annotation annotation);

    /** Up to {@code limit} stored annotations, most similar description first. */
    List<AnnotationMatch> searchAnnotations(String query, int limit);
}
