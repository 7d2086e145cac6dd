package com.fixguard.core.escalation;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * The one priority function for escalation items, used both when the queue fills in
 * a missing priority and when the fix controller escalates.
 *
 * <pre>
 *   severity base   low 0.1 / medium 0.3 / high 0.5 / critical 0.7, 0 when unknown
 * + attempts        min(attempts / 10, 0.3)
 * + critical path   0.3 when the feature mentions auth, login, payment or checkout
 * + age             min(hours since creation / 24, 0.3)
 * </pre>
 * clamped to [0, 1].
 */
public final class EscalationPriority {

    static final double       MAX_ATTEMPTS_SCORE  = 0.3;
    static final double       CRITICAL_PATH_SCORE = 0.3;
    static final double       MAX_AGE_SCORE       = 0.3;
    static final List<String> CRITICAL_KEYWORDS   = List.of("auth", "login", "payment", "checkout");

    private EscalationPriority() {}

    public static double computePriority(
            Severity severity,
            int      attempts,
            String   featureText,
            Instant  createdAt,
            Instant  now
    ) {
        double score = severity != null ? severity.getBaseScore() : 0.0;

        score += Math.min(Math.max(attempts, 0) / 10.0, MAX_ATTEMPTS_SCORE);

        if (isCriticalPath(featureText)) score += CRITICAL_PATH_SCORE;

        if (createdAt != null && now != null && now.isAfter(createdAt)) {
            double hours = Duration.between(createdAt, now).toMillis() / 3_600_000.0;
            score += Math.min(hours / 24.0, MAX_AGE_SCORE);
        }

        return clamp(score);
    }

    public static boolean isCriticalPath(String featureText) {
        if (featureText == null || featureText.isBlank()) return false;
        String lower = featureText.toLowerCase(Locale.ROOT);
        return CRITICAL_KEYWORDS.stream().anyMatch(lower::contains);
    }

    public static double clamp(double priority) {
        if (Double.isNaN(priority)) return 0.0;
        return Math.max(0.0, Math.min(1.0, priority));
    }
}
