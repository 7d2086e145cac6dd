package com.fixguard.core.fix;

/**
 * Whether the controller may hand tasks to the human review queue.
 *
 * Disabled means unattended operation: a low-confidence proposal is applied anyway
 * (the regression gate still protects the suite) and retry exhaustion fails locally.
 */
public final class EscalationPolicy {

    private static final EscalationPolicy ENABLED  = new EscalationPolicy(true);
    private static final EscalationPolicy DISABLED = new EscalationPolicy(false);

    private final boolean enabled;

    private EscalationPolicy(boolean enabled) {
        this.enabled = enabled;
    }

    public static EscalationPolicy enabled()  { return ENABLED; }
    public static EscalationPolicy disabled() { return DISABLED; }

    public boolean isEnabled() { return enabled; }

    @Override
    public String toString() {
        return "EscalationPolicy{enabled=" + enabled + "}";
    }
}
