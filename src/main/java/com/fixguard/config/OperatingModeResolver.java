package com.fixguard.config;

import com.fixguard.core.fix.EscalationPolicy;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves the operating mode from configuration.
 *
 * SUPERVISED: low-confidence proposals and retry-exhausted tasks go to the human review queue.
 * UNATTENDED: overnight / CI runs. Low-confidence proposals are applied anyway and kept
 *              only if the regression run shows no new failures; retry-exhausted tasks
 *              fail locally. Regressions and failed rollbacks are escalated in both modes.
 */
@Component
public class OperatingModeResolver {

    public enum OperatingMode { SUPERVISED, UNATTENDED }

    private final OperatingMode mode;

    public OperatingModeResolver(
        @Value("${fixguard.escalation.enabled:true}") boolean escalationEnabled
    ) {
        this.mode = escalationEnabled ? OperatingMode.SUPERVISED : OperatingMode.UNATTENDED;
    }

    public boolean isSupervised() {
        return mode == OperatingMode.SUPERVISED;
    }

    public EscalationPolicy toEscalationPolicy() {
        return isSupervised() ? EscalationPolicy.enabled() : EscalationPolicy.disabled();
    }
}
