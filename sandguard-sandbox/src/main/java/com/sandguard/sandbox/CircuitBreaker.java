package com.sandguard.sandbox;

import com.sandguard.sandbox.SandboxTypes.CircuitBreakerConfig;

/**
 * Counts consecutive BLOCKED classifications and opens once the configured
 * threshold is reached. While open the classifier forces BLOCKED and rule
 * hits keep counting; a SAFE classification closes it again.
 * <p>
 * Not thread-safe. Each enforcer owns its own breaker.
 */
public class CircuitBreaker {

    public static final int DEFAULT_THRESHOLD = 10;

    private final boolean enabled;
    private final int threshold;
    private int consecutiveBlocked;

    public CircuitBreaker(CircuitBreakerConfig config) {
        CircuitBreakerConfig effective = config != null ? config : CircuitBreakerConfig.builder().build();
        this.enabled = effective.isEnabled();
        this.threshold = effective.getThreshold() > 0 ? effective.getThreshold() : DEFAULT_THRESHOLD;
    }

    public boolean isTripped() {
        return enabled && consecutiveBlocked >= threshold;
    }

    /**
     * Count one rule-driven block.
     *
     * @return true if this block moved the breaker from closed to open
     */
    public boolean recordBlocked() {
        boolean wasTripped = isTripped();
        consecutiveBlocked++;
        return !wasTripped && isTripped();
    }

    public void recordSafe() {
        consecutiveBlocked = 0;
    }

    public int getConsecutiveBlocked() {
        return consecutiveBlocked;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getThreshold() {
        return threshold;
    }
}
