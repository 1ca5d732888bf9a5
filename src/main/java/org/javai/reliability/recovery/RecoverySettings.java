package org.javai.reliability.recovery;

import java.time.Duration;

/**
 * Tunables of the recovery ladder.
 *
 * @param maxTransientRetries same-candidate retries allowed for a transient failure
 * @param retryBackoffBase backoff unit; retry {@code k} (0-based) waits {@code base * (k + 1)}
 * @param maxEscalationLevel highest ladder rung used before the planner aborts (1 to 4)
 */
public record RecoverySettings(
		int maxTransientRetries,
		Duration retryBackoffBase,
		int maxEscalationLevel
) {

	public static final int DEFAULT_MAX_TRANSIENT_RETRIES = 2;
	public static final Duration DEFAULT_RETRY_BACKOFF_BASE = Duration.ofMillis(500);
	public static final int DEFAULT_MAX_ESCALATION_LEVEL = 4;

	public RecoverySettings {
		if (maxTransientRetries < 0) {
			throw new IllegalArgumentException("maxTransientRetries must be >= 0");
		}
		if (retryBackoffBase == null || retryBackoffBase.isNegative()) {
			throw new IllegalArgumentException("retryBackoffBase must be a non-negative duration");
		}
		if (maxEscalationLevel < 1 || maxEscalationLevel > DEFAULT_MAX_ESCALATION_LEVEL) {
			throw new IllegalArgumentException("maxEscalationLevel must be within [1, 4]");
		}
	}

	public static RecoverySettings defaults() {
		return new RecoverySettings(DEFAULT_MAX_TRANSIENT_RETRIES, DEFAULT_RETRY_BACKOFF_BASE,
				DEFAULT_MAX_ESCALATION_LEVEL);
	}
}
