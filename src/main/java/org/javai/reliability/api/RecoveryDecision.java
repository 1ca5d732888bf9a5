package org.javai.reliability.api;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * What the caller should do next after a failed action.
 *
 * @param action recovery action to take
 * @param reason human-readable explanation for logs and audit
 * @param detail additional hints (e.g. {@value #WAIT_MS} for retries)
 */
public record RecoveryDecision(
		RecoveryAction action,
		String reason,
		Map<String, Object> detail
) {

	/**
	 * Detail key carrying the suggested wait before a retry, in milliseconds.
	 */
	public static final String WAIT_MS = "wait_ms";

	public RecoveryDecision {
		if (action == null) {
			throw new IllegalArgumentException("action must not be null");
		}
		reason = reason != null ? reason : "";
		detail = detail != null ? Collections.unmodifiableMap(new HashMap<>(detail)) : Map.of();
	}

	public RecoveryDecision(RecoveryAction action, String reason) {
		this(action, reason, Map.of());
	}

	/**
	 * Suggested wait before acting, zero when the decision carries none.
	 */
	public Duration backoff() {
		Object waitMs = detail.get(WAIT_MS);
		if (waitMs instanceof Number number) {
			return Duration.ofMillis(number.longValue());
		}
		return Duration.ZERO;
	}
}
