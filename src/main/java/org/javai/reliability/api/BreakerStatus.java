package org.javai.reliability.api;

/**
 * States of a per-candidate circuit breaker.
 */
public enum BreakerStatus {
	/**
	 * Candidate is used normally.
	 */
	CLOSED,

	/**
	 * Candidate is quarantined until its cooldown elapses.
	 */
	OPEN,

	/**
	 * Cooldown elapsed; the next outcome decides whether the candidate recovers.
	 */
	HALF_OPEN
}
