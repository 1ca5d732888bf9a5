package org.javai.reliability.api;

import java.util.Locale;

/**
 * Closed set of outcomes a caller can report after executing an action through a candidate.
 *
 * <p>Each outcome carries the reward credited to the candidate's statistics and the
 * failure weight fed into its circuit breaker.</p>
 */
public enum OutcomeKind {
	/**
	 * The action hit the intended element and produced the expected effect.
	 */
	SUCCESS("success", 1.0, 0.0),

	/**
	 * The action executed but affected the wrong element.
	 */
	MISCLICK("misclick", -1.0, 1.0),

	/**
	 * The selector resolved to nothing.
	 */
	NOT_FOUND("not_found", -0.6, 0.7),

	/**
	 * The action did not complete within the caller's deadline.
	 */
	TIMEOUT("timeout", -0.4, 0.5),

	/**
	 * The action executed but the screen ended in an unexpected state.
	 */
	STATE_MISMATCH("state_mismatch", -1.0, 1.0);

	private final String wireName;
	private final double reward;
	private final double failureWeight;

	OutcomeKind(String wireName, double reward, double failureWeight) {
		this.wireName = wireName;
		this.reward = reward;
		this.failureWeight = failureWeight;
	}

	public String wireName() {
		return wireName;
	}

	public double reward() {
		return reward;
	}

	public double failureWeight() {
		return failureWeight;
	}

	public boolean isSuccess() {
		return this == SUCCESS;
	}

	/**
	 * Resolves an outcome from its wire name ("not_found") or constant name ("NOT_FOUND").
	 *
	 * @throws IllegalArgumentException if the name is not one of the five outcomes
	 */
	public static OutcomeKind fromWireName(String name) {
		if (name == null) {
			throw new IllegalArgumentException("outcome must not be null");
		}
		String normalized = name.trim().toLowerCase(Locale.ROOT);
		for (OutcomeKind kind : values()) {
			if (kind.wireName.equals(normalized)) {
				return kind;
			}
		}
		throw new IllegalArgumentException("Unknown outcome: '" + name + "'");
	}
}
