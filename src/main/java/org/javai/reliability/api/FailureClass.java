package org.javai.reliability.api;

/**
 * Classification of a failure symptom, which determines the recovery strategy.
 */
public enum FailureClass {
	/**
	 * Likely to clear up on its own (timeouts, flaky network, page still loading).
	 */
	TRANSIENT,

	/**
	 * Will repeat if the same thing is tried again (element not found, stale selector).
	 */
	DETERMINISTIC,

	/**
	 * An unexpected gate such as a login modal or consent dialog.
	 */
	POLICY_GATE,

	/**
	 * Active bot detection (captcha, rate limiting).
	 */
	ANTI_BOT,

	/**
	 * Nothing sensible can be done automatically.
	 */
	FATAL
}
