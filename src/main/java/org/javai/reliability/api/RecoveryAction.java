package org.javai.reliability.api;

/**
 * Recovery actions, roughly in order of increasing disruption.
 */
public enum RecoveryAction {
	RETRY_SAME,
	SWITCH_CANDIDATE,
	SWITCH_ACTION,
	RESET_ENVIRONMENT,
	BROADEN_SEARCH,
	HUMAN_HANDOFF,
	ABORT;

	/**
	 * Whether the action ends the automated attempt.
	 */
	public boolean isTerminal() {
		return this == HUMAN_HANDOFF || this == ABORT;
	}
}
