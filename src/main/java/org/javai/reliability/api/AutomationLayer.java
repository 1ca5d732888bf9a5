package org.javai.reliability.api;

/**
 * Automation layers through which a candidate can reach its target, ordered from the
 * nearest (most structured, cheapest) to the farthest (least structured, most expensive).
 *
 * <p>Declaration order is the escalation order.</p>
 */
public enum AutomationLayer {
	/**
	 * Browser DOM through the Chrome DevTools Protocol.
	 */
	CDP,

	/**
	 * Native accessibility tree through UI Automation.
	 */
	UIA,

	/**
	 * Image matching and coordinate clicks.
	 */
	PIXEL,

	/**
	 * Vision-model grounding on a screenshot.
	 */
	VLM;

	public boolean isFartherThan(AutomationLayer other) {
		return ordinal() > other.ordinal();
	}
}
