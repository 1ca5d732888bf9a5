package org.javai.reliability.api;

/**
 * Identity of one logical UI target under which interchangeable candidates compete.
 *
 * <p>Two keys are the same target when screen, intent and element role are all equal.
 * The string form {@code screenKey:intent:elementRole} is stable and is what log
 * messages show.</p>
 *
 * @param screenKey identifier of the screen or window the target lives on
 * @param intent what the caller wants to do with the element (e.g. "click_submit")
 * @param elementRole role of the element (e.g. "button")
 */
public record TargetKey(
		String screenKey,
		String intent,
		String elementRole
) {

	public TargetKey {
		if (screenKey == null || screenKey.isBlank()) {
			throw new IllegalArgumentException("screenKey must not be blank");
		}
		if (intent == null || intent.isBlank()) {
			throw new IllegalArgumentException("intent must not be blank");
		}
		if (elementRole == null || elementRole.isBlank()) {
			throw new IllegalArgumentException("elementRole must not be blank");
		}
	}

	public static TargetKey of(String screenKey, String intent, String elementRole) {
		return new TargetKey(screenKey, intent, elementRole);
	}

	/**
	 * Stable string form, suitable as a persistence or log key.
	 */
	public String asString() {
		return screenKey + ":" + intent + ":" + elementRole;
	}

	@Override
	public String toString() {
		return asString();
	}
}
