package org.javai.reliability.api;

/**
 * One concrete way to address a logical UI target.
 *
 * @param id identifier, unique within a {@link TargetKey} (e.g. "css:#submit")
 * @param layer automation layer the selector belongs to
 * @param selectorKind kind of selector (css, xpath, uia, image, coords)
 * @param selectorValue the selector itself
 * @param staticPriority declared priority; informational, selection is learned
 */
public record Candidate(
		String id,
		AutomationLayer layer,
		String selectorKind,
		String selectorValue,
		int staticPriority
) {

	public Candidate {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("id must not be blank");
		}
		if (layer == null) {
			throw new IllegalArgumentException("layer must not be null");
		}
		selectorKind = selectorKind != null ? selectorKind : "";
		selectorValue = selectorValue != null ? selectorValue : "";
	}

	public Candidate(String id, AutomationLayer layer, String selectorKind, String selectorValue) {
		this(id, layer, selectorKind, selectorValue, 0);
	}
}
