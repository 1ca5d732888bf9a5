package org.javai.reliability.api;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A failed action as reported to the recovery planner.
 *
 * @param failureClass classification of the symptom
 * @param symptom short symptom code, e.g. "element_not_found"
 * @param retryCount how many times this step has already been retried (0 on first failure)
 * @param detail caller-supplied context passed through to the decision
 */
public record FailureEvent(
		FailureClass failureClass,
		String symptom,
		int retryCount,
		Map<String, Object> detail
) {

	public FailureEvent {
		if (failureClass == null) {
			throw new IllegalArgumentException("failureClass must not be null");
		}
		if (retryCount < 0) {
			throw new IllegalArgumentException("retryCount must be >= 0");
		}
		symptom = symptom != null ? symptom : "";
		detail = detail != null ? Collections.unmodifiableMap(new HashMap<>(detail)) : Map.of();
	}

	public FailureEvent(FailureClass failureClass, String symptom, int retryCount) {
		this(failureClass, symptom, retryCount, Map.of());
	}
}
