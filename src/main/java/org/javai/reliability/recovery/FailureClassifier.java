package org.javai.reliability.recovery;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.javai.reliability.api.FailureClass;

/**
 * Maps free-form failure symptoms to a {@link FailureClass}.
 *
 * <p>The symptom is lower-cased and hyphens and spaces become underscores; it then matches a
 * class when it contains one of the class's keywords. Classes are tried from the most to the
 * least severe: FATAL, ANTI_BOT, POLICY_GATE, DETERMINISTIC, TRANSIENT. Anything unmatched is
 * DETERMINISTIC, so an unknown failure leads to escalation rather than blind retries.</p>
 *
 * <p>Stateless and thread safe. Never throws.</p>
 */
public final class FailureClassifier {

	static final Set<String> FATAL_SYMPTOMS = Set.of(
			"crash", "permission_denied", "disk_full", "out_of_memory", "invalid_state");

	static final Set<String> ANTI_BOT_SYMPTOMS = Set.of(
			"captcha_detected", "rate_limited", "403_forbidden", "429_too_many", "bot_detected",
			"challenge_required");

	static final Set<String> POLICY_GATE_SYMPTOMS = Set.of(
			"login_modal_shown", "login_required", "age_gate", "terms_required", "cookie_consent",
			"region_block");

	static final Set<String> DETERMINISTIC_SYMPTOMS = Set.of(
			"element_not_found", "stale_selector", "event_mismatch", "overlay_blocking", "wrong_element",
			"no_navigation");

	static final Set<String> TRANSIENT_SYMPTOMS = Set.of(
			"timeout", "network_flaky", "page_not_ready", "loading", "request_blocked", "connection_error",
			"retry_after");

	private static final List<Vocabulary> BY_PRIORITY = List.of(
			new Vocabulary(FailureClass.FATAL, FATAL_SYMPTOMS),
			new Vocabulary(FailureClass.ANTI_BOT, ANTI_BOT_SYMPTOMS),
			new Vocabulary(FailureClass.POLICY_GATE, POLICY_GATE_SYMPTOMS),
			new Vocabulary(FailureClass.DETERMINISTIC, DETERMINISTIC_SYMPTOMS),
			new Vocabulary(FailureClass.TRANSIENT, TRANSIENT_SYMPTOMS));

	public FailureClass classify(String symptom) {
		if (symptom == null || symptom.isBlank()) {
			return FailureClass.DETERMINISTIC;
		}
		String normalized = normalize(symptom);
		for (Vocabulary vocabulary : BY_PRIORITY) {
			if (vocabulary.matches(normalized)) {
				return vocabulary.failureClass();
			}
		}
		return FailureClass.DETERMINISTIC;
	}

	static String normalize(String symptom) {
		return symptom.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
	}

	private record Vocabulary(FailureClass failureClass, Set<String> keywords) {

		boolean matches(String normalizedSymptom) {
			for (String keyword : keywords) {
				if (normalizedSymptom.contains(keyword)) {
					return true;
				}
			}
			return false;
		}
	}
}
