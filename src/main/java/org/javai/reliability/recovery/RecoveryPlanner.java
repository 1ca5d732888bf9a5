package org.javai.reliability.recovery;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.reliability.api.FailureClass;
import org.javai.reliability.api.FailureEvent;
import org.javai.reliability.api.RecoveryAction;
import org.javai.reliability.api.RecoveryDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides how to recover from a failed action, escalating as failures accumulate within one
 * logical run.
 *
 * <table>
 *   <caption>Decisions by failure class</caption>
 *   <tr><th>Class</th><th>Decision</th></tr>
 *   <tr><td>FATAL</td><td>ABORT</td></tr>
 *   <tr><td>ANTI_BOT</td><td>HUMAN_HANDOFF, never a retry</td></tr>
 *   <tr><td>POLICY_GATE</td><td>SWITCH_ACTION, or RESET_ENVIRONMENT when the event asks for it</td></tr>
 *   <tr><td>TRANSIENT</td><td>RETRY_SAME with linear backoff, then SWITCH_CANDIDATE</td></tr>
 *   <tr><td>DETERMINISTIC</td><td>escalation ladder</td></tr>
 * </table>
 *
 * <p>Ladder rungs: 1 SWITCH_CANDIDATE, 2 SWITCH_ACTION, 3 RESET_ENVIRONMENT, 4 BROADEN_SEARCH,
 * beyond the last rung ABORT. An exhausted transient failure raises the level but always
 * answers SWITCH_CANDIDATE, so a later deterministic failure resumes one rung higher.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread safe. Use one planner per logical task run and call {@link #reset()} before
 * reusing it for another run.</p>
 */
public class RecoveryPlanner {

	private static final Logger logger = LoggerFactory.getLogger(RecoveryPlanner.class);

	/**
	 * Event detail flag asking a policy-gate recovery to reset the environment.
	 */
	public static final String RESET_ENVIRONMENT_HINT = "reset_environment";

	/**
	 * Decision detail key naming a suggested alternate route.
	 */
	public static final String SUGGESTED_ROUTE = "suggested_route";

	private static final List<RecoveryAction> LADDER = List.of(
			RecoveryAction.SWITCH_CANDIDATE,
			RecoveryAction.SWITCH_ACTION,
			RecoveryAction.RESET_ENVIRONMENT,
			RecoveryAction.BROADEN_SEARCH);

	private final FailureClassifier classifier;
	private final RecoverySettings settings;
	private final List<FailureEvent> history = new ArrayList<>();
	private int escalationLevel;

	public RecoveryPlanner() {
		this(new FailureClassifier(), RecoverySettings.defaults());
	}

	public RecoveryPlanner(FailureClassifier classifier, RecoverySettings settings) {
		this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	public FailureClass classify(String symptom) {
		return classifier.classify(symptom);
	}

	/**
	 * Classifies the symptom and decides in one step.
	 */
	public RecoveryDecision decide(String symptom, int retryCount) {
		return decide(new FailureEvent(classify(symptom), symptom, retryCount));
	}

	public RecoveryDecision decide(FailureEvent event) {
		Objects.requireNonNull(event, "event must not be null");
		history.add(event);
		RecoveryDecision decision = switch (event.failureClass()) {
			case FATAL -> new RecoveryDecision(RecoveryAction.ABORT, "Fatal failure: " + event.symptom(),
					event.detail());
			case ANTI_BOT -> new RecoveryDecision(RecoveryAction.HUMAN_HANDOFF,
					"Bot detection: " + event.symptom(), event.detail());
			case POLICY_GATE -> policyGate(event);
			case TRANSIENT -> transientFailure(event);
			case DETERMINISTIC -> escalate(event, "Deterministic failure: " + event.symptom());
		};
		logger.debug("{} ({}, retry {}) -> {} at level {}", event.symptom(), event.failureClass(),
				event.retryCount(), decision.action(), escalationLevel);
		return decision;
	}

	/**
	 * Clears escalation level and history for a new run.
	 */
	public void reset() {
		escalationLevel = 0;
		history.clear();
	}

	public int escalationLevel() {
		return escalationLevel;
	}

	public List<FailureEvent> history() {
		return List.copyOf(history);
	}

	private RecoveryDecision policyGate(FailureEvent event) {
		if (Boolean.TRUE.equals(event.detail().get(RESET_ENVIRONMENT_HINT))) {
			return new RecoveryDecision(RecoveryAction.RESET_ENVIRONMENT,
					"Policy gate, resetting environment: " + event.symptom(), event.detail());
		}
		if ("login_modal_shown".equals(FailureClassifier.normalize(event.symptom()))) {
			Map<String, Object> detail = new HashMap<>(event.detail());
			detail.put(SUGGESTED_ROUTE, "url_query");
			return new RecoveryDecision(RecoveryAction.SWITCH_ACTION,
					"Login modal shown, switching to URL query route", detail);
		}
		return new RecoveryDecision(RecoveryAction.SWITCH_ACTION, "Policy gate: " + event.symptom(),
				event.detail());
	}

	private RecoveryDecision transientFailure(FailureEvent event) {
		int retryCount = event.retryCount();
		if (retryCount < settings.maxTransientRetries()) {
			long waitMs = settings.retryBackoffBase().multipliedBy(retryCount + 1L).toMillis();
			Map<String, Object> detail = new HashMap<>(event.detail());
			detail.put(RecoveryDecision.WAIT_MS, waitMs);
			return new RecoveryDecision(RecoveryAction.RETRY_SAME,
					"Transient failure: " + event.symptom() + " (retry " + (retryCount + 1) + "/"
							+ settings.maxTransientRetries() + ")",
					detail);
		}
		escalationLevel++;
		return new RecoveryDecision(RecoveryAction.SWITCH_CANDIDATE,
				"Transient failure persisted: " + event.symptom() + " (escalation level " + escalationLevel + ")",
				event.detail());
	}

	private RecoveryDecision escalate(FailureEvent event, String reason) {
		escalationLevel++;
		if (escalationLevel > settings.maxEscalationLevel()) {
			return new RecoveryDecision(RecoveryAction.ABORT,
					reason + " (escalation limit " + settings.maxEscalationLevel() + " reached)", event.detail());
		}
		RecoveryAction action = LADDER.get(escalationLevel - 1);
		return new RecoveryDecision(action, reason + " (escalation level " + escalationLevel + ")", event.detail());
	}
}
