package org.javai.reliability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.javai.reliability.api.AutomationLayer;
import org.javai.reliability.api.Candidate;
import org.javai.reliability.api.FailureClass;
import org.javai.reliability.api.OutcomeKind;
import org.javai.reliability.api.RecoveryAction;
import org.javai.reliability.api.TargetKey;
import org.javai.reliability.store.PersistenceStatus;
import org.javai.reliability.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReliabilityEngineTest {

	private static final TargetKey SUBMIT = TargetKey.of("vscode:main", "click_submit", "button");

	private static final Candidate CSS = new Candidate("css:#submit", AutomationLayer.CDP, "css", "#submit");
	private static final Candidate XPATH = new Candidate("xpath:submit", AutomationLayer.CDP, "xpath", "//button");
	private static final Candidate UIA = new Candidate("uia:Submit", AutomationLayer.UIA, "uia_name", "Submit");

	private MutableClock clock;
	private ReliabilityEngine engine;

	@BeforeEach
	void setUp() {
		clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
		engine = ReliabilityEngine.builder()
				.clock(clock)
				.config(ReliabilityConfig.builder().writeBackoff(Duration.ZERO).build())
				.build();
		engine.registerCandidates(SUBMIT, List.of(CSS, XPATH, UIA));
	}

	@Nested
	class Selection {

		@Test
		void learnsAwayFromMisclickingCandidate() {
			for (int i = 0; i < 5; i++) {
				engine.reportOutcome(SUBMIT, CSS.id(), OutcomeKind.MISCLICK);
			}

			assertThat(engine.isOpen(SUBMIT, CSS.id())).isTrue();
			assertThat(engine.selectBest(SUBMIT)).contains(XPATH);
		}

		@Test
		void escalatesLayerOnceCdpIsExhausted() {
			for (Candidate candidate : List.of(CSS, XPATH)) {
				for (int i = 0; i < 5; i++) {
					engine.reportOutcome(SUBMIT, candidate.id(), OutcomeKind.MISCLICK);
				}
			}

			assertThat(engine.escalateLayer(SUBMIT, AutomationLayer.CDP)).contains(AutomationLayer.UIA);
			assertThat(engine.selectBest(SUBMIT)).contains(UIA);
		}

		@Test
		void acceptsOutcomeWireNames() {
			assertThat(engine.reportOutcome(SUBMIT, CSS.id(), "state_mismatch")).isEqualTo(-1.0);
			assertThat(engine.getStats(SUBMIT, CSS.id()).orElseThrow().trials()).isEqualTo(1);
		}

		@Test
		void unknownOutcomeChangesNothing() {
			assertThatThrownBy(() -> engine.reportOutcome(SUBMIT, CSS.id(), "partial"))
					.isInstanceOf(IllegalArgumentException.class);
			assertThat(engine.getStats(SUBMIT, CSS.id())).isEmpty();
		}

		@Test
		void registrationIsIdempotent() {
			assertThat(engine.registerCandidate(SUBMIT, CSS)).isFalse();
			assertThat(engine.candidates(SUBMIT)).containsExactly(CSS, XPATH, UIA);
		}

		@Test
		void scoresListEveryEligibleCandidate() {
			engine.reportOutcome(SUBMIT, CSS.id(), OutcomeKind.SUCCESS);

			assertThat(engine.scoreCandidates(SUBMIT))
					.extracting(score -> score.candidate().id())
					.containsExactly(XPATH.id(), UIA.id(), CSS.id());
		}

		@Test
		void resetTargetForgetsLearning() {
			for (int i = 0; i < 5; i++) {
				engine.reportOutcome(SUBMIT, CSS.id(), OutcomeKind.MISCLICK);
			}

			engine.resetTarget(SUBMIT);

			assertThat(engine.isOpen(SUBMIT, CSS.id())).isFalse();
			assertThat(engine.getBreaker(SUBMIT, CSS.id())).isEmpty();
			assertThat(engine.candidates(SUBMIT)).hasSize(3);
		}
	}

	@Nested
	class Recovery {

		@Test
		void classifiesThroughEngine() {
			assertThat(engine.classify("captcha_detected")).isEqualTo(FailureClass.ANTI_BOT);
		}

		@Test
		void escalationIsTrackedPerRun() {
			assertThat(engine.decide("run-1", "element_not_found", 0).action())
					.isEqualTo(RecoveryAction.SWITCH_CANDIDATE);
			assertThat(engine.decide("run-1", "element_not_found", 1).action())
					.isEqualTo(RecoveryAction.SWITCH_ACTION);
			assertThat(engine.decide("run-2", "element_not_found", 0).action())
					.isEqualTo(RecoveryAction.SWITCH_CANDIDATE);
			assertThat(engine.activeRuns()).isEqualTo(2);
		}

		@Test
		void endRunForgetsEscalation() {
			engine.decide("run-1", "stale_selector", 0);
			engine.decide("run-1", "stale_selector", 0);

			engine.endRun("run-1");

			assertThat(engine.activeRuns()).isZero();
			assertThat(engine.decide("run-1", "stale_selector", 0).action())
					.isEqualTo(RecoveryAction.SWITCH_CANDIDATE);
		}

		@Test
		void resetAllClearsRuns() {
			engine.decide("run-1", "timeout", 0);

			engine.resetAll();

			assertThat(engine.activeRuns()).isZero();
		}

		@Test
		void plannersHonourConfiguredRetries() {
			ReliabilityEngine patient = ReliabilityEngine.builder()
					.config(ReliabilityConfig.builder().maxTransientRetries(3).build())
					.build();

			assertThat(patient.decide("run", "timeout", 2).action()).isEqualTo(RecoveryAction.RETRY_SAME);
			assertThat(patient.decide("run", "timeout", 2).backoff()).isEqualTo(Duration.ofMillis(1500));
			assertThat(patient.newRecoveryPlanner().decide("timeout", 3).action())
					.isEqualTo(RecoveryAction.SWITCH_CANDIDATE);
		}
	}

	@Nested
	class Persistence {

		@TempDir
		Path tempDir;

		@Test
		void storeFileKeepsLearningAcrossEngines() {
			Path file = tempDir.resolve("learning.json");
			ReliabilityEngine first = ReliabilityEngine.builder().clock(clock).storeFile(file).build();
			first.reportOutcome(SUBMIT, CSS.id(), OutcomeKind.NOT_FOUND);
			first.reportOutcome(SUBMIT, CSS.id(), OutcomeKind.SUCCESS);

			ReliabilityEngine second = ReliabilityEngine.builder().clock(clock).storeFile(file).build();

			assertThat(second.getStats(SUBMIT, CSS.id()).orElseThrow().trials()).isEqualTo(2);
			assertThat(second.persistenceStatus()).isEqualTo(PersistenceStatus.HEALTHY);
			assertThat(second.candidates(SUBMIT)).isEmpty();
		}

		@Test
		void statusListenerSeesDegradation() throws Exception {
			Path blocker = Files.createFile(tempDir.resolve("blocker"));
			List<PersistenceStatus> seen = new ArrayList<>();
			ReliabilityEngine degraded = ReliabilityEngine.builder()
					.clock(clock)
					.config(ReliabilityConfig.builder().writeAttempts(1).build())
					.storeFile(blocker.resolve("learning.json"))
					.statusListener((previous, current, pending) -> seen.add(current))
					.build();

			degraded.reportOutcome(SUBMIT, CSS.id(), OutcomeKind.SUCCESS);

			assertThat(seen).containsExactly(PersistenceStatus.DEGRADED_PERSISTENCE);
			assertThat(degraded.flushPending()).isEqualTo(PersistenceStatus.DEGRADED_PERSISTENCE);
			assertThat(degraded.getStats(SUBMIT, CSS.id())).isPresent();
		}
	}
}
