package org.javai.reliability.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import java.time.Duration;
import java.time.Instant;
import org.javai.reliability.api.BreakerState;
import org.javai.reliability.api.BreakerStatus;
import org.javai.reliability.api.OutcomeKind;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EmaBreakerPolicyTest {

	private final EmaBreakerPolicy policy = EmaBreakerPolicy.defaults();
	private final Instant t0 = Instant.parse("2026-03-01T10:00:00Z");

	private BreakerState apply(BreakerState state, OutcomeKind outcome, int times) {
		BreakerState current = state;
		for (int i = 0; i < times; i++) {
			current = policy.onOutcome(current, outcome, t0);
		}
		return current;
	}

	@Nested
	class Closed {

		@Test
		void averageFollowsFailureWeights() {
			BreakerState state = BreakerState.closed();
			double[] expected = {0.25, 0.4375, 0.578125, 0.68359375};
			for (double value : expected) {
				state = policy.onOutcome(state, OutcomeKind.MISCLICK, t0);
				assertThat(state.emaFail()).isCloseTo(value, offset(1e-9));
			}
			assertThat(state.status()).isEqualTo(BreakerStatus.CLOSED);
			assertThat(state.attempts()).isEqualTo(4);
		}

		@Test
		void opensOnFifthConsecutiveMisclick() {
			BreakerState state = apply(BreakerState.closed(), OutcomeKind.MISCLICK, 5);

			assertThat(state.status()).isEqualTo(BreakerStatus.OPEN);
			assertThat(state.emaFail()).isCloseTo(0.7626953125, offset(1e-9));
			assertThat(state.openUntil()).isEqualTo(t0.plus(EmaBreakerPolicy.DEFAULT_COOLDOWN));
		}

		@Test
		void doesNotOpenBeforeMinimumSamples() {
			BreakerState state = apply(BreakerState.closed(), OutcomeKind.STATE_MISMATCH, 4);

			assertThat(state.emaFail()).isGreaterThan(EmaBreakerPolicy.DEFAULT_FAIL_THRESHOLD);
			assertThat(state.status()).isEqualTo(BreakerStatus.CLOSED);
		}

		@Test
		void timeoutsAloneNeverReachThreshold() {
			BreakerState state = apply(BreakerState.closed(), OutcomeKind.TIMEOUT, 50);

			assertThat(state.emaFail()).isLessThan(0.5);
			assertThat(state.status()).isEqualTo(BreakerStatus.CLOSED);
		}

		@Test
		void successesDecayTheAverage() {
			BreakerState state = apply(BreakerState.closed(), OutcomeKind.MISCLICK, 2);
			state = policy.onOutcome(state, OutcomeKind.SUCCESS, t0);

			assertThat(state.emaFail()).isCloseTo(0.4375 * 0.75, offset(1e-9));
		}
	}

	@Nested
	class OpenAndHalfOpen {

		private final BreakerState open = new BreakerState(BreakerStatus.OPEN, t0.plusSeconds(30), 0.76, 5);

		@Test
		void refreshKeepsOpenDuringCooldown() {
			assertThat(policy.refresh(open, t0.plusSeconds(29))).isSameAs(open);
		}

		@Test
		void refreshMovesToHalfOpenAfterCooldown() {
			BreakerState refreshed = policy.refresh(open, t0.plusSeconds(30));

			assertThat(refreshed.status()).isEqualTo(BreakerStatus.HALF_OPEN);
			assertThat(refreshed.emaFail()).isEqualTo(0.76);
		}

		@Test
		void outcomesDuringCooldownUpdateAverageButStayOpen() {
			BreakerState next = policy.onOutcome(open, OutcomeKind.SUCCESS, t0.plusSeconds(10));

			assertThat(next.status()).isEqualTo(BreakerStatus.OPEN);
			assertThat(next.openUntil()).isEqualTo(open.openUntil());
			assertThat(next.attempts()).isEqualTo(6);
			assertThat(next.emaFail()).isCloseTo(0.57, offset(1e-9));
		}

		@Test
		void successWhileHalfOpenClosesAndClears() {
			BreakerState halfOpen = open.withStatus(BreakerStatus.HALF_OPEN);

			BreakerState next = policy.onOutcome(halfOpen, OutcomeKind.SUCCESS, t0.plusSeconds(40));

			assertThat(next.status()).isEqualTo(BreakerStatus.CLOSED);
			assertThat(next.emaFail()).isZero();
			assertThat(next.attempts()).isZero();
		}

		@Test
		void heavyFailureWhileHalfOpenReopens() {
			BreakerState halfOpen = open.withStatus(BreakerStatus.HALF_OPEN);
			Instant now = t0.plusSeconds(40);

			BreakerState next = policy.onOutcome(halfOpen, OutcomeKind.NOT_FOUND, now);

			assertThat(next.status()).isEqualTo(BreakerStatus.OPEN);
			assertThat(next.openUntil()).isEqualTo(now.plusSeconds(30));
		}

		@Test
		void timeoutWhileHalfOpenReopens() {
			BreakerState halfOpen = open.withStatus(BreakerStatus.HALF_OPEN);

			assertThat(policy.onOutcome(halfOpen, OutcomeKind.TIMEOUT, t0.plusSeconds(40)).status())
					.isEqualTo(BreakerStatus.OPEN);
		}

		@Test
		void expiredOpenIsProbedByTheIncomingOutcome() {
			BreakerState next = policy.onOutcome(open, OutcomeKind.SUCCESS, t0.plusSeconds(31));

			assertThat(next.status()).isEqualTo(BreakerStatus.CLOSED);
		}
	}

	@Test
	void rejectsInvalidParameters() {
		assertThatThrownBy(() -> new EmaBreakerPolicy(0.0, 5, 0.5, Duration.ofSeconds(30)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("alpha");
		assertThatThrownBy(() -> new EmaBreakerPolicy(0.25, 0, 0.5, Duration.ofSeconds(30)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("minSamples");
		assertThatThrownBy(() -> new EmaBreakerPolicy(0.25, 5, 0.5, Duration.ofSeconds(-1)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("cooldown");
	}
}
