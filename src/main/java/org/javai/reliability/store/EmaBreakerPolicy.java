package org.javai.reliability.store;

import java.time.Duration;
import java.time.Instant;
import org.javai.reliability.api.BreakerState;
import org.javai.reliability.api.BreakerStatus;
import org.javai.reliability.api.OutcomeKind;

/**
 * State machine of the per-candidate circuit breaker, driven by an exponential moving
 * average of outcome failure weights.
 *
 * <ul>
 *   <li>CLOSED to OPEN once {@code emaFail >= failThreshold} after at least
 *       {@code minSamples} outcomes.</li>
 *   <li>OPEN to HALF_OPEN once the cooldown has elapsed, evaluated lazily on access.</li>
 *   <li>HALF_OPEN to CLOSED on a success, which also clears the average and the attempt
 *       count.</li>
 *   <li>HALF_OPEN to OPEN on an outcome weighing at least {@value #REOPEN_WEIGHT}.</li>
 * </ul>
 *
 * <p>Stateless and thread safe; every method returns a new {@link BreakerState}.</p>
 *
 * @param alpha smoothing factor of the average, in (0, 1]
 * @param minSamples outcomes required before the breaker may open
 * @param failThreshold average failure weight at which the breaker opens
 * @param cooldown how long an opened breaker stays OPEN
 */
public record EmaBreakerPolicy(
		double alpha,
		int minSamples,
		double failThreshold,
		Duration cooldown
) {

	public static final double DEFAULT_ALPHA = 0.25;
	public static final int DEFAULT_MIN_SAMPLES = 5;
	public static final double DEFAULT_FAIL_THRESHOLD = 0.5;
	public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(30);

	static final double REOPEN_WEIGHT = 0.5;

	public EmaBreakerPolicy {
		if (!(alpha > 0.0 && alpha <= 1.0)) {
			throw new IllegalArgumentException("alpha must be within (0, 1]");
		}
		if (minSamples < 1) {
			throw new IllegalArgumentException("minSamples must be >= 1");
		}
		if (!(failThreshold > 0.0 && failThreshold <= 1.0)) {
			throw new IllegalArgumentException("failThreshold must be within (0, 1]");
		}
		if (cooldown == null || cooldown.isNegative()) {
			throw new IllegalArgumentException("cooldown must be a non-negative duration");
		}
	}

	public static EmaBreakerPolicy defaults() {
		return new EmaBreakerPolicy(DEFAULT_ALPHA, DEFAULT_MIN_SAMPLES, DEFAULT_FAIL_THRESHOLD, DEFAULT_COOLDOWN);
	}

	/**
	 * Applies the lazy OPEN to HALF_OPEN transition.
	 */
	public BreakerState refresh(BreakerState state, Instant now) {
		if (state.cooldownElapsedAt(now)) {
			return state.withStatus(BreakerStatus.HALF_OPEN);
		}
		return state;
	}

	/**
	 * Folds one outcome into the breaker.
	 */
	public BreakerState onOutcome(BreakerState state, OutcomeKind outcome, Instant now) {
		BreakerState current = refresh(state, now);
		double weight = outcome.failureWeight();
		double ema = clamp(alpha * weight + (1.0 - alpha) * current.emaFail());
		long attempts = current.attempts() + 1;

		return switch (current.status()) {
			case CLOSED -> {
				if (ema >= failThreshold && attempts >= minSamples) {
					yield new BreakerState(BreakerStatus.OPEN, now.plus(cooldown), ema, attempts);
				}
				yield new BreakerState(BreakerStatus.CLOSED, current.openUntil(), ema, attempts);
			}
			case OPEN -> new BreakerState(BreakerStatus.OPEN, current.openUntil(), ema, attempts);
			case HALF_OPEN -> {
				if (outcome.isSuccess()) {
					yield new BreakerState(BreakerStatus.CLOSED, current.openUntil(), 0.0, 0);
				}
				if (weight >= REOPEN_WEIGHT) {
					yield new BreakerState(BreakerStatus.OPEN, now.plus(cooldown), ema, attempts);
				}
				yield new BreakerState(BreakerStatus.HALF_OPEN, current.openUntil(), ema, attempts);
			}
		};
	}

	private static double clamp(double value) {
		return Math.max(0.0, Math.min(1.0, value));
	}
}
