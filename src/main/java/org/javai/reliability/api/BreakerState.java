package org.javai.reliability.api;

import java.time.Instant;

/**
 * Circuit-breaker row for one candidate of one target.
 *
 * @param status current breaker status
 * @param openUntil end of the cooldown while OPEN; {@link Instant#EPOCH} when never opened
 * @param emaFail exponentially smoothed failure estimate in [0, 1]
 * @param attempts outcomes seen since the breaker was created or last closed from HALF_OPEN
 */
public record BreakerState(
		BreakerStatus status,
		Instant openUntil,
		double emaFail,
		long attempts
) {

	public BreakerState {
		if (status == null) {
			throw new IllegalArgumentException("status must not be null");
		}
		if (emaFail < 0.0 || emaFail > 1.0) {
			throw new IllegalArgumentException("emaFail must be within [0, 1]");
		}
		if (attempts < 0) {
			throw new IllegalArgumentException("attempts must be >= 0");
		}
		openUntil = openUntil != null ? openUntil : Instant.EPOCH;
	}

	public static BreakerState closed() {
		return new BreakerState(BreakerStatus.CLOSED, Instant.EPOCH, 0.0, 0);
	}

	/**
	 * True while the breaker is OPEN and its cooldown has not elapsed at {@code now}.
	 */
	public boolean blocksAt(Instant now) {
		return status == BreakerStatus.OPEN && now.isBefore(openUntil);
	}

	/**
	 * True when the breaker is OPEN but its cooldown has elapsed at {@code now}.
	 */
	public boolean cooldownElapsedAt(Instant now) {
		return status == BreakerStatus.OPEN && !now.isBefore(openUntil);
	}

	public BreakerState withStatus(BreakerStatus newStatus) {
		return new BreakerState(newStatus, openUntil, emaFail, attempts);
	}
}
