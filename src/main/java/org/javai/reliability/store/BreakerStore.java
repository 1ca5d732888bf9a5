package org.javai.reliability.store;

import java.util.Optional;
import org.javai.reliability.api.BreakerState;
import org.javai.reliability.api.TargetKey;

/**
 * Read side of the per-candidate circuit breakers. Breakers are written only as a side
 * effect of {@link StatsStore#recordOutcome}.
 */
public interface BreakerStore {

	/**
	 * Whether the candidate is quarantined right now.
	 *
	 * <p>An OPEN breaker whose cooldown has elapsed is moved to HALF_OPEN by this call and
	 * reported as not open, so that the candidate can be probed.</p>
	 */
	boolean isOpen(TargetKey target, String candidateId);

	/**
	 * Current breaker state, with the same lazy OPEN to HALF_OPEN transition as
	 * {@link #isOpen}.
	 */
	Optional<BreakerState> getBreaker(TargetKey target, String candidateId);
}
