package org.javai.reliability.store;

import java.util.Map;
import java.util.Optional;
import org.javai.reliability.api.CandidateStats;
import org.javai.reliability.api.OutcomeKind;
import org.javai.reliability.api.TargetKey;

/**
 * Reward accounting per (target, candidate).
 *
 * <p>Recording an outcome also updates the candidate's circuit breaker in the same
 * atomic step; there is no way to update one without the other.</p>
 */
public interface StatsStore {

	/**
	 * Records one outcome for a candidate and returns the reward credited for it.
	 *
	 * <p>Never throws on persistence failure; see {@link #persistenceStatus()}.</p>
	 *
	 * @throws NullPointerException if any argument is null
	 */
	double recordOutcome(TargetKey target, String candidateId, OutcomeKind outcome);

	Optional<CandidateStats> getStats(TargetKey target, String candidateId);

	/**
	 * Statistics of every candidate of a target that has at least one recorded outcome,
	 * keyed and ordered by candidate id.
	 */
	Map<String, CandidateStats> getTargetStats(TargetKey target);

	void resetTarget(TargetKey target);

	void resetAll();

	PersistenceStatus persistenceStatus();
}
