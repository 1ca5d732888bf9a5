package org.javai.reliability.store;

import org.javai.reliability.api.BreakerState;
import org.javai.reliability.api.CandidateStats;

/**
 * Statistics and breaker state of one candidate, persisted together so that the two can
 * never diverge.
 */
public record LearningRow(CandidateStats stats, BreakerState breaker) {

	public LearningRow {
		if (stats == null) {
			throw new IllegalArgumentException("stats must not be null");
		}
		if (breaker == null) {
			throw new IllegalArgumentException("breaker must not be null");
		}
	}

	public static LearningRow initial() {
		return new LearningRow(CandidateStats.empty(), BreakerState.closed());
	}

	public LearningRow withBreaker(BreakerState newBreaker) {
		return new LearningRow(stats, newBreaker);
	}
}
