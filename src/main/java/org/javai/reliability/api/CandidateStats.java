package org.javai.reliability.api;

import java.time.Instant;

/**
 * Learned statistics for one candidate of one target.
 *
 * <p>Immutable; {@link #withOutcome(OutcomeKind, Instant)} returns the row that results from
 * recording one more trial. {@code trials} never decreases except through an explicit reset
 * of the owning store.</p>
 *
 * @param trials number of recorded outcomes
 * @param rewardSum sum of rewards over all trials
 * @param misclicks number of {@link OutcomeKind#MISCLICK} outcomes
 * @param timeouts number of {@link OutcomeKind#TIMEOUT} outcomes
 * @param notFound number of {@link OutcomeKind#NOT_FOUND} outcomes
 * @param lastSeen time of the most recent outcome, {@link Instant#EPOCH} if none
 */
public record CandidateStats(
		long trials,
		double rewardSum,
		long misclicks,
		long timeouts,
		long notFound,
		Instant lastSeen
) {

	public CandidateStats {
		if (trials < 0) {
			throw new IllegalArgumentException("trials must be >= 0");
		}
		if (misclicks < 0 || timeouts < 0 || notFound < 0) {
			throw new IllegalArgumentException("failure counters must be >= 0");
		}
		lastSeen = lastSeen != null ? lastSeen : Instant.EPOCH;
	}

	public static CandidateStats empty() {
		return new CandidateStats(0, 0.0, 0, 0, 0, Instant.EPOCH);
	}

	public double meanReward() {
		return trials > 0 ? rewardSum / trials : 0.0;
	}

	public double misclickRate() {
		return trials > 0 ? (double) misclicks / trials : 0.0;
	}

	public boolean untried() {
		return trials < 1;
	}

	public CandidateStats withOutcome(OutcomeKind outcome, Instant now) {
		return new CandidateStats(
				trials + 1,
				rewardSum + outcome.reward(),
				misclicks + (outcome == OutcomeKind.MISCLICK ? 1 : 0),
				timeouts + (outcome == OutcomeKind.TIMEOUT ? 1 : 0),
				notFound + (outcome == OutcomeKind.NOT_FOUND ? 1 : 0),
				now
		);
	}
}
