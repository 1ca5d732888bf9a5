package org.javai.reliability.select;

import java.util.Comparator;
import java.util.Optional;
import org.javai.reliability.api.Candidate;
import org.javai.reliability.api.CandidateStats;

/**
 * Auditable score breakdown of one candidate.
 *
 * <p>{@code score = meanReward + exploration - misclickPenalty}, or positive infinity for a
 * candidate that has never been tried.</p>
 *
 * @param candidate the scored candidate
 * @param registrationIndex position of the candidate in registration order
 * @param stats learned statistics, empty if the candidate has never been tried
 * @param meanReward mean reward (0 when untried)
 * @param exploration uncertainty bonus {@code C * sqrt(ln N / trials)}
 * @param misclickPenalty {@code beta * misclickRate}
 * @param score final score
 */
public record CandidateScore(
		Candidate candidate,
		int registrationIndex,
		Optional<CandidateStats> stats,
		double meanReward,
		double exploration,
		double misclickPenalty,
		double score
) {

	/**
	 * Best first: higher score, then earlier registration, then smaller id.
	 */
	public static final Comparator<CandidateScore> BEST_FIRST = Comparator
			.comparingDouble(CandidateScore::score).reversed()
			.thenComparingInt(CandidateScore::registrationIndex)
			.thenComparing(s -> s.candidate().id());

	public CandidateScore {
		stats = stats != null ? stats : Optional.empty();
	}

	public boolean untried() {
		return stats.map(CandidateStats::untried).orElse(true);
	}
}
