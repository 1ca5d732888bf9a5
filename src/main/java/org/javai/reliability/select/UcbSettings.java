package org.javai.reliability.select;

/**
 * Tunables of the UCB selection rule and its safety filter.
 *
 * @param explorationWeight weight {@code C} of the uncertainty bonus
 * @param misclickPenaltyWeight weight {@code beta} of the misclick-rate penalty
 * @param safetyMinTrials trials after which the misclick safety filter applies
 * @param safetyMaxMisclickRate misclick rate above which a candidate is never auto-selected
 */
public record UcbSettings(
		double explorationWeight,
		double misclickPenaltyWeight,
		long safetyMinTrials,
		double safetyMaxMisclickRate
) {

	public static final double DEFAULT_EXPLORATION_WEIGHT = 1.0;
	public static final double DEFAULT_MISCLICK_PENALTY_WEIGHT = 0.5;
	public static final long DEFAULT_SAFETY_MIN_TRIALS = 10;
	public static final double DEFAULT_SAFETY_MAX_MISCLICK_RATE = 0.2;

	public UcbSettings {
		if (explorationWeight < 0.0) {
			throw new IllegalArgumentException("explorationWeight must be >= 0");
		}
		if (misclickPenaltyWeight < 0.0) {
			throw new IllegalArgumentException("misclickPenaltyWeight must be >= 0");
		}
		if (safetyMinTrials < 1) {
			throw new IllegalArgumentException("safetyMinTrials must be >= 1");
		}
		if (safetyMaxMisclickRate < 0.0 || safetyMaxMisclickRate > 1.0) {
			throw new IllegalArgumentException("safetyMaxMisclickRate must be within [0, 1]");
		}
	}

	public static UcbSettings defaults() {
		return new UcbSettings(DEFAULT_EXPLORATION_WEIGHT, DEFAULT_MISCLICK_PENALTY_WEIGHT,
				DEFAULT_SAFETY_MIN_TRIALS, DEFAULT_SAFETY_MAX_MISCLICK_RATE);
	}
}
