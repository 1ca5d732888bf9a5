package org.javai.reliability;

import java.time.Duration;
import org.javai.reliability.recovery.RecoverySettings;
import org.javai.reliability.select.UcbSettings;
import org.javai.reliability.store.EmaBreakerPolicy;

/**
 * Configuration of a {@link ReliabilityEngine}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * ReliabilityConfig config = ReliabilityConfig.defaults();
 *
 * // Custom configuration
 * ReliabilityConfig config = ReliabilityConfig.builder()
 *         .breakerCooldown(Duration.ofMinutes(2))
 *         .explorationWeight(0.5)
 *         .build();
 * }</pre>
 *
 * @param breaker circuit-breaker parameters
 * @param selection UCB and safety-filter parameters
 * @param recovery recovery-ladder parameters
 * @param writeAttempts backend write attempts before a row is buffered in memory
 * @param writeBackoff backoff unit between write attempts
 */
public record ReliabilityConfig(
		EmaBreakerPolicy breaker,
		UcbSettings selection,
		RecoverySettings recovery,
		int writeAttempts,
		Duration writeBackoff
) {

	public static final int DEFAULT_WRITE_ATTEMPTS = 3;
	public static final Duration DEFAULT_WRITE_BACKOFF = Duration.ofMillis(50);

	public ReliabilityConfig {
		if (breaker == null) {
			throw new IllegalArgumentException("breaker must not be null");
		}
		if (selection == null) {
			throw new IllegalArgumentException("selection must not be null");
		}
		if (recovery == null) {
			throw new IllegalArgumentException("recovery must not be null");
		}
		if (writeAttempts < 1) {
			throw new IllegalArgumentException("writeAttempts must be >= 1");
		}
		if (writeBackoff == null || writeBackoff.isNegative()) {
			throw new IllegalArgumentException("writeBackoff must be a non-negative duration");
		}
	}

	public static ReliabilityConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link ReliabilityConfig}. Every value starts at its default.
	 */
	public static class Builder {
		private double breakerAlpha = EmaBreakerPolicy.DEFAULT_ALPHA;
		private int breakerMinSamples = EmaBreakerPolicy.DEFAULT_MIN_SAMPLES;
		private double breakerFailThreshold = EmaBreakerPolicy.DEFAULT_FAIL_THRESHOLD;
		private Duration breakerCooldown = EmaBreakerPolicy.DEFAULT_COOLDOWN;
		private double explorationWeight = UcbSettings.DEFAULT_EXPLORATION_WEIGHT;
		private double misclickPenaltyWeight = UcbSettings.DEFAULT_MISCLICK_PENALTY_WEIGHT;
		private long safetyMinTrials = UcbSettings.DEFAULT_SAFETY_MIN_TRIALS;
		private double safetyMaxMisclickRate = UcbSettings.DEFAULT_SAFETY_MAX_MISCLICK_RATE;
		private int maxTransientRetries = RecoverySettings.DEFAULT_MAX_TRANSIENT_RETRIES;
		private Duration retryBackoffBase = RecoverySettings.DEFAULT_RETRY_BACKOFF_BASE;
		private int maxEscalationLevel = RecoverySettings.DEFAULT_MAX_ESCALATION_LEVEL;
		private int writeAttempts = DEFAULT_WRITE_ATTEMPTS;
		private Duration writeBackoff = DEFAULT_WRITE_BACKOFF;

		private Builder() {}

		/**
		 * Smoothing factor of the breaker's failure average, in (0, 1].
		 */
		public Builder breakerAlpha(double breakerAlpha) {
			this.breakerAlpha = breakerAlpha;
			return this;
		}

		/**
		 * Outcomes a candidate needs before its breaker may open.
		 */
		public Builder breakerMinSamples(int breakerMinSamples) {
			this.breakerMinSamples = breakerMinSamples;
			return this;
		}

		public Builder breakerFailThreshold(double breakerFailThreshold) {
			this.breakerFailThreshold = breakerFailThreshold;
			return this;
		}

		public Builder breakerCooldown(Duration breakerCooldown) {
			this.breakerCooldown = breakerCooldown;
			return this;
		}

		/**
		 * Weight {@code C} of the UCB exploration bonus.
		 */
		public Builder explorationWeight(double explorationWeight) {
			this.explorationWeight = explorationWeight;
			return this;
		}

		/**
		 * Weight {@code beta} of the misclick-rate penalty.
		 */
		public Builder misclickPenaltyWeight(double misclickPenaltyWeight) {
			this.misclickPenaltyWeight = misclickPenaltyWeight;
			return this;
		}

		public Builder safetyMinTrials(long safetyMinTrials) {
			this.safetyMinTrials = safetyMinTrials;
			return this;
		}

		public Builder safetyMaxMisclickRate(double safetyMaxMisclickRate) {
			this.safetyMaxMisclickRate = safetyMaxMisclickRate;
			return this;
		}

		public Builder maxTransientRetries(int maxTransientRetries) {
			this.maxTransientRetries = maxTransientRetries;
			return this;
		}

		public Builder retryBackoffBase(Duration retryBackoffBase) {
			this.retryBackoffBase = retryBackoffBase;
			return this;
		}

		public Builder maxEscalationLevel(int maxEscalationLevel) {
			this.maxEscalationLevel = maxEscalationLevel;
			return this;
		}

		public Builder writeAttempts(int writeAttempts) {
			this.writeAttempts = writeAttempts;
			return this;
		}

		/**
		 * Backoff unit between write attempts; attempt {@code k} waits {@code k * writeBackoff}.
		 * Zero disables waiting, which tests use.
		 */
		public Builder writeBackoff(Duration writeBackoff) {
			this.writeBackoff = writeBackoff;
			return this;
		}

		public ReliabilityConfig build() {
			return new ReliabilityConfig(
					new EmaBreakerPolicy(breakerAlpha, breakerMinSamples, breakerFailThreshold, breakerCooldown),
					new UcbSettings(explorationWeight, misclickPenaltyWeight, safetyMinTrials, safetyMaxMisclickRate),
					new RecoverySettings(maxTransientRetries, retryBackoffBase, maxEscalationLevel),
					writeAttempts,
					writeBackoff);
		}
	}
}
