package org.javai.reliability.select;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.reliability.api.AutomationLayer;
import org.javai.reliability.api.Candidate;
import org.javai.reliability.api.CandidateStats;
import org.javai.reliability.api.OutcomeKind;
import org.javai.reliability.api.TargetKey;
import org.javai.reliability.store.BreakerStore;
import org.javai.reliability.store.StatsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bandit-based choice among the candidates of a target.
 *
 * <p>Each eligible candidate is scored with an upper confidence bound penalised by its
 * misclick rate:</p>
 * <pre>
 * score = meanReward + C * sqrt(ln N / trials) - beta * misclickRate
 * </pre>
 * <p>where {@code N} is the total number of trials over the eligible candidates (at least 1).
 * A candidate that has never been tried scores positive infinity, so every candidate is
 * tried once before learned statistics take over. Ties go to the earlier registered
 * candidate, then to the smaller id.</p>
 *
 * <p>Eligibility:</p>
 * <ul>
 *   <li>with {@code excludeOpen}, candidates whose breaker is OPEN are skipped;</li>
 *   <li>with {@code safetyFilter}, candidates with at least {@code safetyMinTrials} trials and
 *       a misclick rate above {@code safetyMaxMisclickRate} are skipped, regardless of their
 *       breaker.</li>
 * </ul>
 */
public class CandidateSelector {

	private static final Logger logger = LoggerFactory.getLogger(CandidateSelector.class);

	private final CandidateRegistry registry;
	private final StatsStore statsStore;
	private final BreakerStore breakerStore;
	private final UcbSettings settings;

	public CandidateSelector(CandidateRegistry registry, StatsStore statsStore, BreakerStore breakerStore,
			UcbSettings settings) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
		this.statsStore = Objects.requireNonNull(statsStore, "statsStore must not be null");
		this.breakerStore = Objects.requireNonNull(breakerStore, "breakerStore must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	public boolean registerCandidate(TargetKey target, Candidate candidate) {
		return registry.register(target, candidate);
	}

	public void registerCandidates(TargetKey target, Collection<Candidate> candidates) {
		registry.registerAll(target, candidates);
	}

	public List<Candidate> candidates(TargetKey target) {
		return registry.candidates(target);
	}

	public List<Candidate> candidatesOnLayer(TargetKey target, AutomationLayer layer) {
		return registry.candidatesOnLayer(target, layer);
	}

	public Optional<Candidate> selectBest(TargetKey target) {
		return selectBest(target, true, true);
	}

	/**
	 * Picks the best eligible candidate.
	 *
	 * @return the chosen candidate, or empty when no candidate is safe to try
	 */
	public Optional<Candidate> selectBest(TargetKey target, boolean excludeOpen, boolean safetyFilter) {
		List<CandidateScore> scores = scoreCandidates(target, excludeOpen, safetyFilter);
		if (scores.isEmpty()) {
			logger.warn("No viable candidate for {}", target);
			return Optional.empty();
		}
		CandidateScore best = scores.get(0);
		if (logger.isDebugEnabled()) {
			logger.debug("Selected {} for {} (score={})", best.candidate().id(), target, formatScore(best.score()));
		}
		return Optional.of(best.candidate());
	}

	/**
	 * Scores every eligible candidate, best first.
	 */
	public List<CandidateScore> scoreCandidates(TargetKey target, boolean excludeOpen, boolean safetyFilter) {
		Objects.requireNonNull(target, "target must not be null");
		List<Candidate> registered = registry.candidates(target);
		if (registered.isEmpty()) {
			return List.of();
		}
		Map<String, CandidateStats> statsById = statsStore.getTargetStats(target);

		List<Eligible> eligible = new ArrayList<>();
		for (int i = 0; i < registered.size(); i++) {
			Candidate candidate = registered.get(i);
			if (excludeOpen && breakerStore.isOpen(target, candidate.id())) {
				logger.debug("Skip (open): {}", candidate.id());
				continue;
			}
			CandidateStats stats = statsById.get(candidate.id());
			if (safetyFilter && isUnsafe(stats)) {
				logger.debug("Skip (unsafe): {} misclickRate={}", candidate.id(), formatScore(stats.misclickRate()));
				continue;
			}
			eligible.add(new Eligible(candidate, i, stats));
		}

		long totalTrials = 0;
		for (Eligible e : eligible) {
			if (e.stats() != null) {
				totalTrials += e.stats().trials();
			}
		}
		long n = Math.max(1, totalTrials);

		List<CandidateScore> scores = new ArrayList<>(eligible.size());
		for (Eligible e : eligible) {
			scores.add(score(e, n));
		}
		scores.sort(CandidateScore.BEST_FIRST);
		return scores;
	}

	public double reportOutcome(TargetKey target, String candidateId, OutcomeKind outcome) {
		return statsStore.recordOutcome(target, candidateId, outcome);
	}

	/**
	 * Decides whether to leave the current automation layer.
	 *
	 * @return empty while some candidate on {@code currentLayer} is not open ("stay"), or when
	 *         no farther layer has candidates ("exhausted"); otherwise the nearest farther
	 *         layer with at least one registered candidate, whatever its breaker state
	 */
	public Optional<AutomationLayer> escalateLayer(TargetKey target, AutomationLayer currentLayer) {
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(currentLayer, "currentLayer must not be null");
		for (Candidate candidate : registry.candidatesOnLayer(target, currentLayer)) {
			if (!breakerStore.isOpen(target, candidate.id())) {
				return Optional.empty();
			}
		}
		for (AutomationLayer layer : AutomationLayer.values()) {
			if (layer.isFartherThan(currentLayer) && registry.hasCandidatesOnLayer(target, layer)) {
				logger.info("Layer escalation for {}: {} -> {}", target, currentLayer, layer);
				return Optional.of(layer);
			}
		}
		logger.warn("Layer escalation for {} exhausted after {}", target, currentLayer);
		return Optional.empty();
	}

	private boolean isUnsafe(CandidateStats stats) {
		return stats != null
				&& stats.trials() >= settings.safetyMinTrials()
				&& stats.misclickRate() > settings.safetyMaxMisclickRate();
	}

	private CandidateScore score(Eligible e, long totalTrials) {
		CandidateStats stats = e.stats();
		if (stats == null || stats.untried()) {
			return new CandidateScore(e.candidate(), e.index(), Optional.ofNullable(stats), 0.0, 0.0, 0.0,
					Double.POSITIVE_INFINITY);
		}
		double mean = stats.meanReward();
		double exploration = settings.explorationWeight() * Math.sqrt(Math.log(totalTrials) / stats.trials());
		double penalty = settings.misclickPenaltyWeight() * stats.misclickRate();
		return new CandidateScore(e.candidate(), e.index(), Optional.of(stats), mean, exploration, penalty,
				mean + exploration - penalty);
	}

	private static String formatScore(double value) {
		return Double.isInfinite(value) ? "inf" : String.format("%.3f", value);
	}

	private record Eligible(Candidate candidate, int index, CandidateStats stats) {
	}
}
