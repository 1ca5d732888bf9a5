package org.javai.reliability;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.reliability.api.AutomationLayer;
import org.javai.reliability.api.BreakerState;
import org.javai.reliability.api.Candidate;
import org.javai.reliability.api.CandidateStats;
import org.javai.reliability.api.FailureClass;
import org.javai.reliability.api.FailureEvent;
import org.javai.reliability.api.OutcomeKind;
import org.javai.reliability.api.RecoveryDecision;
import org.javai.reliability.api.TargetKey;
import org.javai.reliability.recovery.FailureClassifier;
import org.javai.reliability.recovery.RecoveryPlanner;
import org.javai.reliability.select.CandidateRegistry;
import org.javai.reliability.select.CandidateScore;
import org.javai.reliability.select.CandidateSelector;
import org.javai.reliability.store.InMemoryLearningBackend;
import org.javai.reliability.store.JsonFileLearningBackend;
import org.javai.reliability.store.LearningBackend;
import org.javai.reliability.store.LearningStore;
import org.javai.reliability.store.PersistenceStatus;
import org.javai.reliability.store.PersistenceStatusListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;

/**
 * Entry point of the execution-reliability engine used by the automation layer.
 *
 * <p>Typical loop for one action:</p>
 * <pre>{@code
 * Optional<Candidate> candidate = engine.selectBest(target);
 * if (candidate.isEmpty()) {
 *     // no viable path: fail the calling action
 * }
 * OutcomeKind outcome = driver.execute(candidate.get());
 * engine.reportOutcome(target, candidate.get().id(), outcome);
 * if (!outcome.isSuccess()) {
 *     RecoveryDecision next = engine.decide(runId, symptom, retryCount);
 * }
 * }</pre>
 *
 * <p>Learning state is shared by every caller and is safe for concurrent use. Recovery
 * planners are kept per run id; a run must end with {@link #endRun(String)}.</p>
 */
public final class ReliabilityEngine {

	private static final Logger logger = LoggerFactory.getLogger(ReliabilityEngine.class);

	private final ReliabilityConfig config;
	private final LearningStore store;
	private final CandidateSelector selector;
	private final FailureClassifier classifier = new FailureClassifier();
	private final Map<String, RecoveryPlanner> planners = new ConcurrentHashMap<>();

	private ReliabilityEngine(Builder builder) {
		this.config = builder.config;
		this.store = new LearningStore(builder.backend, config.breaker(), builder.clock, config.writeAttempts(),
				config.writeBackoff());
		builder.statusListeners.forEach(store::addStatusListener);
		this.selector = new CandidateSelector(new CandidateRegistry(), store, store, config.selection());
	}

	public static Builder builder() {
		return new Builder();
	}

	public ReliabilityConfig config() {
		return config;
	}

	// Candidates and selection

	public void registerCandidates(@NonNull TargetKey target, @NonNull Collection<Candidate> candidates) {
		selector.registerCandidates(target, candidates);
	}

	public boolean registerCandidate(@NonNull TargetKey target, @NonNull Candidate candidate) {
		return selector.registerCandidate(target, candidate);
	}

	public List<Candidate> candidates(@NonNull TargetKey target) {
		return selector.candidates(target);
	}

	public Optional<Candidate> selectBest(@NonNull TargetKey target) {
		return selector.selectBest(target);
	}

	public Optional<Candidate> selectBest(@NonNull TargetKey target, boolean excludeOpen, boolean safetyFilter) {
		return selector.selectBest(target, excludeOpen, safetyFilter);
	}

	public List<CandidateScore> scoreCandidates(@NonNull TargetKey target) {
		return selector.scoreCandidates(target, true, true);
	}

	public double reportOutcome(@NonNull TargetKey target, @NonNull String candidateId, @NonNull OutcomeKind outcome) {
		return selector.reportOutcome(target, candidateId, outcome);
	}

	/**
	 * Reports an outcome given by its wire name ("success", "not_found", ...).
	 *
	 * @throws IllegalArgumentException if the name is not a known outcome
	 */
	public double reportOutcome(@NonNull TargetKey target, @NonNull String candidateId, @NonNull String outcome) {
		return reportOutcome(target, candidateId, OutcomeKind.fromWireName(outcome));
	}

	public boolean isOpen(@NonNull TargetKey target, @NonNull String candidateId) {
		return store.isOpen(target, candidateId);
	}

	public Optional<AutomationLayer> escalateLayer(@NonNull TargetKey target, @NonNull AutomationLayer currentLayer) {
		return selector.escalateLayer(target, currentLayer);
	}

	public Optional<CandidateStats> getStats(@NonNull TargetKey target, @NonNull String candidateId) {
		return store.getStats(target, candidateId);
	}

	public Optional<BreakerState> getBreaker(@NonNull TargetKey target, @NonNull String candidateId) {
		return store.getBreaker(target, candidateId);
	}

	public PersistenceStatus persistenceStatus() {
		return store.persistenceStatus();
	}

	/**
	 * Retries any learning rows buffered after a persistence failure.
	 */
	public PersistenceStatus flushPending() {
		return store.flushPending();
	}

	// Recovery

	public FailureClass classify(String symptom) {
		return classifier.classify(symptom);
	}

	/**
	 * Creates a planner owned by the caller, for callers that manage runs themselves.
	 */
	public RecoveryPlanner newRecoveryPlanner() {
		return new RecoveryPlanner(classifier, config.recovery());
	}

	/**
	 * Decides the recovery for a failure within the given run. Escalation accumulates per run.
	 */
	public RecoveryDecision decide(@NonNull String runId, @NonNull FailureEvent event) {
		Objects.requireNonNull(runId, "runId must not be null");
		RecoveryPlanner planner = planners.computeIfAbsent(runId, id -> newRecoveryPlanner());
		synchronized (planner) {
			return planner.decide(event);
		}
	}

	public RecoveryDecision decide(@NonNull String runId, String symptom, int retryCount) {
		return decide(runId, new FailureEvent(classify(symptom), symptom, retryCount));
	}

	/**
	 * Forgets the escalation state of a finished run.
	 */
	public void endRun(@NonNull String runId) {
		planners.remove(runId);
	}

	public int activeRuns() {
		return planners.size();
	}

	// Operations

	public void resetTarget(@NonNull TargetKey target) {
		store.resetTarget(target);
	}

	public void resetAll() {
		store.resetAll();
		planners.clear();
		logger.info("Reliability engine reset");
	}

	/**
	 * Builder for {@link ReliabilityEngine}.
	 */
	public static final class Builder {
		private ReliabilityConfig config = ReliabilityConfig.defaults();
		private Clock clock = Clock.systemUTC();
		private LearningBackend backend;
		private final List<PersistenceStatusListener> statusListeners = new ArrayList<>();

		private Builder() {
		}

		public Builder config(ReliabilityConfig config) {
			this.config = Objects.requireNonNull(config, "config must not be null");
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = Objects.requireNonNull(clock, "clock must not be null");
			return this;
		}

		public Builder backend(LearningBackend backend) {
			this.backend = Objects.requireNonNull(backend, "backend must not be null");
			return this;
		}

		/**
		 * Persists learning to a JSON file at the given path.
		 */
		public Builder storeFile(Path file) {
			return backend(new JsonFileLearningBackend(file));
		}

		public Builder statusListener(PersistenceStatusListener listener) {
			statusListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
			return this;
		}

		/**
		 * Builds the engine, loading persisted learning from the backend. Without a backend,
		 * learning is kept in memory only.
		 */
		public ReliabilityEngine build() {
			if (backend == null) {
				backend = new InMemoryLearningBackend();
			}
			return new ReliabilityEngine(this);
		}
	}
}
