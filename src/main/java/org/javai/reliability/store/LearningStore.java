package org.javai.reliability.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.javai.reliability.api.BreakerState;
import org.javai.reliability.api.BreakerStatus;
import org.javai.reliability.api.CandidateStats;
import org.javai.reliability.api.OutcomeKind;
import org.javai.reliability.api.TargetKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-through learning store holding candidate statistics and circuit breakers.
 *
 * <p>Rows are cached in memory and written to a {@link LearningBackend} on every change.
 * Each row is updated under its own lock; statistics and breaker live in the same row and
 * are always written together.</p>
 *
 * <h2>Degraded persistence</h2>
 * <p>A failed backend write is retried {@code writeAttempts} times with a linearly growing
 * backoff. If it still fails the row is kept in a pending buffer, the store reports
 * {@link PersistenceStatus#DEGRADED_PERSISTENCE}, and the buffer is retried at the start of
 * every later write. Rows are cumulative, so buffering the latest snapshot of a row loses no
 * learning event.</p>
 */
public class LearningStore implements StatsStore, BreakerStore {

	private static final Logger logger = LoggerFactory.getLogger(LearningStore.class);

	private final LearningBackend backend;
	private final EmaBreakerPolicy breakerPolicy;
	private final Clock clock;
	private final int writeAttempts;
	private final Duration writeBackoff;

	private final Map<RowKey, LearningRow> rows = new ConcurrentHashMap<>();
	private final Map<RowKey, Object> rowLocks = new ConcurrentHashMap<>();
	private final Map<RowKey, LearningRow> pendingWrites = new ConcurrentHashMap<>();
	private final List<PersistenceStatusListener> listeners = new CopyOnWriteArrayList<>();
	private final Object statusLock = new Object();
	private volatile PersistenceStatus status = PersistenceStatus.HEALTHY;

	/**
	 * Opens a store over the given backend, loading every persisted row.
	 *
	 * @throws PersistenceException if the backend cannot be read
	 */
	public LearningStore(LearningBackend backend, EmaBreakerPolicy breakerPolicy, Clock clock,
			int writeAttempts, Duration writeBackoff) {
		this.backend = Objects.requireNonNull(backend, "backend must not be null");
		this.breakerPolicy = Objects.requireNonNull(breakerPolicy, "breakerPolicy must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		if (writeAttempts < 1) {
			throw new IllegalArgumentException("writeAttempts must be >= 1");
		}
		if (writeBackoff == null || writeBackoff.isNegative()) {
			throw new IllegalArgumentException("writeBackoff must be a non-negative duration");
		}
		this.writeAttempts = writeAttempts;
		this.writeBackoff = writeBackoff;
		this.rows.putAll(backend.loadAll());
		logger.debug("Learning store opened with {} rows", rows.size());
	}

	public LearningStore(LearningBackend backend, Clock clock) {
		this(backend, EmaBreakerPolicy.defaults(), clock, 3, Duration.ofMillis(50));
	}

	@Override
	public double recordOutcome(TargetKey target, String candidateId, OutcomeKind outcome) {
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(candidateId, "candidateId must not be null");
		Objects.requireNonNull(outcome, "outcome must not be null");

		drainPending();

		RowKey key = new RowKey(target, candidateId);
		Instant now = clock.instant();
		synchronized (lockFor(key)) {
			LearningRow current = rows.getOrDefault(key, LearningRow.initial());
			LearningRow updated = new LearningRow(
					current.stats().withOutcome(outcome, now),
					breakerPolicy.onOutcome(current.breaker(), outcome, now));
			rows.put(key, updated);
			logTransition(key, current.breaker(), updated.breaker());
			persist(key, updated);
		}
		logger.debug("Recorded {} for {} (reward={})", outcome.wireName(), key, outcome.reward());
		return outcome.reward();
	}

	@Override
	public Optional<CandidateStats> getStats(TargetKey target, String candidateId) {
		LearningRow row = rows.get(new RowKey(target, candidateId));
		return row != null ? Optional.of(row.stats()) : Optional.empty();
	}

	@Override
	public Map<String, CandidateStats> getTargetStats(TargetKey target) {
		Objects.requireNonNull(target, "target must not be null");
		Map<String, CandidateStats> result = new TreeMap<>();
		rows.forEach((key, row) -> {
			if (key.target().equals(target)) {
				result.put(key.candidateId(), row.stats());
			}
		});
		return result;
	}

	@Override
	public boolean isOpen(TargetKey target, String candidateId) {
		return refreshedBreaker(new RowKey(target, candidateId))
				.map(breaker -> breaker.blocksAt(clock.instant()))
				.orElse(false);
	}

	@Override
	public Optional<BreakerState> getBreaker(TargetKey target, String candidateId) {
		return refreshedBreaker(new RowKey(target, candidateId));
	}

	@Override
	public void resetTarget(TargetKey target) {
		Objects.requireNonNull(target, "target must not be null");
		for (RowKey key : List.copyOf(rows.keySet())) {
			if (key.target().equals(target)) {
				dropRow(key);
			}
		}
		try {
			backend.deleteTarget(target);
		}
		finally {
			updateStatus();
		}
		logger.info("Reset learning rows of target {}", target);
	}

	@Override
	public void resetAll() {
		for (RowKey key : List.copyOf(rows.keySet())) {
			dropRow(key);
		}
		try {
			backend.deleteAll();
		}
		finally {
			updateStatus();
		}
		logger.info("Reset all learning rows");
	}

	@Override
	public PersistenceStatus persistenceStatus() {
		return status;
	}

	public int pendingWriteCount() {
		return pendingWrites.size();
	}

	public void addStatusListener(PersistenceStatusListener listener) {
		listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
	}

	/**
	 * Retries every buffered row once.
	 *
	 * @return the resulting persistence status
	 */
	public PersistenceStatus flushPending() {
		drainPending();
		return status;
	}

	private Optional<BreakerState> refreshedBreaker(RowKey key) {
		if (!rows.containsKey(key)) {
			return Optional.empty();
		}
		synchronized (lockFor(key)) {
			LearningRow row = rows.get(key);
			if (row == null) {
				return Optional.empty();
			}
			BreakerState refreshed = breakerPolicy.refresh(row.breaker(), clock.instant());
			if (refreshed != row.breaker()) {
				LearningRow updated = row.withBreaker(refreshed);
				rows.put(key, updated);
				logTransition(key, row.breaker(), refreshed);
				persist(key, updated);
			}
			return Optional.of(refreshed);
		}
	}

	private Object lockFor(RowKey key) {
		return rowLocks.computeIfAbsent(key, k -> new Object());
	}

	private void dropRow(RowKey key) {
		synchronized (lockFor(key)) {
			rows.remove(key);
			pendingWrites.remove(key);
			rowLocks.remove(key);
		}
	}

	int lockCount() {
		return rowLocks.size();
	}

	// Caller holds the row lock.
	private void persist(RowKey key, LearningRow row) {
		if (tryWrite(key, row, writeAttempts)) {
			pendingWrites.remove(key);
		}
		else {
			pendingWrites.put(key, row);
		}
		updateStatus();
	}

	private boolean tryWrite(RowKey key, LearningRow row, int attempts) {
		for (int attempt = 1; attempt <= attempts; attempt++) {
			try {
				backend.save(key, row);
				return true;
			}
			catch (PersistenceException e) {
				logger.warn("Write of {} failed (attempt {}/{}): {}", key, attempt, attempts, e.getMessage());
				if (attempt < attempts && !backoff(attempt)) {
					return false;
				}
			}
		}
		return false;
	}

	private boolean backoff(int attempt) {
		if (writeBackoff.isZero()) {
			return true;
		}
		try {
			Thread.sleep(writeBackoff.multipliedBy(attempt).toMillis());
			return true;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	private void drainPending() {
		if (pendingWrites.isEmpty()) {
			return;
		}
		for (RowKey key : List.copyOf(pendingWrites.keySet())) {
			synchronized (lockFor(key)) {
				LearningRow row = pendingWrites.get(key);
				if (row == null) {
					continue;
				}
				if (!tryWrite(key, row, 1)) {
					break;
				}
				pendingWrites.remove(key, row);
			}
		}
		updateStatus();
	}

	private void updateStatus() {
		PersistenceStatus previous;
		PersistenceStatus current;
		int pending;
		synchronized (statusLock) {
			pending = pendingWrites.size();
			current = pending == 0 ? PersistenceStatus.HEALTHY : PersistenceStatus.DEGRADED_PERSISTENCE;
			previous = status;
			if (previous == current) {
				return;
			}
			status = current;
		}
		if (current == PersistenceStatus.DEGRADED_PERSISTENCE) {
			logger.warn("Learning persistence degraded: {} rows buffered in memory", pending);
		}
		else {
			logger.info("Learning persistence recovered");
		}
		for (PersistenceStatusListener listener : listeners) {
			listener.onStatusChange(previous, current, pending);
		}
	}

	private void logTransition(RowKey key, BreakerState before, BreakerState after) {
		if (before.status() == after.status()) {
			return;
		}
		if (after.status() == BreakerStatus.OPEN) {
			logger.warn("Breaker OPEN: {} (emaFail={}, until {})", key, String.format("%.2f", after.emaFail()),
					after.openUntil());
		}
		else {
			logger.info("Breaker {} -> {}: {}", before.status(), after.status(), key);
		}
	}
}
