package org.javai.reliability.select;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.reliability.api.AutomationLayer;
import org.javai.reliability.api.Candidate;
import org.javai.reliability.api.TargetKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-process registry of the candidates known for each target.
 *
 * <p>Candidates are re-declared at startup and are not persisted. Registration is
 * idempotent by candidate id within a target: re-registering an id keeps the original
 * descriptor and its position. Registration order is preserved and used as the
 * deterministic tie-break during selection.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Safe for concurrent registration and lookup.</p>
 */
public class CandidateRegistry {

	private static final Logger logger = LoggerFactory.getLogger(CandidateRegistry.class);

	private final Map<TargetKey, List<Candidate>> candidates = new ConcurrentHashMap<>();

	/**
	 * Registers a candidate unless one with the same id is already known for the target.
	 *
	 * @return true if the candidate was added
	 */
	public boolean register(TargetKey target, Candidate candidate) {
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(candidate, "candidate must not be null");
		List<Candidate> list = candidates.computeIfAbsent(target, k -> new ArrayList<>());
		synchronized (list) {
			for (Candidate existing : list) {
				if (existing.id().equals(candidate.id())) {
					return false;
				}
			}
			list.add(candidate);
		}
		logger.debug("Registered candidate {} ({}) for {}", candidate.id(), candidate.layer(), target);
		return true;
	}

	public void registerAll(TargetKey target, Collection<Candidate> newCandidates) {
		Objects.requireNonNull(newCandidates, "candidates must not be null");
		for (Candidate candidate : newCandidates) {
			register(target, candidate);
		}
	}

	/**
	 * Candidates of a target in registration order; empty for an unknown target.
	 */
	public List<Candidate> candidates(TargetKey target) {
		List<Candidate> list = candidates.get(target);
		if (list == null) {
			return List.of();
		}
		synchronized (list) {
			return List.copyOf(list);
		}
	}

	public List<Candidate> candidatesOnLayer(TargetKey target, AutomationLayer layer) {
		return candidates(target).stream()
				.filter(candidate -> candidate.layer() == layer)
				.toList();
	}

	public boolean hasCandidatesOnLayer(TargetKey target, AutomationLayer layer) {
		return candidates(target).stream().anyMatch(candidate -> candidate.layer() == layer);
	}

	public void clear() {
		candidates.clear();
	}
}
