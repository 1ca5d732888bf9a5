package org.javai.reliability.store;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.reliability.api.TargetKey;

/**
 * Simple in-memory backend, intended for tests and for agents that do not need learning
 * to survive a restart.
 */
public class InMemoryLearningBackend implements LearningBackend {

	private final Map<RowKey, LearningRow> rows = new ConcurrentHashMap<>();

	@Override
	public Map<RowKey, LearningRow> loadAll() {
		return Map.copyOf(rows);
	}

	@Override
	public void save(RowKey key, LearningRow row) {
		rows.put(key, row);
	}

	@Override
	public void deleteTarget(TargetKey target) {
		rows.keySet().removeIf(key -> key.target().equals(target));
	}

	@Override
	public void deleteAll() {
		rows.clear();
	}

	public int size() {
		return rows.size();
	}
}
