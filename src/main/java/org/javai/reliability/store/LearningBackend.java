package org.javai.reliability.store;

import java.util.Map;
import org.javai.reliability.api.TargetKey;

/**
 * Persistence contract for learning rows, keyed by (target, candidate).
 *
 * <p>Implementations signal I/O failures with {@link PersistenceException}; retrying and
 * buffering is the caller's concern.</p>
 */
public interface LearningBackend {

	/**
	 * Loads every persisted row. Called once when a store is opened.
	 */
	Map<RowKey, LearningRow> loadAll();

	/**
	 * Inserts or replaces one row.
	 */
	void save(RowKey key, LearningRow row);

	void deleteTarget(TargetKey target);

	void deleteAll();
}
