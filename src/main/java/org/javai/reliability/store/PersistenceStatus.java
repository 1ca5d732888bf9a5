package org.javai.reliability.store;

/**
 * Health of the persistence path behind a learning store.
 */
public enum PersistenceStatus {
	/**
	 * Every recorded outcome has reached the backend.
	 */
	HEALTHY,

	/**
	 * Some rows could not be written and are buffered in memory until a later write succeeds.
	 */
	DEGRADED_PERSISTENCE
}
