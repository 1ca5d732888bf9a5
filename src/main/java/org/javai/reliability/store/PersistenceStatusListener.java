package org.javai.reliability.store;

/**
 * Notified when a learning store's persistence status changes.
 */
@FunctionalInterface
public interface PersistenceStatusListener {

	/**
	 * @param previous status before the change
	 * @param current status after the change
	 * @param pendingRows number of rows waiting to be written
	 */
	void onStatusChange(PersistenceStatus previous, PersistenceStatus current, int pendingRows);
}
