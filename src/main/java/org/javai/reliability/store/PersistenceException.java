package org.javai.reliability.store;

/**
 * Thrown by a {@link LearningBackend} when rows cannot be read or written.
 */
public class PersistenceException extends RuntimeException {

	public PersistenceException(String message) {
		super(message);
	}

	public PersistenceException(String message, Throwable cause) {
		super(message, cause);
	}
}
