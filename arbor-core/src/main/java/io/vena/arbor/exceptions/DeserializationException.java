package io.vena.arbor.exceptions;

/**
 * Persisted registry state was too damaged to read at all.
 * Damage confined to individual entries doesn't cause this;
 * those entries are skipped instead.
 */
public class DeserializationException extends RuntimeException {
	public DeserializationException(String message) {
		super(message);
	}

	public DeserializationException(String message, Throwable cause) {
		super(message, cause);
	}
}
