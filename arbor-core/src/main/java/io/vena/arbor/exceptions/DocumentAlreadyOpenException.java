package io.vena.arbor.exceptions;

public class DocumentAlreadyOpenException extends IllegalStateException {
	public DocumentAlreadyOpenException(String message) { super(message); }
}
