package io.vena.arbor.exceptions;

public class DocumentNotOpenException extends IllegalStateException {
	public DocumentNotOpenException(String message) { super(message); }
}
