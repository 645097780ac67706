package org.javai.springai.voltage.classify;

import org.javai.springai.voltage.VoltageAgentException;

/**
 * The classifier failed to produce a verdict.
 */
public class ClassificationException extends VoltageAgentException {

	public ClassificationException(String message) {
		super(message);
	}

	public ClassificationException(String message, Throwable cause) {
		super(message, cause);
	}
}
