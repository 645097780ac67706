package org.javai.springai.voltage.retrieve;

import org.javai.springai.voltage.VoltageAgentException;

/**
 * The reference corpus could not be read.
 */
public class KnowledgeLoadException extends VoltageAgentException {

	public KnowledgeLoadException(String message) {
		super(message);
	}

	public KnowledgeLoadException(String message, Throwable cause) {
		super(message, cause);
	}
}
