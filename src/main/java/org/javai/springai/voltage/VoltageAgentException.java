package org.javai.springai.voltage;

/**
 * Base type for the recoverable failures raised while processing a turn.
 *
 * <p>Every subclass is caught at the workflow engine boundary and turned into a
 * logged turn with an explanatory response. None of them escape
 * {@code WorkflowEngine.process}.</p>
 */
public class VoltageAgentException extends RuntimeException {

	public VoltageAgentException(String message) {
		super(message);
	}

	public VoltageAgentException(String message, Throwable cause) {
		super(message, cause);
	}
}
