package org.javai.springai.voltage.param;

import org.javai.springai.voltage.VoltageAgentException;

/**
 * A parameter mutation that cannot be committed.
 *
 * <p>Carries the offending parameter name so the user can be told exactly
 * which value to correct.</p>
 */
public abstract class ParameterException extends VoltageAgentException {

	private final String parameterName;

	protected ParameterException(String parameterName, String message) {
		super(message);
		this.parameterName = parameterName;
	}

	public String parameterName() {
		return parameterName;
	}
}
