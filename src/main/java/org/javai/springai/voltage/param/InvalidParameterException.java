package org.javai.springai.voltage.param;

/**
 * Raised when a value falls outside a parameter's declared type, range or choices.
 */
public class InvalidParameterException extends ParameterException {

	private final Object rejectedValue;
	private final String allowed;

	public InvalidParameterException(String parameterName, Object rejectedValue, String allowed) {
		super(parameterName, "Invalid value '" + rejectedValue + "' for " + parameterName
				+ ": expected " + allowed);
		this.rejectedValue = rejectedValue;
		this.allowed = allowed;
	}

	public Object rejectedValue() {
		return rejectedValue;
	}

	/**
	 * Human-readable description of the accepted domain, e.g. {@code "a number between 0 and 1"}.
	 */
	public String allowed() {
		return allowed;
	}
}
