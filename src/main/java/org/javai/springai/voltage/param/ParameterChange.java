package org.javai.springai.voltage.param;

import java.util.Objects;

/**
 * A committed change of one parameter.
 *
 * @param name the parameter key
 * @param oldValue the value before the change
 * @param newValue the value after the change
 */
public record ParameterChange(String name, Object oldValue, Object newValue) {

	public ParameterChange {
		Objects.requireNonNull(name, "name must not be null");
	}

	@Override
	public String toString() {
		return name + ": " + ParameterValues.format(oldValue) + " -> " + ParameterValues.format(newValue);
	}
}
