package org.javai.springai.voltage.param;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Raised when a mutation names a parameter outside the known set.
 */
public class UnknownParameterException extends ParameterException {

	public UnknownParameterException(String parameterName) {
		super(parameterName, "Unknown parameter '" + parameterName + "'. Known parameters: "
				+ Arrays.stream(GridParameter.values())
						.map(GridParameter::key)
						.collect(Collectors.joining(", ")));
	}
}
