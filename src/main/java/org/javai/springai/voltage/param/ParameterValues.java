package org.javai.springai.voltage.param;

import java.math.BigDecimal;

/**
 * Formatting for parameter values shown to users and language models.
 */
public final class ParameterValues {

	private ParameterValues() {
	}

	/**
	 * Render a value without trailing zeros: {@code 150.0} becomes {@code "150"},
	 * {@code 0.050} becomes {@code "0.05"}.
	 */
	public static String format(Object value) {
		if (value == null) {
			return "unset";
		}
		if (value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				return String.valueOf(d);
			}
			return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
		}
		return String.valueOf(value);
	}
}
