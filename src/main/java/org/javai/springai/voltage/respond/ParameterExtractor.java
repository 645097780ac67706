package org.javai.springai.voltage.respond;

import java.util.Map;
import org.javai.springai.voltage.param.ParameterSet;

/**
 * Reads the parameter changes a user asks for.
 */
@FunctionalInterface
public interface ParameterExtractor {

	/**
	 * @param text the raw user input
	 * @param current the parameters in effect
	 * @return requested values keyed by parameter name, unvalidated; empty when none are named
	 */
	Map<String, Object> extract(String text, ParameterSet current);
}
