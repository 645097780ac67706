package org.javai.springai.voltage.classify;

import java.util.Locale;

/**
 * Closed set of turn kinds a classifier can report.
 *
 * <p>{@link #UNCLASSIFIABLE} is an explicit signal, never dispatched: the workflow engine
 * maps it to {@link #QUESTION}, which neither mutates parameters nor runs a simulation.</p>
 */
public enum TurnLabel {

	QUESTION,
	PARAMETER,
	GENERATION,
	ANALYSIS,
	UNCLASSIFIABLE;

	/**
	 * Lower-case name used in prompts and model responses.
	 */
	public String wireName() {
		return name().toLowerCase(Locale.ROOT);
	}

	public boolean isDispatchable() {
		return this != UNCLASSIFIABLE;
	}

	/**
	 * Parse a label as written by a model. Anything unrecognised becomes {@link #UNCLASSIFIABLE}.
	 */
	public static TurnLabel fromWire(String text) {
		if (text == null || text.isBlank()) {
			return UNCLASSIFIABLE;
		}
		String normalized = text.trim().toUpperCase(Locale.ROOT).replace('-', '_');
		// question_general, question_parameter
		if (normalized.startsWith("QUESTION")) {
			return QUESTION;
		}
		for (TurnLabel label : values()) {
			if (label.name().equals(normalized)) {
				return label;
			}
		}
		return UNCLASSIFIABLE;
	}
}
