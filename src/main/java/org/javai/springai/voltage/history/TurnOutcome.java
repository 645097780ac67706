package org.javai.springai.voltage.history;

/**
 * How a turn ended.
 */
public enum TurnOutcome {
	/** The responder chain ran and its delta, if any, was committed. */
	COMPLETED,
	/** A parameter batch failed validation; nothing was committed. */
	REJECTED,
	/**
	 * A step of the turn failed. Parameter changes staged before a failed simulation are kept;
	 * any other failure commits nothing but the turn.
	 */
	FAILED
}
