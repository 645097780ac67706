package org.javai.springai.voltage.workflow;

import org.javai.springai.voltage.VoltageAgentException;

/**
 * A single input chained more responder invocations than allowed.
 */
public class RecursionLimitExceededException extends VoltageAgentException {

	private final int limit;

	public RecursionLimitExceededException(int limit) {
		super("More than " + limit + " responder invocations for one input");
		this.limit = limit;
	}

	public int limit() {
		return limit;
	}
}
