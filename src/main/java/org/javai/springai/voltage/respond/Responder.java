package org.javai.springai.voltage.respond;

import org.javai.springai.voltage.classify.TurnLabel;

/**
 * Handles one kind of turn.
 *
 * <p>Responders never mutate session state. They read the request snapshot and return a
 * {@link ResponderOutcome}; the workflow engine decides what gets committed.</p>
 */
public interface Responder {

	/**
	 * The label this responder is dispatched for.
	 */
	TurnLabel label();

	ResponderOutcome respond(ResponderRequest request);
}
