package org.javai.springai.voltage.workflow;

/**
 * A session state was not issued by the engine it was handed to, or was altered afterwards.
 * Never recovered into a turn.
 */
public class StateIntegrityException extends IllegalStateException {

	public StateIntegrityException(String message) {
		super(message);
	}
}
