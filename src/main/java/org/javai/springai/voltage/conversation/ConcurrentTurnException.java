package org.javai.springai.voltage.conversation;

/**
 * Another turn for the same session was committed while this one was being processed.
 */
public class ConcurrentTurnException extends IllegalStateException {

	private final String sessionId;

	public ConcurrentTurnException(String sessionId) {
		super("Session '" + sessionId + "' was updated by a concurrent turn");
		this.sessionId = sessionId;
	}

	public String sessionId() {
		return sessionId;
	}
}
