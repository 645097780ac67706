package org.javai.springai.voltage.workflow;

import java.util.Objects;
import org.javai.springai.voltage.history.Turn;

/**
 * The outcome of processing one input.
 *
 * @param state the new session state; pass it to the next call
 * @param responseText the reply to show the user
 * @param turn the turn appended to the log
 */
public record TurnResult(SessionState state, String responseText, Turn turn) {

	public TurnResult {
		Objects.requireNonNull(state, "state must not be null");
		Objects.requireNonNull(responseText, "responseText must not be null");
		Objects.requireNonNull(turn, "turn must not be null");
	}
}
