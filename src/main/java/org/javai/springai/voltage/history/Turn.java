package org.javai.springai.voltage.history;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.javai.springai.voltage.classify.TurnLabel;
import org.javai.springai.voltage.param.ParameterChange;
import org.javai.springai.voltage.simulation.SimulationResult;

/**
 * One processed user input and the assistant's reply to it.
 *
 * <p>The log holds exactly one turn per raw input, so the user side and the assistant side of
 * the exchange live in the same record.</p>
 *
 * @param sequence 1-based position in the interaction log
 * @param userText the raw user input
 * @param responseText the assistant's reply
 * @param timestamp when the turn was committed
 * @param kind the label the turn was dispatched under
 * @param outcome how the turn ended
 * @param simulationResult the curve produced by this turn, or null
 * @param parameterChanges parameter changes committed by this turn
 */
public record Turn(
		int sequence,
		String userText,
		String responseText,
		Instant timestamp,
		TurnLabel kind,
		TurnOutcome outcome,
		SimulationResult simulationResult,
		List<ParameterChange> parameterChanges
) {

	public Turn {
		if (sequence < 1) {
			throw new IllegalArgumentException("sequence must be >= 1");
		}
		Objects.requireNonNull(userText, "userText must not be null");
		Objects.requireNonNull(responseText, "responseText must not be null");
		Objects.requireNonNull(timestamp, "timestamp must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(outcome, "outcome must not be null");
		parameterChanges = parameterChanges != null ? List.copyOf(parameterChanges) : List.of();
	}

	public boolean hasSimulationResult() {
		return simulationResult != null;
	}

	public boolean hasParameterChanges() {
		return !parameterChanges.isEmpty();
	}
}
