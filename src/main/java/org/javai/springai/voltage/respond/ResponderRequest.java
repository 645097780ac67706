package org.javai.springai.voltage.respond;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.springai.voltage.history.HistoryView;
import org.javai.springai.voltage.param.ParameterSet;
import org.javai.springai.voltage.simulation.SimulationResult;

/**
 * Everything a responder may read while handling a turn.
 *
 * @param userText the raw user input
 * @param parameters the parameter snapshot, including changes staged earlier in the same turn
 * @param history bounded view of the committed history
 * @param latestResult the most recent result, including one produced earlier in the same turn, or null
 * @param latestFromThisTurn whether {@code latestResult} was produced earlier in the same turn and is
 *        therefore not yet in the simulation window
 */
public record ResponderRequest(
		String userText,
		ParameterSet parameters,
		HistoryView history,
		SimulationResult latestResult,
		boolean latestFromThisTurn
) {

	public ResponderRequest {
		Objects.requireNonNull(userText, "userText must not be null");
		Objects.requireNonNull(parameters, "parameters must not be null");
		history = history != null ? history : HistoryView.empty();
		if (latestFromThisTurn && latestResult == null) {
			throw new IllegalArgumentException("latestFromThisTurn requires a latestResult");
		}
	}

	/**
	 * A request whose latest result, if any, is the committed one at the head of the simulation window.
	 */
	public ResponderRequest(String userText, ParameterSet parameters, HistoryView history, SimulationResult latestResult) {
		this(userText, parameters, history, latestResult, false);
	}

	public Optional<SimulationResult> latest() {
		return Optional.ofNullable(latestResult);
	}

	/**
	 * The result produced before {@link #latestResult()}, taken from the simulation window.
	 */
	public Optional<SimulationResult> previousResult() {
		if (latestResult == null) {
			return Optional.empty();
		}
		List<SimulationResult> window = history.simulationWindow();
		int index = latestFromThisTurn ? 0 : 1;
		return window.size() > index ? Optional.of(window.get(index)) : Optional.empty();
	}
}
