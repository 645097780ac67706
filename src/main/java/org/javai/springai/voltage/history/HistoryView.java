package org.javai.springai.voltage.history;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.springai.voltage.simulation.SimulationResult;

/**
 * Bounded view of the history, recomputed for every dispatch and never persisted.
 *
 * @param conversationWindow recent turns, most recent first
 * @param simulationWindow recent simulation results, most recent first
 * @param parameterEvolution recent changes per parameter key, oldest first within each key
 * @param contextSummary bounded digest of the above
 */
public record HistoryView(
		List<Turn> conversationWindow,
		List<SimulationResult> simulationWindow,
		Map<String, List<ParameterEvolutionEntry>> parameterEvolution,
		String contextSummary
) {

	private static final HistoryView EMPTY = new HistoryView(List.of(), List.of(), Map.of(), "");

	public HistoryView {
		conversationWindow = conversationWindow != null ? List.copyOf(conversationWindow) : List.of();
		simulationWindow = simulationWindow != null ? List.copyOf(simulationWindow) : List.of();
		Map<String, List<ParameterEvolutionEntry>> evolution = new LinkedHashMap<>();
		if (parameterEvolution != null) {
			parameterEvolution.forEach((name, entries) -> evolution.put(name, List.copyOf(entries)));
		}
		parameterEvolution = Collections.unmodifiableMap(evolution);
		contextSummary = contextSummary != null ? contextSummary : "";
	}

	public static HistoryView empty() {
		return EMPTY;
	}

	/**
	 * The most recent change of a parameter, if it changed within the evolution bound.
	 */
	public Optional<ParameterEvolutionEntry> lastChange(String parameterKey) {
		List<ParameterEvolutionEntry> entries = parameterEvolution.getOrDefault(parameterKey, List.of());
		return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
	}

	public Optional<SimulationResult> latestResult() {
		return simulationWindow.isEmpty() ? Optional.empty() : Optional.of(simulationWindow.get(0));
	}

	public Optional<SimulationResult> previousResult() {
		return simulationWindow.size() < 2 ? Optional.empty() : Optional.of(simulationWindow.get(1));
	}
}
