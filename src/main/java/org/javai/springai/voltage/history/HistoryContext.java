package org.javai.springai.voltage.history;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.springai.voltage.param.ParameterChange;
import org.javai.springai.voltage.param.ParameterSet;
import org.javai.springai.voltage.param.ParameterValues;
import org.javai.springai.voltage.simulation.SimulationResult;

/**
 * Derives bounded views of an {@link InteractionLog}.
 *
 * <p>The log can grow without limit; everything returned here is capped by
 * {@link HistoryConfig}. All methods are pure functions of their arguments and the
 * configuration: calling them twice with the same log yields equal results.</p>
 */
public class HistoryContext {

	private static final String ELLIPSIS = "...";

	private final HistoryConfig config;

	public HistoryContext() {
		this(HistoryConfig.defaults());
	}

	public HistoryContext(HistoryConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	public HistoryConfig config() {
		return config;
	}

	/**
	 * Recent turns, most recent first, at most {@code maxConversationTurns}.
	 */
	public List<Turn> conversationWindow(InteractionLog log) {
		List<Turn> turns = log.turns();
		int count = Math.min(turns.size(), config.maxConversationTurns());
		List<Turn> window = new ArrayList<>(count);
		for (int i = turns.size() - 1; i >= turns.size() - count; i--) {
			window.add(turns.get(i));
		}
		return List.copyOf(window);
	}

	/**
	 * Recent simulation results, most recent first, at most {@code maxSimulationResults}.
	 */
	public List<SimulationResult> simulationWindow(InteractionLog log) {
		List<Turn> turns = log.turns();
		List<SimulationResult> window = new ArrayList<>();
		for (int i = turns.size() - 1; i >= 0 && window.size() < config.maxSimulationResults(); i--) {
			Turn turn = turns.get(i);
			if (turn.hasSimulationResult()) {
				window.add(turn.simulationResult());
			}
		}
		return List.copyOf(window);
	}

	/**
	 * The last few turns in chronological order, enough for a classifier to resolve references
	 * such as "do it again" without seeing the whole conversation.
	 */
	public List<Turn> classificationContext(InteractionLog log) {
		List<Turn> turns = log.turns();
		int from = Math.max(0, turns.size() - config.classificationContextTurns());
		return List.copyOf(turns.subList(from, turns.size()));
	}

	/**
	 * Rebuild the change history of every parameter from the log.
	 *
	 * @param log the interaction log
	 * @param parameterSet the current parameters; its keys define the map's keys and order
	 * @return per parameter key, its most recent changes oldest first, at most
	 *         {@code maxEvolutionEntries} each; parameters that never changed map to an empty list
	 */
	public Map<String, List<ParameterEvolutionEntry>> parameterEvolution(InteractionLog log, ParameterSet parameterSet) {
		Map<String, Deque<ParameterEvolutionEntry>> collected = new LinkedHashMap<>();
		for (String key : parameterSet.asMap().keySet()) {
			collected.put(key, new ArrayDeque<>());
		}
		List<Turn> turns = log.turns();
		for (int i = turns.size() - 1; i >= 0; i--) {
			Turn turn = turns.get(i);
			for (ParameterChange change : turn.parameterChanges()) {
				Deque<ParameterEvolutionEntry> entries = collected.get(change.name());
				if (entries != null && entries.size() < config.maxEvolutionEntries()) {
					entries.addFirst(new ParameterEvolutionEntry(
							turn.timestamp(), change.oldValue(), change.newValue(), turn.sequence()));
				}
			}
		}
		Map<String, List<ParameterEvolutionEntry>> evolution = new LinkedHashMap<>();
		collected.forEach((key, entries) -> evolution.put(key, List.copyOf(entries)));
		return Collections.unmodifiableMap(evolution);
	}

	/**
	 * Assemble the view handed to a responder.
	 */
	public HistoryView view(InteractionLog log, ParameterSet parameterSet) {
		List<Turn> conversation = conversationWindow(log);
		List<SimulationResult> simulations = simulationWindow(log);
		return new HistoryView(
				conversation,
				simulations,
				parameterEvolution(log, parameterSet),
				summarize(conversation, simulations));
	}

	/**
	 * Bounded digest of the windows: recent intents, recent critical-voltage and maximum-power
	 * pairs, and the names of recently changed parameters.
	 *
	 * @param conversationWindow turns, most recent first
	 * @param simulationWindow results, most recent first
	 * @return a digest no longer than {@code maxSummaryLength}
	 */
	public String summarize(List<Turn> conversationWindow, List<SimulationResult> simulationWindow) {
		List<String> lines = new ArrayList<>();

		List<String> intents = new ArrayList<>();
		for (Turn turn : conversationWindow.subList(0, Math.min(config.summaryIntents(), conversationWindow.size()))) {
			String intent = turn.kind().wireName();
			if (turn.outcome() != TurnOutcome.COMPLETED) {
				intent += " (" + turn.outcome().name().toLowerCase(Locale.ROOT) + ")";
			}
			intents.add(intent);
		}
		if (!intents.isEmpty()) {
			lines.add("Recent intents: " + String.join(", ", intents));
		}

		List<String> results = new ArrayList<>();
		for (SimulationResult result : simulationWindow.subList(0, Math.min(config.summarySimulations(), simulationWindow.size()))) {
			results.add("Vcrit=" + ParameterValues.format(round(result.criticalVoltage(), 4)) + " pu at Pmax="
					+ ParameterValues.format(round(result.maxPower(), 2)) + " MW");
		}
		if (!results.isEmpty()) {
			lines.add("Recent results: " + String.join("; ", results));
		}

		Set<String> changed = new LinkedHashSet<>();
		for (Turn turn : conversationWindow.subList(0, Math.min(config.summaryChangeTurns(), conversationWindow.size()))) {
			for (ParameterChange change : turn.parameterChanges()) {
				changed.add(change.name());
			}
		}
		if (!changed.isEmpty()) {
			lines.add("Recently changed: " + String.join(", ", changed));
		}

		return truncate(String.join("\n", lines), config.maxSummaryLength());
	}

	/**
	 * Parameters changed back and forth repeatedly in recent turns.
	 *
	 * <p>A reversal is a change whose new value equals the previous change's old value. A
	 * parameter oscillates when at least {@code oscillationThreshold} reversals occur among its
	 * last {@code oscillationWindow} changes.</p>
	 */
	public Set<String> oscillatingParameters(HistoryView view) {
		Set<String> oscillating = new LinkedHashSet<>();
		view.parameterEvolution().forEach((key, entries) -> {
			List<ParameterEvolutionEntry> recent =
					entries.subList(Math.max(0, entries.size() - config.oscillationWindow()), entries.size());
			int reversals = 0;
			for (int i = 1; i < recent.size(); i++) {
				if (Objects.equals(recent.get(i).newValue(), recent.get(i - 1).oldValue())) {
					reversals++;
				}
			}
			if (reversals >= config.oscillationThreshold()) {
				oscillating.add(key);
			}
		});
		return Collections.unmodifiableSet(oscillating);
	}

	private static String truncate(String text, int maxLength) {
		if (text.length() <= maxLength) {
			return text;
		}
		return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
	}

	private static double round(double value, int places) {
		double scale = Math.pow(10, places);
		return Math.round(value * scale) / scale;
	}
}
