package org.javai.springai.voltage.prompt;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.javai.springai.voltage.history.HistoryView;
import org.javai.springai.voltage.history.ParameterEvolutionEntry;
import org.javai.springai.voltage.history.Turn;
import org.javai.springai.voltage.param.GridParameter;
import org.javai.springai.voltage.param.ParameterChange;
import org.javai.springai.voltage.param.ParameterSet;
import org.javai.springai.voltage.param.ParameterStore;
import org.javai.springai.voltage.param.ParameterValues;
import org.javai.springai.voltage.simulation.SimulationResult;

/**
 * Renders the system and user prompts sent to the language model.
 */
public final class PromptTemplates {

	static final int MAX_PROMPT_SIMULATIONS = 3;
	static final int MAX_PROMPT_CHANGES_PER_PARAMETER = 5;

	private final VoltagePersona persona;

	public PromptTemplates() {
		this(VoltagePersona.voltageStabilityAssistant());
	}

	public PromptTemplates(VoltagePersona persona) {
		this.persona = Objects.requireNonNull(persona, "persona must not be null");
	}

	public VoltagePersona persona() {
		return persona;
	}

	public String classifierSystemPrompt() {
		return String.format(
				"""
				%s

				Classify the user's message into exactly one label:
				- question: asks about voltage stability concepts, the tool, or current parameter values
				- parameter: asks to set, change or reset one or more simulation parameters
				- generation: asks to run the simulation or generate a PV curve
				- analysis: asks to compare or interpret simulation results, including earlier ones

				If the message asks for a parameter change and then a simulation run, answer "parameter"
				and list "generation" in followUps.

				Known parameters: %s

				Respond with JSON only, in this form:
				{"label": "<label>", "confidence": <0..1>, "followUps": ["<label>", ...]}
				""",
				persona.render(),
				parameterKeys());
	}

	public String classifierUserPrompt(String text, List<Turn> recentTurns) {
		StringBuilder sb = new StringBuilder();
		if (!recentTurns.isEmpty()) {
			sb.append("Recent conversation:\n");
			for (Turn turn : recentTurns) {
				sb.append("User: ").append(turn.userText()).append("\n");
				sb.append("Assistant (").append(turn.kind().wireName()).append("): ")
						.append(turn.responseText()).append("\n");
			}
			sb.append("\n");
		}
		sb.append("Message to classify:\n").append(text);
		return sb.toString();
	}

	public String extractorSystemPrompt(ParameterSet current) {
		StringBuilder parameters = new StringBuilder();
		for (GridParameter parameter : GridParameter.values()) {
			parameters.append("- ").append(parameter.key())
					.append(" (").append(parameter.domain().describe()).append("), current: ")
					.append(ParameterValues.format(current.value(parameter))).append("\n");
		}
		return String.format(
				"""
				%s

				Extract the parameter changes the user asks for. Use only these parameter names:
				%s
				Give the requested value as written by the user; do not clamp or correct it.
				A request to reset a parameter means its default value: %s

				Respond with JSON only, in this form:
				{"changes": {"<parameter>": <value>, ...}}
				Use an empty object when the message names no change.
				""",
				persona.render(),
				parameters.toString().trim(),
				ParameterSet.DEFAULT.describe());
	}

	public String answerSystemPrompt() {
		return String.format(
				"""
				%s

				Answer the user's question about voltage stability analysis. Use the reference material
				and the session context below when they are relevant.
				""",
				persona.render());
	}

	public String answerUserPrompt(String question, List<String> snippets, HistoryView view, ParameterSet parameters) {
		StringBuilder sb = new StringBuilder();
		if (!snippets.isEmpty()) {
			sb.append("REFERENCE MATERIAL:\n");
			snippets.forEach(snippet -> sb.append("- ").append(snippet).append("\n"));
			sb.append("\n");
		}
		sb.append("CURRENT PARAMETERS:\n").append(parameters.describe()).append("\n\n");
		if (!view.contextSummary().isBlank()) {
			sb.append("SESSION SUMMARY:\n").append(view.contextSummary()).append("\n\n");
		}
		appendSimulations(sb, view.simulationWindow());
		appendEvolution(sb, view.parameterEvolution());
		if (!view.conversationWindow().isEmpty()) {
			sb.append("RECENT CONVERSATION (most recent first):\n");
			for (Turn turn : view.conversationWindow()) {
				sb.append("User: ").append(turn.userText()).append("\n");
				sb.append("Assistant: ").append(turn.responseText()).append("\n");
			}
			sb.append("\n");
		}
		sb.append("QUESTION:\n").append(question);
		return sb.toString();
	}

	private static void appendSimulations(StringBuilder sb, List<SimulationResult> window) {
		if (window.isEmpty()) {
			return;
		}
		sb.append("RECENT SIMULATIONS (most recent first):\n");
		int shown = Math.min(window.size(), MAX_PROMPT_SIMULATIONS);
		for (int i = 0; i < shown; i++) {
			SimulationResult result = window.get(i);
			ParameterSet inputs = result.parameters();
			sb.append("- ").append(inputs.stringValue(GridParameter.GRID))
					.append(" bus ").append(inputs.intValue(GridParameter.MONITORED_BUS))
					.append(", power factor ").append(ParameterValues.format(inputs.value(GridParameter.POWER_FACTOR)))
					.append(", ").append(inputs.stringValue(GridParameter.LOAD_TYPE)).append(" load")
					.append(String.format(Locale.ROOT, ": Vcrit=%.4f pu, Pmax=%.2f MW, load margin %.2f MW",
							result.criticalVoltage(), result.maxPower(), result.loadMarginMw()));
			if (i + 1 < window.size()) {
				List<ParameterChange> differences = ParameterStore.diff(window.get(i + 1).parameters(), inputs);
				sb.append(differences.isEmpty()
						? "; same parameters as the run before"
						: "; differs from the run before in " + describe(differences));
			}
			sb.append("\n");
		}
		sb.append("\n");
	}

	private static void appendEvolution(StringBuilder sb, Map<String, List<ParameterEvolutionEntry>> evolution) {
		StringBuilder lines = new StringBuilder();
		evolution.forEach((name, entries) -> {
			if (entries.isEmpty()) {
				return;
			}
			List<ParameterEvolutionEntry> recent =
					entries.subList(Math.max(0, entries.size() - MAX_PROMPT_CHANGES_PER_PARAMETER), entries.size());
			lines.append("- ").append(name).append(": ")
					.append(recent.stream()
							.map(entry -> ParameterValues.format(entry.oldValue()) + " -> "
									+ ParameterValues.format(entry.newValue()) + " (turn " + entry.turnSequence() + ")")
							.collect(Collectors.joining(", ")))
					.append("\n");
		});
		if (lines.length() > 0) {
			sb.append("PARAMETER EVOLUTION (oldest first):\n").append(lines).append("\n");
		}
	}

	private static String describe(List<ParameterChange> changes) {
		return changes.stream()
				.map(change -> change.name() + " " + ParameterValues.format(change.oldValue()) + " -> "
						+ ParameterValues.format(change.newValue()))
				.collect(Collectors.joining(", "));
	}

	private static String parameterKeys() {
		return List.of(GridParameter.values()).stream()
				.map(GridParameter::key)
				.collect(Collectors.joining(", "));
	}
}
