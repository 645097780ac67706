package org.javai.springai.voltage.respond;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.javai.springai.voltage.classify.TurnLabel;
import org.javai.springai.voltage.param.GridParameter;
import org.javai.springai.voltage.param.ParameterChange;
import org.javai.springai.voltage.param.ParameterStore;
import org.javai.springai.voltage.param.ParameterValues;
import org.javai.springai.voltage.simulation.SimulationResult;

/**
 * Compares the latest simulation result with the one before it.
 */
public class AnalysisResponder implements Responder {

	static final String NO_RESULTS_TEXT = "There are no simulation results to analyse yet. "
			+ "Generate a PV curve first, for example with \"run the simulation\".";

	@Override
	public TurnLabel label() {
		return TurnLabel.ANALYSIS;
	}

	@Override
	public ResponderOutcome respond(ResponderRequest request) {
		Optional<SimulationResult> latest = request.latest();
		if (latest.isEmpty()) {
			return ResponderOutcome.reply(NO_RESULTS_TEXT);
		}
		SimulationResult current = latest.get();
		Optional<SimulationResult> previous = request.previousResult();
		if (previous.isEmpty()) {
			return ResponderOutcome.reply("Only one simulation result is available: maximum power "
					+ GenerationResponder.mw(current.maxPower()) + " at a critical voltage of "
					+ GenerationResponder.pu(current.criticalVoltage()) + ", load margin "
					+ GenerationResponder.mw(current.loadMarginMw()) + ". Change a parameter and run the "
					+ "simulation again to compare.");
		}

		SimulationResult prior = previous.get();
		double powerDelta = current.maxPower() - prior.maxPower();
		double voltageDelta = current.criticalVoltage() - prior.criticalVoltage();
		StringBuilder sb = new StringBuilder("Comparison of the latest run with the previous one: maximum power ")
				.append(GenerationResponder.mw(prior.maxPower()))
				.append(" -> ")
				.append(GenerationResponder.mw(current.maxPower()))
				.append(" (")
				.append(GenerationResponder.signedMw(powerDelta))
				.append("), critical voltage ")
				.append(GenerationResponder.pu(prior.criticalVoltage()))
				.append(" -> ")
				.append(GenerationResponder.pu(current.criticalVoltage()))
				.append(" (")
				.append(GenerationResponder.signedPu(voltageDelta))
				.append(").");

		List<ParameterChange> differences = ParameterStore.diff(prior.parameters(), current.parameters());
		if (differences.isEmpty()) {
			sb.append(" Both runs used the same parameters.");
		}
		else {
			sb.append(" Parameters that differ: ")
					.append(differences.stream()
							.map(change -> GridParameter.fromName(change.name()).map(GridParameter::displayName).orElse(change.name())
									+ " " + ParameterValues.format(change.oldValue()) + " -> "
									+ ParameterValues.format(change.newValue()))
							.collect(Collectors.joining(", ")))
					.append(".");
		}
		if (powerDelta > 0) {
			sb.append(" The system can now carry more load before reaching the nose.");
		}
		else if (powerDelta < 0) {
			sb.append(" The loadability limit moved lower.");
		}
		return ResponderOutcome.reply(sb.toString());
	}
}
