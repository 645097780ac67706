package org.javai.springai.voltage.respond;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.voltage.classify.TurnLabel;
import org.javai.springai.voltage.simulation.SimulationResult;

/**
 * What a responder proposes. Nothing here is committed until the workflow engine accepts it.
 *
 * @param responseText text shown to the user
 * @param parameterDeltas requested parameter values keyed by name; empty for none
 * @param simulationResult a newly generated result, or null
 * @param followUp a label to run next within the same input, or null
 * @param failed whether the responder could not do what was asked
 */
public record ResponderOutcome(
		String responseText,
		Map<String, Object> parameterDeltas,
		SimulationResult simulationResult,
		TurnLabel followUp,
		boolean failed
) {

	public ResponderOutcome {
		Objects.requireNonNull(responseText, "responseText must not be null");
		parameterDeltas = parameterDeltas != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(parameterDeltas))
				: Map.of();
		if (followUp != null && !followUp.isDispatchable()) {
			throw new IllegalArgumentException("followUp must be a dispatchable label");
		}
	}

	public static ResponderOutcome reply(String text) {
		return new ResponderOutcome(text, Map.of(), null, null, false);
	}

	public static ResponderOutcome proposing(String text, Map<String, ?> deltas) {
		return new ResponderOutcome(text, new LinkedHashMap<>(deltas), null, null, false);
	}

	public static ResponderOutcome produced(String text, SimulationResult result) {
		return new ResponderOutcome(text, Map.of(), Objects.requireNonNull(result, "result must not be null"), null, false);
	}

	public static ResponderOutcome failure(String text) {
		return new ResponderOutcome(text, Map.of(), null, null, true);
	}

	public ResponderOutcome withFollowUp(TurnLabel label) {
		return new ResponderOutcome(responseText, parameterDeltas, simulationResult, label, failed);
	}

	public boolean hasParameterDeltas() {
		return !parameterDeltas.isEmpty();
	}
}
