package org.javai.springai.voltage.workflow;

import java.util.Objects;
import org.javai.springai.voltage.history.InteractionLog;
import org.javai.springai.voltage.param.ParameterSet;
import org.javai.springai.voltage.simulation.SimulationResult;

/**
 * Everything carried from one turn to the next.
 *
 * <p>States are issued by {@link WorkflowEngine} with a {@code fingerprint}; the engine only
 * accepts states it signed itself, or the unsigned {@link #initial()} state.</p>
 *
 * @param parameters the committed parameters
 * @param log every turn so far
 * @param latestResult the most recent simulation result, or null
 * @param contextSummary bounded digest of recent history
 * @param fingerprint integrity tag issued by the engine, or null for the initial state
 */
public record SessionState(
		ParameterSet parameters,
		InteractionLog log,
		SimulationResult latestResult,
		String contextSummary,
		String fingerprint
) {

	private static final SessionState INITIAL =
			new SessionState(ParameterSet.DEFAULT, InteractionLog.empty(), null, "", null);

	public SessionState {
		Objects.requireNonNull(parameters, "parameters must not be null");
		Objects.requireNonNull(log, "log must not be null");
		contextSummary = contextSummary != null ? contextSummary : "";
	}

	/**
	 * Default parameters, empty log, no result, empty summary.
	 */
	public static SessionState initial() {
		return INITIAL;
	}

	public boolean isSigned() {
		return fingerprint != null;
	}

	SessionState withFingerprint(String value) {
		return new SessionState(parameters, log, latestResult, contextSummary, value);
	}
}
