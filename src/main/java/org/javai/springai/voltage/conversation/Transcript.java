package org.javai.springai.voltage.conversation;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Exported record of a session, as written by {@link TranscriptWriter}.
 *
 * @param sessionName display name of the session
 * @param createdAt when the session started
 * @param exportedAt when the transcript was written
 * @param finalParameters the parameters at export time
 * @param turns every turn of the session, oldest first
 * @param simulationResults summaries of the most recent results, most recent first
 * @param statistics counts over the whole session
 */
public record Transcript(
		String sessionName,
		Instant createdAt,
		Instant exportedAt,
		Map<String, Object> finalParameters,
		List<Entry> turns,
		List<ResultSummary> simulationResults,
		Statistics statistics
) {

	/**
	 * One exchange.
	 */
	public record Entry(
			int sequence,
			Instant timestamp,
			String kind,
			String outcome,
			String user,
			String assistant,
			List<Change> parameterChanges,
			ResultSummary simulation
	) {
	}

	public record Change(String name, Object oldValue, Object newValue) {
	}

	/**
	 * Headline figures of a simulation result; the curve points are left out.
	 */
	public record ResultSummary(
			Instant timestamp,
			Map<String, Object> parameters,
			double maxPowerMw,
			double criticalVoltagePu,
			double loadMarginMw,
			double voltageDropPercent,
			int convergedSteps
	) {
	}

	public record Statistics(
			int totalTurns,
			int completedTurns,
			int rejectedTurns,
			int failedTurns,
			int simulations,
			int parameterChanges
	) {
	}
}
