package org.javai.springai.voltage.history;

/**
 * Bounds applied when deriving views from the interaction log.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * HistoryConfig config = HistoryConfig.defaults();
 *
 * // Custom configuration
 * HistoryConfig config = HistoryConfig.builder()
 *         .maxConversationTurns(20)
 *         .maxSimulationResults(3)
 *         .build();
 * }</pre>
 *
 * @param maxConversationTurns turns in the conversation window
 * @param maxSimulationResults results in the simulation window
 * @param classificationContextTurns turns passed to the classifier to disambiguate a message
 * @param maxEvolutionEntries changes kept per parameter in the evolution view
 * @param summaryIntents turn intents listed in the context summary
 * @param summarySimulations simulation results listed in the context summary
 * @param summaryChangeTurns turns scanned for changed parameter names in the context summary
 * @param maxSummaryLength hard cap on the context summary length in characters
 * @param oscillationWindow recent evolution entries inspected for back-and-forth changes
 * @param oscillationThreshold reversals inside the window that count as oscillation
 */
public record HistoryConfig(
		int maxConversationTurns,
		int maxSimulationResults,
		int classificationContextTurns,
		int maxEvolutionEntries,
		int summaryIntents,
		int summarySimulations,
		int summaryChangeTurns,
		int maxSummaryLength,
		int oscillationWindow,
		int oscillationThreshold
) {

	public static final int DEFAULT_MAX_CONVERSATION_TURNS = 10;
	public static final int DEFAULT_MAX_SIMULATION_RESULTS = 5;
	public static final int DEFAULT_CLASSIFICATION_CONTEXT_TURNS = 3;
	public static final int DEFAULT_MAX_EVOLUTION_ENTRIES = 10;
	public static final int DEFAULT_SUMMARY_INTENTS = 5;
	public static final int DEFAULT_SUMMARY_SIMULATIONS = 3;
	public static final int DEFAULT_SUMMARY_CHANGE_TURNS = 5;
	public static final int DEFAULT_MAX_SUMMARY_LENGTH = 1000;
	public static final int DEFAULT_OSCILLATION_WINDOW = 6;
	public static final int DEFAULT_OSCILLATION_THRESHOLD = 3;

	public HistoryConfig {
		requireNonNegative(maxConversationTurns, "maxConversationTurns");
		requireNonNegative(maxSimulationResults, "maxSimulationResults");
		requireNonNegative(classificationContextTurns, "classificationContextTurns");
		requireNonNegative(maxEvolutionEntries, "maxEvolutionEntries");
		requireNonNegative(summaryIntents, "summaryIntents");
		requireNonNegative(summarySimulations, "summarySimulations");
		requireNonNegative(summaryChangeTurns, "summaryChangeTurns");
		if (maxSummaryLength < 16) {
			throw new IllegalArgumentException("maxSummaryLength must be at least 16");
		}
		if (oscillationWindow < 2) {
			throw new IllegalArgumentException("oscillationWindow must be at least 2");
		}
		if (oscillationThreshold < 1) {
			throw new IllegalArgumentException("oscillationThreshold must be at least 1");
		}
	}

	private static void requireNonNegative(int value, String name) {
		if (value < 0) {
			throw new IllegalArgumentException(name + " must be non-negative");
		}
	}

	/**
	 * Creates a configuration with default values.
	 */
	public static HistoryConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Creates a builder seeded with this configuration's values.
	 */
	public Builder toBuilder() {
		return new Builder()
				.maxConversationTurns(maxConversationTurns)
				.maxSimulationResults(maxSimulationResults)
				.classificationContextTurns(classificationContextTurns)
				.maxEvolutionEntries(maxEvolutionEntries)
				.summaryIntents(summaryIntents)
				.summarySimulations(summarySimulations)
				.summaryChangeTurns(summaryChangeTurns)
				.maxSummaryLength(maxSummaryLength)
				.oscillationWindow(oscillationWindow)
				.oscillationThreshold(oscillationThreshold);
	}

	/**
	 * Builder for {@link HistoryConfig}.
	 */
	public static class Builder {
		private int maxConversationTurns = DEFAULT_MAX_CONVERSATION_TURNS;
		private int maxSimulationResults = DEFAULT_MAX_SIMULATION_RESULTS;
		private int classificationContextTurns = DEFAULT_CLASSIFICATION_CONTEXT_TURNS;
		private int maxEvolutionEntries = DEFAULT_MAX_EVOLUTION_ENTRIES;
		private int summaryIntents = DEFAULT_SUMMARY_INTENTS;
		private int summarySimulations = DEFAULT_SUMMARY_SIMULATIONS;
		private int summaryChangeTurns = DEFAULT_SUMMARY_CHANGE_TURNS;
		private int maxSummaryLength = DEFAULT_MAX_SUMMARY_LENGTH;
		private int oscillationWindow = DEFAULT_OSCILLATION_WINDOW;
		private int oscillationThreshold = DEFAULT_OSCILLATION_THRESHOLD;

		private Builder() {}

		public Builder maxConversationTurns(int value) {
			this.maxConversationTurns = value;
			return this;
		}

		public Builder maxSimulationResults(int value) {
			this.maxSimulationResults = value;
			return this;
		}

		public Builder classificationContextTurns(int value) {
			this.classificationContextTurns = value;
			return this;
		}

		public Builder maxEvolutionEntries(int value) {
			this.maxEvolutionEntries = value;
			return this;
		}

		public Builder summaryIntents(int value) {
			this.summaryIntents = value;
			return this;
		}

		public Builder summarySimulations(int value) {
			this.summarySimulations = value;
			return this;
		}

		public Builder summaryChangeTurns(int value) {
			this.summaryChangeTurns = value;
			return this;
		}

		/**
		 * Sets the hard cap on the context summary. Longer digests are cut and end with "...".
		 */
		public Builder maxSummaryLength(int value) {
			this.maxSummaryLength = value;
			return this;
		}

		public Builder oscillationWindow(int value) {
			this.oscillationWindow = value;
			return this;
		}

		public Builder oscillationThreshold(int value) {
			this.oscillationThreshold = value;
			return this;
		}

		public HistoryConfig build() {
			return new HistoryConfig(maxConversationTurns, maxSimulationResults, classificationContextTurns,
					maxEvolutionEntries, summaryIntents, summarySimulations, summaryChangeTurns,
					maxSummaryLength, oscillationWindow, oscillationThreshold);
		}
	}
}
