package org.javai.springai.voltage.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.time.Duration;
import java.util.Map;
import java.util.function.IntConsumer;
import org.javai.springai.voltage.history.HistoryConfig;
import org.javai.springai.voltage.workflow.WorkflowConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link AgentConfig} from YAML, overlaying the defaults.
 *
 * <pre>{@code
 * history:
 *   max-conversation-turns: 10
 *   max-simulation-results: 5
 * workflow:
 *   max-chained-invocations: 4
 *   minimum-confidence: 0.5
 *   generation-timeout-seconds: 30
 * retrieval:
 *   top-k: 5
 * chat:
 *   model: gpt-4.1-mini
 * transcript:
 *   directory: transcripts
 * }</pre>
 *
 * <p>Missing keys keep their defaults. Unknown keys are logged and ignored. Values of the wrong
 * type or out of range raise {@link IllegalArgumentException}.</p>
 */
public class AgentConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(AgentConfigLoader.class);

	public static final String DEFAULT_RESOURCE = "voltage-agent.yaml";

	private final Yaml yaml = new Yaml();

	/**
	 * Load {@value #DEFAULT_RESOURCE} from the classpath, or the defaults if it is absent.
	 */
	public AgentConfig load() {
		return loadResource(DEFAULT_RESOURCE);
	}

	public AgentConfig loadResource(String resource) {
		InputStream in = AgentConfigLoader.class.getClassLoader().getResourceAsStream(resource);
		if (in == null) {
			logger.debug("No {} on the classpath; using defaults", resource);
			return AgentConfig.defaults();
		}
		try (in) {
			return parse(yaml.load(in));
		}
		catch (IOException e) {
			throw new IllegalArgumentException("Failed to read configuration resource " + resource, e);
		}
	}

	public AgentConfig load(Reader reader) {
		return parse(yaml.load(reader));
	}

	public AgentConfig loadString(String content) {
		return parse(yaml.load(content));
	}

	private AgentConfig parse(Object data) {
		AgentConfig.Builder builder = AgentConfig.builder();
		if (data == null) {
			return builder.build();
		}
		Map<String, Object> root = section(data, "root");
		for (Map.Entry<String, Object> entry : root.entrySet()) {
			switch (entry.getKey()) {
				case "history" -> builder.history(parseHistory(section(entry.getValue(), "history")));
				case "workflow" -> builder.workflow(parseWorkflow(section(entry.getValue(), "workflow")));
				case "retrieval" -> {
					Map<String, Object> retrieval = section(entry.getValue(), "retrieval");
					if (retrieval.containsKey("top-k")) {
						builder.retrievalTopK(intValue(retrieval.get("top-k"), "retrieval.top-k"));
					}
				}
				case "chat" -> {
					Map<String, Object> chat = section(entry.getValue(), "chat");
					if (chat.containsKey("model")) {
						builder.chatModel(stringValue(chat.get("model"), "chat.model"));
					}
				}
				case "transcript" -> {
					Map<String, Object> transcript = section(entry.getValue(), "transcript");
					if (transcript.containsKey("directory")) {
						builder.transcriptDirectory(stringValue(transcript.get("directory"), "transcript.directory"));
					}
				}
				default -> logger.warn("Ignoring unknown configuration section '{}'", entry.getKey());
			}
		}
		return builder.build();
	}

	private HistoryConfig parseHistory(Map<String, Object> section) {
		HistoryConfig.Builder builder = HistoryConfig.builder();
		for (Map.Entry<String, Object> entry : section.entrySet()) {
			String key = "history." + entry.getKey();
			IntConsumer setter = switch (entry.getKey()) {
				case "max-conversation-turns" -> builder::maxConversationTurns;
				case "max-simulation-results" -> builder::maxSimulationResults;
				case "classification-context-turns" -> builder::classificationContextTurns;
				case "max-evolution-entries" -> builder::maxEvolutionEntries;
				case "summary-intents" -> builder::summaryIntents;
				case "summary-simulations" -> builder::summarySimulations;
				case "summary-change-turns" -> builder::summaryChangeTurns;
				case "max-summary-length" -> builder::maxSummaryLength;
				case "oscillation-window" -> builder::oscillationWindow;
				case "oscillation-threshold" -> builder::oscillationThreshold;
				default -> null;
			};
			if (setter == null) {
				logger.warn("Ignoring unknown configuration key '{}'", key);
				continue;
			}
			setter.accept(intValue(entry.getValue(), key));
		}
		return builder.build();
	}

	private WorkflowConfig parseWorkflow(Map<String, Object> section) {
		WorkflowConfig.Builder builder = WorkflowConfig.builder();
		for (Map.Entry<String, Object> entry : section.entrySet()) {
			String key = "workflow." + entry.getKey();
			switch (entry.getKey()) {
				case "max-chained-invocations" -> builder.maxChainedInvocations(intValue(entry.getValue(), key));
				case "minimum-confidence" -> builder.minimumConfidence(doubleValue(entry.getValue(), key));
				case "generation-timeout-seconds" ->
						builder.generationTimeout(Duration.ofSeconds(intValue(entry.getValue(), key)));
				default -> logger.warn("Ignoring unknown configuration key '{}'", key);
			}
		}
		return builder.build();
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> section(Object value, String name) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map)) {
			throw new IllegalArgumentException("Configuration section '" + name + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private static int intValue(Object value, String key) {
		if (value instanceof Integer i) {
			return i;
		}
		throw new IllegalArgumentException("Configuration key '" + key + "' must be an integer, was: " + value);
	}

	private static double doubleValue(Object value, String key) {
		if (value instanceof Number n) {
			return n.doubleValue();
		}
		throw new IllegalArgumentException("Configuration key '" + key + "' must be a number, was: " + value);
	}

	private static String stringValue(Object value, String key) {
		if (value instanceof String s && !s.isBlank()) {
			return s;
		}
		throw new IllegalArgumentException("Configuration key '" + key + "' must be a non-blank string, was: " + value);
	}
}
