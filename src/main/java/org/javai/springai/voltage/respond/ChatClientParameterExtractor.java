package org.javai.springai.voltage.respond;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.springai.voltage.VoltageAgentException;
import org.javai.springai.voltage.param.ParameterSet;
import org.javai.springai.voltage.prompt.JsonResponses;
import org.javai.springai.voltage.prompt.PromptTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Extractor backed by a Spring AI {@link ChatClient}. The model answers with
 * {@code {"changes": {"name": value}}}.
 */
public class ChatClientParameterExtractor implements ParameterExtractor {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientParameterExtractor.class);

	private final ChatClient chatClient;
	private final PromptTemplates prompts;

	public ChatClientParameterExtractor(ChatClient chatClient) {
		this(chatClient, new PromptTemplates());
	}

	public ChatClientParameterExtractor(ChatClient chatClient, PromptTemplates prompts) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.prompts = Objects.requireNonNull(prompts, "prompts must not be null");
	}

	@Override
	public Map<String, Object> extract(String text, ParameterSet current) {
		String content;
		try {
			content = chatClient.prompt()
					.system(prompts.extractorSystemPrompt(current))
					.user(text)
					.call()
					.content();
		}
		catch (RuntimeException ex) {
			throw new VoltageAgentException("Parameter extraction failed: " + ex.getMessage(), ex);
		}
		logger.debug("Extractor response:\n{}", content);

		Optional<JsonNode> json = JsonResponses.parseObject(content);
		if (json.isEmpty() || !json.get().path("changes").isObject()) {
			return Map.of();
		}
		Map<String, Object> changes = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> fields = json.get().path("changes").fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			Object value = toValue(field.getValue());
			if (value != null) {
				changes.put(field.getKey(), value);
			}
		}
		return changes;
	}

	private static Object toValue(JsonNode node) {
		if (node.isNumber()) {
			return node.numberValue();
		}
		if (node.isBoolean()) {
			return node.booleanValue();
		}
		if (node.isTextual()) {
			return node.textValue();
		}
		return null;
	}
}
