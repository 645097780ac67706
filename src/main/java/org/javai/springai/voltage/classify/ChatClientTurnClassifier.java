package org.javai.springai.voltage.classify;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.springai.voltage.history.Turn;
import org.javai.springai.voltage.prompt.JsonResponses;
import org.javai.springai.voltage.prompt.PromptTemplates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Classifier backed by a Spring AI {@link ChatClient}.
 *
 * <p>The model is asked for a JSON verdict. A response without a usable JSON object is reported
 * as {@link TurnLabel#UNCLASSIFIABLE}; a failing call raises {@link ClassificationException}.</p>
 */
public class ChatClientTurnClassifier implements TurnClassifier {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientTurnClassifier.class);

	private final ChatClient chatClient;
	private final PromptTemplates prompts;

	public ChatClientTurnClassifier(ChatClient chatClient) {
		this(chatClient, new PromptTemplates());
	}

	public ChatClientTurnClassifier(ChatClient chatClient, PromptTemplates prompts) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.prompts = Objects.requireNonNull(prompts, "prompts must not be null");
	}

	@Override
	public Classification classify(String text, List<Turn> recentTurns) {
		String content;
		try {
			content = chatClient.prompt()
					.system(prompts.classifierSystemPrompt())
					.user(prompts.classifierUserPrompt(text, recentTurns))
					.call()
					.content();
		}
		catch (RuntimeException ex) {
			throw new ClassificationException("Classifier call failed: " + ex.getMessage(), ex);
		}
		logger.debug("Classifier response:\n{}", content);

		Optional<JsonNode> json = JsonResponses.parseObject(content);
		if (json.isEmpty()) {
			logger.debug("Classifier response holds no JSON object");
			return Classification.unclassifiable();
		}
		return toClassification(json.get());
	}

	private static Classification toClassification(JsonNode node) {
		TurnLabel label = TurnLabel.fromWire(node.path("label").asText(null));
		double confidence = node.path("confidence").asDouble(1.0);
		confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));

		List<TurnLabel> followUps = new ArrayList<>();
		JsonNode followUpNode = node.path("followUps");
		if (followUpNode.isArray()) {
			for (JsonNode item : followUpNode) {
				TurnLabel followUp = TurnLabel.fromWire(item.asText(null));
				if (followUp.isDispatchable()) {
					followUps.add(followUp);
				}
			}
		}
		return new Classification(label, confidence, followUps);
	}
}
