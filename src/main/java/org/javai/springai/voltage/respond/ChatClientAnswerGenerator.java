package org.javai.springai.voltage.respond;

import java.util.Objects;
import org.javai.springai.voltage.VoltageAgentException;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Answer generator backed by a Spring AI {@link ChatClient}.
 */
public class ChatClientAnswerGenerator implements AnswerGenerator {

	private final ChatClient chatClient;

	public ChatClientAnswerGenerator(ChatClient chatClient) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
	}

	@Override
	public String generate(String systemPrompt, String userPrompt) {
		String content;
		try {
			content = chatClient.prompt()
					.system(systemPrompt)
					.user(userPrompt)
					.call()
					.content();
		}
		catch (RuntimeException ex) {
			throw new VoltageAgentException("Answer generation failed: " + ex.getMessage(), ex);
		}
		if (content == null || content.isBlank()) {
			throw new VoltageAgentException("Answer generation returned no content");
		}
		return content.trim();
	}
}
