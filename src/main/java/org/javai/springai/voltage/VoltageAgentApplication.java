package org.javai.springai.voltage;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import org.javai.springai.voltage.config.AgentConfig;
import org.javai.springai.voltage.config.AgentConfigLoader;
import org.javai.springai.voltage.conversation.ConsoleSession;
import org.javai.springai.voltage.conversation.ConversationManager;
import org.javai.springai.voltage.conversation.TranscriptWriter;
import org.javai.springai.voltage.history.HistoryContext;
import org.javai.springai.voltage.retrieve.KeywordKnowledgeRetriever;
import org.javai.springai.voltage.retrieve.KnowledgeRetriever;
import org.javai.springai.voltage.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;

/**
 * Console entry point. Uses OpenAI when {@code OPENAI_API_KEY} is set, the offline
 * collaborators otherwise.
 */
public final class VoltageAgentApplication {

	private static final Logger logger = LoggerFactory.getLogger(VoltageAgentApplication.class);

	private VoltageAgentApplication() {
	}

	public static void main(String[] args) throws IOException {
		AgentConfig config = new AgentConfigLoader().load();
		Clock clock = Clock.systemUTC();
		KnowledgeRetriever retriever = KeywordKnowledgeRetriever.fromClasspath(config.retrievalTopK());

		String apiKey = System.getenv("OPENAI_API_KEY");
		WorkflowEngine engine;
		String mode;
		if (apiKey != null && !apiKey.isBlank()) {
			engine = VoltageAgents.withChatClient(config, openAiClient(apiKey, config.chatModel()), retriever, clock);
			mode = "openai";
		}
		else {
			engine = VoltageAgents.offline(config, retriever, clock);
			mode = "offline";
		}
		logger.info("Starting console session in {} mode", mode);

		ConsoleSession session = new ConsoleSession(
				new ConversationManager(engine),
				new TranscriptWriter(new HistoryContext(config.history()), clock),
				Path.of(config.transcriptDirectory()),
				clock,
				"pv-curve-session-" + mode);
		session.run(
				new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
				new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
	}

	static ChatClient openAiClient(String apiKey, String model) {
		OpenAiApi openAiApi = OpenAiApi.builder().apiKey(apiKey).build();
		OpenAiChatModel chatModel = OpenAiChatModel.builder()
				.openAiApi(openAiApi)
				.build();
		OpenAiChatOptions options = OpenAiChatOptions.builder()
				.model(model)
				.temperature(0.0)
				.build();
		return ChatClient.builder(chatModel)
				.defaultOptions(options)
				.build();
	}
}
