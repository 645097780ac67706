package org.javai.springai.voltage;

import java.time.Clock;
import java.util.Objects;
import org.javai.springai.voltage.classify.ChatClientTurnClassifier;
import org.javai.springai.voltage.classify.KeywordTurnClassifier;
import org.javai.springai.voltage.config.AgentConfig;
import org.javai.springai.voltage.history.HistoryContext;
import org.javai.springai.voltage.prompt.PromptTemplates;
import org.javai.springai.voltage.respond.AnalysisResponder;
import org.javai.springai.voltage.respond.ChatClientAnswerGenerator;
import org.javai.springai.voltage.respond.ChatClientParameterExtractor;
import org.javai.springai.voltage.respond.GenerationResponder;
import org.javai.springai.voltage.respond.ParameterResponder;
import org.javai.springai.voltage.respond.PatternParameterExtractor;
import org.javai.springai.voltage.respond.QuestionResponder;
import org.javai.springai.voltage.retrieve.KnowledgeRetriever;
import org.javai.springai.voltage.simulation.CurveGenerator;
import org.javai.springai.voltage.simulation.TheveninCurveGenerator;
import org.javai.springai.voltage.workflow.WorkflowEngine;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Factory methods that wire a complete {@link WorkflowEngine}.
 */
public final class VoltageAgents {

	private VoltageAgents() {
	}

	/**
	 * An engine that needs no language model: keyword classification, pattern extraction and
	 * answers taken from the retrieved reference material.
	 */
	public static WorkflowEngine offline(AgentConfig config, KnowledgeRetriever retriever, Clock clock) {
		HistoryContext historyContext = new HistoryContext(config.history());
		return base(config, historyContext, new TheveninCurveGenerator(clock), clock)
				.classifier(new KeywordTurnClassifier())
				.responder(new QuestionResponder(retriever, null))
				.responder(new ParameterResponder(new PatternParameterExtractor(), historyContext))
				.build();
	}

	/**
	 * An engine that classifies, extracts parameters and answers questions with a chat model.
	 */
	public static WorkflowEngine withChatClient(AgentConfig config, ChatClient chatClient, KnowledgeRetriever retriever,
			Clock clock) {
		Objects.requireNonNull(chatClient, "chatClient must not be null");
		HistoryContext historyContext = new HistoryContext(config.history());
		PromptTemplates prompts = new PromptTemplates();
		return base(config, historyContext, new TheveninCurveGenerator(clock), clock)
				.classifier(new ChatClientTurnClassifier(chatClient, prompts))
				.responder(new QuestionResponder(retriever, new ChatClientAnswerGenerator(chatClient), prompts))
				.responder(new ParameterResponder(new ChatClientParameterExtractor(chatClient, prompts), historyContext))
				.build();
	}

	private static WorkflowEngine.Builder base(AgentConfig config, HistoryContext historyContext,
			CurveGenerator generator, Clock clock) {
		return WorkflowEngine.builder()
				.historyContext(historyContext)
				.config(config.workflow())
				.clock(clock)
				.responder(new GenerationResponder(generator, config.workflow().generationTimeout()))
				.responder(new AnalysisResponder());
	}
}
