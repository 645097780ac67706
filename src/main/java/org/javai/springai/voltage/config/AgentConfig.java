package org.javai.springai.voltage.config;

import java.util.Objects;
import org.javai.springai.voltage.history.HistoryConfig;
import org.javai.springai.voltage.workflow.WorkflowConfig;

/**
 * Top-level settings of the agent.
 *
 * @param history bounds for history views
 * @param workflow routing limits
 * @param retrievalTopK reference snippets retrieved per question
 * @param chatModel model name used when a language model is configured
 * @param transcriptDirectory where console sessions export their transcripts
 */
public record AgentConfig(
		HistoryConfig history,
		WorkflowConfig workflow,
		int retrievalTopK,
		String chatModel,
		String transcriptDirectory
) {

	public static final int DEFAULT_RETRIEVAL_TOP_K = 5;
	public static final String DEFAULT_CHAT_MODEL = "gpt-4.1-mini";
	public static final String DEFAULT_TRANSCRIPT_DIRECTORY = "transcripts";

	public AgentConfig {
		Objects.requireNonNull(history, "history must not be null");
		Objects.requireNonNull(workflow, "workflow must not be null");
		if (retrievalTopK < 1) {
			throw new IllegalArgumentException("retrievalTopK must be at least 1");
		}
		if (chatModel == null || chatModel.isBlank()) {
			throw new IllegalArgumentException("chatModel must not be blank");
		}
		if (transcriptDirectory == null || transcriptDirectory.isBlank()) {
			throw new IllegalArgumentException("transcriptDirectory must not be blank");
		}
	}

	public static AgentConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private HistoryConfig history = HistoryConfig.defaults();
		private WorkflowConfig workflow = WorkflowConfig.defaults();
		private int retrievalTopK = DEFAULT_RETRIEVAL_TOP_K;
		private String chatModel = DEFAULT_CHAT_MODEL;
		private String transcriptDirectory = DEFAULT_TRANSCRIPT_DIRECTORY;

		private Builder() {}

		public Builder history(HistoryConfig history) {
			this.history = history;
			return this;
		}

		public Builder workflow(WorkflowConfig workflow) {
			this.workflow = workflow;
			return this;
		}

		public Builder retrievalTopK(int value) {
			this.retrievalTopK = value;
			return this;
		}

		public Builder chatModel(String value) {
			this.chatModel = value;
			return this;
		}

		public Builder transcriptDirectory(String value) {
			this.transcriptDirectory = value;
			return this;
		}

		public AgentConfig build() {
			return new AgentConfig(history, workflow, retrievalTopK, chatModel, transcriptDirectory);
		}
	}
}
