package org.javai.springai.voltage.respond;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import java.util.Map;
import org.javai.springai.voltage.VoltageAgentException;
import org.javai.springai.voltage.param.ParameterSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.chat.client.ChatClient;

class ChatClientParameterExtractorTest {

	private ChatClient chatClient;

	@BeforeEach
	void setUp() {
		chatClient = Mockito.mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
	}

	@Test
	void readsChangesObject() {
		Mockito.when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
				.thenReturn("```json\n{\"changes\": {\"step_size\": 0.05, \"load_type\": \"capacitive\", \"continuation\": false, \"bogus\": null}}\n```");

		Map<String, Object> changes = new ChatClientParameterExtractor(chatClient).extract("...", ParameterSet.DEFAULT);

		assertThat(changes).containsExactly(
				Map.entry("step_size", 0.05),
				Map.entry("load_type", "capacitive"),
				Map.entry("continuation", false));
	}

	@Test
	void missingChangesMeansNoChange() {
		Mockito.when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
				.thenReturn("There is nothing to change.");

		assertThat(new ChatClientParameterExtractor(chatClient).extract("hello", ParameterSet.DEFAULT)).isEmpty();
	}

	@Test
	void failingCallIsWrapped() {
		Mockito.when(chatClient.prompt()).thenThrow(new IllegalStateException("timeout"));

		assertThatThrownBy(() -> new ChatClientParameterExtractor(chatClient).extract("set pf to 0.9", ParameterSet.DEFAULT))
				.isInstanceOf(VoltageAgentException.class)
				.hasMessageContaining("timeout");
	}

	@Test
	void answerGeneratorRejectsBlankContent() {
		Mockito.when(chatClient.prompt().system(anyString()).user(anyString()).call().content()).thenReturn("  ");

		assertThatThrownBy(() -> new ChatClientAnswerGenerator(chatClient).generate("system", "user"))
				.isInstanceOf(VoltageAgentException.class)
				.hasMessageContaining("no content");
	}

	@Test
	void answerGeneratorTrimsContent() {
		Mockito.when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
				.thenReturn("  The nose is the maximum-power point.\n");

		assertThat(new ChatClientAnswerGenerator(chatClient).generate("system", "user"))
				.isEqualTo("The nose is the maximum-power point.");
	}
}
