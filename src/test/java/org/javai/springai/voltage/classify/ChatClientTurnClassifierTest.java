package org.javai.springai.voltage.classify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.chat.client.ChatClient;

class ChatClientTurnClassifierTest {

	private ChatClient chatClient;
	private ChatClientTurnClassifier classifier;

	@BeforeEach
	void setUp() {
		chatClient = Mockito.mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
		classifier = new ChatClientTurnClassifier(chatClient);
	}

	private void respondWith(String content) {
		Mockito.when(chatClient.prompt().system(anyString()).user(anyString()).call().content()).thenReturn(content);
	}

	@Test
	void parsesPlainJsonVerdict() {
		respondWith("{\"label\": \"generation\", \"confidence\": 0.92, \"followUps\": []}");

		Classification result = classifier.classify("run it", List.of());

		assertThat(result.label()).isEqualTo(TurnLabel.GENERATION);
		assertThat(result.confidence()).isEqualTo(0.92);
		assertThat(result.followUps()).isEmpty();
	}

	@Test
	void parsesVerdictInsideMarkdownBlock() {
		respondWith("""
				Here is the classification:
				```json
				{"label": "parameter", "confidence": 0.8, "followUps": ["generation", "nonsense"]}
				```
				""");

		Classification result = classifier.classify("set step to 0.05 then run", List.of());

		assertThat(result.label()).isEqualTo(TurnLabel.PARAMETER);
		assertThat(result.followUps()).containsExactly(TurnLabel.GENERATION);
	}

	@Test
	void clampsConfidence() {
		respondWith("{\"label\": \"analysis\", \"confidence\": 7}");

		assertThat(classifier.classify("compare", List.of()).confidence()).isEqualTo(1.0);
	}

	@Test
	void garbageResponseIsUnclassifiable() {
		respondWith("I think the user wants a simulation.");

		Classification result = classifier.classify("run it", List.of());

		assertThat(result.label()).isEqualTo(TurnLabel.UNCLASSIFIABLE);
		assertThat(result.confidence()).isZero();
	}

	@Test
	void failingCallRaisesClassificationException() {
		Mockito.when(chatClient.prompt()).thenThrow(new IllegalStateException("rate limited"));

		assertThatThrownBy(() -> classifier.classify("run it", List.of()))
				.isInstanceOf(ClassificationException.class)
				.hasMessageContaining("rate limited")
				.hasCauseInstanceOf(IllegalStateException.class);
	}
}
