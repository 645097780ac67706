package org.javai.springai.voltage.respond;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.javai.springai.voltage.history.HistoryView;
import org.javai.springai.voltage.history.ParameterEvolutionEntry;
import org.javai.springai.voltage.param.GridParameter;
import org.javai.springai.voltage.param.ParameterSet;
import org.javai.springai.voltage.param.ParameterStore;
import org.javai.springai.voltage.prompt.PromptTemplates;
import org.javai.springai.voltage.retrieve.KnowledgeRetriever;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class QuestionResponderTest {

	@Mock
	private KnowledgeRetriever retriever;

	@Mock
	private AnswerGenerator generator;

	@Test
	void currentValueIsAnsweredFromHistory() {
		ParameterSet parameters = new ParameterStore().apply(Map.of("step_size", 0.05));
		HistoryView history = new HistoryView(List.of(), List.of(),
				Map.of("step_size", List.of(new ParameterEvolutionEntry(Instant.EPOCH, 0.01, 0.05, 1))), "");
		QuestionResponder responder = new QuestionResponder(retriever, generator);

		ResponderOutcome outcome = responder.respond(
				new ResponderRequest("What is the current step size?", parameters, history, null));

		assertThat(outcome.responseText()).isEqualTo("The current step size is 0.05 (changed from 0.01 in turn 1).");
		assertThat(outcome.hasParameterDeltas()).isFalse();
		verifyNoInteractions(retriever, generator);
	}

	@Test
	void untouchedValueIsReportedAsDefault() {
		QuestionResponder responder = new QuestionResponder(null, null);

		ResponderOutcome outcome = responder.respond(
				new ResponderRequest("what's the power factor", ParameterSet.DEFAULT, null, null));

		assertThat(outcome.responseText()).isEqualTo("The current power factor is 0.95 (the default).");
	}

	@Test
	void conceptQuestionsSharingAParameterNameAreNotAnsweredWithItsValue() {
		when(retriever.retrieve(anyString())).thenReturn(List.of("A bus is a node of the network."));
		when(generator.generate(anyString(), anyString())).thenReturn("Explained.");
		QuestionResponder responder = new QuestionResponder(retriever, generator);

		List<String> questions = List.of("What is a bus?", "What is voltage stability in this system?",
				"What is a power factor?", "How does the power factor affect the nose?",
				"What is the current bus voltage at the nose?");
		for (String question : questions) {
			ResponderOutcome outcome = responder.respond(new ResponderRequest(question, ParameterSet.DEFAULT, null, null));

			assertThat(outcome.responseText()).as(question).isEqualTo("Explained.");
		}
		verify(generator, times(questions.size())).generate(anyString(), contains("A bus is a node of the network."));
	}

	@Test
	void recognisesTheWaysOfAskingForASetting() {
		assertThat(QuestionResponder.askedValue("what is the grid set to?")).contains(GridParameter.GRID);
		assertThat(QuestionResponder.askedValue("what's my pf")).contains(GridParameter.POWER_FACTOR);
		assertThat(QuestionResponder.askedValue("what is the value of the step size?")).contains(GridParameter.STEP_SIZE);
		assertThat(QuestionResponder.askedValue("which bus is currently monitored")).contains(GridParameter.MONITORED_BUS);
		assertThat(QuestionResponder.askedValue("what is the monitored bus right now?")).contains(GridParameter.MONITORED_BUS);
		assertThat(QuestionResponder.askedValue("what is a bus?")).isEmpty();
	}

	@Test
	void listsAllParameters() {
		QuestionResponder responder = new QuestionResponder(null, null);

		ResponderOutcome outcome = responder.respond(
				new ResponderRequest("show me the current parameters", ParameterSet.DEFAULT, null, null));

		assertThat(outcome.responseText()).startsWith("Current parameters: grid=ieee39, base_power=100");
	}

	@Test
	void conceptQuestionsGoThroughTheGenerator() {
		when(retriever.retrieve("What is the nose point?")).thenReturn(List.of("The nose point is the maximum."));
		when(generator.generate(anyString(), contains("The nose point is the maximum."))).thenReturn("It is the tip of the curve.");
		QuestionResponder responder = new QuestionResponder(retriever, generator);

		ResponderOutcome outcome = responder.respond(
				new ResponderRequest("What is the nose point?", ParameterSet.DEFAULT, null, null));

		assertThat(outcome.responseText()).isEqualTo("It is the tip of the curve.");
		verify(generator).generate(contains("PERSONA:"), eq(new PromptTemplates()
				.answerUserPrompt("What is the nose point?", List.of("The nose point is the maximum."),
						HistoryView.empty(), ParameterSet.DEFAULT)));
	}

	@Test
	void withoutGeneratorSnippetsAreQuoted() {
		when(retriever.retrieve(anyString())).thenReturn(List.of("one", "two", "three", "four"));
		QuestionResponder responder = new QuestionResponder(retriever, null);

		ResponderOutcome outcome = responder.respond(
				new ResponderRequest("Explain voltage collapse", ParameterSet.DEFAULT, null, null));

		assertThat(outcome.responseText()).isEqualTo("From the reference material:\n- one\n- two\n- three");
	}

	@Test
	void nothingToSayFallsBackToHelp() {
		when(retriever.retrieve(anyString())).thenReturn(List.of());
		QuestionResponder responder = new QuestionResponder(retriever, null);

		ResponderOutcome outcome = responder.respond(
				new ResponderRequest("hmm", ParameterSet.DEFAULT, null, null));

		assertThat(outcome.responseText()).isEqualTo(QuestionResponder.FALLBACK_TEXT);
		verify(generator, never()).generate(anyString(), anyString());
	}
}
