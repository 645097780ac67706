package org.javai.springai.voltage.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.springai.voltage.classify.Classification;
import org.javai.springai.voltage.classify.ClassificationException;
import org.javai.springai.voltage.classify.KeywordTurnClassifier;
import org.javai.springai.voltage.classify.TurnClassifier;
import org.javai.springai.voltage.classify.TurnLabel;
import org.javai.springai.voltage.history.HistoryContext;
import org.javai.springai.voltage.history.TurnOutcome;
import org.javai.springai.voltage.param.ParameterChange;
import org.javai.springai.voltage.param.ParameterSet;
import org.javai.springai.voltage.param.ParameterStore;
import org.javai.springai.voltage.respond.AnalysisResponder;
import org.javai.springai.voltage.respond.GenerationResponder;
import org.javai.springai.voltage.respond.ParameterResponder;
import org.javai.springai.voltage.respond.PatternParameterExtractor;
import org.javai.springai.voltage.respond.QuestionResponder;
import org.javai.springai.voltage.respond.Responder;
import org.javai.springai.voltage.respond.ResponderOutcome;
import org.javai.springai.voltage.respond.ResponderRequest;
import org.javai.springai.voltage.simulation.TheveninCurveGenerator;
import org.javai.springai.voltage.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("WorkflowEngine")
class WorkflowEngineTest {

	private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

	private static WorkflowEngine.Builder offlineBuilder(TurnClassifier classifier) {
		HistoryContext historyContext = new HistoryContext();
		return WorkflowEngine.builder()
				.classifier(classifier)
				.historyContext(historyContext)
				.clock(CLOCK)
				.responder(new QuestionResponder(null, null))
				.responder(new ParameterResponder(new PatternParameterExtractor(), historyContext))
				.responder(new GenerationResponder(new TheveninCurveGenerator(CLOCK)))
				.responder(new AnalysisResponder());
	}

	private static WorkflowEngine offlineEngine() {
		return offlineBuilder(new KeywordTurnClassifier()).build();
	}

	private static TurnResult run(WorkflowEngine engine, String... inputs) {
		SessionState state = engine.initialState();
		TurnResult result = null;
		for (String input : inputs) {
			result = engine.process(input, state);
			state = result.state();
		}
		return result;
	}

	@Nested
	@DisplayName("Committing")
	class Committing {

		@Test
		@DisplayName("a parameter change is committed with one turn")
		void parameterChange() {
			TurnResult result = run(offlineEngine(), "Set the base power to 150");

			assertThat(result.state().parameters().get("base_power")).isEqualTo(150.0);
			assertThat(result.state().log().size()).isEqualTo(1);
			assertThat(result.turn().kind()).isEqualTo(TurnLabel.PARAMETER);
			assertThat(result.turn().outcome()).isEqualTo(TurnOutcome.COMPLETED);
			assertThat(result.turn().parameterChanges()).containsExactly(new ParameterChange("base_power", 100.0, 150.0));
			assertThat(result.turn().timestamp()).isEqualTo(CLOCK.instant());
			assertThat(result.responseText()).isEqualTo("Updated base power from 100 to 150.");
			assertThat(result.state().isSigned()).isTrue();
		}

		@Test
		@DisplayName("an invalid batch is rejected without changing anything")
		void rejectedBatch() {
			WorkflowEngine engine = offlineEngine();
			TurnResult first = engine.process("Set the base power to 150", engine.initialState());

			TurnResult rejected = engine.process("set the base power to 200 and the power factor to 1.5", first.state());

			assertThat(rejected.turn().outcome()).isEqualTo(TurnOutcome.REJECTED);
			assertThat(rejected.turn().parameterChanges()).isEmpty();
			assertThat(rejected.state().parameters()).isEqualTo(first.state().parameters());
			assertThat(rejected.responseText()).startsWith("Could not update parameters: Invalid value '1.5' for power_factor")
					.endsWith("No parameters were changed.");
			assertThat(rejected.state().log().size()).isEqualTo(2);
		}

		@Test
		@DisplayName("a generation run records its result as the latest")
		void generationRecordsResult() {
			TurnResult result = run(offlineEngine(), "Run the simulation");

			assertThat(result.turn().kind()).isEqualTo(TurnLabel.GENERATION);
			assertThat(result.turn().simulationResult()).isNotNull();
			assertThat(result.state().latestResult()).isSameAs(result.turn().simulationResult());
			assertThat(result.state().contextSummary()).contains("Recent intents: generation", "Recent results: Vcrit=");
		}

		@Test
		@DisplayName("a failed generation keeps the previous result")
		void failedGenerationKeepsPreviousResult() {
			WorkflowEngine engine = offlineEngine();
			TurnResult first = run(engine, "Run the simulation");
			TurnResult overloaded = engine.process("Set the base power to 500", first.state());

			TurnResult failed = engine.process("Run the simulation", overloaded.state());

			assertThat(failed.turn().outcome()).isEqualTo(TurnOutcome.FAILED);
			assertThat(failed.turn().simulationResult()).isNull();
			assertThat(failed.state().latestResult()).isSameAs(first.state().latestResult());
			assertThat(failed.responseText()).contains("the power flow did not converge");
		}
	}

	@Nested
	@DisplayName("Routing")
	class Routing {

		@Test
		@DisplayName("compound requests run the follow-up on the staged parameters")
		void compoundRequest() {
			TurnResult result = run(offlineEngine(), "Set the step size to 0.05 and run the simulation");

			assertThat(result.state().log().size()).isEqualTo(1);
			assertThat(result.turn().kind()).isEqualTo(TurnLabel.PARAMETER);
			assertThat(result.turn().outcome()).isEqualTo(TurnOutcome.COMPLETED);
			assertThat(result.turn().parameterChanges()).containsExactly(new ParameterChange("step_size", 0.01, 0.05));
			assertThat(result.turn().simulationResult().parameters().get("step_size")).isEqualTo(0.05);
			assertThat(result.responseText()).contains("Updated step size from 0.01 to 0.05.", "PV curve generated");
		}

		@Test
		@DisplayName("a failing simulation in a compound request keeps the staged parameter change")
		void compoundWithFailingSimulation() {
			TurnResult result = run(offlineEngine(), "Set the base power to 500 and run the simulation");

			assertThat(result.turn().outcome()).isEqualTo(TurnOutcome.FAILED);
			assertThat(result.state().parameters().get("base_power")).isEqualTo(500.0);
			assertThat(result.state().latestResult()).isNull();
		}

		@Test
		@DisplayName("unclassifiable input falls back to a question and says so in the log")
		void fallbackIsLogged() {
			WorkflowEngine engine = offlineEngine();

			try (LogCaptorAppender captor = LogCaptorAppender.create(WorkflowEngine.class, Level.INFO)) {
				TurnResult result = engine.process("hello there", engine.initialState());

				assertThat(result.turn().kind()).isEqualTo(TurnLabel.QUESTION);
				assertThat(result.turn().outcome()).isEqualTo(TurnOutcome.COMPLETED);
				assertThat(result.state().parameters()).isEqualTo(ParameterSet.DEFAULT);
				assertThat(captor.messagesAt(Level.INFO))
						.contains("Turn 1 falls back to question (classified unclassifiable with confidence 0.0)");
			}
		}

		@Test
		@DisplayName("low confidence falls back to a question")
		void lowConfidenceFallsBack() {
			WorkflowEngine engine = offlineBuilder((text, turns) -> Classification.of(TurnLabel.GENERATION, 0.3)).build();

			TurnResult result = engine.process("maybe run?", engine.initialState());

			assertThat(result.turn().kind()).isEqualTo(TurnLabel.QUESTION);
			assertThat(result.turn().simulationResult()).isNull();
		}

		@Test
		@DisplayName("a classifier failure is recorded as a failed turn")
		void classifierFailure() {
			WorkflowEngine engine = offlineBuilder((text, turns) -> {
				throw new ClassificationException("model unavailable");
			}).build();

			TurnResult result = engine.process("Set the base power to 150", engine.initialState());

			assertThat(result.turn().outcome()).isEqualTo(TurnOutcome.FAILED);
			assertThat(result.turn().kind()).isEqualTo(TurnLabel.UNCLASSIFIABLE);
			assertThat(result.responseText()).contains("model unavailable").endsWith("Nothing was changed.");
			assertThat(result.state().parameters()).isEqualTo(ParameterSet.DEFAULT);
			assertThat(result.state().log().size()).isEqualTo(1);
		}

		@Test
		@DisplayName("endless follow-ups hit the chaining limit and change nothing")
		void recursionLimit() {
			Responder looping = new Responder() {
				@Override
				public TurnLabel label() {
					return TurnLabel.ANALYSIS;
				}

				@Override
				public ResponderOutcome respond(ResponderRequest request) {
					return ResponderOutcome.proposing("again", Map.of("step_size", 0.05)).withFollowUp(TurnLabel.ANALYSIS);
				}
			};
			WorkflowEngine engine = offlineBuilder((text, turns) -> Classification.of(TurnLabel.ANALYSIS, 1.0))
					.responder(looping)
					.build();

			TurnResult result = engine.process("analyse forever", engine.initialState());

			assertThat(result.turn().outcome()).isEqualTo(TurnOutcome.FAILED);
			assertThat(result.turn().parameterChanges()).isEmpty();
			assertThat(result.state().parameters()).isEqualTo(ParameterSet.DEFAULT);
			assertThat(result.responseText()).contains("more than " + WorkflowConfig.DEFAULT_MAX_CHAINED_INVOCATIONS + " steps");
		}

		@Test
		@DisplayName("a question responder is required")
		void questionResponderRequired() {
			assertThatThrownBy(() -> WorkflowEngine.builder()
					.classifier(new KeywordTurnClassifier())
					.responder(new AnalysisResponder())
					.build())
					.isInstanceOf(IllegalStateException.class);
		}
	}

	@Nested
	@DisplayName("State integrity")
	class Integrity {

		@Test
		@DisplayName("a state issued by another engine is refused")
		void foreignState() {
			TurnResult result = run(offlineEngine(), "Set the base power to 150");

			assertThatThrownBy(() -> offlineEngine().process("Run the simulation", result.state()))
					.isInstanceOf(StateIntegrityException.class);
		}

		@Test
		@DisplayName("an altered state is refused")
		void tamperedState() {
			WorkflowEngine engine = offlineEngine();
			SessionState issued = engine.process("Set the base power to 150", engine.initialState()).state();
			SessionState tampered = new SessionState(new ParameterStore().apply(Map.of("base_power", 5)),
					issued.log(), issued.latestResult(), issued.contextSummary(), issued.fingerprint());

			assertThatThrownBy(() -> engine.process("Run the simulation", tampered))
					.isInstanceOf(StateIntegrityException.class);
		}

		@Test
		@DisplayName("an unsigned state other than the initial one is refused")
		void unsignedState() {
			WorkflowEngine engine = offlineEngine();
			SessionState forged = new SessionState(new ParameterStore().apply(Map.of("base_power", 5)),
					SessionState.initial().log(), null, "", null);

			assertThatThrownBy(() -> engine.process("Run the simulation", forged))
					.isInstanceOf(StateIntegrityException.class);
		}

		@Test
		@DisplayName("engines sharing a fingerprinter and clock are deterministic")
		void deterministic() {
			StateFingerprinter fingerprinter = new StateFingerprinter(new byte[32]);
			WorkflowEngine first = offlineBuilder(new KeywordTurnClassifier()).fingerprinter(fingerprinter).build();
			WorkflowEngine second = offlineBuilder(new KeywordTurnClassifier()).fingerprinter(fingerprinter).build();
			String[] inputs = { "Set the step size to 0.05", "Run the simulation", "What is the current step size?" };

			TurnResult a = run(first, inputs);
			TurnResult b = run(second, inputs);

			assertThat(a.state()).isEqualTo(b.state());
			assertThat(a.responseText()).isEqualTo(b.responseText());
			assertThat(second.process("Run the simulation", a.state()).turn().sequence()).isEqualTo(4);
		}
	}

	@Test
	@DisplayName("the listener sees every phase of a turn")
	void listenerSeesPhases() {
		List<String> transitions = new ArrayList<>();
		WorkflowEngine engine = offlineBuilder(new KeywordTurnClassifier())
				.listener((sequence, from, to) -> transitions.add(sequence + ":" + from + "->" + to))
				.build();

		engine.process("Run the simulation", engine.initialState());

		assertThat(transitions).containsExactly(
				"1:AWAITING_TURN->CLASSIFYING",
				"1:CLASSIFYING->DISPATCHING",
				"1:DISPATCHING->COMMITTING",
				"1:COMMITTING->AWAITING_TURN");
	}
}
