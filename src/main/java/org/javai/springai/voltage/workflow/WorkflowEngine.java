package org.javai.springai.voltage.workflow;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.voltage.classify.Classification;
import org.javai.springai.voltage.classify.TurnClassifier;
import org.javai.springai.voltage.classify.TurnLabel;
import org.javai.springai.voltage.history.HistoryContext;
import org.javai.springai.voltage.history.HistoryView;
import org.javai.springai.voltage.history.InteractionLog;
import org.javai.springai.voltage.history.Turn;
import org.javai.springai.voltage.history.TurnOutcome;
import org.javai.springai.voltage.param.ParameterException;
import org.javai.springai.voltage.param.ParameterSet;
import org.javai.springai.voltage.param.ParameterStore;
import org.javai.springai.voltage.respond.Responder;
import org.javai.springai.voltage.respond.ResponderOutcome;
import org.javai.springai.voltage.respond.ResponderRequest;
import org.javai.springai.voltage.simulation.SimulationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes each user input through classification, dispatch and commit.
 *
 * <p>The engine holds no session data. Each call to {@link #process(String, SessionState)} takes
 * the prior state and returns a new one, so one engine can serve many sessions concurrently; calls
 * for the same session must be made one after another.</p>
 *
 * <h2>Turn lifecycle</h2>
 * <ol>
 *   <li>CLASSIFYING: the classifier labels the input. Unclassifiable or low-confidence results
 *   fall back to a question.</li>
 *   <li>DISPATCHING: the responder for the label runs, followed by any follow-up labels the
 *   classifier or a responder asked for. Follow-ups see parameters staged earlier in the same
 *   input.</li>
 *   <li>COMMITTING: staged parameters, any new simulation result and exactly one turn are
 *   committed together.</li>
 * </ol>
 *
 * <p>Failures of the classifier or of a responder, and chains longer than
 * {@link WorkflowConfig#maxChainedInvocations()}, are recorded as a FAILED turn that changes
 * nothing else. A responder that reports a failed outcome, such as a curve that did not converge,
 * also ends the turn as FAILED, but parameters staged before it are still committed. A parameter
 * batch that fails validation is recorded as a REJECTED turn. Only {@link StateIntegrityException}
 * escapes.</p>
 *
 * <pre>{@code
 * WorkflowEngine engine = WorkflowEngine.builder()
 *         .classifier(new KeywordTurnClassifier())
 *         .responder(new QuestionResponder(retriever, null))
 *         .responder(new ParameterResponder(new PatternParameterExtractor(), new HistoryContext()))
 *         .responder(new GenerationResponder(new TheveninCurveGenerator()))
 *         .responder(new AnalysisResponder())
 *         .build();
 *
 * TurnResult result = engine.process("Set the base power to 150", engine.initialState());
 * }</pre>
 */
public class WorkflowEngine {

	private static final Logger logger = LoggerFactory.getLogger(WorkflowEngine.class);

	private final TurnClassifier classifier;
	private final Map<TurnLabel, Responder> responders;
	private final HistoryContext historyContext;
	private final WorkflowConfig config;
	private final Clock clock;
	private final StateFingerprinter fingerprinter;
	private final WorkflowListener listener;

	private WorkflowEngine(Builder builder) {
		this.classifier = Objects.requireNonNull(builder.classifier, "classifier must not be null");
		this.responders = new EnumMap<>(builder.responders);
		this.historyContext = builder.historyContext != null ? builder.historyContext : new HistoryContext();
		this.config = builder.config != null ? builder.config : WorkflowConfig.defaults();
		this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
		this.fingerprinter = builder.fingerprinter != null ? builder.fingerprinter : new StateFingerprinter();
		this.listener = builder.listener != null ? builder.listener : WorkflowListener.NONE;
		if (!responders.containsKey(TurnLabel.QUESTION)) {
			throw new IllegalStateException("A question responder is required as the fallback route");
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * The state to pass with the first input of a session.
	 */
	public SessionState initialState() {
		return SessionState.initial();
	}

	public HistoryContext historyContext() {
		return historyContext;
	}

	/**
	 * Process one raw input.
	 *
	 * @param rawText the user's input
	 * @param priorState a state returned by this engine, or {@link SessionState#initial()}
	 * @return the new state, the reply and the appended turn
	 * @throws StateIntegrityException if the prior state was not issued by this engine
	 */
	public TurnResult process(String rawText, SessionState priorState) {
		Objects.requireNonNull(rawText, "rawText must not be null");
		Objects.requireNonNull(priorState, "priorState must not be null");
		verify(priorState);

		int sequence = priorState.log().nextSequence();
		transition(sequence, WorkflowState.AWAITING_TURN, WorkflowState.CLASSIFYING);

		Classification classification;
		try {
			classification = classifier.classify(rawText, historyContext.classificationContext(priorState.log()));
			Objects.requireNonNull(classification, "classifier returned null");
		}
		catch (RuntimeException ex) {
			logger.warn("Classification failed for turn {}", sequence, ex);
			return commitFailure(priorState, rawText, TurnLabel.UNCLASSIFIABLE, WorkflowState.CLASSIFYING,
					"Sorry, I could not interpret that message (" + ex.getMessage() + "). Nothing was changed.");
		}

		List<TurnLabel> route = route(sequence, classification);
		transition(sequence, WorkflowState.CLASSIFYING, WorkflowState.DISPATCHING);

		TurnLabel kind = route.get(0);
		Dispatch dispatch;
		try {
			dispatch = dispatch(rawText, priorState, route);
		}
		catch (RecursionLimitExceededException ex) {
			logger.warn("Turn {} exceeded the chaining limit of {}", sequence, ex.limit(), ex);
			return commitFailure(priorState, rawText, kind, WorkflowState.DISPATCHING,
					"That request needed more than " + ex.limit() + " steps, so it was stopped. Nothing was changed.");
		}
		catch (RuntimeException ex) {
			logger.warn("Responder failed for turn {} ({})", sequence, kind.wireName(), ex);
			return commitFailure(priorState, rawText, kind, WorkflowState.DISPATCHING,
					"Sorry, something went wrong while handling your request: " + ex.getMessage()
							+ ". Nothing was changed.");
		}

		transition(sequence, WorkflowState.DISPATCHING, WorkflowState.COMMITTING);
		return commit(priorState, rawText, kind, dispatch.outcome(), String.join("\n\n", dispatch.texts()),
				dispatch.parameters(), dispatch.result());
	}

	/**
	 * Resolve the labels to run, fallback and follow-ups included.
	 */
	private List<TurnLabel> route(int sequence, Classification classification) {
		TurnLabel label = classification.label();
		if (!label.isDispatchable() || !responders.containsKey(label)
				|| classification.confidence() < config.minimumConfidence()) {
			logger.info("Turn {} falls back to {} (classified {} with confidence {})",
					sequence, TurnLabel.QUESTION.wireName(), label.wireName(), classification.confidence());
			return List.of(TurnLabel.QUESTION);
		}
		List<TurnLabel> route = new ArrayList<>();
		route.add(label);
		for (TurnLabel followUp : classification.followUps()) {
			if (followUp.isDispatchable() && responders.containsKey(followUp)) {
				route.add(followUp);
			}
		}
		logger.debug("Turn {} routed to {}", sequence, route);
		return route;
	}

	private Dispatch dispatch(String rawText, SessionState priorState, List<TurnLabel> route) {
		HistoryView view = historyContext.view(priorState.log(), priorState.parameters());
		ParameterStore staged = new ParameterStore(priorState.parameters());
		SimulationResult latest = priorState.latestResult();
		SimulationResult produced = null;
		List<String> texts = new ArrayList<>();

		Deque<TurnLabel> pending = new ArrayDeque<>(route);
		int invocations = 0;
		while (!pending.isEmpty()) {
			TurnLabel label = pending.poll();
			if (++invocations > config.maxChainedInvocations()) {
				throw new RecursionLimitExceededException(config.maxChainedInvocations());
			}
			Responder responder = responders.get(label);
			ResponderOutcome outcome = responder.respond(
					new ResponderRequest(rawText, staged.getAll(), view, latest, produced != null));
			Objects.requireNonNull(outcome, "responder for " + label.wireName() + " returned null");

			if (outcome.hasParameterDeltas()) {
				try {
					staged.apply(outcome.parameterDeltas());
				}
				catch (ParameterException ex) {
					logger.info("Parameter batch rejected: {}", ex.getMessage());
					texts.add("Could not update parameters: " + ex.getMessage() + ". No parameters were changed.");
					return new Dispatch(TurnOutcome.REJECTED, texts, priorState.parameters(), null);
				}
			}
			texts.add(outcome.responseText());
			if (outcome.simulationResult() != null) {
				produced = outcome.simulationResult();
				latest = produced;
			}
			if (outcome.failed()) {
				return new Dispatch(TurnOutcome.FAILED, texts, staged.getAll(), produced);
			}
			if (outcome.followUp() != null && responders.containsKey(outcome.followUp())) {
				pending.addFirst(outcome.followUp());
			}
		}
		return new Dispatch(TurnOutcome.COMPLETED, texts, staged.getAll(), produced);
	}

	private TurnResult commitFailure(SessionState priorState, String rawText, TurnLabel kind, WorkflowState from,
			String text) {
		transition(priorState.log().nextSequence(), from, WorkflowState.COMMITTING);
		return commit(priorState, rawText, kind, TurnOutcome.FAILED, text, priorState.parameters(), null);
	}

	private TurnResult commit(SessionState priorState, String rawText, TurnLabel kind, TurnOutcome outcome,
			String text, ParameterSet parameters, SimulationResult result) {
		int sequence = priorState.log().nextSequence();
		Turn turn = new Turn(sequence, rawText, text, clock.instant(), kind, outcome, result,
				ParameterStore.diff(priorState.parameters(), parameters));
		InteractionLog log = priorState.log().append(turn);
		String summary = historyContext.summarize(
				historyContext.conversationWindow(log), historyContext.simulationWindow(log));
		SimulationResult latest = result != null ? result : priorState.latestResult();
		SessionState next = fingerprinter.sign(new SessionState(parameters, log, latest, summary, null));
		transition(sequence, WorkflowState.COMMITTING, WorkflowState.AWAITING_TURN);
		return new TurnResult(next, text, turn);
	}

	private void verify(SessionState state) {
		if (!state.isSigned()) {
			if (!state.equals(SessionState.initial())) {
				throw new StateIntegrityException("Unsigned session state must be the initial state");
			}
			return;
		}
		if (!fingerprinter.verify(state)) {
			throw new StateIntegrityException("Session state was not issued by this engine or has been altered");
		}
	}

	private void transition(int sequence, WorkflowState from, WorkflowState to) {
		logger.debug("Turn {}: {} -> {}", sequence, from, to);
		try {
			listener.onTransition(sequence, from, to);
		}
		catch (RuntimeException ex) {
			logger.warn("Workflow listener threw an exception", ex);
		}
	}

	private record Dispatch(TurnOutcome outcome, List<String> texts, ParameterSet parameters, SimulationResult result) {
	}

	/**
	 * Builder for {@link WorkflowEngine}.
	 */
	public static class Builder {
		private TurnClassifier classifier;
		private final Map<TurnLabel, Responder> responders = new EnumMap<>(TurnLabel.class);
		private HistoryContext historyContext;
		private WorkflowConfig config;
		private Clock clock;
		private StateFingerprinter fingerprinter;
		private WorkflowListener listener;

		private Builder() {}

		public Builder classifier(TurnClassifier classifier) {
			this.classifier = classifier;
			return this;
		}

		/**
		 * Register a responder under its {@link Responder#label()}, replacing any earlier one.
		 */
		public Builder responder(Responder responder) {
			Objects.requireNonNull(responder, "responder must not be null");
			if (!responder.label().isDispatchable()) {
				throw new IllegalArgumentException("Responders cannot be registered for " + responder.label());
			}
			this.responders.put(responder.label(), responder);
			return this;
		}

		public Builder historyContext(HistoryContext historyContext) {
			this.historyContext = historyContext;
			return this;
		}

		public Builder config(WorkflowConfig config) {
			this.config = config;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder fingerprinter(StateFingerprinter fingerprinter) {
			this.fingerprinter = fingerprinter;
			return this;
		}

		public Builder listener(WorkflowListener listener) {
			this.listener = listener;
			return this;
		}

		public WorkflowEngine build() {
			return new WorkflowEngine(this);
		}
	}
}
