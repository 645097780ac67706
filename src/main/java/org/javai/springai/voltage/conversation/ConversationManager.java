package org.javai.springai.voltage.conversation;

import java.util.Objects;
import java.util.Optional;
import org.javai.springai.voltage.workflow.SessionState;
import org.javai.springai.voltage.workflow.TurnResult;
import org.javai.springai.voltage.workflow.WorkflowEngine;

/**
 * Caller-facing entry point for conversations.
 *
 * <h2>Two Usage Modes</h2>
 *
 * <h3>1. State-threaded</h3>
 * <p>The caller keeps the state and hands it back on the next turn:</p>
 * <pre>{@code
 * ConversationManager manager = new ConversationManager(engine);
 * TurnResult result = manager.process(userMessage, priorState);
 * SessionState next = result.state();
 * }</pre>
 *
 * <h3>2. Store-based</h3>
 * <p>State is kept in a {@link SessionStateStore} keyed by session id:</p>
 * <pre>{@code
 * ConversationManager manager = new ConversationManager(engine, new InMemorySessionStateStore());
 * TurnResult result = manager.converse(userMessage, sessionId);
 * }</pre>
 */
public class ConversationManager {

	private final WorkflowEngine engine;
	private final SessionStateStore stateStore;

	/**
	 * Creates a manager for state-threaded use.
	 */
	public ConversationManager(WorkflowEngine engine) {
		this.engine = Objects.requireNonNull(engine, "engine must not be null");
		this.stateStore = null;
	}

	/**
	 * Creates a manager that keeps state in a store.
	 */
	public ConversationManager(WorkflowEngine engine, SessionStateStore stateStore) {
		this.engine = Objects.requireNonNull(engine, "engine must not be null");
		this.stateStore = Objects.requireNonNull(stateStore, "stateStore must not be null");
	}

	public SessionState initialState() {
		return engine.initialState();
	}

	/**
	 * Process a turn against a caller-held state.
	 */
	public TurnResult process(String userMessage, SessionState priorState) {
		Objects.requireNonNull(userMessage, "userMessage must not be null");
		return engine.process(userMessage, priorState != null ? priorState : engine.initialState());
	}

	/**
	 * Start or continue the conversation stored under a session id.
	 *
	 * @throws IllegalStateException if this manager has no store
	 * @throws ConcurrentTurnException if another turn for the session committed first
	 */
	public TurnResult converse(String userMessage, String sessionId) {
		Objects.requireNonNull(userMessage, "userMessage must not be null");
		Objects.requireNonNull(sessionId, "sessionId must not be null");
		SessionStateStore store = requireStore("converse");

		Optional<SessionState> prior = store.load(sessionId);
		TurnResult result = engine.process(userMessage, prior.orElse(engine.initialState()));
		if (!store.replace(sessionId, prior.orElse(null), result.state())) {
			throw new ConcurrentTurnException(sessionId);
		}
		return result;
	}

	/**
	 * The stored state of a session, if any.
	 */
	public Optional<SessionState> sessionState(String sessionId) {
		return requireStore("sessionState").load(sessionId);
	}

	/**
	 * Forget a session; its next turn starts from the initial state.
	 */
	public void expire(String sessionId) {
		requireStore("expire").remove(sessionId);
	}

	private SessionStateStore requireStore(String operation) {
		if (stateStore == null) {
			throw new IllegalStateException(operation + " requires a SessionStateStore. "
					+ "Use process(userMessage, priorState) for state-threaded mode.");
		}
		return stateStore;
	}
}
