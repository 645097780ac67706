package org.javai.springai.voltage.conversation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.javai.springai.voltage.VoltageAgents;
import org.javai.springai.voltage.config.AgentConfig;
import org.javai.springai.voltage.retrieve.KeywordKnowledgeRetriever;
import org.javai.springai.voltage.workflow.SessionState;
import org.javai.springai.voltage.workflow.TurnResult;
import org.javai.springai.voltage.workflow.WorkflowEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class ConversationManagerTest {

	private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

	@Mock
	private SessionStateStore mockStore;

	private WorkflowEngine engine;

	@BeforeEach
	void setUp() {
		MockitoAnnotations.openMocks(this);
		engine = VoltageAgents.offline(AgentConfig.defaults(), KeywordKnowledgeRetriever.fromClasspath(3), CLOCK);
	}

	@Test
	void constructorRequiresDependencies() {
		assertThatThrownBy(() -> new ConversationManager(null)).isInstanceOf(NullPointerException.class);
		assertThatThrownBy(() -> new ConversationManager(engine, null)).isInstanceOf(NullPointerException.class);
	}

	@Test
	void stateThreadedMode() {
		ConversationManager manager = new ConversationManager(engine);

		TurnResult first = manager.process("Set the base power to 150", null);
		TurnResult second = manager.process("Run the simulation", first.state());

		assertThat(second.state().log().size()).isEqualTo(2);
		assertThat(second.turn().simulationResult().parameters().get("base_power")).isEqualTo(150.0);
	}

	@Test
	void storeModeKeepsSessionsApart() {
		InMemorySessionStateStore store = new InMemorySessionStateStore();
		ConversationManager manager = new ConversationManager(engine, store);

		manager.converse("Set the base power to 150", "alice");
		manager.converse("Set the step size to 0.05", "bob");
		TurnResult aliceAgain = manager.converse("Run the simulation", "alice");

		assertThat(store.size()).isEqualTo(2);
		assertThat(aliceAgain.state().log().size()).isEqualTo(2);
		assertThat(manager.sessionState("bob")).get()
				.satisfies(state -> assertThat(state.parameters().get("step_size")).isEqualTo(0.05));
		assertThat(manager.sessionState("alice")).contains(aliceAgain.state());
	}

	@Test
	void expiredSessionStartsOver() {
		ConversationManager manager = new ConversationManager(engine, new InMemorySessionStateStore());
		manager.converse("Set the base power to 150", "s1");

		manager.expire("s1");
		TurnResult fresh = manager.converse("What is the current base power?", "s1");

		assertThat(fresh.turn().sequence()).isEqualTo(1);
		assertThat(fresh.responseText()).contains("100");
	}

	@Test
	void lostRaceIsReported() {
		when(mockStore.load("s1")).thenReturn(Optional.empty());
		when(mockStore.replace(eq("s1"), isNull(), any(SessionState.class))).thenReturn(false);
		ConversationManager manager = new ConversationManager(engine, mockStore);

		assertThatThrownBy(() -> manager.converse("Run the simulation", "s1"))
				.isInstanceOf(ConcurrentTurnException.class)
				.satisfies(ex -> assertThat(((ConcurrentTurnException) ex).sessionId()).isEqualTo("s1"));
	}

	@Test
	void storeOperationsNeedAStore() {
		ConversationManager manager = new ConversationManager(engine);

		assertThatThrownBy(() -> manager.converse("hi", "s1"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("requires a SessionStateStore");
		assertThatThrownBy(() -> manager.expire("s1")).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void inMemoryStoreComparesAndSets() {
		InMemorySessionStateStore store = new InMemorySessionStateStore();
		SessionState first = engine.process("Set the base power to 150", engine.initialState()).state();
		SessionState second = engine.process("Run the simulation", first).state();

		assertThat(store.replace("s1", null, first)).isTrue();
		assertThat(store.replace("s1", null, second)).isFalse();
		assertThat(store.replace("s1", engine.initialState(), second)).isFalse();
		assertThat(store.replace("s1", first, second)).isTrue();
		assertThat(store.load("s1")).contains(second);
	}
}
