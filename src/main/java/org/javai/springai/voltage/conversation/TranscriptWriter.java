package org.javai.springai.voltage.conversation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.javai.springai.voltage.history.HistoryContext;
import org.javai.springai.voltage.history.Turn;
import org.javai.springai.voltage.history.TurnOutcome;
import org.javai.springai.voltage.simulation.SimulationResult;
import org.javai.springai.voltage.workflow.SessionState;

/**
 * Exports a session as pretty-printed JSON with ISO-8601 timestamps.
 */
public class TranscriptWriter {

	private final ObjectMapper mapper;
	private final HistoryContext historyContext;
	private final Clock clock;

	public TranscriptWriter() {
		this(new HistoryContext(), Clock.systemUTC());
	}

	public TranscriptWriter(HistoryContext historyContext, Clock clock) {
		this.historyContext = Objects.requireNonNull(historyContext, "historyContext must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
				.enable(SerializationFeature.INDENT_OUTPUT);
	}

	/**
	 * Build the transcript of a session. Simulation summaries are limited to the simulation window.
	 */
	public Transcript transcript(String sessionName, Instant createdAt, SessionState state) {
		List<Turn> turns = state.log().turns();
		List<Transcript.Entry> entries = turns.stream().map(TranscriptWriter::toEntry).toList();
		List<Transcript.ResultSummary> results = historyContext.simulationWindow(state.log()).stream()
				.map(TranscriptWriter::summarize)
				.toList();
		return new Transcript(sessionName, createdAt, clock.instant(), state.parameters().asMap(),
				entries, results, statistics(turns));
	}

	public String toJson(Transcript transcript) {
		try {
			return mapper.writeValueAsString(transcript);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize transcript", e);
		}
	}

	/**
	 * Write a session transcript, creating parent directories as needed.
	 */
	public Path write(Path file, String sessionName, Instant createdAt, SessionState state) throws IOException {
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(file, toJson(transcript(sessionName, createdAt, state)), StandardCharsets.UTF_8);
		return file;
	}

	private static Transcript.Entry toEntry(Turn turn) {
		return new Transcript.Entry(
				turn.sequence(),
				turn.timestamp(),
				turn.kind().wireName(),
				turn.outcome().name().toLowerCase(Locale.ROOT),
				turn.userText(),
				turn.responseText(),
				turn.parameterChanges().stream()
						.map(change -> new Transcript.Change(change.name(), change.oldValue(), change.newValue()))
						.toList(),
				turn.hasSimulationResult() ? summarize(turn.simulationResult()) : null);
	}

	private static Transcript.ResultSummary summarize(SimulationResult result) {
		return new Transcript.ResultSummary(
				result.timestamp(),
				result.parameters().asMap(),
				result.maxPower(),
				result.criticalVoltage(),
				result.loadMarginMw(),
				result.voltageDropPercent(),
				result.convergedSteps());
	}

	private static Transcript.Statistics statistics(List<Turn> turns) {
		int completed = 0;
		int rejected = 0;
		int failed = 0;
		int simulations = 0;
		int changes = 0;
		for (Turn turn : turns) {
			if (turn.outcome() == TurnOutcome.COMPLETED) {
				completed++;
			}
			else if (turn.outcome() == TurnOutcome.REJECTED) {
				rejected++;
			}
			else {
				failed++;
			}
			if (turn.hasSimulationResult()) {
				simulations++;
			}
			changes += turn.parameterChanges().size();
		}
		return new Transcript.Statistics(turns.size(), completed, rejected, failed, simulations, changes);
	}
}
