package org.javai.springai.voltage.conversation;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.javai.springai.voltage.workflow.SessionState;
import org.javai.springai.voltage.workflow.TurnResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interactive line-based session: shows the current parameters, processes each line and exports
 * the transcript when the user quits.
 */
public class ConsoleSession {

	private static final Logger logger = LoggerFactory.getLogger(ConsoleSession.class);

	static final Set<String> QUIT_COMMANDS = Set.of("quit", "q", "exit");
	private static final String DIVIDER = "-".repeat(60);
	private static final DateTimeFormatter FILE_STAMP =
			DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

	private final ConversationManager manager;
	private final TranscriptWriter transcriptWriter;
	private final Path transcriptDirectory;
	private final Clock clock;
	private final String sessionName;

	/**
	 * @param transcriptDirectory where to export on quit, or null to skip the export
	 */
	public ConsoleSession(ConversationManager manager, TranscriptWriter transcriptWriter, Path transcriptDirectory,
			Clock clock, String sessionName) {
		this.manager = Objects.requireNonNull(manager, "manager must not be null");
		this.transcriptWriter = Objects.requireNonNull(transcriptWriter, "transcriptWriter must not be null");
		this.transcriptDirectory = transcriptDirectory;
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.sessionName = Objects.requireNonNull(sessionName, "sessionName must not be null");
	}

	/**
	 * Run until the user quits or the input ends.
	 *
	 * @return the final session state
	 */
	public SessionState run(BufferedReader in, PrintWriter out) throws IOException {
		Instant createdAt = clock.instant();
		SessionState state = manager.initialState();
		out.println("Welcome to the voltage stability assistant. Type 'quit' or 'q' to exit.");

		while (true) {
			out.println(DIVIDER);
			out.println("Current parameters: " + state.parameters().describe());
			out.println(DIVIDER);
			out.print("Message: ");
			out.flush();

			String line = in.readLine();
			if (line == null) {
				break;
			}
			String text = line.trim();
			if (text.isEmpty()) {
				continue;
			}
			if (QUIT_COMMANDS.contains(text.toLowerCase(Locale.ROOT))) {
				out.println("Quitting...");
				break;
			}
			TurnResult result = manager.process(text, state);
			state = result.state();
			out.println(result.responseText());
		}

		export(state, createdAt, out);
		out.flush();
		return state;
	}

	private void export(SessionState state, Instant createdAt, PrintWriter out) {
		if (transcriptDirectory == null || state.log().isEmpty()) {
			return;
		}
		Path file = transcriptDirectory.resolve(sessionName + "-" + FILE_STAMP.format(createdAt) + ".json");
		try {
			transcriptWriter.write(file, sessionName, createdAt, state);
			out.println("Session saved to " + file + " (" + state.log().size() + " turns)");
		}
		catch (IOException ex) {
			logger.warn("Failed to export transcript to {}", file, ex);
			out.println("Could not save the session transcript: " + ex.getMessage());
		}
	}
}
