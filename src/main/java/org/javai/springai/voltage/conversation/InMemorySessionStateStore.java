package org.javai.springai.voltage.conversation;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.javai.springai.voltage.workflow.SessionState;

/**
 * Process-local store; state does not survive a restart.
 */
public class InMemorySessionStateStore implements SessionStateStore {

	private final ConcurrentMap<String, SessionState> sessions = new ConcurrentHashMap<>();

	@Override
	public Optional<SessionState> load(String sessionId) {
		Objects.requireNonNull(sessionId, "sessionId must not be null");
		return Optional.ofNullable(sessions.get(sessionId));
	}

	@Override
	public boolean replace(String sessionId, SessionState expected, SessionState updated) {
		Objects.requireNonNull(sessionId, "sessionId must not be null");
		Objects.requireNonNull(updated, "updated must not be null");
		if (expected == null) {
			return sessions.putIfAbsent(sessionId, updated) == null;
		}
		return sessions.replace(sessionId, expected, updated);
	}

	@Override
	public void remove(String sessionId) {
		sessions.remove(sessionId);
	}

	public int size() {
		return sessions.size();
	}
}
