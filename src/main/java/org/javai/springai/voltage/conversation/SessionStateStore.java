package org.javai.springai.voltage.conversation;

import java.util.Optional;
import org.javai.springai.voltage.workflow.SessionState;

/**
 * Persistence contract for session state, keyed by session id.
 */
public interface SessionStateStore {

	Optional<SessionState> load(String sessionId);

	/**
	 * Store {@code updated} only if the session still holds {@code expected}.
	 *
	 * @param expected the state the update was computed from, or null if the session was new
	 * @return whether the update was stored
	 */
	boolean replace(String sessionId, SessionState expected, SessionState updated);

	void remove(String sessionId);
}
