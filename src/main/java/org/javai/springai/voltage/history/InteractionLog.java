package org.javai.springai.voltage.history;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only, immutable sequence of turns.
 *
 * <p>{@link #append(Turn)} returns a new log; the receiver is never modified. Sequence numbers
 * are contiguous from 1, which lets the engine detect logs it did not produce.</p>
 *
 * <p>The log itself is unbounded. Responders only ever see it through the bounded views of
 * {@link HistoryContext}.</p>
 *
 * @param turns the turns in the order they were committed
 */
public record InteractionLog(List<Turn> turns) {

	private static final InteractionLog EMPTY = new InteractionLog(List.of());

	public InteractionLog {
		turns = turns != null ? List.copyOf(turns) : List.of();
		for (int i = 0; i < turns.size(); i++) {
			if (turns.get(i).sequence() != i + 1) {
				throw new IllegalArgumentException("turn at position " + i + " has sequence "
						+ turns.get(i).sequence() + ", expected " + (i + 1));
			}
		}
	}

	public static InteractionLog empty() {
		return EMPTY;
	}

	/**
	 * Creates a copy with one more turn.
	 *
	 * @throws IllegalArgumentException if the turn's sequence is not {@link #nextSequence()}
	 */
	public InteractionLog append(Turn turn) {
		Objects.requireNonNull(turn, "turn must not be null");
		List<Turn> updated = new ArrayList<>(turns.size() + 1);
		updated.addAll(turns);
		updated.add(turn);
		return new InteractionLog(updated);
	}

	public int size() {
		return turns.size();
	}

	public boolean isEmpty() {
		return turns.isEmpty();
	}

	public int nextSequence() {
		return turns.size() + 1;
	}

	public Optional<Turn> lastTurn() {
		return turns.isEmpty() ? Optional.empty() : Optional.of(turns.get(turns.size() - 1));
	}
}
