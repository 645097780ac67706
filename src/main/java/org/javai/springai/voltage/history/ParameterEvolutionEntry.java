package org.javai.springai.voltage.history;

import java.time.Instant;

/**
 * One step in the history of a single parameter.
 *
 * @param timestamp when the change was committed
 * @param oldValue value before the change
 * @param newValue value after the change
 * @param turnSequence the turn that made the change
 */
public record ParameterEvolutionEntry(Instant timestamp, Object oldValue, Object newValue, int turnSequence) {
}
