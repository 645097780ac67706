package org.javai.springai.voltage.workflow;

/**
 * Observer of engine phase changes, e.g. for progress display or tests.
 */
@FunctionalInterface
public interface WorkflowListener {

	WorkflowListener NONE = (sequence, from, to) -> { };

	/**
	 * @param turnSequence the sequence number of the turn being processed
	 * @param from the phase being left
	 * @param to the phase being entered
	 */
	void onTransition(int turnSequence, WorkflowState from, WorkflowState to);
}
