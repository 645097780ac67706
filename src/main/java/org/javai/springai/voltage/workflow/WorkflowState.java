package org.javai.springai.voltage.workflow;

/**
 * Phases of a turn inside {@link WorkflowEngine}.
 */
public enum WorkflowState {
	AWAITING_TURN,
	CLASSIFYING,
	DISPATCHING,
	COMMITTING
}
