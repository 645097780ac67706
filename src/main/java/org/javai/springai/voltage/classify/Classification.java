package org.javai.springai.voltage.classify;

import java.util.List;
import java.util.Objects;

/**
 * A classifier's verdict on one user input.
 *
 * @param label the primary label
 * @param confidence confidence in the label, between 0 and 1
 * @param followUps further labels to run within the same input, in order, for compound requests
 *                  such as "set the step size to 0.05 and run the simulation"
 */
public record Classification(TurnLabel label, double confidence, List<TurnLabel> followUps) {

	public Classification {
		Objects.requireNonNull(label, "label must not be null");
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("confidence must be between 0 and 1");
		}
		followUps = followUps != null ? List.copyOf(followUps) : List.of();
	}

	public static Classification of(TurnLabel label, double confidence) {
		return new Classification(label, confidence, List.of());
	}

	public static Classification unclassifiable() {
		return new Classification(TurnLabel.UNCLASSIFIABLE, 0.0, List.of());
	}

	public boolean isCompound() {
		return !followUps.isEmpty();
	}
}
