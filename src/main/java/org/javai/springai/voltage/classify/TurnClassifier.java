package org.javai.springai.voltage.classify;

import java.util.List;
import org.javai.springai.voltage.history.Turn;

/**
 * Assigns a {@link TurnLabel} to a raw user input.
 */
@FunctionalInterface
public interface TurnClassifier {

	/**
	 * @param text the raw user input
	 * @param recentTurns the last few turns, oldest first, for resolving references
	 * @return the classification; {@link TurnLabel#UNCLASSIFIABLE} when nothing fits
	 * @throws ClassificationException if the classifier cannot be reached or fails
	 */
	Classification classify(String text, List<Turn> recentTurns);
}
