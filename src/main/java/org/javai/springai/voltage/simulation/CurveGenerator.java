package org.javai.springai.voltage.simulation;

import org.javai.springai.voltage.param.ParameterSet;

/**
 * Computes a power-voltage curve from a full parameter snapshot.
 *
 * <p>Implementations may be long-running; callers invoke them without holding any session lock.</p>
 */
@FunctionalInterface
public interface CurveGenerator {

	/**
	 * Generate a curve.
	 *
	 * @param parameters the snapshot to simulate
	 * @return the computed result
	 * @throws GenerationException if no curve can be produced
	 */
	SimulationResult generate(ParameterSet parameters);
}
