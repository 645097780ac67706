package org.javai.springai.voltage.simulation;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.javai.springai.voltage.param.ParameterSet;

/**
 * The outcome of one curve generation run.
 *
 * <p>Owned by the workflow engine once committed; later turns reference it but never change it.
 * The nose of the curve is the point of maximum power; its voltage is the critical voltage.</p>
 *
 * @param parameters the parameter snapshot the curve was generated from
 * @param curve operating points in the order they were computed
 * @param criticalVoltage voltage at the nose point (pu)
 * @param maxPower load at the nose point (MW)
 * @param timestamp when the run completed
 */
public record SimulationResult(
		ParameterSet parameters,
		List<CurvePoint> curve,
		double criticalVoltage,
		double maxPower,
		Instant timestamp
) {

	public SimulationResult {
		Objects.requireNonNull(parameters, "parameters must not be null");
		Objects.requireNonNull(timestamp, "timestamp must not be null");
		curve = curve != null ? List.copyOf(curve) : List.of();
		if (curve.isEmpty()) {
			throw new IllegalArgumentException("curve must contain at least one point");
		}
	}

	/**
	 * Build a result from raw curve points, locating the nose as the maximum-power point.
	 */
	public static SimulationResult fromCurve(ParameterSet parameters, List<CurvePoint> curve, Instant timestamp) {
		if (curve == null || curve.isEmpty()) {
			throw new IllegalArgumentException("curve must contain at least one point");
		}
		CurvePoint nose = curve.get(0);
		for (CurvePoint point : curve) {
			if (point.powerMw() > nose.powerMw()) {
				nose = point;
			}
		}
		return new SimulationResult(parameters, curve, nose.voltagePu(), nose.powerMw(), timestamp);
	}

	/**
	 * Number of operating points that were solved.
	 */
	public int convergedSteps() {
		return curve.size();
	}

	/**
	 * Headroom between the base-case load and the nose, in MW.
	 */
	public double loadMarginMw() {
		return maxPower - curve.get(0).powerMw();
	}

	/**
	 * Voltage drop from the first to the last solved point, as a percentage of the first.
	 */
	public double voltageDropPercent() {
		double initial = curve.get(0).voltagePu();
		double last = curve.get(curve.size() - 1).voltagePu();
		return initial > 0 ? (initial - last) / initial * 100.0 : 0.0;
	}
}
