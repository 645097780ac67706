package org.javai.springai.voltage.simulation;

/**
 * One operating point on a power-voltage curve.
 *
 * @param powerMw total active load in MW
 * @param voltagePu voltage magnitude at the monitored bus in per unit
 */
public record CurvePoint(double powerMw, double voltagePu) {
}
