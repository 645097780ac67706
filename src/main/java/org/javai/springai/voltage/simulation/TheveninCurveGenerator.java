package org.javai.springai.voltage.simulation;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.voltage.param.GridParameter;
import org.javai.springai.voltage.param.ParameterSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference curve generator that reduces the selected test grid to a Thevenin equivalent seen
 * from the monitored bus and solves the two-bus load-flow equation in closed form.
 *
 * <p>Load is scaled from 1.0 to {@code max_scale} in increments of {@code step_size}. Reactive
 * load follows the power factor, negative for capacitive loads. For each scale the upper-branch
 * voltage is the larger root of</p>
 * <pre>
 *   V^4 + (2QX - E^2) V^2 + X^2 (P^2 + Q^2) = 0
 * </pre>
 * <p>A negative discriminant means the nose has been passed. With continuation enabled the lower
 * branch is then traced back down until the voltage limit is reached.</p>
 *
 * <p>This is a teaching approximation; it is not a substitute for an AC power-flow solver.</p>
 */
public class TheveninCurveGenerator implements CurveGenerator {

	private static final Logger logger = LoggerFactory.getLogger(TheveninCurveGenerator.class);

	/** System MVA base used to convert MW to per unit. */
	static final double MVA_BASE = 100.0;
	private static final double SOURCE_VOLTAGE = 1.0;

	private static final Map<String, GridModel> GRIDS = Map.of(
			"ieee14", new GridModel(14, 0.15),
			"ieee24", new GridModel(24, 0.18),
			"ieee30", new GridModel(30, 0.20),
			"ieee39", new GridModel(39, 0.20),
			"ieee57", new GridModel(57, 0.22),
			"ieee118", new GridModel(118, 0.16),
			"ieee300", new GridModel(300, 0.25));

	private final Clock clock;

	public TheveninCurveGenerator() {
		this(Clock.systemUTC());
	}

	public TheveninCurveGenerator(Clock clock) {
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	@Override
	public SimulationResult generate(ParameterSet parameters) {
		Objects.requireNonNull(parameters, "parameters must not be null");
		String grid = parameters.stringValue(GridParameter.GRID);
		GridModel model = GRIDS.get(grid);
		if (model == null) {
			throw new GenerationException(GenerationException.Reason.INVALID_CONFIGURATION,
					"Unsupported grid '" + grid + "'");
		}
		int bus = parameters.intValue(GridParameter.MONITORED_BUS);
		if (bus >= model.busCount()) {
			throw new GenerationException(GenerationException.Reason.INVALID_CONFIGURATION,
					"Bus " + bus + " does not exist in " + grid + " (buses 0-" + (model.busCount() - 1) + ")");
		}
		double basePower = parameters.doubleValue(GridParameter.BASE_POWER);
		if (basePower <= 0.0) {
			throw new GenerationException(GenerationException.Reason.INVALID_CONFIGURATION,
					"Base power must be positive to scale the load");
		}

		double reactance = model.reactance() * (1.0 + bus / (2.0 * model.busCount()));
		double stepSize = parameters.doubleValue(GridParameter.STEP_SIZE);
		double maxScale = parameters.doubleValue(GridParameter.MAX_SCALE);
		double voltageLimit = parameters.doubleValue(GridParameter.VOLTAGE_LIMIT);
		double reactiveRatio = Math.tan(Math.acos(parameters.doubleValue(GridParameter.POWER_FACTOR)));
		if ("capacitive".equals(parameters.stringValue(GridParameter.LOAD_TYPE))) {
			reactiveRatio = -reactiveRatio;
		}

		List<CurvePoint> curve = new ArrayList<>();
		double lastScale = 1.0;
		boolean collapsed = false;
		int steps = (int) Math.floor((maxScale - 1.0) / stepSize + 1e-9);
		for (int i = 0; i <= steps; i++) {
			double scale = 1.0 + i * stepSize;
			double p = basePower * scale / MVA_BASE;
			double[] roots = solve(p, p * reactiveRatio, reactance);
			if (roots == null) {
				collapsed = true;
				break;
			}
			curve.add(new CurvePoint(basePower * scale, roots[0]));
			lastScale = scale;
			if (roots[0] < voltageLimit) {
				break;
			}
		}

		if (curve.isEmpty()) {
			throw new GenerationException(GenerationException.Reason.NON_CONVERGENCE,
					"No operating point converged at the base-case load of "
							+ basePower + " MW; the system is beyond its loadability limit");
		}

		if (collapsed && parameters.booleanValue(GridParameter.CONTINUATION)) {
			traceLowerBranch(curve, basePower, lastScale, stepSize, reactiveRatio, reactance, voltageLimit);
		}

		logger.debug("Generated {} curve points for {} bus {} (collapsed={})", curve.size(), grid, bus, collapsed);
		return SimulationResult.fromCurve(parameters, curve, clock.instant());
	}

	private void traceLowerBranch(List<CurvePoint> curve, double basePower, double fromScale, double stepSize,
			double reactiveRatio, double reactance, double voltageLimit) {
		for (double scale = fromScale; scale >= 1.0 - 1e-9; scale -= stepSize) {
			double p = basePower * scale / MVA_BASE;
			double[] roots = solve(p, p * reactiveRatio, reactance);
			if (roots == null || roots[1] < voltageLimit) {
				return;
			}
			curve.add(new CurvePoint(basePower * scale, roots[1]));
		}
	}

	/**
	 * Solve the two-bus voltage equation.
	 *
	 * @return {upper, lower} voltage magnitudes, or null when no real solution exists
	 */
	static double[] solve(double p, double q, double x) {
		double e2 = SOURCE_VOLTAGE * SOURCE_VOLTAGE;
		double b = e2 - 2.0 * q * x;
		double discriminant = b * b - 4.0 * x * x * (p * p + q * q);
		if (discriminant < 0.0 || b <= 0.0) {
			return null;
		}
		double root = Math.sqrt(discriminant);
		double upper = Math.sqrt((b + root) / 2.0);
		double lower = Math.sqrt(Math.max(0.0, (b - root) / 2.0));
		return new double[] { upper, lower };
	}

	private record GridModel(int busCount, double reactance) {
	}
}
