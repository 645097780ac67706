package org.javai.springai.voltage.simulation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.javai.springai.voltage.param.ParameterSet;
import org.javai.springai.voltage.param.ParameterStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TheveninCurveGenerator")
class TheveninCurveGeneratorTest {

	private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

	private final TheveninCurveGenerator generator = new TheveninCurveGenerator(Clock.fixed(NOW, ZoneOffset.UTC));

	@Test
	@DisplayName("the default configuration produces a curve with a nose above the voltage limit")
	void defaultCurveHasNose() {
		SimulationResult result = generator.generate(ParameterSet.DEFAULT);

		assertThat(result.timestamp()).isEqualTo(NOW);
		assertThat(result.parameters()).isEqualTo(ParameterSet.DEFAULT);
		assertThat(result.curve().get(0).powerMw()).isEqualTo(100.0);
		assertThat(result.maxPower()).isBetween(160.0, 180.0);
		assertThat(result.criticalVoltage()).isBetween(0.55, 0.7);
		assertThat(result.curve()).allSatisfy(point -> assertThat(point.powerMw()).isLessThanOrEqualTo(result.maxPower()));
		assertThat(result.loadMarginMw()).isEqualTo(result.maxPower() - 100.0);
	}

	@Test
	@DisplayName("continuation traces the lower branch past the nose")
	void continuationTracesLowerBranch() {
		SimulationResult withContinuation = generator.generate(ParameterSet.DEFAULT);
		SimulationResult upperOnly = generator.generate(set(Map.of("continuation", false)));

		assertThat(withContinuation.convergedSteps()).isGreaterThan(upperOnly.convergedSteps());
		CurvePoint last = withContinuation.curve().get(withContinuation.curve().size() - 1);
		assertThat(last.voltagePu()).isLessThan(withContinuation.criticalVoltage());
		assertThat(upperOnly.maxPower()).isEqualTo(withContinuation.maxPower());
	}

	@Test
	@DisplayName("a larger base power shifts the load axis")
	void basePowerScalesLoad() {
		SimulationResult result = generator.generate(set(Map.of("base_power", 150)));

		assertThat(result.curve().get(0).powerMw()).isEqualTo(150.0);
		assertThat(result.criticalVoltage()).isGreaterThan(0.4);
	}

	@Test
	@DisplayName("a base case beyond the loadability limit does not converge")
	void overloadedBaseCaseFails() {
		ParameterSet overloaded = set(Map.of("base_power", 500));

		assertThatThrownBy(() -> generator.generate(overloaded))
				.isInstanceOf(GenerationException.class)
				.satisfies(ex -> assertThat(((GenerationException) ex).reason())
						.isEqualTo(GenerationException.Reason.NON_CONVERGENCE));
	}

	@Test
	@DisplayName("a bus outside the selected grid is an invalid configuration")
	void busOutsideGrid() {
		ParameterSet parameters = set(Map.of("grid", "ieee14", "monitored_bus", 20));

		assertThatThrownBy(() -> generator.generate(parameters))
				.isInstanceOf(GenerationException.class)
				.hasMessageContaining("Bus 20 does not exist in ieee14")
				.satisfies(ex -> assertThat(((GenerationException) ex).reason())
						.isEqualTo(GenerationException.Reason.INVALID_CONFIGURATION));
	}

	@Test
	@DisplayName("zero base power cannot be scaled")
	void zeroBasePower() {
		assertThatThrownBy(() -> generator.generate(set(Map.of("base_power", 0))))
				.isInstanceOf(GenerationException.class)
				.hasMessageContaining("Base power must be positive");
	}

	@Test
	@DisplayName("the same parameters and clock give the same result")
	void deterministic() {
		ParameterSet parameters = set(Map.of("step_size", 0.05, "load_type", "capacitive"));

		assertThat(generator.generate(parameters)).isEqualTo(generator.generate(parameters));
	}

	@Test
	void solveReportsNoRootBeyondTheNose() {
		assertThat(TheveninCurveGenerator.solve(5.0, 1.6, 0.2)).isNull();
		double[] roots = TheveninCurveGenerator.solve(1.0, 0.0, 0.2);
		assertThat(roots).hasSize(2);
		assertThat(roots[0]).isGreaterThan(roots[1]);
	}

	private static ParameterSet set(Map<String, ?> deltas) {
		return new ParameterStore().apply(deltas);
	}
}
