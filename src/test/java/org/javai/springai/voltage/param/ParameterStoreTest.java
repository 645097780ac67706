package org.javai.springai.voltage.param;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ParameterStore")
class ParameterStoreTest {

	@Nested
	@DisplayName("Applying batches")
	class Applying {

		@Test
		@DisplayName("applies a valid batch and bumps the version")
		void appliesValidBatch() {
			ParameterStore store = new ParameterStore();

			ParameterSet updated = store.apply(Map.of("base_power", 150, "step_size", "0.05"));

			assertThat(updated.get("base_power")).isEqualTo(150.0);
			assertThat(updated.get("step_size")).isEqualTo(0.05);
			assertThat(store.getAll()).isSameAs(updated);
			assertThat(store.version()).isEqualTo(1);
		}

		@Test
		@DisplayName("resolves aliases and loosely written keys")
		void resolvesAliases() {
			ParameterStore store = new ParameterStore();

			store.apply(Map.of("Step-Size", 0.02, "pf", 0.9, "target bus", 7));

			assertThat(store.getAll().value(GridParameter.STEP_SIZE)).isEqualTo(0.02);
			assertThat(store.getAll().value(GridParameter.POWER_FACTOR)).isEqualTo(0.9);
			assertThat(store.getAll().value(GridParameter.MONITORED_BUS)).isEqualTo(7);
		}

		@Test
		@DisplayName("an empty batch changes nothing")
		void emptyBatchIsNoOp() {
			ParameterStore store = new ParameterStore();

			assertThat(store.apply(Map.of())).isSameAs(ParameterSet.DEFAULT);
			assertThat(store.version()).isZero();
		}

		@Test
		@DisplayName("a batch with one invalid entry is rejected as a whole")
		void batchIsAtomic() {
			ParameterStore store = new ParameterStore();
			Map<String, Object> batch = new LinkedHashMap<>();
			batch.put("base_power", 150);
			batch.put("power_factor", 1.5);

			assertThatThrownBy(() -> store.apply(batch))
					.isInstanceOf(InvalidParameterException.class)
					.hasMessageContaining("power_factor");
			assertThat(store.getAll()).isEqualTo(ParameterSet.DEFAULT);
			assertThat(store.version()).isZero();
		}

		@Test
		@DisplayName("unknown names are reported with the known keys")
		void unknownParameter() {
			ParameterStore store = new ParameterStore();

			assertThatThrownBy(() -> store.apply(Map.of("frequency", 50)))
					.isInstanceOf(UnknownParameterException.class)
					.hasMessageContaining("frequency")
					.hasMessageContaining("step_size");
			assertThat(store.getAll()).isEqualTo(ParameterSet.DEFAULT);
		}
	}

	@Test
	@DisplayName("reset restores the defaults")
	void resetRestoresDefaults() {
		ParameterStore store = new ParameterStore();
		store.apply(Map.of("grid", "ieee118", "continuation", false));

		ParameterSet reset = store.resetToDefault();

		assertThat(reset).isEqualTo(ParameterSet.DEFAULT);
		assertThat(store.version()).isEqualTo(2);
	}

	@Test
	@DisplayName("validate normalises without committing")
	void validateDoesNotCommit() {
		ParameterStore store = new ParameterStore();

		assertThat(store.validate("monitored_bus", "12")).isEqualTo(12);
		assertThat(store.getAll()).isEqualTo(ParameterSet.DEFAULT);
		assertThatThrownBy(() -> store.validate("monitored_bus", 2.5))
				.isInstanceOf(InvalidParameterException.class);
	}

	@Test
	@DisplayName("diff lists changed parameters in declaration order")
	void diffInDeclarationOrder() {
		ParameterSet after = new ParameterStore().apply(Map.of("step_size", 0.05, "grid", "ieee14"));

		List<ParameterChange> changes = ParameterStore.diff(ParameterSet.DEFAULT, after);

		assertThat(changes).containsExactly(
				new ParameterChange("grid", "ieee39", "ieee14"),
				new ParameterChange("step_size", 0.01, 0.05));
	}

	@Test
	@DisplayName("canonicalKeys keeps unknown names verbatim")
	void canonicalKeys() {
		Map<String, Object> batch = new LinkedHashMap<>();
		batch.put("step size", 0.05);
		batch.put("mystery", 1);

		assertThat(ParameterStore.canonicalKeys(batch)).containsExactly(
				Map.entry("step_size", 0.05),
				Map.entry("mystery", 1));
	}
}
