package org.javai.springai.voltage.param;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Versioned holder of the current {@link ParameterSet}, and the only gate through which
 * parameter values change.
 *
 * <p>Every mutation is validated before anything is committed. Batches are atomic: if one
 * entry fails, the store keeps its previous snapshot and version.</p>
 *
 * <pre>{@code
 * ParameterStore store = new ParameterStore();
 * store.apply(Map.of("base_power", 150, "step_size", "0.05"));
 * store.getAll().get("base_power");   // 150.0
 * }</pre>
 *
 * <p>Instances are not thread-safe; a store belongs to a single session turn.</p>
 */
public class ParameterStore {

	private ParameterSet current;
	private long version;

	/**
	 * Creates a store holding {@link ParameterSet#DEFAULT}.
	 */
	public ParameterStore() {
		this(ParameterSet.DEFAULT);
	}

	/**
	 * Creates a store seeded with an existing snapshot.
	 *
	 * @param initial the starting snapshot
	 */
	public ParameterStore(ParameterSet initial) {
		this.current = Objects.requireNonNull(initial, "initial must not be null");
	}

	/**
	 * Read-only snapshot of all parameters.
	 */
	public ParameterSet getAll() {
		return current;
	}

	/**
	 * Number of committed batches since this store was created.
	 */
	public long version() {
		return version;
	}

	/**
	 * Check a single proposed value without committing it.
	 *
	 * @param name parameter key or alias
	 * @param value proposed value
	 * @return the normalised value
	 * @throws UnknownParameterException if the name is not known
	 * @throws InvalidParameterException if the value is outside the parameter's domain
	 */
	public Object validate(String name, Object value) {
		GridParameter parameter = resolve(name);
		return parameter.domain().normalize(parameter.key(), value);
	}

	/**
	 * Apply a batch of changes atomically.
	 *
	 * @param deltas proposed values keyed by parameter key or alias
	 * @return the new snapshot (the unchanged one if the batch is empty)
	 * @throws ParameterException for the first entry that fails; nothing is applied
	 */
	public ParameterSet apply(Map<String, ?> deltas) {
		Objects.requireNonNull(deltas, "deltas must not be null");
		if (deltas.isEmpty()) {
			return current;
		}
		EnumMap<GridParameter, Object> staged = new EnumMap<>(current.values());
		for (Map.Entry<String, ?> entry : deltas.entrySet()) {
			GridParameter parameter = resolve(entry.getKey());
			staged.put(parameter, parameter.domain().normalize(parameter.key(), entry.getValue()));
		}
		current = new ParameterSet(staged);
		version++;
		return current;
	}

	/**
	 * Restore the default snapshot. Always succeeds.
	 */
	public ParameterSet resetToDefault() {
		current = ParameterSet.DEFAULT;
		version++;
		return current;
	}

	/**
	 * List the parameters whose values differ between two snapshots, in declaration order.
	 */
	public static List<ParameterChange> diff(ParameterSet before, ParameterSet after) {
		List<ParameterChange> changes = new ArrayList<>();
		for (GridParameter parameter : GridParameter.values()) {
			Object oldValue = before.value(parameter);
			Object newValue = after.value(parameter);
			if (!Objects.equals(oldValue, newValue)) {
				changes.add(new ParameterChange(parameter.key(), oldValue, newValue));
			}
		}
		return List.copyOf(changes);
	}

	/**
	 * Resolve every key of a batch to its canonical parameter key, keeping insertion order.
	 * Unknown names are kept verbatim so validation can report them.
	 */
	public static Map<String, Object> canonicalKeys(Map<String, ?> deltas) {
		Map<String, Object> canonical = new LinkedHashMap<>();
		deltas.forEach((name, value) -> canonical.put(
				GridParameter.fromName(name).map(GridParameter::key).orElse(name), value));
		return canonical;
	}

	private static GridParameter resolve(String name) {
		return GridParameter.fromName(name).orElseThrow(() -> new UnknownParameterException(name));
	}
}
