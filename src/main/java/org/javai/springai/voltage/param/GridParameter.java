package org.javai.springai.voltage.param;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of simulation inputs a user can change.
 *
 * <p>Each constant carries its snake_case key, its validated domain, its default value and the
 * phrases users tend to call it by. The declaration order is the order parameters are listed
 * in responses and prompts.</p>
 */
public enum GridParameter {

	GRID("grid",
			ParameterDomain.choice("ieee14", "ieee24", "ieee30", "ieee39", "ieee57", "ieee118", "ieee300"),
			"ieee39",
			"grid", "test system", "network", "system"),
	BASE_POWER("base_power", ParameterDomain.real(0.0, 100_000.0), 100.0,
			"base power", "base load", "base mw"),
	MONITORED_BUS("monitored_bus", ParameterDomain.integer(0, 299), 5,
			"monitored bus", "target bus", "bus id", "bus"),
	STEP_SIZE("step_size", ParameterDomain.real(0.001, 1.0), 0.01,
			"step size", "step", "load step", "increment"),
	MAX_SCALE("max_scale", ParameterDomain.real(1.0, 10.0), 3.0,
			"max scale", "maximum scale", "load scale", "scale"),
	VOLTAGE_LIMIT("voltage_limit", ParameterDomain.real(0.0, 1.0), 0.4,
			"voltage limit", "minimum voltage", "voltage threshold"),
	POWER_FACTOR("power_factor", ParameterDomain.realAboveMin(0.0, 1.0), 0.95,
			"power factor", "pf"),
	LOAD_TYPE("load_type", ParameterDomain.choice("inductive", "capacitive"), "inductive",
			"load type", "load kind"),
	CONTINUATION("continuation", ParameterDomain.flag(), Boolean.TRUE,
			"continuation", "continuation curve", "lower branch");

	private final String key;
	private final ParameterDomain domain;
	private final Object defaultValue;
	private final List<String> aliases;

	GridParameter(String key, ParameterDomain domain, Object defaultValue, String... aliases) {
		this.key = key;
		this.domain = domain;
		this.defaultValue = defaultValue;
		this.aliases = List.of(aliases);
	}

	public String key() {
		return key;
	}

	public ParameterDomain domain() {
		return domain;
	}

	public Object defaultValue() {
		return defaultValue;
	}

	/**
	 * Phrases that refer to this parameter, longest first within the declaration.
	 */
	public List<String> aliases() {
		return aliases;
	}

	/**
	 * The key with spaces instead of underscores, e.g. {@code "step size"}.
	 */
	public String displayName() {
		return key.replace('_', ' ');
	}

	/**
	 * Resolve a parameter by key, by a loosely written key ({@code "Step-Size"}) or by alias.
	 *
	 * @param name the name to resolve
	 * @return the parameter, or empty if the name is not known
	 */
	public static Optional<GridParameter> fromName(String name) {
		if (name == null || name.isBlank()) {
			return Optional.empty();
		}
		String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
		for (GridParameter parameter : values()) {
			if (parameter.key.equals(normalized)) {
				return Optional.of(parameter);
			}
		}
		String spaced = normalized.replace('_', ' ');
		for (GridParameter parameter : values()) {
			if (parameter.aliases.contains(spaced)) {
				return Optional.of(parameter);
			}
		}
		return Optional.empty();
	}
}
