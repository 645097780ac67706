package org.javai.springai.voltage.param;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of every simulation input.
 *
 * <p>A set always holds a value for each {@link GridParameter}. Values are the canonical
 * types produced by {@link ParameterDomain#normalize}. New sets are derived through
 * {@link ParameterStore}, which validates before deriving.</p>
 *
 * @param values the value of each parameter
 */
public record ParameterSet(Map<GridParameter, Object> values) {

	/**
	 * The canonical reset target.
	 */
	public static final ParameterSet DEFAULT = defaults();

	public ParameterSet {
		Objects.requireNonNull(values, "values must not be null");
		EnumMap<GridParameter, Object> copy = new EnumMap<>(GridParameter.class);
		copy.putAll(values);
		for (GridParameter parameter : GridParameter.values()) {
			if (copy.get(parameter) == null) {
				throw new IllegalArgumentException("missing value for " + parameter.key());
			}
		}
		values = Collections.unmodifiableMap(copy);
	}

	private static ParameterSet defaults() {
		EnumMap<GridParameter, Object> values = new EnumMap<>(GridParameter.class);
		for (GridParameter parameter : GridParameter.values()) {
			values.put(parameter, parameter.defaultValue());
		}
		return new ParameterSet(values);
	}

	/**
	 * Look up a value by parameter key or alias.
	 *
	 * @throws UnknownParameterException if the name is not a known parameter
	 */
	public Object get(String name) {
		GridParameter parameter = GridParameter.fromName(name)
				.orElseThrow(() -> new UnknownParameterException(name));
		return values.get(parameter);
	}

	public Object value(GridParameter parameter) {
		return values.get(parameter);
	}

	public double doubleValue(GridParameter parameter) {
		return ((Number) values.get(parameter)).doubleValue();
	}

	public int intValue(GridParameter parameter) {
		return ((Number) values.get(parameter)).intValue();
	}

	public String stringValue(GridParameter parameter) {
		return String.valueOf(values.get(parameter));
	}

	public boolean booleanValue(GridParameter parameter) {
		return Boolean.TRUE.equals(values.get(parameter));
	}

	/**
	 * Values keyed by parameter key, in declaration order.
	 */
	public Map<String, Object> asMap() {
		Map<String, Object> map = new LinkedHashMap<>();
		values.forEach((parameter, value) -> map.put(parameter.key(), value));
		return Collections.unmodifiableMap(map);
	}

	/**
	 * One {@code key=value} pair per parameter, comma separated.
	 */
	public String describe() {
		return values.entrySet().stream()
				.map(e -> e.getKey().key() + "=" + ParameterValues.format(e.getValue()))
				.collect(Collectors.joining(", "));
	}
}
