package org.javai.springai.voltage.param;

import java.util.List;
import java.util.Locale;

/**
 * The set of values a simulation parameter accepts. Sealed so every domain kind is known.
 * <p>
 * Domains can be:
 * <ul>
 *   <li>{@link RealRange} - a bounded real number</li>
 *   <li>{@link IntegerRange} - a bounded whole number</li>
 *   <li>{@link Choice} - one of a fixed list of lower-case labels</li>
 *   <li>{@link Flag} - a boolean switch</li>
 * </ul>
 * Normalisation coerces loosely typed input (strings from a language model, boxed numbers of
 * any width) into the canonical Java type of the domain, or rejects it.
 */
public sealed interface ParameterDomain {

	/**
	 * Coerce and check a raw value.
	 *
	 * @param name the parameter name, used in the error
	 * @param raw the proposed value
	 * @return the canonical value ({@code Double}, {@code Integer}, {@code String} or {@code Boolean})
	 * @throws InvalidParameterException if the value is of the wrong type or out of bounds
	 */
	Object normalize(String name, Object raw);

	/**
	 * Describe the accepted values for error messages and prompts.
	 */
	String describe();

	static RealRange real(double min, double max) {
		return new RealRange(min, max, false);
	}

	static RealRange realAboveMin(double min, double max) {
		return new RealRange(min, max, true);
	}

	static IntegerRange integer(int min, int max) {
		return new IntegerRange(min, max);
	}

	static Choice choice(String... options) {
		return new Choice(List.of(options));
	}

	static Flag flag() {
		return new Flag();
	}

	/**
	 * A real number in {@code [min, max]}, or {@code (min, max]} when {@code minExclusive}.
	 */
	record RealRange(double min, double max, boolean minExclusive) implements ParameterDomain {

		@Override
		public Object normalize(String name, Object raw) {
			Double value = toDouble(raw);
			if (value == null || value.isNaN() || value.isInfinite()) {
				throw new InvalidParameterException(name, raw, describe());
			}
			boolean aboveMin = minExclusive ? value > min : value >= min;
			if (!aboveMin || value > max) {
				throw new InvalidParameterException(name, raw, describe());
			}
			return value;
		}

		@Override
		public String describe() {
			if (minExclusive) {
				return "a number greater than " + ParameterValues.format(min)
						+ " and at most " + ParameterValues.format(max);
			}
			return "a number between " + ParameterValues.format(min)
					+ " and " + ParameterValues.format(max);
		}
	}

	/**
	 * A whole number in {@code [min, max]}.
	 */
	record IntegerRange(int min, int max) implements ParameterDomain {

		@Override
		public Object normalize(String name, Object raw) {
			Double value = toDouble(raw);
			if (value == null || value.isNaN() || value.isInfinite() || value != Math.rint(value)) {
				throw new InvalidParameterException(name, raw, describe());
			}
			if (value < min || value > max) {
				throw new InvalidParameterException(name, raw, describe());
			}
			return value.intValue();
		}

		@Override
		public String describe() {
			return "a whole number between " + min + " and " + max;
		}
	}

	/**
	 * One of a fixed set of labels, matched case-insensitively.
	 */
	record Choice(List<String> options) implements ParameterDomain {

		public Choice {
			options = List.copyOf(options);
		}

		@Override
		public Object normalize(String name, Object raw) {
			if (raw instanceof String text) {
				String candidate = text.trim().toLowerCase(Locale.ROOT);
				if (options.contains(candidate)) {
					return candidate;
				}
			}
			throw new InvalidParameterException(name, raw, describe());
		}

		@Override
		public String describe() {
			return "one of " + String.join(", ", options);
		}
	}

	/**
	 * A boolean switch; accepts {@code true/false}, {@code yes/no} and {@code on/off}.
	 */
	record Flag() implements ParameterDomain {

		private static final List<String> TRUE_WORDS = List.of("true", "yes", "on");
		private static final List<String> FALSE_WORDS = List.of("false", "no", "off");

		@Override
		public Object normalize(String name, Object raw) {
			if (raw instanceof Boolean flag) {
				return flag;
			}
			if (raw instanceof String text) {
				String candidate = text.trim().toLowerCase(Locale.ROOT);
				if (TRUE_WORDS.contains(candidate)) {
					return Boolean.TRUE;
				}
				if (FALSE_WORDS.contains(candidate)) {
					return Boolean.FALSE;
				}
			}
			throw new InvalidParameterException(name, raw, describe());
		}

		@Override
		public String describe() {
			return "true or false";
		}
	}

	private static Double toDouble(Object raw) {
		if (raw instanceof Number number) {
			return number.doubleValue();
		}
		if (raw instanceof String text) {
			try {
				return Double.valueOf(text.trim());
			}
			catch (NumberFormatException e) {
				return null;
			}
		}
		return null;
	}
}
