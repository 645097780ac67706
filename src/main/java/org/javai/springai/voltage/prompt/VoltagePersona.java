package org.javai.springai.voltage.prompt;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Persona rendered at the top of every system prompt sent to the language model.
 */
public final class VoltagePersona {

	private final String name;
	private final String role;
	private final List<String> principles;
	private final List<String> constraints;
	private final List<String> styleGuidance;

	private VoltagePersona(Builder builder) {
		this.name = builder.name;
		this.role = builder.role;
		this.principles = List.copyOf(builder.principles);
		this.constraints = List.copyOf(builder.constraints);
		this.styleGuidance = List.copyOf(builder.styleGuidance);
	}

	/**
	 * The persona used when none is configured.
	 */
	public static VoltagePersona voltageStabilityAssistant() {
		return builder()
				.name("VoltageStabilityAssistant")
				.role("Assistant for power-system voltage-stability analysis with power-voltage (nose) curves")
				.principles(List.of(
						"Explain voltage stability, loadability and the nose point in plain engineering terms",
						"Ground answers in the provided reference material and the session history",
						"Refer to earlier simulation results by their critical voltage and maximum power"))
				.constraints(List.of(
						"Never invent simulation results; only cite results listed in the context",
						"Report parameter values exactly as given in the current parameter list"))
				.styleGuidance(List.of(
						"Be concise; prefer short paragraphs",
						"Give units: MW for power, pu for voltage"))
				.build();
	}

	public String name() {
		return name;
	}

	public String role() {
		return role;
	}

	public List<String> principles() {
		return principles;
	}

	public List<String> constraints() {
		return constraints;
	}

	public List<String> styleGuidance() {
		return styleGuidance;
	}

	/**
	 * Render the persona as a prompt section.
	 */
	public String render() {
		StringBuilder sb = new StringBuilder("PERSONA:\n");
		if (role != null && !role.isBlank()) {
			sb.append("Role: ").append(role.trim()).append("\n");
		}
		appendSection(sb, "Principles", principles);
		appendSection(sb, "Constraints", constraints);
		appendSection(sb, "Style", styleGuidance);
		return sb.toString().trim();
	}

	private static void appendSection(StringBuilder sb, String title, List<String> items) {
		if (items.isEmpty()) {
			return;
		}
		sb.append(title).append(":\n");
		for (String item : items) {
			if (item != null && !item.isBlank()) {
				sb.append("- ").append(item.trim()).append("\n");
			}
		}
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {
		private String name;
		private String role;
		private final List<String> principles = new ArrayList<>();
		private final List<String> constraints = new ArrayList<>();
		private final List<String> styleGuidance = new ArrayList<>();

		public Builder name(String name) {
			this.name = name;
			return this;
		}

		public Builder role(String role) {
			this.role = role;
			return this;
		}

		public Builder principles(List<String> values) {
			if (values != null) {
				this.principles.addAll(values);
			}
			return this;
		}

		public Builder constraints(List<String> values) {
			if (values != null) {
				this.constraints.addAll(values);
			}
			return this;
		}

		public Builder styleGuidance(List<String> values) {
			if (values != null) {
				this.styleGuidance.addAll(values);
			}
			return this;
		}

		public VoltagePersona build() {
			Objects.requireNonNull(name, "name must not be null");
			return new VoltagePersona(this);
		}
	}
}
