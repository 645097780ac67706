package org.javai.springai.voltage.workflow;

import java.time.Duration;
import java.util.Objects;

/**
 * Routing limits of {@link WorkflowEngine}.
 *
 * @param maxChainedInvocations responder invocations allowed for one input, follow-ups included
 * @param minimumConfidence classifications below this confidence fall back to a question
 * @param generationTimeout how long one curve generation run may take
 */
public record WorkflowConfig(int maxChainedInvocations, double minimumConfidence, Duration generationTimeout) {

	public static final int DEFAULT_MAX_CHAINED_INVOCATIONS = 4;
	public static final double DEFAULT_MINIMUM_CONFIDENCE = 0.5;
	public static final Duration DEFAULT_GENERATION_TIMEOUT = Duration.ofSeconds(30);

	public WorkflowConfig {
		if (maxChainedInvocations < 1) {
			throw new IllegalArgumentException("maxChainedInvocations must be at least 1");
		}
		if (Double.isNaN(minimumConfidence) || minimumConfidence < 0.0 || minimumConfidence > 1.0) {
			throw new IllegalArgumentException("minimumConfidence must be between 0 and 1");
		}
		Objects.requireNonNull(generationTimeout, "generationTimeout must not be null");
		if (generationTimeout.isNegative() || generationTimeout.isZero()) {
			throw new IllegalArgumentException("generationTimeout must be positive");
		}
	}

	public static WorkflowConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Builder toBuilder() {
		return new Builder()
				.maxChainedInvocations(maxChainedInvocations)
				.minimumConfidence(minimumConfidence)
				.generationTimeout(generationTimeout);
	}

	public static class Builder {
		private int maxChainedInvocations = DEFAULT_MAX_CHAINED_INVOCATIONS;
		private double minimumConfidence = DEFAULT_MINIMUM_CONFIDENCE;
		private Duration generationTimeout = DEFAULT_GENERATION_TIMEOUT;

		private Builder() {}

		public Builder maxChainedInvocations(int value) {
			this.maxChainedInvocations = value;
			return this;
		}

		public Builder minimumConfidence(double value) {
			this.minimumConfidence = value;
			return this;
		}

		public Builder generationTimeout(Duration value) {
			this.generationTimeout = value;
			return this;
		}

		public WorkflowConfig build() {
			return new WorkflowConfig(maxChainedInvocations, minimumConfidence, generationTimeout);
		}
	}
}
