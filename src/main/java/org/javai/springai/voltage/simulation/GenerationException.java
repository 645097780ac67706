package org.javai.springai.voltage.simulation;

import java.util.Objects;
import org.javai.springai.voltage.VoltageAgentException;

/**
 * Structured failure of a curve generation run.
 */
public class GenerationException extends VoltageAgentException {

	/**
	 * Why a run produced no curve.
	 */
	public enum Reason {
		/** The power flow did not converge at the first operating point. */
		NON_CONVERGENCE("the power flow did not converge"),
		/** The parameter snapshot cannot be simulated, e.g. an unsupported grid or bus. */
		INVALID_CONFIGURATION("the parameter configuration cannot be simulated"),
		/** The generator did not answer in time. */
		TIMEOUT("the curve generator timed out"),
		/** Any other failure inside the generator. */
		INTERNAL_ERROR("the curve generator failed");

		private final String description;

		Reason(String description) {
			this.description = description;
		}

		public String description() {
			return description;
		}
	}

	private final Reason reason;

	public GenerationException(Reason reason, String message) {
		super(message);
		this.reason = Objects.requireNonNull(reason, "reason must not be null");
	}

	public GenerationException(Reason reason, String message, Throwable cause) {
		super(message, cause);
		this.reason = Objects.requireNonNull(reason, "reason must not be null");
	}

	public Reason reason() {
		return reason;
	}
}
