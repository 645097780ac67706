package org.javai.springai.voltage.respond;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import org.javai.springai.voltage.classify.TurnLabel;
import org.javai.springai.voltage.param.GridParameter;
import org.javai.springai.voltage.param.ParameterSet;
import org.javai.springai.voltage.simulation.CurveGenerator;
import org.javai.springai.voltage.simulation.GenerationException;
import org.javai.springai.voltage.simulation.SimulationResult;
import org.javai.springai.voltage.workflow.WorkflowConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the curve generator on the staged parameters and summarises the curve.
 *
 * <p>Each run gets a deadline. A {@link GenerationException} becomes a failed outcome naming the
 * reason; a run past the deadline fails as {@link GenerationException.Reason#TIMEOUT} and any other
 * runtime failure of the generator as {@link GenerationException.Reason#INTERNAL_ERROR}. A request
 * that also asks for a comparison ("run it again and compare") chains an analysis step.</p>
 */
public class GenerationResponder implements Responder {

	private static final Logger logger = LoggerFactory.getLogger(GenerationResponder.class);

	private static final Pattern COMPARISON_REQUEST = Pattern.compile("\\b(?:compare|comparison|versus|vs)\\b");

	private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

	private static final ExecutorService RUNNER = Executors.newCachedThreadPool(task -> {
		Thread thread = new Thread(task, "curve-generator-" + THREAD_COUNTER.incrementAndGet());
		thread.setDaemon(true);
		return thread;
	});

	private final CurveGenerator generator;
	private final Duration timeout;

	public GenerationResponder(CurveGenerator generator) {
		this(generator, WorkflowConfig.DEFAULT_GENERATION_TIMEOUT);
	}

	public GenerationResponder(CurveGenerator generator, Duration timeout) {
		this.generator = Objects.requireNonNull(generator, "generator must not be null");
		this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
		if (timeout.isNegative() || timeout.isZero()) {
			throw new IllegalArgumentException("timeout must be positive");
		}
	}

	@Override
	public TurnLabel label() {
		return TurnLabel.GENERATION;
	}

	@Override
	public ResponderOutcome respond(ResponderRequest request) {
		ParameterSet parameters = request.parameters();
		SimulationResult result;
		try {
			result = generateWithin(parameters);
		}
		catch (GenerationException ex) {
			logger.warn("Curve generation failed ({})", ex.reason(), ex);
			return ResponderOutcome.failure("The simulation did not produce a curve: "
					+ ex.reason().description() + ". " + ex.getMessage() + ".");
		}

		StringBuilder sb = new StringBuilder()
				.append("PV curve generated for ")
				.append(parameters.stringValue(GridParameter.GRID))
				.append(", bus ")
				.append(parameters.intValue(GridParameter.MONITORED_BUS))
				.append(": maximum power ")
				.append(mw(result.maxPower()))
				.append(" at a critical voltage of ")
				.append(pu(result.criticalVoltage()))
				.append(". Load margin ")
				.append(mw(result.loadMarginMw()))
				.append(", voltage drop ")
				.append(String.format(Locale.ROOT, "%.1f%%", result.voltageDropPercent()))
				.append(" over ")
				.append(result.convergedSteps())
				.append(" converged points.");

		Optional<SimulationResult> previous = request.latest();
		previous.ifPresent(prior -> sb.append(" Compared with the previous run: maximum power ")
				.append(signedMw(result.maxPower() - prior.maxPower()))
				.append(", critical voltage ")
				.append(signedPu(result.criticalVoltage() - prior.criticalVoltage()))
				.append("."));

		ResponderOutcome outcome = ResponderOutcome.produced(sb.toString(), result);
		if (previous.isPresent() && COMPARISON_REQUEST.matcher(ParameterMentions.lower(request.userText())).find()) {
			return outcome.withFollowUp(TurnLabel.ANALYSIS);
		}
		return outcome;
	}

	private SimulationResult generateWithin(ParameterSet parameters) {
		Future<SimulationResult> run = RUNNER.submit(() -> generator.generate(parameters));
		try {
			return run.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (TimeoutException ex) {
			run.cancel(true);
			throw new GenerationException(GenerationException.Reason.TIMEOUT,
					"No curve within " + timeout.toMillis() + " ms", ex);
		}
		catch (InterruptedException ex) {
			run.cancel(true);
			Thread.currentThread().interrupt();
			throw new GenerationException(GenerationException.Reason.INTERNAL_ERROR, "Interrupted while generating", ex);
		}
		catch (ExecutionException ex) {
			Throwable cause = ex.getCause();
			if (cause instanceof GenerationException generationException) {
				throw generationException;
			}
			throw new GenerationException(GenerationException.Reason.INTERNAL_ERROR,
					String.valueOf(cause != null ? cause.getMessage() : ex.getMessage()), cause != null ? cause : ex);
		}
	}

	static String mw(double value) {
		return String.format(Locale.ROOT, "%.2f MW", value);
	}

	static String pu(double value) {
		return String.format(Locale.ROOT, "%.4f pu", value);
	}

	static String signedMw(double value) {
		return String.format(Locale.ROOT, "%+.2f MW", value);
	}

	static String signedPu(double value) {
		return String.format(Locale.ROOT, "%+.4f pu", value);
	}
}
