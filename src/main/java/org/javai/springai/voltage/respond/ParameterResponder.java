package org.javai.springai.voltage.respond;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.springai.voltage.classify.TurnLabel;
import org.javai.springai.voltage.history.HistoryContext;
import org.javai.springai.voltage.param.GridParameter;
import org.javai.springai.voltage.param.ParameterChange;
import org.javai.springai.voltage.param.ParameterException;
import org.javai.springai.voltage.param.ParameterSet;
import org.javai.springai.voltage.param.ParameterStore;
import org.javai.springai.voltage.param.ParameterValues;

/**
 * Turns a change request into a proposed parameter batch.
 *
 * <p>The batch is previewed against the request snapshot to describe its effect. A batch that
 * fails validation is still proposed; the engine rejects it at commit time. When a requested
 * parameter has been flipped back and forth recently, an advisory note is appended.</p>
 */
public class ParameterResponder implements Responder {

	static final String NO_CHANGE_TEXT = "I could not find a parameter change in your message. "
			+ "Name a parameter and a value, for example \"set step size to 0.05\". Known parameters: ";

	private final ParameterExtractor extractor;
	private final HistoryContext historyContext;

	public ParameterResponder(ParameterExtractor extractor, HistoryContext historyContext) {
		this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
		this.historyContext = Objects.requireNonNull(historyContext, "historyContext must not be null");
	}

	@Override
	public TurnLabel label() {
		return TurnLabel.PARAMETER;
	}

	@Override
	public ResponderOutcome respond(ResponderRequest request) {
		Map<String, Object> requested = ParameterStore.canonicalKeys(
				extractor.extract(request.userText(), request.parameters()));
		if (requested.isEmpty()) {
			return ResponderOutcome.reply(NO_CHANGE_TEXT + knownKeys() + ".");
		}

		ParameterSet preview;
		try {
			preview = new ParameterStore(request.parameters()).apply(requested);
		}
		catch (ParameterException ex) {
			return ResponderOutcome.proposing(ex.getMessage(), requested);
		}

		List<ParameterChange> changes = ParameterStore.diff(request.parameters(), preview);
		StringBuilder sb = new StringBuilder();
		if (changes.isEmpty()) {
			sb.append("No change: ").append(describeValues(requested.keySet(), preview)).append(".");
		}
		else {
			sb.append("Updated ").append(changes.stream()
					.map(change -> displayName(change.name()) + " from " + ParameterValues.format(change.oldValue())
							+ " to " + ParameterValues.format(change.newValue()))
					.collect(Collectors.joining(", "))).append(".");
		}

		Set<String> oscillating = historyContext.oscillatingParameters(request.history());
		List<String> flagged = new ArrayList<>();
		for (String key : requested.keySet()) {
			if (oscillating.contains(key)) {
				flagged.add(displayName(key));
			}
		}
		if (!flagged.isEmpty()) {
			sb.append("\nNote: ").append(String.join(", ", flagged))
					.append(flagged.size() == 1 ? " has" : " have")
					.append(" been changed back and forth several times recently. ")
					.append("To see its effect, run the simulation for each value and compare the results.");
		}
		return ResponderOutcome.proposing(sb.toString(), requested);
	}

	private static String describeValues(Set<String> keys, ParameterSet parameters) {
		return keys.stream()
				.map(key -> displayName(key) + " is already " + ParameterValues.format(parameters.get(key)))
				.collect(Collectors.joining(", "));
	}

	private static String displayName(String key) {
		return GridParameter.fromName(key).map(GridParameter::displayName).orElse(key);
	}

	private static String knownKeys() {
		return List.of(GridParameter.values()).stream()
				.map(GridParameter::key)
				.collect(Collectors.joining(", "));
	}
}
