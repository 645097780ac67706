package org.javai.springai.voltage.classify;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.javai.springai.voltage.history.Turn;
import org.javai.springai.voltage.param.GridParameter;

/**
 * Deterministic classifier based on weighted keywords.
 *
 * <p>Each label accumulates the weights of the keywords found in the input. A numeric assignment
 * ("to 0.05") and a mention of a known parameter add to the parameter score; a question mark adds
 * to the question score. The best label wins when its score reaches {@code minScore}; its
 * confidence is its share of the total score.</p>
 *
 * <p>An input that scores as both a parameter change and a generation request and joins them with
 * "and" or "then" is reported as a parameter change with a generation follow-up.</p>
 */
public final class KeywordTurnClassifier implements TurnClassifier {

	private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{Nd}_]+");
	private static final Pattern NUMERIC_ASSIGNMENT = Pattern.compile("\\b(?:to|=|at)\\s*-?\\d");
	private static final Pattern CONNECTIVE = Pattern.compile("\\b(?:and|then)\\b");

	private static final double QUESTION_MARK_WEIGHT = 0.5;
	private static final double ASSIGNMENT_WEIGHT = 0.6;
	private static final double PARAMETER_MENTION_WEIGHT = 0.3;

	private final Map<TurnLabel, Map<String, Double>> weights;
	private final double minScore;

	public KeywordTurnClassifier() {
		this(defaultWeights(), 0.6);
	}

	public KeywordTurnClassifier(Map<TurnLabel, Map<String, Double>> weights, double minScore) {
		this.weights = new EnumMap<>(TurnLabel.class);
		if (weights != null) {
			this.weights.putAll(weights);
		}
		this.minScore = Math.max(0.0, minScore);
	}

	@Override
	public Classification classify(String text, List<Turn> recentTurns) {
		if (text == null || text.isBlank()) {
			return Classification.unclassifiable();
		}
		String lower = text.trim().toLowerCase(Locale.ROOT);
		Map<TurnLabel, Double> scores = score(lower);

		double total = scores.values().stream().mapToDouble(Double::doubleValue).sum();
		if (total <= 0.0) {
			return Classification.unclassifiable();
		}

		double parameterScore = scores.get(TurnLabel.PARAMETER);
		double generationScore = scores.get(TurnLabel.GENERATION);
		if (parameterScore >= minScore && generationScore >= minScore && CONNECTIVE.matcher(lower).find()) {
			double confidence = (parameterScore + generationScore) / total;
			return new Classification(TurnLabel.PARAMETER, confidence, List.of(TurnLabel.GENERATION));
		}

		TurnLabel best = TurnLabel.UNCLASSIFIABLE;
		double bestScore = 0.0;
		for (Map.Entry<TurnLabel, Double> entry : scores.entrySet()) {
			if (entry.getValue() > bestScore) {
				bestScore = entry.getValue();
				best = entry.getKey();
			}
		}
		if (bestScore < minScore) {
			return Classification.unclassifiable();
		}
		return Classification.of(best, bestScore / total);
	}

	private Map<TurnLabel, Double> score(String lower) {
		Map<TurnLabel, Double> scores = new EnumMap<>(TurnLabel.class);
		for (TurnLabel label : TurnLabel.values()) {
			if (label.isDispatchable()) {
				scores.put(label, 0.0);
			}
		}
		for (String token : tokens(lower)) {
			for (Map.Entry<TurnLabel, Map<String, Double>> entry : weights.entrySet()) {
				Double weight = entry.getValue().get(token);
				if (weight != null && scores.containsKey(entry.getKey())) {
					scores.merge(entry.getKey(), weight, Double::sum);
				}
			}
		}
		if (lower.indexOf('?') >= 0) {
			scores.merge(TurnLabel.QUESTION, QUESTION_MARK_WEIGHT, Double::sum);
		}
		if (NUMERIC_ASSIGNMENT.matcher(lower).find()) {
			scores.merge(TurnLabel.PARAMETER, ASSIGNMENT_WEIGHT, Double::sum);
		}
		if (mentionsParameter(lower)) {
			scores.merge(TurnLabel.PARAMETER, PARAMETER_MENTION_WEIGHT, Double::sum);
		}
		return scores;
	}

	private static boolean mentionsParameter(String lower) {
		for (GridParameter parameter : GridParameter.values()) {
			if (lower.contains(parameter.key()) || lower.contains(parameter.displayName())) {
				return true;
			}
		}
		return false;
	}

	private static Set<String> tokens(String s) {
		return WORD.matcher(s)
				.results()
				.map(MatchResult::group)
				.limit(128)
				.collect(Collectors.toSet());
	}

	private static Map<TurnLabel, Map<String, Double>> defaultWeights() {
		EnumMap<TurnLabel, Map<String, Double>> m = new EnumMap<>(TurnLabel.class);

		m.put(TurnLabel.QUESTION, Map.ofEntries(
				Map.entry("what", 0.60),
				Map.entry("why", 0.80),
				Map.entry("how", 0.60),
				Map.entry("explain", 0.70),
				Map.entry("describe", 0.60),
				Map.entry("define", 0.60),
				Map.entry("mean", 0.50),
				Map.entry("meaning", 0.50),
				Map.entry("tell", 0.40),
				Map.entry("current", 0.40),
				Map.entry("does", 0.30),
				Map.entry("is", 0.20)
		));

		m.put(TurnLabel.PARAMETER, Map.ofEntries(
				Map.entry("set", 1.00),
				Map.entry("change", 0.80),
				Map.entry("modify", 0.80),
				Map.entry("update", 0.80),
				Map.entry("reset", 0.80),
				Map.entry("adjust", 0.70),
				Map.entry("increase", 0.60),
				Map.entry("decrease", 0.60),
				Map.entry("switch", 0.60),
				Map.entry("use", 0.30)
		));

		m.put(TurnLabel.GENERATION, Map.ofEntries(
				Map.entry("run", 1.00),
				Map.entry("generate", 1.00),
				Map.entry("simulate", 1.00),
				Map.entry("execute", 0.80),
				Map.entry("plot", 0.80),
				Map.entry("simulation", 0.60),
				Map.entry("compute", 0.60),
				Map.entry("start", 0.40),
				Map.entry("curve", 0.40),
				Map.entry("pv", 0.40),
				Map.entry("nose", 0.30)
		));

		m.put(TurnLabel.ANALYSIS, Map.ofEntries(
				Map.entry("compare", 1.00),
				Map.entry("comparison", 1.00),
				Map.entry("analyze", 1.00),
				Map.entry("analyse", 1.00),
				Map.entry("analysis", 1.00),
				Map.entry("difference", 0.80),
				Map.entry("versus", 0.60),
				Map.entry("vs", 0.60),
				Map.entry("trend", 0.60),
				Map.entry("previous", 0.50),
				Map.entry("earlier", 0.40),
				Map.entry("last", 0.40),
				Map.entry("results", 0.40)
		));

		return m;
	}
}
