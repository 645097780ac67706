package org.javai.springai.voltage.respond;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.springai.voltage.param.GridParameter;
import org.javai.springai.voltage.param.ParameterDomain;
import org.javai.springai.voltage.param.ParameterSet;

/**
 * Offline extractor for phrasings such as "set the step size to 0.05", "grid = ieee118",
 * "change base power from 100 to 150", "disable continuation" and "reset all parameters".
 *
 * <p>Values are returned as written; validation is left to the parameter store.</p>
 */
public final class PatternParameterExtractor implements ParameterExtractor {

	private static final String NUMBER = "-?\\d+(?:\\.\\d+)?";
	private static final Pattern NUMERIC_VALUE = Pattern.compile(
			"^(?:'s)?\\s*(?:from\\s+" + NUMBER + "\\s+)?(?:(?:to|=|:|at|of|as|is)\\s*)?(" + NUMBER + ")");
	private static final Pattern WORD_VALUE = Pattern.compile(
			"^(?:'s)?\\s*(?:from\\s+\\S+\\s+)?(?:to|=|:|as|is)\\s*([a-z][a-z0-9_]*)");
	private static final Pattern RESET = Pattern.compile("\\b(?:reset|restore)\\b");
	private static final Pattern RESET_ALL = Pattern.compile("\\b(?:all|everything|parameters|defaults)\\b");
	private static final Pattern ENABLE = Pattern.compile("\\b(?:enable|activate|turn on|switch on)\\b");
	private static final Pattern DISABLE = Pattern.compile("\\b(?:disable|deactivate|turn off|switch off|without)\\b");
	private static final Pattern SPACED_GRID = Pattern.compile("\\bieee[\\s-]+(\\d+)\\b");

	@Override
	public Map<String, Object> extract(String text, ParameterSet current) {
		if (text == null || text.isBlank()) {
			return Map.of();
		}
		String lower = SPACED_GRID.matcher(ParameterMentions.lower(text)).replaceAll("ieee$1");
		List<ParameterMentions.Mention> mentions = ParameterMentions.find(lower);
		Map<String, Object> deltas = new LinkedHashMap<>();

		if (RESET.matcher(lower).find()) {
			if (mentions.isEmpty() || RESET_ALL.matcher(lower).find()) {
				for (GridParameter parameter : GridParameter.values()) {
					deltas.put(parameter.key(), parameter.defaultValue());
				}
			}
			else {
				mentions.forEach(m -> deltas.put(m.parameter().key(), m.parameter().defaultValue()));
			}
			return deltas;
		}

		for (ParameterMentions.Mention mention : mentions) {
			String rest = lower.substring(mention.end());
			GridParameter parameter = mention.parameter();
			Matcher numeric = NUMERIC_VALUE.matcher(rest);
			if (numeric.find()) {
				deltas.putIfAbsent(parameter.key(), numeric.group(1));
				continue;
			}
			Matcher word = WORD_VALUE.matcher(rest);
			if (word.find()) {
				deltas.putIfAbsent(parameter.key(), word.group(1));
				continue;
			}
			if (parameter.domain() instanceof ParameterDomain.Flag) {
				String before = lower.substring(0, mention.start());
				if (ENABLE.matcher(before).find()) {
					deltas.putIfAbsent(parameter.key(), Boolean.TRUE);
				}
				else if (DISABLE.matcher(before).find()) {
					deltas.putIfAbsent(parameter.key(), Boolean.FALSE);
				}
			}
		}

		for (GridParameter parameter : GridParameter.values()) {
			if (deltas.containsKey(parameter.key()) || !(parameter.domain() instanceof ParameterDomain.Choice choice)) {
				continue;
			}
			List<String> named = choice.options().stream()
					.filter(option -> Pattern.compile("\\b" + Pattern.quote(option) + "\\b").matcher(lower).find())
					.toList();
			if (named.size() == 1) {
				deltas.put(parameter.key(), named.get(0));
			}
		}
		return deltas;
	}
}
