package org.javai.springai.voltage.respond;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.springai.voltage.param.GridParameter;

/**
 * Locates references to known parameters in free text.
 */
final class ParameterMentions {

	private static final List<Phrase> PHRASES = phrases();

	private ParameterMentions() {
	}

	/**
	 * A parameter named in the text, with the character range of the phrase that named it.
	 */
	record Mention(GridParameter parameter, int start, int end) {
	}

	/**
	 * Find every non-overlapping mention, preferring longer phrases, in text order.
	 *
	 * @param lower the text, already lower-cased
	 */
	static List<Mention> find(String lower) {
		List<Mention> mentions = new ArrayList<>();
		boolean[] taken = new boolean[lower.length()];
		for (Phrase phrase : PHRASES) {
			Matcher matcher = phrase.pattern().matcher(lower);
			while (matcher.find()) {
				if (isFree(taken, matcher.start(), matcher.end())) {
					for (int i = matcher.start(); i < matcher.end(); i++) {
						taken[i] = true;
					}
					mentions.add(new Mention(phrase.parameter(), matcher.start(), matcher.end()));
				}
			}
		}
		mentions.sort(Comparator.comparingInt(Mention::start));
		return mentions;
	}

	static Optional<GridParameter> first(String lower) {
		List<Mention> mentions = find(lower);
		return mentions.isEmpty() ? Optional.empty() : Optional.of(mentions.get(0).parameter());
	}

	static String lower(String text) {
		return text.toLowerCase(Locale.ROOT);
	}

	private static boolean isFree(boolean[] taken, int start, int end) {
		for (int i = start; i < end; i++) {
			if (taken[i]) {
				return false;
			}
		}
		return true;
	}

	private static List<Phrase> phrases() {
		List<Phrase> phrases = new ArrayList<>();
		for (GridParameter parameter : GridParameter.values()) {
			List<String> names = new ArrayList<>(parameter.aliases());
			names.add(parameter.key());
			names.add(parameter.displayName());
			for (String name : names) {
				String regex = "\\b" + Pattern.quote(name).replace(" ", "\\E[\\s_-]+\\Q") + "\\b";
				phrases.add(new Phrase(parameter, name.length(), Pattern.compile(regex)));
			}
		}
		phrases.sort(Comparator.comparingInt(Phrase::length).reversed());
		return List.copyOf(phrases);
	}

	private record Phrase(GridParameter parameter, int length, Pattern pattern) {
	}
}
