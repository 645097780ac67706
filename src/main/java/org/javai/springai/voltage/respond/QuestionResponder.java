package org.javai.springai.voltage.respond;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.javai.springai.voltage.classify.TurnLabel;
import org.javai.springai.voltage.history.ParameterEvolutionEntry;
import org.javai.springai.voltage.param.GridParameter;
import org.javai.springai.voltage.param.ParameterSet;
import org.javai.springai.voltage.param.ParameterValues;
import org.javai.springai.voltage.prompt.PromptTemplates;
import org.javai.springai.voltage.retrieve.KnowledgeRetriever;

/**
 * Answers questions.
 *
 * <p>Questions about the current value of a parameter ("what is the current step size?", "what is
 * the grid set to?") are answered from the parameter snapshot and its change history, without
 * calling a model. Questions about a concept that merely shares a parameter's name ("what is a
 * bus?") are not. Other questions are answered by the {@link AnswerGenerator} with retrieved
 * reference material and the session context; without a generator the retrieved snippets are
 * returned as they are.</p>
 */
public class QuestionResponder implements Responder {

	static final int MAX_SNIPPETS_WITHOUT_GENERATOR = 3;

	static final String FALLBACK_TEXT = "I can answer questions about voltage stability and PV curves, "
			+ "change simulation parameters, run the simulation and compare results. "
			+ "Try \"what is the nose point?\", \"set step size to 0.05\" or \"run the simulation\".";

	// "what is a bus?", "how does the power factor ..." ask about the concept, not the setting
	private static final Pattern CONCEPT_QUESTION = Pattern.compile(
			"^\\s*(?:what(?:'s| is| are)\\s+(?:a|an)\\b|how\\b|why\\b|explain\\b|describe\\b|define\\b)");
	// text just before the parameter: "the current", "value of the", "what's my"
	private static final Pattern VALUE_PREFIX = Pattern.compile(
			"(?:\\bcurrent|\\bcurrently|\\bvalue of(?:\\s+the)?|^\\s*what(?:'s| is)\\s+(?:the|my|our))\\s+$");
	// text just after the parameter: "set to", "right now"
	private static final Pattern VALUE_SUFFIX = Pattern.compile(
			"^\\s*(?:is\\s+)?(?:currently\\s+|now\\s+)?(?:set to|right now|now|at the moment|currently)\\b");
	private static final Pattern END_OF_QUESTION = Pattern.compile("^\\s*(?:(?:is|in use|used)\\s*)?[?.!]*\\s*$");
	private static final Pattern PARAMETER_LISTING = Pattern.compile(
			"\\b(?:show|list|current|all)\\b.*\\bparameters\\b");

	private final KnowledgeRetriever retriever;
	private final AnswerGenerator generator;
	private final PromptTemplates prompts;

	/**
	 * @param retriever reference lookup, or null for none
	 * @param generator model-backed answers, or null to answer from snippets only
	 */
	public QuestionResponder(KnowledgeRetriever retriever, AnswerGenerator generator) {
		this(retriever, generator, new PromptTemplates());
	}

	public QuestionResponder(KnowledgeRetriever retriever, AnswerGenerator generator, PromptTemplates prompts) {
		this.retriever = retriever;
		this.generator = generator;
		this.prompts = prompts;
	}

	@Override
	public TurnLabel label() {
		return TurnLabel.QUESTION;
	}

	@Override
	public ResponderOutcome respond(ResponderRequest request) {
		String lower = ParameterMentions.lower(request.userText());

		if (PARAMETER_LISTING.matcher(lower).find()) {
			return ResponderOutcome.reply("Current parameters: " + request.parameters().describe() + ".");
		}
		Optional<GridParameter> asked = askedValue(lower);
		if (asked.isPresent()) {
			return ResponderOutcome.reply(describeCurrentValue(asked.get(), request));
		}

		List<String> snippets = retriever != null ? retriever.retrieve(request.userText()) : List.of();
		if (generator != null) {
			String answer = generator.generate(
					prompts.answerSystemPrompt(),
					prompts.answerUserPrompt(request.userText(), snippets, request.history(), request.parameters()));
			return ResponderOutcome.reply(answer);
		}
		if (!snippets.isEmpty()) {
			StringBuilder sb = new StringBuilder("From the reference material:");
			snippets.stream().limit(MAX_SNIPPETS_WITHOUT_GENERATOR)
					.forEach(snippet -> sb.append("\n- ").append(snippet));
			return ResponderOutcome.reply(sb.toString());
		}
		return ResponderOutcome.reply(FALLBACK_TEXT);
	}

	/**
	 * The parameter whose setting the question asks for, if it asks for one.
	 */
	static Optional<GridParameter> askedValue(String lower) {
		if (CONCEPT_QUESTION.matcher(lower).find()) {
			return Optional.empty();
		}
		for (ParameterMentions.Mention mention : ParameterMentions.find(lower)) {
			String before = lower.substring(0, mention.start());
			String after = lower.substring(mention.end());
			boolean named = VALUE_PREFIX.matcher(before).find() && END_OF_QUESTION.matcher(after).matches();
			if (named || VALUE_SUFFIX.matcher(after).find()) {
				return Optional.of(mention.parameter());
			}
		}
		return Optional.empty();
	}

	private static String describeCurrentValue(GridParameter parameter, ResponderRequest request) {
		ParameterSet parameters = request.parameters();
		String value = ParameterValues.format(parameters.value(parameter));
		StringBuilder sb = new StringBuilder("The current ")
				.append(parameter.displayName())
				.append(" is ")
				.append(value);
		Optional<ParameterEvolutionEntry> lastChange = request.history().lastChange(parameter.key());
		if (lastChange.isPresent() && ParameterValues.format(lastChange.get().newValue()).equals(value)) {
			sb.append(" (changed from ")
					.append(ParameterValues.format(lastChange.get().oldValue()))
					.append(" in turn ")
					.append(lastChange.get().turnSequence())
					.append(")");
		}
		else if (parameters.value(parameter).equals(parameter.defaultValue())) {
			sb.append(" (the default)");
		}
		return sb.append(".").toString();
	}
}
