package org.javai.springai.voltage.respond;

/**
 * Produces free-text answers from rendered prompts.
 */
@FunctionalInterface
public interface AnswerGenerator {

	String generate(String systemPrompt, String userPrompt);
}
