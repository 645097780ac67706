package org.javai.springai.voltage.retrieve;

import java.util.Objects;

/**
 * One entry of the bundled reference corpus.
 *
 * @param topic short title
 * @param text the snippet returned to callers
 */
public record KnowledgeDocument(String topic, String text) {

	public KnowledgeDocument {
		Objects.requireNonNull(topic, "topic must not be null");
		Objects.requireNonNull(text, "text must not be null");
	}
}
