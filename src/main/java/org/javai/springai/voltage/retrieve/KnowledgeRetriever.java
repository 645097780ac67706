package org.javai.springai.voltage.retrieve;

import java.util.List;

/**
 * Finds reference snippets relevant to a question.
 */
@FunctionalInterface
public interface KnowledgeRetriever {

	/**
	 * @param query the user's question
	 * @return relevant snippets, best first; an empty list when nothing matches
	 */
	List<String> retrieve(String query);
}
