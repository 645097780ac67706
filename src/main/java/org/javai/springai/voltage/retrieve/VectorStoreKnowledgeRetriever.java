package org.javai.springai.voltage.retrieve;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

/**
 * Retriever backed by a Spring AI {@link VectorStore} similarity search.
 */
public class VectorStoreKnowledgeRetriever implements KnowledgeRetriever {

	private static final Logger logger = LoggerFactory.getLogger(VectorStoreKnowledgeRetriever.class);

	private final VectorStore vectorStore;
	private final int topK;

	public VectorStoreKnowledgeRetriever(VectorStore vectorStore, int topK) {
		this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore must not be null");
		if (topK < 1) {
			throw new IllegalArgumentException("topK must be at least 1");
		}
		this.topK = topK;
	}

	@Override
	public List<String> retrieve(String query) {
		if (query == null || query.isBlank()) {
			return List.of();
		}
		List<Document> documents = vectorStore.similaritySearch(
				SearchRequest.builder().query(query).topK(topK).build());
		if (documents == null) {
			return List.of();
		}
		logger.debug("Vector search returned {} documents", documents.size());
		return documents.stream()
				.map(Document::getText)
				.filter(Objects::nonNull)
				.toList();
	}
}
