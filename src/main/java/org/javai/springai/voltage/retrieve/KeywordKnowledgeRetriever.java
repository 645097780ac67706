package org.javai.springai.voltage.retrieve;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import org.yaml.snakeyaml.Yaml;

/**
 * Offline retriever over a small YAML corpus, scored by IDF-weighted token overlap (BM25 style).
 *
 * <p>The corpus format is:</p>
 * <pre>{@code
 * documents:
 *   - topic: Nose point
 *     text: The nose point is ...
 * }</pre>
 *
 * <p>Statistics are computed once at construction; instances are immutable and thread-safe.</p>
 */
public final class KeywordKnowledgeRetriever implements KnowledgeRetriever {

	public static final String DEFAULT_CORPUS = "knowledge/voltage-stability.yaml";

	private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{Nd}]{3,}");
	private static final Set<String> STOP_WORDS = Set.of(
			"the", "and", "what", "why", "how", "does", "this", "that", "are", "for", "with", "from", "when", "which");
	private static final double K1 = 1.2;
	private static final double B = 0.75;

	private final List<KnowledgeDocument> documents;
	private final List<String[]> documentTokens;
	private final Map<String, Double> idf;
	private final double avgDocLen;
	private final int topK;

	public KeywordKnowledgeRetriever(List<KnowledgeDocument> documents, int topK) {
		Objects.requireNonNull(documents, "documents must not be null");
		if (topK < 1) {
			throw new IllegalArgumentException("topK must be at least 1");
		}
		this.documents = List.copyOf(documents);
		this.topK = topK;

		List<String[]> tokens = new ArrayList<>(this.documents.size());
		Map<String, Integer> df = new HashMap<>();
		long totalLen = 0;
		for (KnowledgeDocument document : this.documents) {
			String[] docTokens = tokenize(document.topic() + " " + document.text());
			tokens.add(docTokens);
			totalLen += docTokens.length;
			for (String token : new HashSet<>(List.of(docTokens))) {
				df.merge(token, 1, Integer::sum);
			}
		}
		double n = Math.max(1.0, this.documents.size());
		Map<String, Double> idfLocal = new HashMap<>();
		df.forEach((token, count) -> idfLocal.put(token, Math.log((n + 1.0) / (count + 1.0)) + 1.0));

		this.documentTokens = List.copyOf(tokens);
		this.idf = Collections.unmodifiableMap(idfLocal);
		this.avgDocLen = Math.max(1.0, totalLen / n);
	}

	/**
	 * Load the bundled corpus from the classpath.
	 */
	public static KeywordKnowledgeRetriever fromClasspath(int topK) {
		return fromClasspath(DEFAULT_CORPUS, topK);
	}

	/**
	 * Load a corpus from a classpath resource.
	 *
	 * @throws KnowledgeLoadException if the resource is missing or malformed
	 */
	public static KeywordKnowledgeRetriever fromClasspath(String resource, int topK) {
		ClassLoader loader = KeywordKnowledgeRetriever.class.getClassLoader();
		try (InputStream in = loader.getResourceAsStream(resource)) {
			if (in == null) {
				throw new KnowledgeLoadException("Knowledge corpus not found on classpath: " + resource);
			}
			return new KeywordKnowledgeRetriever(parse(new Yaml().load(in)), topK);
		}
		catch (KnowledgeLoadException e) {
			throw e;
		}
		catch (Exception e) {
			throw new KnowledgeLoadException("Failed to load knowledge corpus: " + resource, e);
		}
	}

	@SuppressWarnings("unchecked")
	static List<KnowledgeDocument> parse(Object data) {
		if (!(data instanceof Map<?, ?> root) || !(root.get("documents") instanceof List<?> entries)) {
			throw new KnowledgeLoadException("Knowledge corpus must have a 'documents' list");
		}
		List<KnowledgeDocument> documents = new ArrayList<>();
		for (Object entry : entries) {
			Map<String, Object> map = (Map<String, Object>) entry;
			Object topic = map.get("topic");
			Object text = map.get("text");
			if (topic == null || text == null) {
				throw new KnowledgeLoadException("Knowledge document needs 'topic' and 'text': " + map);
			}
			documents.add(new KnowledgeDocument(topic.toString(), text.toString().trim()));
		}
		return documents;
	}

	public List<KnowledgeDocument> documents() {
		return documents;
	}

	@Override
	public List<String> retrieve(String query) {
		if (query == null || query.isBlank() || documents.isEmpty()) {
			return List.of();
		}
		Set<String> queryTokens = new HashSet<>(List.of(tokenize(query)));
		if (queryTokens.isEmpty()) {
			return List.of();
		}
		List<Scored> scored = new ArrayList<>();
		for (int i = 0; i < documents.size(); i++) {
			double score = score(queryTokens, documentTokens.get(i));
			if (score > 0.0) {
				scored.add(new Scored(i, score));
			}
		}
		return scored.stream()
				.sorted(Comparator.comparingDouble(Scored::score).reversed().thenComparingInt(Scored::index))
				.limit(topK)
				.map(s -> documents.get(s.index()).text())
				.toList();
	}

	private double score(Set<String> queryTokens, String[] docTokens) {
		if (docTokens.length == 0) {
			return 0.0;
		}
		Map<String, Integer> tf = new HashMap<>();
		for (String token : docTokens) {
			tf.merge(token, 1, Integer::sum);
		}
		double norm = (1.0 - B) + B * (docTokens.length / avgDocLen);
		double sum = 0.0;
		for (String token : queryTokens) {
			Integer f = tf.get(token);
			if (f == null) {
				continue;
			}
			double tfPart = (f * (K1 + 1.0)) / (f + K1 * norm);
			sum += idf.getOrDefault(token, 1.0) * tfPart;
		}
		return sum;
	}

	private static String[] tokenize(String text) {
		return WORD.matcher(text.toLowerCase(Locale.ROOT))
				.results()
				.map(MatchResult::group)
				.filter(token -> !STOP_WORDS.contains(token))
				.toArray(String[]::new);
	}

	private record Scored(int index, double score) {
	}
}
