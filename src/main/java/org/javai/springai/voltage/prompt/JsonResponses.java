package org.javai.springai.voltage.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a JSON object from a model response that may wrap it in a markdown code block
 * or surround it with prose.
 */
public final class JsonResponses {

	private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
	private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*\\n?(\\{.*?\\})\\s*```", Pattern.DOTALL);

	private JsonResponses() {
	}

	/**
	 * Parse the first JSON object found in the response.
	 *
	 * @param response raw model output
	 * @return the parsed object, or empty if the response holds no valid JSON object
	 */
	public static Optional<JsonNode> parseObject(String response) {
		return extractJsonContent(response).flatMap(JsonResponses::readTree);
	}

	static Optional<String> extractJsonContent(String response) {
		if (response == null || response.isBlank()) {
			return Optional.empty();
		}
		String trimmed = response.trim();
		Matcher matcher = JSON_BLOCK_PATTERN.matcher(trimmed);
		if (matcher.find()) {
			return Optional.of(matcher.group(1).trim());
		}
		if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
			return Optional.of(trimmed);
		}
		int start = trimmed.indexOf('{');
		int end = trimmed.lastIndexOf('}');
		if (start >= 0 && end > start) {
			return Optional.of(trimmed.substring(start, end + 1));
		}
		return Optional.empty();
	}

	private static Optional<JsonNode> readTree(String json) {
		try {
			JsonNode node = JSON_MAPPER.readTree(json);
			return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
		}
		catch (JsonProcessingException e) {
			return Optional.empty();
		}
	}
}
