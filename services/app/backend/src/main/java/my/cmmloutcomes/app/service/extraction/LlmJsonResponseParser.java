package my.cmmloutcomes.app.service.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import my.cmmloutcomes.app.llm.LlmOutputException;

import java.util.List;

/**
 * Locates and parses the JSON object in a model answer that may carry code fences or prose
 * around it.
 */
public class LlmJsonResponseParser {
	private static final List<String> WRAPPER_KEYS = List.of("extraction", "result", "data", "response");

	private final ObjectMapper objectMapper;

	public LlmJsonResponseParser(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public JsonNode parse(String output) {
		if (output == null || output.isBlank()) {
			throw new LlmOutputException("LLM response is empty");
		}
		String candidate = locateObject(stripCodeFence(output.trim()));
		if (candidate == null) {
			throw new LlmOutputException("No JSON object found in LLM response");
		}
		JsonNode root;
		try {
			root = objectMapper.readTree(candidate);
		} catch (JsonProcessingException ex) {
			throw new LlmOutputException("LLM response is not valid JSON: " + ex.getOriginalMessage());
		}
		if (root == null || !root.isObject()) {
			throw new LlmOutputException("LLM response is not a JSON object");
		}
		return unwrap(root);
	}

	static String stripCodeFence(String text) {
		if (!text.startsWith("```")) {
			return text;
		}
		int firstNewline = text.indexOf('\n');
		int lastFence = text.lastIndexOf("```");
		if (firstNewline < 0 || lastFence <= firstNewline) {
			return text.substring(3);
		}
		return text.substring(firstNewline + 1, lastFence).trim();
	}

	/**
	 * Returns the first top-level {@code {...}} block with balanced braces, skipping braces inside
	 * string literals. Falls back to first-open to last-close brace when the scan never balances.
	 */
	static String locateObject(String text) {
		int start = text.indexOf('{');
		if (start < 0) {
			return null;
		}
		int depth = 0;
		boolean inString = false;
		boolean escaped = false;
		for (int i = start; i < text.length(); i++) {
			char c = text.charAt(i);
			if (inString) {
				if (escaped) {
					escaped = false;
				} else if (c == '\\') {
					escaped = true;
				} else if (c == '"') {
					inString = false;
				}
				continue;
			}
			if (c == '"') {
				inString = true;
			} else if (c == '{') {
				depth++;
			} else if (c == '}') {
				depth--;
				if (depth == 0) {
					return text.substring(start, i + 1);
				}
			}
		}
		int end = text.lastIndexOf('}');
		return end > start ? text.substring(start, end + 1) : null;
	}

	private JsonNode unwrap(JsonNode root) {
		if (root.size() != 1) {
			return root;
		}
		for (String key : WRAPPER_KEYS) {
			JsonNode inner = root.get(key);
			if (inner != null && inner.isObject()) {
				return inner;
			}
		}
		return root;
	}
}
