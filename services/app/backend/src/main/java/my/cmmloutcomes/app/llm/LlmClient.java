package my.cmmloutcomes.app.llm;

public interface LlmClient {
	/**
	 * Sends a single prompt that asks for a JSON object and returns the raw model output.
	 *
	 * @throws LlmRequestException when the service cannot be reached or rejects the request
	 */
	LlmResponse runJsonPrompt(String prompt, int maxOutputTokens);
}
