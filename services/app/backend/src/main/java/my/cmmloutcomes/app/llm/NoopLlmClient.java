package my.cmmloutcomes.app.llm;

public class NoopLlmClient implements LlmClient {
	@Override
	public LlmResponse runJsonPrompt(String prompt, int maxOutputTokens) {
		throw new LlmRequestException("LLM disabled", null, false, null);
	}
}
