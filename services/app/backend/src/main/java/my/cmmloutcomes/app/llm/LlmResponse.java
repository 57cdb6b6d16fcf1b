package my.cmmloutcomes.app.llm;

public record LlmResponse(String output, String model) {
}
