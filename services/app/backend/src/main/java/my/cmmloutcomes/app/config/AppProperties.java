package my.cmmloutcomes.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Llm llm,
		@Valid @NotNull Extraction extraction,
		Aggregation aggregation,
		Pipeline pipeline
) {
	public record Llm(
			@NotBlank String provider,
			OpenAi openai
	) {
		public record OpenAi(
				String apiKey,
				String baseUrl,
				String model,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}
	}

	public record Extraction(
			boolean generativeEnabled,
			Integer maxInputChars,
			Integer maxOutputTokens,
			Duration requestDelay,
			Integer maxAttempts,
			Duration retryBackoff,
			Double patternConfidence,
			Integer maxSupportingQuotes,
			@NotBlank String phraseTable,
			List<String> conditionTerms,
			Map<String, List<String>> drugSynonyms
	) {
	}

	public record Aggregation(
			Map<String, List<String>> combinedGroups
	) {
	}

	public record Pipeline(
			List<String> queryTemplates
	) {
	}
}
