package my.cmmloutcomes.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import my.cmmloutcomes.app.llm.LlmClient;
import my.cmmloutcomes.app.llm.NoopLlmClient;
import my.cmmloutcomes.app.service.QueryPlanner;
import my.cmmloutcomes.app.service.extraction.ConfidenceScorer;
import my.cmmloutcomes.app.service.extraction.DrugVocabulary;
import my.cmmloutcomes.app.service.extraction.ExtractionCoordinator;
import my.cmmloutcomes.app.service.extraction.ExtractionPolicy;
import my.cmmloutcomes.app.service.extraction.GenerativeCallThrottle;
import my.cmmloutcomes.app.service.extraction.GenerativeCircuitBreaker;
import my.cmmloutcomes.app.service.extraction.GenerativeExtractor;
import my.cmmloutcomes.app.service.extraction.PatternExtractor;
import my.cmmloutcomes.app.service.extraction.PatternPhraseTable;
import my.cmmloutcomes.app.service.extraction.RecordValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@Configuration
public class ExtractionConfig {
	private static final Logger logger = LoggerFactory.getLogger(ExtractionConfig.class);

	@Bean
	public PatternPhraseTable patternPhraseTable(AppProperties properties, ResourceLoader resourceLoader) {
		String location = properties.extraction().phraseTable();
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			throw new IllegalStateException("Phrase table not found: " + location);
		}
		try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
			PatternPhraseTable table = PatternPhraseTable.load(reader, location);
			logger.info("Loaded pattern phrase table from {}.", location);
			return table;
		} catch (IOException ex) {
			throw new IllegalStateException("Failed to read phrase table " + location, ex);
		}
	}

	@Bean
	public PatternExtractor patternExtractor(PatternPhraseTable phraseTable) {
		return new PatternExtractor(phraseTable);
	}

	@Bean
	public GenerativeExtractor generativeExtractor(LlmClient llmClient, ObjectMapper objectMapper, AppProperties properties) {
		AppProperties.Extraction extraction = properties.extraction();
		return new GenerativeExtractor(llmClient, objectMapper,
				valueOrDefault(extraction.maxInputChars(), 100_000),
				valueOrDefault(extraction.maxOutputTokens(), 2048),
				valueOrDefault(extraction.maxSupportingQuotes(), 10));
	}

	@Bean
	public RecordValidator recordValidator() {
		return new RecordValidator();
	}

	@Bean
	public ConfidenceScorer confidenceScorer(AppProperties properties) {
		Double patternConfidence = properties.extraction().patternConfidence();
		return new ConfidenceScorer(patternConfidence == null ? 0.3 : patternConfidence);
	}

	@Bean
	public DrugVocabulary drugVocabulary(AppProperties properties) {
		Map<String, List<String>> synonyms = properties.extraction().drugSynonyms();
		List<String> conditionTerms = properties.extraction().conditionTerms();
		return new DrugVocabulary(synonyms == null ? Map.of() : synonyms, conditionTerms == null ? List.of() : conditionTerms);
	}

	@Bean
	public GenerativeCircuitBreaker generativeCircuitBreaker() {
		return new GenerativeCircuitBreaker();
	}

	@Bean
	public GenerativeCallThrottle generativeCallThrottle(AppProperties properties) {
		Duration delay = properties.extraction().requestDelay();
		return new GenerativeCallThrottle(delay == null ? Duration.ofSeconds(3) : delay);
	}

	@Bean
	public ExtractionPolicy extractionPolicy(AppProperties properties, LlmClient llmClient) {
		AppProperties.Extraction extraction = properties.extraction();
		boolean generativeEnabled = extraction.generativeEnabled() && !(llmClient instanceof NoopLlmClient);
		if (extraction.generativeEnabled() && !generativeEnabled) {
			logger.info("Generative extraction requested but no LLM provider is configured; using pattern extraction.");
		}
		return new ExtractionPolicy(generativeEnabled,
				valueOrDefault(extraction.maxAttempts(), 1),
				extraction.retryBackoff() == null ? Duration.ofSeconds(2) : extraction.retryBackoff(),
				valueOrDefault(extraction.maxSupportingQuotes(), 10));
	}

	@Bean
	public ExtractionCoordinator extractionCoordinator(PatternExtractor patternExtractor,
													   GenerativeExtractor generativeExtractor,
													   RecordValidator recordValidator,
													   ConfidenceScorer confidenceScorer,
													   DrugVocabulary drugVocabulary,
													   GenerativeCircuitBreaker circuitBreaker,
													   GenerativeCallThrottle throttle,
													   ExtractionPolicy policy) {
		return new ExtractionCoordinator(patternExtractor, generativeExtractor, recordValidator, confidenceScorer,
				drugVocabulary, circuitBreaker, throttle, policy);
	}

	@Bean
	public QueryPlanner queryPlanner(AppProperties properties) {
		AppProperties.Pipeline pipeline = properties.pipeline();
		return new QueryPlanner(pipeline == null ? List.of() : pipeline.queryTemplates());
	}

	private static int valueOrDefault(Integer value, int fallback) {
		return value == null ? fallback : value;
	}
}
