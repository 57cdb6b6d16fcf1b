package my.cmmloutcomes.app.service.extraction;

import my.cmmloutcomes.app.domain.DocumentRecord;
import my.cmmloutcomes.app.domain.ExtractedClinicalRecord;
import my.cmmloutcomes.app.domain.ExtractionMethod;
import my.cmmloutcomes.app.domain.SubgroupSampleSizes;
import my.cmmloutcomes.app.llm.LlmOutputException;
import my.cmmloutcomes.app.llm.LlmRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns one document into one {@link ExtractedClinicalRecord} for a drug. Generative extraction is
 * tried first when enabled; any service or output failure falls back to pattern extraction, so a
 * record is always returned. Every record is range-validated and scored before it leaves here.
 */
public class ExtractionCoordinator {
	private static final Logger logger = LoggerFactory.getLogger(ExtractionCoordinator.class);
	static final String PATTERN_MODEL = "pattern";

	private final PatternExtractor patternExtractor;
	private final GenerativeExtractor generativeExtractor;
	private final RecordValidator validator;
	private final ConfidenceScorer confidenceScorer;
	private final DrugVocabulary vocabulary;
	private final GenerativeCircuitBreaker circuitBreaker;
	private final GenerativeCallThrottle throttle;
	private final ExtractionPolicy policy;

	public ExtractionCoordinator(PatternExtractor patternExtractor,
								 GenerativeExtractor generativeExtractor,
								 RecordValidator validator,
								 ConfidenceScorer confidenceScorer,
								 DrugVocabulary vocabulary,
								 GenerativeCircuitBreaker circuitBreaker,
								 GenerativeCallThrottle throttle,
								 ExtractionPolicy policy) {
		this.patternExtractor = patternExtractor;
		this.generativeExtractor = generativeExtractor;
		this.validator = validator;
		this.confidenceScorer = confidenceScorer;
		this.vocabulary = vocabulary;
		this.circuitBreaker = circuitBreaker;
		this.throttle = throttle;
		this.policy = policy;
	}

	public ExtractedClinicalRecord extract(DocumentRecord document, String drug) {
		return extract(document, drug, ExtractionMode.GENERATIVE_WITH_FALLBACK);
	}

	public ExtractedClinicalRecord extract(DocumentRecord document, String drug, ExtractionMode mode) {
		return extractWithOutcome(document, drug, mode).record();
	}

	public ExtractionOutcome extractWithOutcome(DocumentRecord document, String drug, ExtractionMode mode) {
		String failure = null;
		if (isGenerativeAvailable(mode)) {
			try {
				RawExtractionPayload payload = callGenerative(document, drug);
				return new ExtractionOutcome(fromGenerative(document, drug, payload), null);
			} catch (LlmRequestException ex) {
				circuitBreaker.recordFailure(ex);
				failure = "service error: " + ex.getMessage();
			} catch (LlmOutputException ex) {
				failure = "malformed response: " + ex.getMessage();
			} catch (RuntimeException ex) {
				logger.error("Unexpected generative extraction error for {}", document.identifier(), ex);
				failure = "unexpected error: " + ex.getClass().getSimpleName();
			}
			logger.warn("Generative extraction failed for {} ({}); falling back to pattern extraction.",
					document.identifier(), failure);
		}
		return new ExtractionOutcome(fromPattern(document, drug, failure), failure);
	}

	public boolean isGenerativeAvailable(ExtractionMode mode) {
		return mode != ExtractionMode.PATTERN_ONLY
				&& policy.generativeEnabled()
				&& generativeExtractor != null
				&& !circuitBreaker.isOpen();
	}

	public GenerativeCircuitBreaker getCircuitBreaker() {
		return circuitBreaker;
	}

	private RawExtractionPayload callGenerative(DocumentRecord document, String drug) {
		int maxAttempts = policy.maxAttempts();
		for (int attempt = 1; ; attempt++) {
			throttle.awaitTurn();
			try {
				return generativeExtractor.extract(document, drug);
			} catch (LlmRequestException ex) {
				if (!ex.isRetryable() || ex.isQuotaExceeded() || attempt >= maxAttempts) {
					throw ex;
				}
				long backoffMillis = policy.retryBackoff().toMillis() * (1L << Math.min(attempt - 1, 10));
				logger.info("Retrying generative extraction for {} (attempt {}/{}, status {}).",
						document.identifier(), attempt + 1, maxAttempts, ex.getStatusCode());
				if (backoffMillis > 0) {
					try {
						Thread.sleep(backoffMillis);
					} catch (InterruptedException iex) {
						Thread.currentThread().interrupt();
						throw ex;
					}
				}
			}
		}
	}

	private ExtractedClinicalRecord fromGenerative(DocumentRecord document, String drug, RawExtractionPayload payload) {
		List<String> warnings = new ArrayList<>(payload.warnings());
		ExtractedClinicalRecord draft = baseRecord(document, drug)
				.extractionMethod(ExtractionMethod.GENERATIVE)
				.model(payload.model())
				.overall(payload.overall())
				.rasMutant(payload.rasMutant())
				.nonRasMutant(payload.nonRasMutant())
				.sampleSize(payload.sampleSize())
				.subgroupSampleSizes(new SubgroupSampleSizes(payload.rasMutantSampleSize(), payload.nonRasMutantSampleSize()))
				.supportingQuotes(cap(payload.supportingQuotes()))
				.attribution(payload.attribution())
				.warnings(warnings)
				.build();
		ExtractedClinicalRecord validated = validator.validate(draft);
		boolean declaredNone = Boolean.FALSE.equals(payload.hasEvidence());
		if (declaredNone && validated.hasAnyMetric()) {
			List<String> withNote = new ArrayList<>(validated.warnings());
			withNote.add("Model reported no evidence; " + validated.numericFieldCount() + " extracted values discarded.");
			validated = validated.toBuilder().warnings(withNote).build();
		}
		boolean hasEvidence = !declaredNone
				&& (validated.hasAnyMetric() || Boolean.TRUE.equals(payload.hasEvidence()));
		return finish(validated, hasEvidence, payload.selfReportedConfidence());
	}

	private ExtractedClinicalRecord fromPattern(DocumentRecord document, String drug, String generativeFailure) {
		List<String> warnings = new ArrayList<>();
		if (generativeFailure != null) {
			warnings.add("Generative extraction failed (" + generativeFailure + "); used pattern extraction.");
		}
		String text = document.content();
		PatternExtraction extraction;
		if (vocabulary.isRelevant(text, drug)) {
			extraction = patternExtractor.extract(text);
		} else {
			extraction = PatternExtraction.empty();
			warnings.add("Text does not mention " + drug + " together with the target condition.");
		}
		ExtractedClinicalRecord draft = baseRecord(document, drug)
				.extractionMethod(ExtractionMethod.PATTERN)
				.model(PATTERN_MODEL)
				.overall(extraction.overall())
				.rasMutant(extraction.rasMutant())
				.nonRasMutant(extraction.nonRasMutant())
				.sampleSize(extraction.sampleSize())
				.supportingQuotes(cap(extraction.supportingQuotes()))
				.warnings(warnings)
				.build();
		ExtractedClinicalRecord validated = validator.validate(draft);
		return finish(validated, validated.hasAnyMetric(), null);
	}

	private ExtractedClinicalRecord finish(ExtractedClinicalRecord validated, boolean hasEvidence, Double selfReported) {
		ExtractedClinicalRecord decided = hasEvidence
				? validated.toBuilder().hasEvidence(true).build()
				: validator.stripMetrics(validated);
		double confidence = confidenceScorer.score(decided, selfReported);
		return decided.toBuilder().confidence(confidence).build();
	}

	private ExtractedClinicalRecord.Builder baseRecord(DocumentRecord document, String drug) {
		return ExtractedClinicalRecord.builder(document.identifier(), DrugVocabulary.normalizeDrug(drug))
				.title(document.title())
				.citation(document.citation());
	}

	private List<String> cap(List<String> quotes) {
		if (quotes.size() <= policy.maxSupportingQuotes()) {
			return quotes;
		}
		return quotes.subList(0, policy.maxSupportingQuotes());
	}
}
