package my.cmmloutcomes.app.service;

import my.cmmloutcomes.app.domain.DocumentRecord;
import my.cmmloutcomes.app.domain.ExtractedClinicalRecord;
import my.cmmloutcomes.app.domain.ExtractionMethod;
import my.cmmloutcomes.app.service.evidence.EvidenceStore;
import my.cmmloutcomes.app.service.evidence.LiteratureSource;
import my.cmmloutcomes.app.service.evidence.RecordDeduplicator;
import my.cmmloutcomes.app.service.extraction.ExtractionCoordinator;
import my.cmmloutcomes.app.service.extraction.ExtractionMode;
import my.cmmloutcomes.app.service.extraction.ExtractionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Single entry point for one drug: deduplicate documents, extract each one sequentially, merge the
 * records and store them. One failing document never stops the run.
 */
@Service
public class EvidencePipelineService {
	private static final Logger logger = LoggerFactory.getLogger(EvidencePipelineService.class);

	private final ExtractionCoordinator coordinator;
	private final RecordDeduplicator deduplicator;
	private final EvidenceStore evidenceStore;
	private final QueryPlanner queryPlanner;
	private final ObjectProvider<LiteratureSource> literatureSource;

	public EvidencePipelineService(ExtractionCoordinator coordinator,
								   RecordDeduplicator deduplicator,
								   EvidenceStore evidenceStore,
								   QueryPlanner queryPlanner,
								   ObjectProvider<LiteratureSource> literatureSource) {
		this.coordinator = coordinator;
		this.deduplicator = deduplicator;
		this.evidenceStore = evidenceStore;
		this.queryPlanner = queryPlanner;
		this.literatureSource = literatureSource;
	}

	/**
	 * Runs every configured search query for the drug through the literature source, then
	 * {@link #run(String, List, ExtractionMode)} on the combined results.
	 */
	public PipelineRunSummary collect(String drug, ExtractionMode mode) {
		LiteratureSource source = literatureSource.getIfAvailable();
		if (source == null) {
			throw new IllegalStateException("No literature source configured");
		}
		List<DocumentRecord> documents = new ArrayList<>();
		for (String query : queryPlanner.queriesFor(drug)) {
			List<DocumentRecord> found = source.search(query);
			logger.info("Query '{}' returned {} documents.", query, found == null ? 0 : found.size());
			if (found != null) {
				documents.addAll(found);
			}
		}
		return run(drug, documents, mode);
	}

	public PipelineRunSummary run(String drug, List<DocumentRecord> documents, ExtractionMode mode) {
		if (drug == null || drug.isBlank()) {
			throw new IllegalArgumentException("Drug is required");
		}
		ExtractionMode effectiveMode = mode == null ? ExtractionMode.GENERATIVE_WITH_FALLBACK : mode;
		List<DocumentRecord> received = documents == null ? List.of() : documents;
		List<DocumentRecord> unique = deduplicator.mergeDocuments(received);
		logger.info("Extracting {} evidence from {} unique documents ({} received, mode={}).",
				drug, unique.size(), received.size(), effectiveMode);

		List<ExtractedClinicalRecord> extracted = new ArrayList<>();
		int fallbacks = 0;
		for (DocumentRecord document : unique) {
			ExtractionOutcome outcome = coordinator.extractWithOutcome(document, drug, effectiveMode);
			if (outcome.fellBack()) {
				fallbacks++;
			}
			extracted.add(outcome.record());
		}

		List<ExtractedClinicalRecord> merged = deduplicator.mergeToList(extracted);
		List<ExtractedClinicalRecord> stored = new ArrayList<>();
		int withEvidence = 0;
		int generative = 0;
		int pattern = 0;
		for (ExtractedClinicalRecord record : merged) {
			// the store may keep a better record from an earlier run; report what it holds
			ExtractedClinicalRecord kept = evidenceStore.put(record);
			stored.add(kept);
			if (kept.hasEvidence()) {
				withEvidence++;
			}
			if (kept.extractionMethod() == ExtractionMethod.GENERATIVE) {
				generative++;
			} else {
				pattern++;
			}
		}
		boolean generativeDisabled = coordinator.getCircuitBreaker().isOpen();
		logger.info("Finished {}: {} records with evidence, {} generative, {} pattern, {} fallbacks{}.",
				drug, withEvidence, generative, pattern, fallbacks,
				generativeDisabled ? " (generative extraction disabled)" : "");
		return new PipelineRunSummary(drug, received.size(), unique.size(), withEvidence, generative, pattern,
				fallbacks, generativeDisabled, stored);
	}
}
