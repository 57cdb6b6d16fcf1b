package my.cmmloutcomes.app.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import my.cmmloutcomes.app.domain.DocumentRecord;
import my.cmmloutcomes.app.domain.ExtractedClinicalRecord;
import my.cmmloutcomes.app.domain.ExtractionMethod;
import my.cmmloutcomes.app.domain.Metric;
import my.cmmloutcomes.app.llm.LlmClient;
import my.cmmloutcomes.app.llm.LlmRequestException;
import my.cmmloutcomes.app.service.evidence.EvidenceStore;
import my.cmmloutcomes.app.service.evidence.LiteratureSource;
import my.cmmloutcomes.app.service.evidence.RecordDeduplicator;
import my.cmmloutcomes.app.service.extraction.ConfidenceScorer;
import my.cmmloutcomes.app.service.extraction.ExtractionCoordinator;
import my.cmmloutcomes.app.service.extraction.ExtractionMode;
import my.cmmloutcomes.app.service.extraction.ExtractionPolicy;
import my.cmmloutcomes.app.service.extraction.GenerativeCallThrottle;
import my.cmmloutcomes.app.service.extraction.GenerativeCircuitBreaker;
import my.cmmloutcomes.app.service.extraction.GenerativeExtractor;
import my.cmmloutcomes.app.service.extraction.PatternExtractor;
import my.cmmloutcomes.app.service.extraction.RecordValidator;
import my.cmmloutcomes.app.support.TestFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EvidencePipelineServiceTest {
	private final LlmClient llmClient = mock(LlmClient.class);
	private final LiteratureSource literatureSource = mock(LiteratureSource.class);
	@SuppressWarnings("unchecked")
	private final ObjectProvider<LiteratureSource> sourceProvider = mock(ObjectProvider.class);
	private final EvidenceStore store = new EvidenceStore();
	private final EvidencePipelineService pipeline = new EvidencePipelineService(
			new ExtractionCoordinator(
					new PatternExtractor(TestFixtures.defaultPhraseTable()),
					new GenerativeExtractor(llmClient, new ObjectMapper(), 100_000, 2048, 10),
					new RecordValidator(),
					new ConfidenceScorer(0.3),
					TestFixtures.defaultVocabulary(),
					new GenerativeCircuitBreaker(),
					new GenerativeCallThrottle(Duration.ZERO),
					new ExtractionPolicy(true, 1, Duration.ZERO, 10)),
			new RecordDeduplicator(),
			store,
			new QueryPlanner(List.of("{drug} CMML", "{drug} chronic myelomonocytic leukemia")),
			sourceProvider
	);

	@Test
	void deduplicatesDocumentsAndStoresOneRecordEach() {
		DocumentRecord first = TestFixtures.document("PMID1", "Decitabine in CMML: overall response rate 40%.");
		DocumentRecord repeat = TestFixtures.document("PMID1", "Decitabine in CMML: overall response rate 40%.");
		DocumentRecord unrelated = TestFixtures.document("PMID2", "Decitabine in AML: overall response rate 35%.");

		PipelineRunSummary summary = pipeline.run("decitabine", List.of(first, repeat, unrelated), ExtractionMode.PATTERN_ONLY);

		assertThat(summary.documentsReceived()).isEqualTo(3);
		assertThat(summary.uniqueDocuments()).isEqualTo(2);
		assertThat(summary.recordsWithEvidence()).isEqualTo(1);
		assertThat(summary.patternRecords()).isEqualTo(2);
		assertThat(summary.fallbacks()).isZero();
		assertThat(store.records("decitabine")).hasSize(2);
		assertThat(store.get("decitabine", "PMID1"))
				.hasValueSatisfying(record -> assertThat(record.overall().get(Metric.OVERALL_RESPONSE_RATE)).isEqualTo(40.0));
	}

	@Test
	void countsFallbacksWhenModelFails() {
		when(llmClient.runJsonPrompt(anyString(), anyInt()))
				.thenThrow(new LlmRequestException("Internal error", 500, false, null));
		DocumentRecord document = TestFixtures.document("PMID3", "Azacitidine in CMML: complete response 18%.");

		PipelineRunSummary summary = pipeline.run("azacitidine", List.of(document), ExtractionMode.GENERATIVE_WITH_FALLBACK);

		assertThat(summary.fallbacks()).isEqualTo(1);
		assertThat(summary.generativeDisabled()).isFalse();
		ExtractedClinicalRecord record = summary.records().get(0);
		assertThat(record.overall().get(Metric.COMPLETE_RESPONSE)).isEqualTo(18.0);
	}

	@Test
	void reportsTheRecordTheStoreKeeps() {
		store.put(TestFixtures.record("PMID5", "azacitidine", 0.9,
				TestFixtures.metrics(Metric.COMPLETE_RESPONSE, 22, Metric.OVERALL_RESPONSE_RATE, 48)));
		DocumentRecord document = TestFixtures.document("PMID5", "Azacitidine in CMML was well tolerated.");

		PipelineRunSummary summary = pipeline.run("azacitidine", List.of(document), ExtractionMode.PATTERN_ONLY);

		assertThat(summary.generativeRecords()).isEqualTo(1);
		assertThat(summary.patternRecords()).isZero();
		assertThat(summary.recordsWithEvidence()).isEqualTo(1);
		assertThat(summary.records()).singleElement()
				.satisfies(record -> assertThat(record.extractionMethod()).isEqualTo(ExtractionMethod.GENERATIVE));
	}

	@Test
	void collectSearchesEveryQueryTemplate() {
		when(sourceProvider.getIfAvailable()).thenReturn(literatureSource);
		DocumentRecord document = TestFixtures.document("PMID4", "Azacitidine in CMML: partial response 12%.");
		when(literatureSource.search("azacitidine CMML")).thenReturn(List.of(document));
		when(literatureSource.search("azacitidine chronic myelomonocytic leukemia")).thenReturn(List.of(document));

		PipelineRunSummary summary = pipeline.collect("azacitidine", ExtractionMode.PATTERN_ONLY);

		verify(literatureSource).search("azacitidine CMML");
		verify(literatureSource).search("azacitidine chronic myelomonocytic leukemia");
		assertThat(summary.documentsReceived()).isEqualTo(2);
		assertThat(summary.uniqueDocuments()).isEqualTo(1);
		assertThat(summary.recordsWithEvidence()).isEqualTo(1);
	}

	@Test
	void collectRequiresLiteratureSource() {
		assertThatThrownBy(() -> pipeline.collect("azacitidine", ExtractionMode.PATTERN_ONLY))
				.isInstanceOf(IllegalStateException.class);
	}
}
