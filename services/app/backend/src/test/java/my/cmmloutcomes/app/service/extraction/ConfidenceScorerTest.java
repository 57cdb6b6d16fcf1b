package my.cmmloutcomes.app.service.extraction;

import my.cmmloutcomes.app.domain.ExtractedClinicalRecord;
import my.cmmloutcomes.app.domain.ExtractionMethod;
import my.cmmloutcomes.app.domain.Metric;
import my.cmmloutcomes.app.domain.MetricSet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static my.cmmloutcomes.app.support.TestFixtures.metrics;
import static my.cmmloutcomes.app.support.TestFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceScorerTest {
	private final ConfidenceScorer scorer = new ConfidenceScorer(0.3);

	@Test
	void patternRecordsGetFixedScore() {
		ExtractedClinicalRecord record = record("PMID1", "azacitidine", 0.0, metrics(Metric.COMPLETE_RESPONSE, 20))
				.toBuilder()
				.extractionMethod(ExtractionMethod.PATTERN)
				.build();

		assertThat(scorer.score(record, 0.95)).isEqualTo(0.3);
	}

	@Test
	void selfReportedConfidenceIsClamped() {
		ExtractedClinicalRecord record = record("PMID1", "azacitidine", 0.0, metrics(Metric.COMPLETE_RESPONSE, 20));

		assertThat(scorer.score(record, 0.82)).isEqualTo(0.82);
		assertThat(scorer.score(record, 1.4)).isEqualTo(1.0);
		assertThat(scorer.score(record, -0.2)).isEqualTo(0.0);
	}

	@Test
	void heuristicUsedWithoutSelfReport() {
		ExtractedClinicalRecord record = record("PMID1", "azacitidine", 0.0, metrics(Metric.COMPLETE_RESPONSE, 20))
				.toBuilder()
				.supportingQuotes(List.of("q1"))
				.build();

		double expected = 0.5 + 0.4 * (1.0 / ConfidenceScorer.TOTAL_FIELDS) + 0.1 / 3.0;
		assertThat(scorer.score(record, null)).isCloseTo(expected, within(1e-9));
	}

	@Test
	void heuristicBounds() {
		assertThat(scorer.heuristic(0, 0)).isEqualTo(0.5);
		assertThat(scorer.heuristic(ConfidenceScorer.TOTAL_FIELDS, 3)).isCloseTo(1.0, within(1e-9));
		assertThat(scorer.heuristic(100, 100)).isCloseTo(1.0, within(1e-9));
	}

	@Test
	void subgroupFieldsRaiseTheScoreBeyondAFullOverallSet() {
		ExtractedClinicalRecord overallOnly = fullyPopulated().build();
		ExtractedClinicalRecord withSubgroups = fullyPopulated()
				.rasMutant(metrics(Metric.OVERALL_RESPONSE_RATE, 30))
				.nonRasMutant(metrics(Metric.OVERALL_RESPONSE_RATE, 50))
				.build();

		assertThat(scorer.score(withSubgroups, null)).isGreaterThan(scorer.score(overallOnly, null));
		assertThat(scorer.score(withSubgroups, null)).isLessThan(1.0);
	}

	private static ExtractedClinicalRecord.Builder fullyPopulated() {
		MetricSet.Builder all = MetricSet.builder();
		for (Metric metric : Metric.values()) {
			all.put(metric, 10.0);
		}
		return record("PMID1", "azacitidine", 0.0, all.build()).toBuilder();
	}

	@Test
	void heuristicNeverDecreasesWithMoreFieldsOrQuotes() {
		for (int fields = 0; fields < 40; fields++) {
			for (int quotes = 0; quotes < 6; quotes++) {
				double score = scorer.heuristic(fields, quotes);
				assertThat(scorer.heuristic(fields + 1, quotes)).isGreaterThanOrEqualTo(score);
				assertThat(scorer.heuristic(fields, quotes + 1)).isGreaterThanOrEqualTo(score);
			}
		}
	}
}
