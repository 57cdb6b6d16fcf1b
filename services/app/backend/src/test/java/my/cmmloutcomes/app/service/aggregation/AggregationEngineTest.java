package my.cmmloutcomes.app.service.aggregation;

import my.cmmloutcomes.app.domain.ExtractedClinicalRecord;
import my.cmmloutcomes.app.domain.Metric;
import my.cmmloutcomes.app.domain.Subgroup;
import my.cmmloutcomes.app.domain.SubgroupSampleSizes;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static my.cmmloutcomes.app.support.TestFixtures.metrics;
import static my.cmmloutcomes.app.support.TestFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AggregationEngineTest {
	private final AggregationEngine engine = new AggregationEngine();

	@Test
	void evenCountMedianAveragesCentralValues() {
		List<ExtractedClinicalRecord> records = List.of(
				record("A", "azacitidine", 0.8, metrics(Metric.COMPLETE_RESPONSE, 10)),
				record("B", "azacitidine", 0.8, metrics(Metric.COMPLETE_RESPONSE, 20)),
				record("C", "azacitidine", 0.8, metrics(Metric.COMPLETE_RESPONSE, 30)),
				record("D", "azacitidine", 0.8, metrics(Metric.COMPLETE_RESPONSE, 40))
		);

		MetricStatistics stats = engine.aggregate(records, Selector.forDrug("azacitidine"))
				.statistics(Metric.COMPLETE_RESPONSE);

		assertThat(stats.count()).isEqualTo(4);
		assertThat(stats.median()).isEqualTo(25.0);
		assertThat(stats.mean()).isEqualTo(25.0);
		assertThat(stats.min()).isEqualTo(10.0);
		assertThat(stats.max()).isEqualTo(40.0);
		assertThat(stats.standardDeviation()).isCloseTo(Math.sqrt(125.0), within(1e-9));
	}

	@Test
	void oddCountMedianIsMiddleValue() {
		MetricStatistics stats = AggregationEngine.statistics(List.of(9.0, 3.0, 5.0));

		assertThat(stats.median()).isEqualTo(5.0);
		assertThat(stats.standardDeviation()).isCloseTo(Math.sqrt(56.0 / 9.0), within(1e-9));
	}

	@Test
	void compositeTreatsMissingTermsAsZero() {
		ExtractedClinicalRecord record = record("A", "azacitidine", 0.8,
				metrics(Metric.COMPLETE_RESPONSE, 10, Metric.MARROW_RESPONSE, 5));

		AggregationResult result = engine.aggregate(List.of(record), Selector.all());

		assertThat(result.compositeResponseRate().count()).isEqualTo(1);
		assertThat(result.compositeResponseRate().mean()).isEqualTo(15.0);
		assertThat(result.statistics(Metric.PARTIAL_RESPONSE).hasData()).isFalse();
	}

	@Test
	void compositeSkipsRecordsWithoutAnyTerm() {
		List<ExtractedClinicalRecord> records = List.of(
				record("A", "azacitidine", 0.8, metrics(Metric.COMPLETE_RESPONSE, 10, Metric.PARTIAL_RESPONSE, 20)),
				record("B", "azacitidine", 0.8, metrics(Metric.OVERALL_SURVIVAL, 18))
		);

		AggregationResult result = engine.aggregate(records, Selector.all());

		assertThat(result.recordCount()).isEqualTo(2);
		assertThat(result.compositeResponseRate().count()).isEqualTo(1);
		assertThat(result.compositeResponseRate().median()).isEqualTo(30.0);
	}

	@Test
	void emptySelectionGivesNoDataSentinelNotZero() {
		List<ExtractedClinicalRecord> records = List.of(
				record("A", "azacitidine", 0.8, metrics(Metric.COMPLETE_RESPONSE, 0))
		);

		AggregationResult empty = engine.aggregate(records, Selector.forDrug("hydroxyurea"));
		AggregationResult zero = engine.aggregate(records, Selector.forDrug("azacitidine"));

		assertThat(empty.recordCount()).isZero();
		assertThat(empty.statistics(Metric.COMPLETE_RESPONSE)).isEqualTo(MetricStatistics.noData());
		assertThat(empty.statistics(Metric.COMPLETE_RESPONSE).mean()).isNull();
		assertThat(empty.totalSampleSize()).isNull();
		assertThat(zero.statistics(Metric.COMPLETE_RESPONSE).hasData()).isTrue();
		assertThat(zero.statistics(Metric.COMPLETE_RESPONSE).mean()).isEqualTo(0.0);
	}

	@Test
	void multiDrugSelectionPoolsRecordsInsteadOfAveragingDrugs() {
		List<ExtractedClinicalRecord> records = List.of(
				record("A", "azacitidine", 0.8, metrics(Metric.OVERALL_RESPONSE_RATE, 10)),
				record("B", "azacitidine", 0.8, metrics(Metric.OVERALL_RESPONSE_RATE, 20)),
				record("C", "decitabine", 0.8, metrics(Metric.OVERALL_RESPONSE_RATE, 60)),
				record("D", "hydroxyurea", 0.8, metrics(Metric.OVERALL_RESPONSE_RATE, 90))
		);

		MetricStatistics pooled = engine.aggregate(records, Selector.forDrugs("azacitidine", "decitabine"))
				.statistics(Metric.OVERALL_RESPONSE_RATE);

		assertThat(pooled.count()).isEqualTo(3);
		assertThat(pooled.mean()).isEqualTo(30.0);
		assertThat(pooled.median()).isEqualTo(20.0);
	}

	@Test
	void excludesRecordsWithoutEvidenceByDefault() {
		ExtractedClinicalRecord noEvidence = record("A", "azacitidine", 0.5, metrics());
		ExtractedClinicalRecord withEvidence = record("B", "azacitidine", 0.5, metrics(Metric.COMPLETE_RESPONSE, 12));

		assertThat(engine.aggregate(List.of(noEvidence, withEvidence), Selector.all()).recordCount()).isEqualTo(1);
		assertThat(engine.aggregate(List.of(noEvidence, withEvidence), Selector.all().includingNoEvidence()).recordCount())
				.isEqualTo(2);
	}

	@Test
	void subgroupSelectionUsesSubgroupValuesAndSampleSizes() {
		ExtractedClinicalRecord record = record("A", "decitabine", 0.8, metrics(Metric.COMPLETE_RESPONSE, 40))
				.toBuilder()
				.rasMutant(metrics(Metric.COMPLETE_RESPONSE, 15))
				.sampleSize(50)
				.subgroupSampleSizes(new SubgroupSampleSizes(18, null))
				.build();
		ExtractedClinicalRecord overallOnly = record("B", "decitabine", 0.8, metrics(Metric.COMPLETE_RESPONSE, 30))
				.toBuilder()
				.sampleSize(25)
				.build();

		AggregationResult ras = engine.aggregate(List.of(record, overallOnly),
				Selector.forDrug("decitabine").withSubgroup(Subgroup.RAS_MUTANT));
		AggregationResult overall = engine.aggregate(List.of(record, overallOnly), Selector.forDrug("decitabine"));

		assertThat(ras.recordCount()).isEqualTo(1);
		assertThat(ras.statistics(Metric.COMPLETE_RESPONSE).mean()).isEqualTo(15.0);
		assertThat(ras.totalSampleSize()).isEqualTo(18);
		assertThat(overall.totalSampleSize()).isEqualTo(75);
	}

	@Test
	void resultDoesNotDependOnRecordOrder() {
		List<ExtractedClinicalRecord> records = new ArrayList<>();
		Random random = new Random(42);
		for (int i = 0; i < 25; i++) {
			records.add(record("R" + i, i % 2 == 0 ? "azacitidine" : "decitabine", 0.7, metrics(
					Metric.COMPLETE_RESPONSE, random.nextDouble() * 100,
					Metric.OVERALL_SURVIVAL, random.nextDouble() * 40)));
		}
		AggregationResult expected = engine.aggregate(records, Selector.all());

		for (int round = 0; round < 5; round++) {
			List<ExtractedClinicalRecord> shuffled = new ArrayList<>(records);
			Collections.shuffle(shuffled, new Random(round));
			assertThat(engine.aggregate(shuffled, Selector.all())).isEqualTo(expected);
		}
	}

	@Test
	void summarizeAddsCombinedGroupRows() {
		List<ExtractedClinicalRecord> records = List.of(
				record("A", "azacitidine", 0.8, metrics(Metric.COMPLETE_RESPONSE, 10)),
				record("B", "decitabine", 0.8, metrics(Metric.COMPLETE_RESPONSE, 30))
		);

		List<DrugSubgroupSummary> summaries = engine.summarize(records, List.of("azacitidine", "decitabine"),
				Map.of("hypomethylating_agents", List.of("azacitidine", "decitabine")));

		assertThat(summaries).hasSize(3 * Subgroup.values().length);
		DrugSubgroupSummary combinedOverall = summaries.stream()
				.filter(summary -> summary.combined() && summary.subgroup() == Subgroup.OVERALL)
				.findFirst()
				.orElseThrow();
		assertThat(combinedOverall.label()).isEqualTo("hypomethylating_agents");
		assertThat(combinedOverall.result().statistics(Metric.COMPLETE_RESPONSE).mean()).isEqualTo(20.0);
		assertThat(combinedOverall.result().recordCount()).isEqualTo(2);
	}
}
