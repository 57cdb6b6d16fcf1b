package my.cmmloutcomes.app.service.aggregation;

import my.cmmloutcomes.app.domain.ExtractedClinicalRecord;
import my.cmmloutcomes.app.domain.Metric;
import my.cmmloutcomes.app.domain.MetricSet;
import my.cmmloutcomes.app.domain.Subgroup;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stateless statistics over extracted records. Results depend only on the set of records selected,
 * not on their order. Multi-drug slices pool the union of records; per-drug results are never
 * combined.
 */
@Service
public class AggregationEngine {
	public AggregationResult aggregate(Collection<ExtractedClinicalRecord> records, Selector selector) {
		Selector effective = selector == null ? Selector.all() : selector;
		Subgroup subgroup = effective.subgroup();
		Map<Metric, List<Double>> valuesByMetric = new EnumMap<>(Metric.class);
		List<Double> composites = new ArrayList<>();
		int recordCount = 0;
		long sampleTotal = 0;
		boolean anySampleSize = false;

		for (ExtractedClinicalRecord record : records == null ? List.<ExtractedClinicalRecord>of() : records) {
			if (record == null || !effective.matchesDrug(record.drug())) {
				continue;
			}
			if (effective.evidenceOnly() && !record.hasEvidence()) {
				continue;
			}
			MetricSet metrics = record.metrics(subgroup);
			if (metrics == null) {
				continue;
			}
			recordCount++;
			for (Metric metric : Metric.values()) {
				Double value = metrics.get(metric);
				if (value != null) {
					valuesByMetric.computeIfAbsent(metric, key -> new ArrayList<>()).add(value);
				}
			}
			Double composite = compositeResponseRate(metrics);
			if (composite != null) {
				composites.add(composite);
			}
			Integer sampleSize = record.sampleSize(subgroup);
			if (sampleSize != null) {
				sampleTotal += sampleSize;
				anySampleSize = true;
			}
		}

		Map<Metric, MetricStatistics> statistics = new EnumMap<>(Metric.class);
		for (Metric metric : Metric.values()) {
			statistics.put(metric, statistics(valuesByMetric.getOrDefault(metric, List.of())));
		}
		Integer totalSampleSize = anySampleSize ? (int) Math.min(Integer.MAX_VALUE, sampleTotal) : null;
		return new AggregationResult(effective, recordCount, statistics, statistics(composites), totalSampleSize);
	}

	/**
	 * One summary per drug and subgroup, then one per combined group and subgroup. Combined groups
	 * pool the records of all their member drugs.
	 */
	public List<DrugSubgroupSummary> summarize(Collection<ExtractedClinicalRecord> records,
											   Collection<String> drugs,
											   Map<String, List<String>> combinedGroups) {
		List<DrugSubgroupSummary> summaries = new ArrayList<>();
		Set<String> orderedDrugs = new LinkedHashSet<>(drugs == null ? List.of() : drugs);
		for (String drug : orderedDrugs) {
			for (Subgroup subgroup : Subgroup.values()) {
				Selector selector = Selector.forDrug(drug).withSubgroup(subgroup);
				summaries.add(new DrugSubgroupSummary(drug, List.of(drug), false, subgroup, aggregate(records, selector)));
			}
		}
		if (combinedGroups != null) {
			for (Map.Entry<String, List<String>> group : combinedGroups.entrySet()) {
				for (Subgroup subgroup : Subgroup.values()) {
					Selector selector = Selector.forDrugs(group.getValue()).withSubgroup(subgroup);
					summaries.add(new DrugSubgroupSummary(group.getKey(), group.getValue(), true, subgroup,
							aggregate(records, selector)));
				}
			}
		}
		return summaries;
	}

	/**
	 * CR + PR + marrow response, with missing terms counted as 0. Null when all three are missing.
	 * The sum is not range-checked.
	 */
	public static Double compositeResponseRate(MetricSet metrics) {
		double sum = 0.0;
		boolean any = false;
		for (Metric metric : Metric.values()) {
			if (!metric.isCompositeComponent()) {
				continue;
			}
			Double value = metrics.get(metric);
			if (value != null) {
				sum += value;
				any = true;
			}
		}
		return any ? sum : null;
	}

	public static MetricStatistics statistics(List<Double> values) {
		if (values == null || values.isEmpty()) {
			return MetricStatistics.noData();
		}
		List<Double> sorted = new ArrayList<>(values);
		// sorted order fixes the summation order, so the mean is independent of input order
		Collections.sort(sorted);
		int count = sorted.size();
		double sum = 0.0;
		for (Double value : sorted) {
			sum += value;
		}
		double mean = sum / count;
		double median = count % 2 == 1
				? sorted.get(count / 2)
				: (sorted.get(count / 2 - 1) + sorted.get(count / 2)) / 2.0;
		double squares = 0.0;
		for (Double value : sorted) {
			double delta = value - mean;
			squares += delta * delta;
		}
		double standardDeviation = Math.sqrt(squares / count);
		return new MetricStatistics(count, mean, median, sorted.get(0), sorted.get(count - 1), standardDeviation);
	}
}
