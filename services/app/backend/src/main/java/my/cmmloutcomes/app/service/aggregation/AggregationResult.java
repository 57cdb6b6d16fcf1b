package my.cmmloutcomes.app.service.aggregation;

import my.cmmloutcomes.app.domain.Metric;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record AggregationResult(
		Selector selector,
		int recordCount,
		Map<Metric, MetricStatistics> metrics,
		MetricStatistics compositeResponseRate,
		Integer totalSampleSize
) {
	public AggregationResult {
		EnumMap<Metric, MetricStatistics> copy = new EnumMap<>(Metric.class);
		if (metrics != null) {
			copy.putAll(metrics);
		}
		for (Metric metric : Metric.values()) {
			copy.putIfAbsent(metric, MetricStatistics.noData());
		}
		metrics = Collections.unmodifiableMap(copy);
		compositeResponseRate = compositeResponseRate == null ? MetricStatistics.noData() : compositeResponseRate;
	}

	public MetricStatistics statistics(Metric metric) {
		return metrics.get(metric);
	}
}
