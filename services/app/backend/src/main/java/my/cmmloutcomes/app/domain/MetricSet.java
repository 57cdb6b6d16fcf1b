package my.cmmloutcomes.app.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable set of nullable outcome values. Absent entries mean "not reported", never zero.
 */
public record MetricSet(Map<Metric, Double> values) {
	private static final MetricSet EMPTY = new MetricSet(Map.of());

	public MetricSet {
		EnumMap<Metric, Double> copy = new EnumMap<>(Metric.class);
		if (values != null) {
			for (Map.Entry<Metric, Double> entry : values.entrySet()) {
				if (entry.getKey() != null && entry.getValue() != null) {
					copy.put(entry.getKey(), entry.getValue());
				}
			}
		}
		values = Collections.unmodifiableMap(copy);
	}

	public static MetricSet empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Double get(Metric metric) {
		return values.get(metric);
	}

	public boolean has(Metric metric) {
		return values.containsKey(metric);
	}

	public int populatedCount() {
		return values.size();
	}

	public boolean isEmpty() {
		return values.isEmpty();
	}

	public MetricSet with(Metric metric, Double value) {
		EnumMap<Metric, Double> copy = new EnumMap<>(Metric.class);
		copy.putAll(values);
		if (value == null) {
			copy.remove(metric);
		} else {
			copy.put(metric, value);
		}
		return new MetricSet(copy);
	}

	public MetricSet without(Metric metric) {
		return with(metric, null);
	}

	public static final class Builder {
		private final EnumMap<Metric, Double> values = new EnumMap<>(Metric.class);

		private Builder() {
		}

		public Builder put(Metric metric, Double value) {
			if (value != null) {
				values.put(metric, value);
			}
			return this;
		}

		public Builder putIfAbsent(Metric metric, Double value) {
			if (value != null) {
				values.putIfAbsent(metric, value);
			}
			return this;
		}

		public boolean has(Metric metric) {
			return values.containsKey(metric);
		}

		public MetricSet build() {
			return values.isEmpty() ? EMPTY : new MetricSet(values);
		}
	}
}
