package my.cmmloutcomes.app.service.aggregation;

/**
 * Summary statistics over the non-null values of one field. {@link #noData()} is the explicit
 * "nothing observed" value: count 0 and every statistic absent, which is distinct from an observed 0.0.
 */
public record MetricStatistics(
		int count,
		Double mean,
		Double median,
		Double min,
		Double max,
		Double standardDeviation
) {
	private static final MetricStatistics NO_DATA = new MetricStatistics(0, null, null, null, null, null);

	public static MetricStatistics noData() {
		return NO_DATA;
	}

	public boolean hasData() {
		return count > 0;
	}
}
