package my.cmmloutcomes.app.domain;

public enum MetricKind {
	PERCENT("0..100"),
	MONTHS(">= 0");

	private final String expectedRange;

	MetricKind(String expectedRange) {
		this.expectedRange = expectedRange;
	}

	public boolean accepts(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return false;
		}
		return switch (this) {
			case PERCENT -> value >= 0.0 && value <= 100.0;
			case MONTHS -> value >= 0.0;
		};
	}

	public String expectedRange() {
		return expectedRange;
	}
}
