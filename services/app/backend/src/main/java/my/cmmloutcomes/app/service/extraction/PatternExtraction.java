package my.cmmloutcomes.app.service.extraction;

import my.cmmloutcomes.app.domain.MetricSet;

import java.util.List;

public record PatternExtraction(
		MetricSet overall,
		MetricSet rasMutant,
		MetricSet nonRasMutant,
		Integer sampleSize,
		List<String> supportingQuotes
) {
	private static final PatternExtraction EMPTY = new PatternExtraction(MetricSet.empty(), null, null, null, List.of());

	public PatternExtraction {
		overall = overall == null ? MetricSet.empty() : overall;
		supportingQuotes = supportingQuotes == null ? List.of() : List.copyOf(supportingQuotes);
	}

	public static PatternExtraction empty() {
		return EMPTY;
	}

	public boolean hasAnyMetric() {
		return !overall.isEmpty()
				|| (rasMutant != null && !rasMutant.isEmpty())
				|| (nonRasMutant != null && !nonRasMutant.isEmpty());
	}
}
