package my.cmmloutcomes.app.service.extraction;

import my.cmmloutcomes.app.domain.MetricSet;
import my.cmmloutcomes.app.domain.StudyAttribution;

import java.util.List;

/**
 * Strictly typed view of a generative answer. Values are type-checked but not yet range-checked;
 * that happens when the coordinator validates the record.
 */
public record RawExtractionPayload(
		Boolean hasEvidence,
		MetricSet overall,
		MetricSet rasMutant,
		MetricSet nonRasMutant,
		Integer sampleSize,
		Integer rasMutantSampleSize,
		Integer nonRasMutantSampleSize,
		List<String> supportingQuotes,
		Double selfReportedConfidence,
		StudyAttribution attribution,
		List<String> warnings,
		String model
) {
	public RawExtractionPayload {
		overall = overall == null ? MetricSet.empty() : overall;
		supportingQuotes = supportingQuotes == null ? List.of() : List.copyOf(supportingQuotes);
		attribution = attribution == null ? StudyAttribution.none() : attribution;
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
	}
}
