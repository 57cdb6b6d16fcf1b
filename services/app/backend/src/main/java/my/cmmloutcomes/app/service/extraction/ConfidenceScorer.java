package my.cmmloutcomes.app.service.extraction;

import my.cmmloutcomes.app.domain.ExtractedClinicalRecord;
import my.cmmloutcomes.app.domain.ExtractionMethod;
import my.cmmloutcomes.app.domain.Metric;
import my.cmmloutcomes.app.domain.Subgroup;

public class ConfidenceScorer {
	private static final int QUOTE_SATURATION = 3;
	/** Overall set plus both subgroup sets, matching {@link ExtractedClinicalRecord#numericFieldCount()}. */
	static final int TOTAL_FIELDS = Metric.values().length * Subgroup.values().length;

	private final double patternConfidence;

	public ConfidenceScorer(double patternConfidence) {
		this.patternConfidence = clamp(patternConfidence);
	}

	/**
	 * Pattern results get the fixed configured score. Generative results use the model's own
	 * estimate when it gave one, otherwise {@code 0.5 + 0.4 * populated/total + 0.1 * min(quotes, 3)/3}.
	 */
	public double score(ExtractedClinicalRecord record, Double selfReported) {
		if (record.extractionMethod() == ExtractionMethod.PATTERN) {
			return patternConfidence;
		}
		if (selfReported != null && !selfReported.isNaN() && !selfReported.isInfinite()) {
			return clamp(selfReported);
		}
		return heuristic(record.numericFieldCount(), record.supportingQuotes().size());
	}

	public double heuristic(int populatedFields, int quoteCount) {
		double fieldShare = Math.min(Math.max(populatedFields, 0), TOTAL_FIELDS) / (double) TOTAL_FIELDS;
		double quoteShare = Math.min(Math.max(quoteCount, 0), QUOTE_SATURATION) / (double) QUOTE_SATURATION;
		return clamp(0.5 + 0.4 * fieldShare + 0.1 * quoteShare);
	}

	public double patternConfidence() {
		return patternConfidence;
	}

	static double clamp(double value) {
		if (Double.isNaN(value)) {
			return 0.0;
		}
		return Math.max(0.0, Math.min(1.0, value));
	}
}
