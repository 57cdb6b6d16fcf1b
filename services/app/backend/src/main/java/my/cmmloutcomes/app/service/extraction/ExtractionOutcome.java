package my.cmmloutcomes.app.service.extraction;

import my.cmmloutcomes.app.domain.ExtractedClinicalRecord;

/**
 * A record together with how it was produced. {@code generativeFailure} is set when a generative
 * attempt was made and the record came from the pattern fallback instead.
 */
public record ExtractionOutcome(ExtractedClinicalRecord record, String generativeFailure) {
	public boolean fellBack() {
		return generativeFailure != null;
	}
}
