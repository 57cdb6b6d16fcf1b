package my.cmmloutcomes.app.service;

import my.cmmloutcomes.app.domain.ExtractedClinicalRecord;

import java.util.List;

public record PipelineRunSummary(
		String drug,
		int documentsReceived,
		int uniqueDocuments,
		int recordsWithEvidence,
		int generativeRecords,
		int patternRecords,
		int fallbacks,
		boolean generativeDisabled,
		List<ExtractedClinicalRecord> records
) {
	public PipelineRunSummary {
		records = records == null ? List.of() : List.copyOf(records);
	}
}
