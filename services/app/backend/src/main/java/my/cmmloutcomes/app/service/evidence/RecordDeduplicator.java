package my.cmmloutcomes.app.service.evidence;

import my.cmmloutcomes.app.domain.DocumentRecord;
import my.cmmloutcomes.app.domain.ExtractedClinicalRecord;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges results of repeated searches. Pure: inputs are never modified and equal inputs give equal
 * outputs, so merging an already merged collection changes nothing.
 */
@Service
public class RecordDeduplicator {
	/**
	 * Keeps one record per source identifier: higher confidence wins, then more non-null numeric
	 * fields, then the record seen first. Result order follows first appearance of each identifier.
	 */
	public Map<String, ExtractedClinicalRecord> merge(Collection<ExtractedClinicalRecord> records) {
		Map<String, ExtractedClinicalRecord> merged = new LinkedHashMap<>();
		if (records == null) {
			return merged;
		}
		for (ExtractedClinicalRecord record : records) {
			if (record == null) {
				continue;
			}
			merged.merge(record.sourceIdentifier(), record, RecordDeduplicator::preferred);
		}
		return merged;
	}

	public List<ExtractedClinicalRecord> mergeToList(Collection<ExtractedClinicalRecord> records) {
		return new ArrayList<>(merge(records).values());
	}

	/**
	 * Unique documents by identifier; the first occurrence is kept with its attribution.
	 */
	public List<DocumentRecord> mergeDocuments(Collection<DocumentRecord> documents) {
		Map<String, DocumentRecord> merged = new LinkedHashMap<>();
		if (documents == null) {
			return new ArrayList<>();
		}
		for (DocumentRecord document : documents) {
			if (document != null) {
				merged.putIfAbsent(document.identifier(), document);
			}
		}
		return new ArrayList<>(merged.values());
	}

	public static ExtractedClinicalRecord preferred(ExtractedClinicalRecord incumbent, ExtractedClinicalRecord candidate) {
		return isBetter(candidate, incumbent) ? candidate : incumbent;
	}

	public static boolean isBetter(ExtractedClinicalRecord candidate, ExtractedClinicalRecord incumbent) {
		int byConfidence = Double.compare(candidate.confidence(), incumbent.confidence());
		if (byConfidence != 0) {
			return byConfidence > 0;
		}
		return candidate.numericFieldCount() > incumbent.numericFieldCount();
	}
}
