package my.cmmloutcomes.app.service.evidence;

import my.cmmloutcomes.app.domain.ExtractedClinicalRecord;
import my.cmmloutcomes.app.service.extraction.DrugVocabulary;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory map of {@code (drug, identifier)} to the best record seen so far. Written by the
 * pipeline, read by aggregation afterwards; iteration follows insertion order.
 */
@Component
public class EvidenceStore {
	private final Map<EvidenceKey, ExtractedClinicalRecord> records = new LinkedHashMap<>();

	/**
	 * Inserts the record, or replaces the stored one when the new record wins the deduplication
	 * tie-break. Returns the record now stored under the key.
	 */
	public synchronized ExtractedClinicalRecord put(ExtractedClinicalRecord record) {
		EvidenceKey key = EvidenceKey.of(record.drug(), record.sourceIdentifier());
		return records.merge(key, record, RecordDeduplicator::preferred);
	}

	public void putAll(Collection<ExtractedClinicalRecord> batch) {
		for (ExtractedClinicalRecord record : batch) {
			put(record);
		}
	}

	public synchronized Optional<ExtractedClinicalRecord> get(String drug, String identifier) {
		return Optional.ofNullable(records.get(EvidenceKey.of(drug, identifier)));
	}

	public synchronized List<ExtractedClinicalRecord> records() {
		return List.copyOf(records.values());
	}

	public synchronized List<ExtractedClinicalRecord> records(String drug) {
		String normalized = DrugVocabulary.normalizeDrug(drug);
		List<ExtractedClinicalRecord> matches = new ArrayList<>();
		for (Map.Entry<EvidenceKey, ExtractedClinicalRecord> entry : records.entrySet()) {
			if (entry.getKey().drug().equals(normalized)) {
				matches.add(entry.getValue());
			}
		}
		return matches;
	}

	public synchronized Set<String> drugs() {
		Set<String> drugs = new LinkedHashSet<>();
		for (EvidenceKey key : records.keySet()) {
			drugs.add(key.drug());
		}
		return drugs;
	}

	public synchronized int size() {
		return records.size();
	}

	public synchronized void clear() {
		records.clear();
	}

	public record EvidenceKey(String drug, String identifier) {
		public static EvidenceKey of(String drug, String identifier) {
			if (identifier == null || identifier.isBlank()) {
				throw new IllegalArgumentException("Identifier is required");
			}
			return new EvidenceKey(DrugVocabulary.normalizeDrug(drug), identifier.trim());
		}
	}
}
