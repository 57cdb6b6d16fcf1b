package my.cmmloutcomes.app.service.extraction;

import my.cmmloutcomes.app.domain.ExtractedClinicalRecord;
import my.cmmloutcomes.app.domain.Metric;
import my.cmmloutcomes.app.domain.MetricSet;
import my.cmmloutcomes.app.domain.SubgroupSampleSizes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Range checks on extracted values. An out-of-range field is set to null and noted in the record's
 * warnings; the rest of the record is kept.
 */
public class RecordValidator {
	private static final Logger logger = LoggerFactory.getLogger(RecordValidator.class);

	public ExtractedClinicalRecord validate(ExtractedClinicalRecord record) {
		List<String> warnings = new ArrayList<>(record.warnings());
		String id = record.sourceIdentifier();
		MetricSet overall = validateSet(record.overall(), "overall", id, warnings);
		MetricSet rasMutant = validateSubgroup(record.rasMutant(), "ras_mutant", id, warnings);
		MetricSet nonRasMutant = validateSubgroup(record.nonRasMutant(), "non_ras_mutant", id, warnings);
		Integer sampleSize = validateCount(record.sampleSize(), "sample_size", id, warnings);
		SubgroupSampleSizes subgroupSizes = new SubgroupSampleSizes(
				validateCount(record.subgroupSampleSizes().rasMutant(), "ras_mutant_sample_size", id, warnings),
				validateCount(record.subgroupSampleSizes().nonRasMutant(), "non_ras_mutant_sample_size", id, warnings)
		);
		return record.toBuilder()
				.overall(overall)
				.rasMutant(rasMutant)
				.nonRasMutant(nonRasMutant)
				.sampleSize(sampleSize)
				.subgroupSampleSizes(subgroupSizes)
				.warnings(warnings)
				.build();
	}

	/**
	 * Drops every outcome value. Sample sizes and attribution are kept for citation listing.
	 */
	public ExtractedClinicalRecord stripMetrics(ExtractedClinicalRecord record) {
		return record.toBuilder()
				.hasEvidence(false)
				.overall(MetricSet.empty())
				.rasMutant(null)
				.nonRasMutant(null)
				.build();
	}

	private MetricSet validateSubgroup(MetricSet set, String scope, String id, List<String> warnings) {
		if (set == null) {
			return null;
		}
		MetricSet validated = validateSet(set, scope, id, warnings);
		return validated.isEmpty() ? null : validated;
	}

	private MetricSet validateSet(MetricSet set, String scope, String id, List<String> warnings) {
		MetricSet validated = set;
		for (Metric metric : Metric.values()) {
			Double value = set.get(metric);
			if (value == null || metric.kind().accepts(value)) {
				continue;
			}
			String warning = "Invalid " + scope + "." + metric.jsonName() + " value (" + value + "); expected "
					+ metric.kind().expectedRange() + ", set to null.";
			logger.warn("{}: {}", id, warning);
			warnings.add(warning);
			validated = validated.without(metric);
		}
		return validated;
	}

	private Integer validateCount(Integer value, String field, String id, List<String> warnings) {
		if (value == null || value >= 0) {
			return value;
		}
		String warning = "Invalid " + field + " value (" + value + "); expected >= 0, set to null.";
		logger.warn("{}: {}", id, warning);
		warnings.add(warning);
		return null;
	}
}
