package my.cmmloutcomes.app.domain;

import java.util.List;

/**
 * Structured outcome data for one (document, drug) pair. Instances are created once by the
 * extraction coordinator and replaced, never mutated; a record without evidence carries no metrics.
 */
public record ExtractedClinicalRecord(
		String sourceIdentifier,
		String drug,
		String title,
		String citation,
		boolean hasEvidence,
		MetricSet overall,
		MetricSet rasMutant,
		MetricSet nonRasMutant,
		Integer sampleSize,
		SubgroupSampleSizes subgroupSampleSizes,
		List<String> supportingQuotes,
		ExtractionMethod extractionMethod,
		double confidence,
		String model,
		StudyAttribution attribution,
		List<String> warnings
) {
	public ExtractedClinicalRecord {
		if (sourceIdentifier == null || sourceIdentifier.isBlank()) {
			throw new IllegalArgumentException("Source identifier is required");
		}
		if (extractionMethod == null) {
			throw new IllegalArgumentException("Extraction method is required");
		}
		if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
			throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
		}
		overall = overall == null ? MetricSet.empty() : overall;
		subgroupSampleSizes = subgroupSampleSizes == null ? SubgroupSampleSizes.unknown() : subgroupSampleSizes;
		supportingQuotes = supportingQuotes == null ? List.of() : List.copyOf(supportingQuotes);
		attribution = attribution == null ? StudyAttribution.none() : attribution;
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
	}

	public MetricSet metrics(Subgroup subgroup) {
		return switch (subgroup) {
			case OVERALL -> overall;
			case RAS_MUTANT -> rasMutant;
			case NON_RAS_MUTANT -> nonRasMutant;
		};
	}

	public Integer sampleSize(Subgroup subgroup) {
		return subgroup == Subgroup.OVERALL ? sampleSize : subgroupSampleSizes.forSubgroup(subgroup);
	}

	/**
	 * Number of non-null outcome values across the overall set and both subgroup sets.
	 */
	public int numericFieldCount() {
		int count = overall.populatedCount();
		if (rasMutant != null) {
			count += rasMutant.populatedCount();
		}
		if (nonRasMutant != null) {
			count += nonRasMutant.populatedCount();
		}
		return count;
	}

	public boolean hasAnyMetric() {
		return numericFieldCount() > 0;
	}

	public Builder toBuilder() {
		return new Builder(this);
	}

	public static Builder builder(String sourceIdentifier, String drug) {
		return new Builder(sourceIdentifier, drug);
	}

	public static final class Builder {
		private final String sourceIdentifier;
		private final String drug;
		private String title;
		private String citation;
		private boolean hasEvidence;
		private MetricSet overall = MetricSet.empty();
		private MetricSet rasMutant;
		private MetricSet nonRasMutant;
		private Integer sampleSize;
		private SubgroupSampleSizes subgroupSampleSizes = SubgroupSampleSizes.unknown();
		private List<String> supportingQuotes = List.of();
		private ExtractionMethod extractionMethod = ExtractionMethod.PATTERN;
		private double confidence;
		private String model;
		private StudyAttribution attribution = StudyAttribution.none();
		private List<String> warnings = List.of();

		private Builder(String sourceIdentifier, String drug) {
			this.sourceIdentifier = sourceIdentifier;
			this.drug = drug;
		}

		private Builder(ExtractedClinicalRecord record) {
			this.sourceIdentifier = record.sourceIdentifier();
			this.drug = record.drug();
			this.title = record.title();
			this.citation = record.citation();
			this.hasEvidence = record.hasEvidence();
			this.overall = record.overall();
			this.rasMutant = record.rasMutant();
			this.nonRasMutant = record.nonRasMutant();
			this.sampleSize = record.sampleSize();
			this.subgroupSampleSizes = record.subgroupSampleSizes();
			this.supportingQuotes = record.supportingQuotes();
			this.extractionMethod = record.extractionMethod();
			this.confidence = record.confidence();
			this.model = record.model();
			this.attribution = record.attribution();
			this.warnings = record.warnings();
		}

		public Builder title(String title) {
			this.title = title;
			return this;
		}

		public Builder citation(String citation) {
			this.citation = citation;
			return this;
		}

		public Builder hasEvidence(boolean hasEvidence) {
			this.hasEvidence = hasEvidence;
			return this;
		}

		public Builder overall(MetricSet overall) {
			this.overall = overall;
			return this;
		}

		public Builder rasMutant(MetricSet rasMutant) {
			this.rasMutant = rasMutant;
			return this;
		}

		public Builder nonRasMutant(MetricSet nonRasMutant) {
			this.nonRasMutant = nonRasMutant;
			return this;
		}

		public Builder sampleSize(Integer sampleSize) {
			this.sampleSize = sampleSize;
			return this;
		}

		public Builder subgroupSampleSizes(SubgroupSampleSizes subgroupSampleSizes) {
			this.subgroupSampleSizes = subgroupSampleSizes;
			return this;
		}

		public Builder supportingQuotes(List<String> supportingQuotes) {
			this.supportingQuotes = supportingQuotes;
			return this;
		}

		public Builder extractionMethod(ExtractionMethod extractionMethod) {
			this.extractionMethod = extractionMethod;
			return this;
		}

		public Builder confidence(double confidence) {
			this.confidence = confidence;
			return this;
		}

		public Builder model(String model) {
			this.model = model;
			return this;
		}

		public Builder attribution(StudyAttribution attribution) {
			this.attribution = attribution;
			return this;
		}

		public Builder warnings(List<String> warnings) {
			this.warnings = warnings;
			return this;
		}

		public ExtractedClinicalRecord build() {
			return new ExtractedClinicalRecord(sourceIdentifier, drug, title, citation, hasEvidence, overall,
					rasMutant, nonRasMutant, sampleSize, subgroupSampleSizes, supportingQuotes, extractionMethod,
					confidence, model, attribution, warnings);
		}
	}
}
