package my.cmmloutcomes.app.domain;

import java.util.List;

/**
 * Catalogue of clinical outcome fields. The JSON name is the key requested from the generative
 * extractor; aliases are additional keys accepted when reading its output.
 */
public enum Metric {
	COMPLETE_RESPONSE("complete_response", MetricKind.PERCENT, true,
			"complete_response_rate", "cr_rate", "cr"),
	PARTIAL_RESPONSE("partial_response", MetricKind.PERCENT, true,
			"partial_response_rate", "pr_rate", "pr"),
	MARROW_RESPONSE("marrow_response", MetricKind.PERCENT, true,
			"marrow_complete_response_rate", "marrow_response_rate", "mcr_rate", "mcr"),
	MARROW_OPTIMAL_RESPONSE("marrow_optimal_response", MetricKind.PERCENT, false,
			"marrow_optimal_response_rate", "mor_rate", "mor"),
	OVERALL_RESPONSE_RATE("overall_response_rate", MetricKind.PERCENT, false,
			"orr", "orr_rate", "overall_response"),
	PROGRESSION_FREE_SURVIVAL("progression_free_survival_months", MetricKind.MONTHS, false,
			"pfs_median_months", "pfs_median", "median_pfs_months", "pfs"),
	OVERALL_SURVIVAL("overall_survival_months", MetricKind.MONTHS, false,
			"os_median_months", "os_median", "median_os_months", "os"),
	EVENT_FREE_SURVIVAL("event_free_survival_months", MetricKind.MONTHS, false,
			"efs_median_months", "efs_median", "median_efs_months", "efs"),
	SERIOUS_ADVERSE_EVENT_RATE("serious_adverse_event_rate", MetricKind.PERCENT, false,
			"sae_frequency_percent", "sae_rate", "sae_percent", "sae", "serious_ae_rate"),
	ANY_GRADE_ADVERSE_EVENT_RATE("any_grade_adverse_event_rate", MetricKind.PERCENT, false,
			"any_grade_ae_rate", "any_ae_rate", "ae_rate"),
	GRADE_3_4_ADVERSE_EVENT_RATE("grade_3_4_adverse_event_rate", MetricKind.PERCENT, false,
			"grade_3_4_ae_rate", "grade_3_4_ae", "grade_3_plus_ae_rate"),
	DISCONTINUATION_RATE("discontinuation_rate", MetricKind.PERCENT, false,
			"discontinuation_due_to_ae_rate", "treatment_discontinuation_rate"),
	DOSE_REDUCTION_RATE("dose_reduction_rate", MetricKind.PERCENT, false,
			"dose_reduction_due_to_ae_rate");

	private final String jsonName;
	private final MetricKind kind;
	private final boolean compositeComponent;
	private final List<String> aliases;

	Metric(String jsonName, MetricKind kind, boolean compositeComponent, String... aliases) {
		this.jsonName = jsonName;
		this.kind = kind;
		this.compositeComponent = compositeComponent;
		this.aliases = List.of(aliases);
	}

	public String jsonName() {
		return jsonName;
	}

	public MetricKind kind() {
		return kind;
	}

	/**
	 * Whether the metric is a term of the composite response rate (CR + PR + marrow response).
	 */
	public boolean isCompositeComponent() {
		return compositeComponent;
	}

	public List<String> aliases() {
		return aliases;
	}

	public String[] acceptedNames() {
		String[] names = new String[aliases.size() + 1];
		names[0] = jsonName;
		for (int i = 0; i < aliases.size(); i++) {
			names[i + 1] = aliases.get(i);
		}
		return names;
	}

	public static Metric fromJsonName(String name) {
		if (name == null) {
			throw new IllegalArgumentException("Metric name is required");
		}
		String normalized = name.trim().toLowerCase(java.util.Locale.ROOT);
		for (Metric metric : values()) {
			if (metric.jsonName.equals(normalized) || metric.aliases.contains(normalized)) {
				return metric;
			}
		}
		throw new IllegalArgumentException("Unknown metric: " + name);
	}
}
