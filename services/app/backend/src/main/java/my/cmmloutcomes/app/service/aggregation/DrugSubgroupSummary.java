package my.cmmloutcomes.app.service.aggregation;

import my.cmmloutcomes.app.domain.Subgroup;

import java.util.List;

/**
 * One row of the comparative report: a single drug, or a named combined group of drugs, in one subgroup.
 */
public record DrugSubgroupSummary(
		String label,
		List<String> drugs,
		boolean combined,
		Subgroup subgroup,
		AggregationResult result
) {
	public DrugSubgroupSummary {
		drugs = drugs == null ? List.of() : List.copyOf(drugs);
	}
}
