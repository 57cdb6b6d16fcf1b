package my.cmmloutcomes.app.service.aggregation;

import my.cmmloutcomes.app.domain.Subgroup;
import my.cmmloutcomes.app.service.extraction.DrugVocabulary;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Slice of the evidence to aggregate. An empty drug set selects every drug.
 */
public record Selector(Set<String> drugs, Subgroup subgroup, boolean evidenceOnly) {
	public Selector {
		Set<String> normalized = new LinkedHashSet<>();
		if (drugs != null) {
			for (String drug : drugs) {
				if (drug != null && !drug.isBlank()) {
					normalized.add(DrugVocabulary.normalizeDrug(drug));
				}
			}
		}
		drugs = Set.copyOf(normalized);
		subgroup = subgroup == null ? Subgroup.OVERALL : subgroup;
	}

	public static Selector all() {
		return new Selector(Set.of(), Subgroup.OVERALL, true);
	}

	public static Selector forDrug(String drug) {
		return new Selector(Set.of(drug), Subgroup.OVERALL, true);
	}

	public static Selector forDrugs(Collection<String> drugs) {
		return new Selector(drugs == null ? Set.of() : new LinkedHashSet<>(drugs), Subgroup.OVERALL, true);
	}

	public static Selector forDrugs(String... drugs) {
		return forDrugs(List.of(drugs));
	}

	public Selector withSubgroup(Subgroup subgroup) {
		return new Selector(drugs, subgroup, evidenceOnly);
	}

	public Selector includingNoEvidence() {
		return new Selector(drugs, subgroup, false);
	}

	public boolean matchesDrug(String drug) {
		return drugs.isEmpty() || drugs.contains(DrugVocabulary.normalizeDrug(drug));
	}
}
