package my.cmmloutcomes.app.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands search templates containing {@code {drug}} into concrete queries.
 */
public class QueryPlanner {
	public static final String DRUG_PLACEHOLDER = "{drug}";

	private final List<String> templates;

	public QueryPlanner(List<String> templates) {
		List<String> cleaned = new ArrayList<>();
		if (templates != null) {
			for (String template : templates) {
				if (template != null && !template.isBlank()) {
					cleaned.add(template.trim());
				}
			}
		}
		this.templates = cleaned.isEmpty() ? List.of(DRUG_PLACEHOLDER + " CMML") : List.copyOf(cleaned);
	}

	public List<String> queriesFor(String drug) {
		if (drug == null || drug.isBlank()) {
			throw new IllegalArgumentException("Drug is required");
		}
		Set<String> queries = new LinkedHashSet<>();
		for (String template : templates) {
			queries.add(template.replace(DRUG_PLACEHOLDER, drug.trim()));
		}
		return List.copyOf(queries);
	}
}
