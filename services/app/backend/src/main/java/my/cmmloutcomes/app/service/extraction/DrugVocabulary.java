package my.cmmloutcomes.app.service.extraction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Drug synonyms and condition terms used to decide whether a text is about a drug in the target
 * condition. Terms match on word boundaries; short all-caps abbreviations such as {@code HU} are
 * matched case-sensitively so author names and ordinary words do not count.
 */
public class DrugVocabulary {
	private static final int ABBREVIATION_MAX_LENGTH = 4;

	private final Map<String, List<String>> synonyms;
	private final List<Pattern> conditionPatterns;
	private final Map<String, List<Pattern>> drugPatterns = new ConcurrentHashMap<>();

	public DrugVocabulary(Map<String, List<String>> synonyms, List<String> conditionTerms) {
		Map<String, List<String>> normalized = new LinkedHashMap<>();
		if (synonyms != null) {
			for (Map.Entry<String, List<String>> entry : synonyms.entrySet()) {
				Set<String> terms = new LinkedHashSet<>();
				terms.add(entry.getKey().trim());
				if (entry.getValue() != null) {
					for (String term : entry.getValue()) {
						if (term != null && !term.isBlank()) {
							terms.add(term.trim());
						}
					}
				}
				normalized.put(normalizeDrug(entry.getKey()), List.copyOf(terms));
			}
		}
		this.synonyms = normalized;
		List<Pattern> conditions = new ArrayList<>();
		if (conditionTerms != null) {
			for (String term : conditionTerms) {
				if (term != null && !term.isBlank()) {
					conditions.add(termPattern(term.trim()));
				}
			}
		}
		this.conditionPatterns = List.copyOf(conditions);
	}

	public static String normalizeDrug(String drug) {
		return drug == null ? "" : drug.trim().toLowerCase(Locale.ROOT);
	}

	public List<String> synonymsFor(String drug) {
		List<String> terms = synonyms.get(normalizeDrug(drug));
		return terms == null ? List.of(drug.trim()) : terms;
	}

	public Set<String> knownDrugs() {
		return synonyms.keySet();
	}

	public boolean mentionsDrug(String text, String drug) {
		if (text == null || text.isBlank() || drug == null || drug.isBlank()) {
			return false;
		}
		List<Pattern> patterns = drugPatterns.computeIfAbsent(normalizeDrug(drug), key -> {
			List<Pattern> compiled = new ArrayList<>();
			for (String term : synonymsFor(drug)) {
				compiled.add(termPattern(term));
			}
			return List.copyOf(compiled);
		});
		return anyMatch(patterns, text);
	}

	public boolean mentionsCondition(String text) {
		if (text == null || text.isBlank()) {
			return false;
		}
		// no configured condition terms means no condition filter
		return conditionPatterns.isEmpty() || anyMatch(conditionPatterns, text);
	}

	public boolean isRelevant(String text, String drug) {
		return mentionsDrug(text, drug) && mentionsCondition(text);
	}

	private static boolean anyMatch(List<Pattern> patterns, String text) {
		for (Pattern pattern : patterns) {
			if (pattern.matcher(text).find()) {
				return true;
			}
		}
		return false;
	}

	private static Pattern termPattern(String term) {
		String regex = "(?<![\\p{L}\\p{N}])" + Pattern.quote(term) + "(?![\\p{L}\\p{N}])";
		boolean abbreviation = term.length() <= ABBREVIATION_MAX_LENGTH && term.equals(term.toUpperCase(Locale.ROOT));
		return abbreviation ? Pattern.compile(regex) : Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
	}
}
