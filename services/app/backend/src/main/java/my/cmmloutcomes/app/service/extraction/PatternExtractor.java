package my.cmmloutcomes.app.service.extraction;

import my.cmmloutcomes.app.domain.Metric;
import my.cmmloutcomes.app.domain.MetricSet;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic, table-driven extraction. For each metric the first pattern (in priority order)
 * that matches anywhere in the text wins. Captured numbers are taken as written.
 */
public class PatternExtractor {
	private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+(?=[A-Z(\\[])|\\n+");
	private static final int MAX_QUOTE_CHARS = 300;

	private final PatternPhraseTable phraseTable;

	public PatternExtractor(PatternPhraseTable phraseTable) {
		this.phraseTable = phraseTable;
	}

	public MetricSet extractMetrics(String text) {
		return extract(text).overall();
	}

	public PatternExtraction extract(String text) {
		if (text == null || text.isBlank()) {
			return PatternExtraction.empty();
		}
		StringBuilder unmarkedText = new StringBuilder();
		StringBuilder rasText = new StringBuilder();
		StringBuilder nonRasText = new StringBuilder();
		for (String sentence : splitSentences(text)) {
			switch (classify(sentence)) {
				case RAS_MUTANT -> appendSentence(rasText, sentence);
				case NON_RAS_MUTANT -> appendSentence(nonRasText, sentence);
				case UNMARKED -> appendSentence(unmarkedText, sentence);
				case BOTH -> {
					// values in a sentence naming both cohorts cannot be attributed to either
				}
			}
		}

		Set<String> quotes = new LinkedHashSet<>();
		MetricSet.Builder overall = MetricSet.builder();
		scanMetrics(unmarkedText.toString(), overall, quotes);
		// whole-cohort sentences win; the full text only fills metrics they do not state
		scanMetrics(text, overall, quotes);
		MetricSet rasMutant = rasText.isEmpty() ? null : nullIfEmpty(scanMetrics(rasText.toString(), quotes));
		MetricSet nonRasMutant = nonRasText.isEmpty() ? null : nullIfEmpty(scanMetrics(nonRasText.toString(), quotes));

		return new PatternExtraction(overall.build(), rasMutant, nonRasMutant, scanSampleSize(text), new ArrayList<>(quotes));
	}

	SentenceCohort classify(String sentence) {
		boolean nonRas = false;
		String masked = sentence;
		for (Pattern marker : phraseTable.nonRasMutantMarkers()) {
			Matcher matcher = marker.matcher(masked);
			if (matcher.find()) {
				nonRas = true;
				// "non-RAS-mutant" contains a RAS-mutant marker, so non-RAS spans are blanked first
				masked = matcher.replaceAll(" ");
			}
		}
		boolean ras = matchesAny(phraseTable.rasMutantMarkers(), masked);
		if (ras && nonRas) {
			return SentenceCohort.BOTH;
		}
		if (nonRas) {
			return SentenceCohort.NON_RAS_MUTANT;
		}
		return ras ? SentenceCohort.RAS_MUTANT : SentenceCohort.UNMARKED;
	}

	private MetricSet scanMetrics(String text, Set<String> quotes) {
		MetricSet.Builder builder = MetricSet.builder();
		scanMetrics(text, builder, quotes);
		return builder.build();
	}

	private void scanMetrics(String text, MetricSet.Builder builder, Set<String> quotes) {
		if (text.isEmpty()) {
			return;
		}
		for (Metric metric : Metric.values()) {
			if (builder.has(metric)) {
				continue;
			}
			for (Pattern pattern : phraseTable.patternsFor(metric)) {
				Matcher matcher = pattern.matcher(text);
				if (!matcher.find()) {
					continue;
				}
				Double value = parseNumber(matcher.group(1));
				if (value == null) {
					continue;
				}
				builder.put(metric, value);
				quotes.add(sentenceAt(text, matcher.start(), matcher.end()));
				break;
			}
		}
	}

	private Integer scanSampleSize(String text) {
		for (Pattern pattern : phraseTable.sampleSizePatterns()) {
			Matcher matcher = pattern.matcher(text);
			while (matcher.find()) {
				String digits = matcher.group(1);
				// longer digit runs are identifiers, not cohort sizes
				if (digits == null || digits.length() > 6) {
					continue;
				}
				return Integer.parseInt(digits);
			}
		}
		return null;
	}

	static List<String> splitSentences(String text) {
		List<String> sentences = new ArrayList<>();
		for (String part : SENTENCE_BOUNDARY.split(text)) {
			String trimmed = part.trim();
			if (!trimmed.isEmpty()) {
				sentences.add(trimmed);
			}
		}
		return sentences;
	}

	static String sentenceAt(String text, int start, int end) {
		int from = 0;
		int to = text.length();
		Matcher boundary = SENTENCE_BOUNDARY.matcher(text);
		while (boundary.find()) {
			if (boundary.end() <= start) {
				from = boundary.end();
			} else if (boundary.start() >= end) {
				to = boundary.start();
				break;
			}
		}
		String sentence = text.substring(from, to).trim();
		if (sentence.length() > MAX_QUOTE_CHARS) {
			sentence = sentence.substring(0, MAX_QUOTE_CHARS).trim() + "...";
		}
		return sentence;
	}

	private static boolean matchesAny(List<Pattern> patterns, String text) {
		for (Pattern pattern : patterns) {
			if (pattern.matcher(text).find()) {
				return true;
			}
		}
		return false;
	}

	private static void appendSentence(StringBuilder target, String sentence) {
		if (!target.isEmpty()) {
			target.append('\n');
		}
		target.append(sentence);
	}

	private static MetricSet nullIfEmpty(MetricSet set) {
		return set.isEmpty() ? null : set;
	}

	private static Double parseNumber(String raw) {
		if (raw == null || raw.isBlank()) {
			return null;
		}
		try {
			return Double.parseDouble(raw.trim());
		} catch (NumberFormatException ex) {
			return null;
		}
	}

	enum SentenceCohort {
		UNMARKED,
		RAS_MUTANT,
		NON_RAS_MUTANT,
		BOTH
	}
}
