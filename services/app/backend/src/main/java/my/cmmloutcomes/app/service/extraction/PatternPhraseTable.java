package my.cmmloutcomes.app.service.extraction;

import my.cmmloutcomes.app.domain.Metric;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered phrase table driving {@link PatternExtractor}. Rows are {@code kind,key,priority,pattern};
 * within a key, lower priority numbers are tried first. Patterns are matched case-insensitively and
 * metric and sample-size patterns must capture the number in group 1.
 */
public final class PatternPhraseTable {
	public static final String KIND_METRIC = "metric";
	public static final String KIND_SUBGROUP = "subgroup";
	public static final String KIND_SAMPLE_SIZE = "sample_size";
	public static final String RAS_MUTANT = "ras_mutant";
	public static final String NON_RAS_MUTANT = "non_ras_mutant";

	private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

	private final Map<Metric, List<Pattern>> metricPatterns;
	private final List<Pattern> rasMutantMarkers;
	private final List<Pattern> nonRasMutantMarkers;
	private final List<Pattern> sampleSizePatterns;

	private PatternPhraseTable(Map<Metric, List<Pattern>> metricPatterns,
							   List<Pattern> rasMutantMarkers,
							   List<Pattern> nonRasMutantMarkers,
							   List<Pattern> sampleSizePatterns) {
		this.metricPatterns = metricPatterns;
		this.rasMutantMarkers = rasMutantMarkers;
		this.nonRasMutantMarkers = nonRasMutantMarkers;
		this.sampleSizePatterns = sampleSizePatterns;
	}

	public static PatternPhraseTable load(Reader reader, String source) {
		List<Row> rows = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(reader, CSVFormat.DEFAULT.withFirstRecordAsHeader().withTrim())) {
			for (CSVRecord record : parser) {
				if (record.size() == 0 || isBlankRecord(record)) {
					continue;
				}
				rows.add(toRow(record, source));
			}
		} catch (IOException ex) {
			throw new IllegalStateException("Failed to read phrase table " + source + ": " + ex.getMessage(), ex);
		}
		return fromRows(rows, source);
	}

	static PatternPhraseTable fromRows(List<Row> rows, String source) {
		Map<Metric, List<Row>> metricRows = new EnumMap<>(Metric.class);
		List<Row> rasRows = new ArrayList<>();
		List<Row> nonRasRows = new ArrayList<>();
		List<Row> sampleRows = new ArrayList<>();
		for (Row row : rows) {
			switch (row.kind()) {
				case KIND_METRIC -> metricRows.computeIfAbsent(metricFor(row, source), key -> new ArrayList<>()).add(row);
				case KIND_SUBGROUP -> {
					if (RAS_MUTANT.equals(row.key())) {
						rasRows.add(row);
					} else if (NON_RAS_MUTANT.equals(row.key())) {
						nonRasRows.add(row);
					} else {
						throw new IllegalStateException("Unknown subgroup '" + row.key() + "' in phrase table " + source);
					}
				}
				case KIND_SAMPLE_SIZE -> sampleRows.add(row);
				default -> throw new IllegalStateException("Unknown row kind '" + row.kind() + "' in phrase table " + source);
			}
		}
		if (metricRows.isEmpty()) {
			throw new IllegalStateException("Phrase table " + source + " defines no metric patterns");
		}
		Map<Metric, List<Pattern>> metricPatterns = new EnumMap<>(Metric.class);
		for (Map.Entry<Metric, List<Row>> entry : metricRows.entrySet()) {
			metricPatterns.put(entry.getKey(), compileOrdered(entry.getValue(), true, source));
		}
		return new PatternPhraseTable(
				metricPatterns,
				compileOrdered(rasRows, false, source),
				compileOrdered(nonRasRows, false, source),
				compileOrdered(sampleRows, true, source)
		);
	}

	public List<Pattern> patternsFor(Metric metric) {
		return metricPatterns.getOrDefault(metric, List.of());
	}

	public List<Pattern> rasMutantMarkers() {
		return rasMutantMarkers;
	}

	public List<Pattern> nonRasMutantMarkers() {
		return nonRasMutantMarkers;
	}

	public List<Pattern> sampleSizePatterns() {
		return sampleSizePatterns;
	}

	private static List<Pattern> compileOrdered(List<Row> rows, boolean requiresCapture, String source) {
		List<Row> ordered = new ArrayList<>(rows);
		// stable sort keeps file order for equal priorities
		ordered.sort(Comparator.comparingInt(Row::priority));
		List<Pattern> patterns = new ArrayList<>();
		for (Row row : ordered) {
			Pattern pattern;
			try {
				pattern = Pattern.compile(row.pattern(), FLAGS);
			} catch (PatternSyntaxException ex) {
				throw new IllegalStateException("Invalid pattern for " + row.kind() + "/" + row.key()
						+ " in phrase table " + source + ": " + ex.getDescription(), ex);
			}
			if (requiresCapture && pattern.matcher("").groupCount() < 1) {
				throw new IllegalStateException("Pattern for " + row.kind() + "/" + row.key()
						+ " in phrase table " + source + " must capture the value in group 1");
			}
			patterns.add(pattern);
		}
		return List.copyOf(patterns);
	}

	private static Metric metricFor(Row row, String source) {
		try {
			return Metric.fromJsonName(row.key());
		} catch (IllegalArgumentException ex) {
			throw new IllegalStateException("Unknown metric '" + row.key() + "' in phrase table " + source, ex);
		}
	}

	private static Row toRow(CSVRecord record, String source) {
		String kind = value(record, "kind").toLowerCase(Locale.ROOT);
		String key = value(record, "key").toLowerCase(Locale.ROOT);
		String pattern = value(record, "pattern");
		String priorityText = value(record, "priority");
		int priority;
		try {
			priority = priorityText.isEmpty() ? Integer.MAX_VALUE : Integer.parseInt(priorityText);
		} catch (NumberFormatException ex) {
			throw new IllegalStateException("Invalid priority '" + priorityText + "' on line "
					+ record.getRecordNumber() + " of phrase table " + source, ex);
		}
		if (kind.isEmpty() || key.isEmpty() || pattern.isEmpty()) {
			throw new IllegalStateException("Incomplete row on line " + record.getRecordNumber()
					+ " of phrase table " + source);
		}
		return new Row(kind, key, priority, pattern);
	}

	private static String value(CSVRecord record, String column) {
		if (!record.isMapped(column)) {
			throw new IllegalStateException("Phrase table is missing column '" + column + "'");
		}
		if (!record.isSet(column)) {
			return "";
		}
		String value = record.get(column);
		return value == null ? "" : value.trim();
	}

	private static boolean isBlankRecord(CSVRecord record) {
		for (String value : record) {
			if (value != null && !value.isBlank()) {
				return false;
			}
		}
		return true;
	}

	record Row(String kind, String key, int priority, String pattern) {
	}
}
