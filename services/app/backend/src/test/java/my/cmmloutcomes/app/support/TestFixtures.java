package my.cmmloutcomes.app.support;

import my.cmmloutcomes.app.domain.DocumentRecord;
import my.cmmloutcomes.app.domain.ExtractedClinicalRecord;
import my.cmmloutcomes.app.domain.ExtractionMethod;
import my.cmmloutcomes.app.domain.Metric;
import my.cmmloutcomes.app.domain.MetricSet;
import my.cmmloutcomes.app.service.extraction.DrugVocabulary;
import my.cmmloutcomes.app.service.extraction.PatternPhraseTable;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

public final class TestFixtures {
	private TestFixtures() {
	}

	public static PatternPhraseTable defaultPhraseTable() {
		InputStream stream = TestFixtures.class.getResourceAsStream("/pattern-phrases.csv");
		if (stream == null) {
			throw new IllegalStateException("pattern-phrases.csv not on classpath");
		}
		try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
			return PatternPhraseTable.load(reader, "pattern-phrases.csv");
		} catch (IOException ex) {
			throw new UncheckedIOException(ex);
		}
	}

	public static DrugVocabulary defaultVocabulary() {
		return new DrugVocabulary(
				Map.of(
						"azacitidine", List.of("azacitidine", "5-azacitidine", "vidaza"),
						"decitabine", List.of("decitabine", "dacogen"),
						"hydroxyurea", List.of("hydroxyurea", "hydroxycarbamide", "hydrea", "HU")
				),
				List.of("cmml", "chronic myelomonocytic leukemia")
		);
	}

	public static DocumentRecord document(String identifier, String abstractText) {
		return new DocumentRecord(identifier, "Study " + identifier, abstractText, "Journal 2020;" + identifier, null);
	}

	public static MetricSet metrics(Object... metricValuePairs) {
		MetricSet.Builder builder = MetricSet.builder();
		for (int i = 0; i < metricValuePairs.length; i += 2) {
			Metric metric = (Metric) metricValuePairs[i];
			Number value = (Number) metricValuePairs[i + 1];
			builder.put(metric, value == null ? null : value.doubleValue());
		}
		return builder.build();
	}

	public static ExtractedClinicalRecord record(String identifier, String drug, double confidence, MetricSet overall) {
		return ExtractedClinicalRecord.builder(identifier, drug)
				.hasEvidence(!overall.isEmpty())
				.overall(overall)
				.extractionMethod(ExtractionMethod.GENERATIVE)
				.confidence(confidence)
				.build();
	}
}
