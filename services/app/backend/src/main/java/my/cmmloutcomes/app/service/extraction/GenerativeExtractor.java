package my.cmmloutcomes.app.service.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import my.cmmloutcomes.app.domain.DocumentRecord;
import my.cmmloutcomes.app.domain.Metric;
import my.cmmloutcomes.app.domain.MetricSet;
import my.cmmloutcomes.app.domain.StudyAttribution;
import my.cmmloutcomes.app.llm.LlmClient;
import my.cmmloutcomes.app.llm.LlmOutputException;
import my.cmmloutcomes.app.llm.LlmResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts outcome fields by asking the configured {@link LlmClient} for a JSON object and
 * converting that object field by field. Unknown keys are ignored; values of the wrong type are
 * rejected with {@link LlmOutputException}.
 */
public class GenerativeExtractor {
	private static final Logger logger = LoggerFactory.getLogger(GenerativeExtractor.class);
	private static final Set<String> NULL_MARKERS = Set.of("", "null", "none", "n/a", "na", "nr",
			"not reported", "not available", "unknown", "-");
	private static final Pattern NUMERIC_TEXT = Pattern.compile(
			"^(?:~|≈|approximately\\s+|approx\\.?\\s+|about\\s+)?([-+]?\\d+(?:\\.\\d+)?)$");
	private static final Pattern SAMPLE_SIZE_TEXT = Pattern.compile("^(?:n\\s*=\\s*)?(\\d+)(?:\\s*patients?)?$");
	private static final String CONDITION = "chronic myelomonocytic leukemia (CMML)";
	private static final String SCHEMA_JSON = """
			{
			  "$schema": "https://json-schema.org/draft/2020-12/schema",
			  "type": "object",
			  "$defs": {
			    "value": { "type": ["number", "string", "object", "array", "null"] },
			    "count": { "type": ["integer", "number", "string", "null"] },
			    "text": { "type": ["string", "number", "array", "null"] },
			    "group": {
			      "type": ["object", "null"],
			      "properties": {
			        "complete_response": { "$ref": "#/$defs/value" },
			        "partial_response": { "$ref": "#/$defs/value" },
			        "marrow_response": { "$ref": "#/$defs/value" },
			        "marrow_optimal_response": { "$ref": "#/$defs/value" },
			        "overall_response_rate": { "$ref": "#/$defs/value" },
			        "progression_free_survival_months": { "$ref": "#/$defs/value" },
			        "overall_survival_months": { "$ref": "#/$defs/value" },
			        "event_free_survival_months": { "$ref": "#/$defs/value" },
			        "serious_adverse_event_rate": { "$ref": "#/$defs/value" },
			        "any_grade_adverse_event_rate": { "$ref": "#/$defs/value" },
			        "grade_3_4_adverse_event_rate": { "$ref": "#/$defs/value" },
			        "discontinuation_rate": { "$ref": "#/$defs/value" },
			        "dose_reduction_rate": { "$ref": "#/$defs/value" },
			        "sample_size": { "$ref": "#/$defs/count" }
			      }
			    }
			  },
			  "properties": {
			    "has_evidence": { "type": ["boolean", "string", "null"] },
			    "overall": { "$ref": "#/$defs/group" },
			    "ras_mutant": { "$ref": "#/$defs/group" },
			    "non_ras_mutant": { "$ref": "#/$defs/group" },
			    "sample_size": { "$ref": "#/$defs/count" },
			    "ras_mutant_sample_size": { "$ref": "#/$defs/count" },
			    "non_ras_mutant_sample_size": { "$ref": "#/$defs/count" },
			    "study_type": { "$ref": "#/$defs/text" },
			    "key_findings": { "$ref": "#/$defs/text" },
			    "patient_population": { "$ref": "#/$defs/text" },
			    "treatment_details": { "$ref": "#/$defs/text" },
			    "data_location": { "$ref": "#/$defs/text" },
			    "supporting_quotes": { "type": ["array", "string", "null"] },
			    "extraction_confidence": { "type": ["number", "string", "null"] }
			  }
			}
			""";

	private final LlmClient llmClient;
	private final LlmJsonResponseParser responseParser;
	private final JsonSchema schema;
	private final int maxInputChars;
	private final int maxOutputTokens;
	private final int maxSupportingQuotes;

	public GenerativeExtractor(LlmClient llmClient,
							   ObjectMapper objectMapper,
							   int maxInputChars,
							   int maxOutputTokens,
							   int maxSupportingQuotes) {
		this.llmClient = llmClient;
		this.responseParser = new LlmJsonResponseParser(objectMapper);
		this.schema = buildSchema(objectMapper);
		this.maxInputChars = Math.max(1, maxInputChars);
		this.maxOutputTokens = Math.max(1, maxOutputTokens);
		this.maxSupportingQuotes = Math.max(0, maxSupportingQuotes);
	}

	public RawExtractionPayload extract(DocumentRecord document, String drug) {
		String prompt = buildPrompt(document, drug);
		logger.debug("Generative extraction prompt for {} ({} chars).", document.identifier(), prompt.length());
		LlmResponse response = llmClient.runJsonPrompt(prompt, maxOutputTokens);
		JsonNode root = responseParser.parse(response == null ? null : response.output());
		Set<ValidationMessage> errors = schema.validate(root);
		if (!errors.isEmpty()) {
			throw new LlmOutputException("Extraction JSON did not match schema: " + errors.iterator().next().getMessage());
		}
		return read(root, response.model());
	}

	String buildPrompt(DocumentRecord document, String drug) {
		String content = document.content();
		if (content.length() > maxInputChars) {
			content = content.substring(0, maxInputChars);
		}
		String citation = document.citation() == null ? "" : document.citation();
		return """
				You are a strict information extraction engine for clinical literature.

				Task:
				Extract treatment outcomes of %s in %s patients from the document below and return a single JSON object.

				Rules:
				- Output JSON only. No Markdown, no code fences, no explanation.
				- Only report values stated explicitly in the text for %s patients. Do not infer, estimate or compute values.
				- If the document does not discuss both %s and CMML, set "has_evidence" to false and leave all outcome fields null.
				- Percentages are plain numbers in percent units (e.g., 25 for 25%%). Durations are numbers in months.
				- Use null for anything not reported. Prefer null over a guess.
				- If several arms report a value, report the value for the %s arm.
				- supporting_quotes holds up to %d short verbatim sentences that contain the reported values.
				- extraction_confidence is a number between 0 and 1.

				Return JSON with these keys:
				- has_evidence: true | false
				- overall: { complete_response, partial_response, marrow_response, marrow_optimal_response,
				  overall_response_rate, progression_free_survival_months, overall_survival_months,
				  event_free_survival_months, serious_adverse_event_rate, any_grade_adverse_event_rate,
				  grade_3_4_adverse_event_rate, discontinuation_rate, dose_reduction_rate }
				- Serious adverse events, grade 3-4 adverse events and adverse events of any grade are different
				  measures; report each only under its own key. discontinuation_rate and dose_reduction_rate are the
				  percentages of patients who stopped treatment or had the dose reduced because of adverse events.
				- ras_mutant: same keys as overall, for RAS-mutant patients | null
				- non_ras_mutant: same keys as overall, for patients without RAS mutations | null
				- sample_size, ras_mutant_sample_size, non_ras_mutant_sample_size
				- study_type, key_findings, patient_population, treatment_details, data_location
				- supporting_quotes: [string]
				- extraction_confidence

				Document identifier: %s
				Citation: %s

				---BEGIN DOCUMENT---
				%s
				---END DOCUMENT---
				""".formatted(drug, CONDITION, CONDITION, drug, drug, maxSupportingQuotes,
				document.identifier(), citation, content);
	}

	RawExtractionPayload read(JsonNode root, String model) {
		List<String> warnings = new ArrayList<>();
		Boolean hasEvidence = booleanOrNull(field(root, "has_evidence", "has_cmml_data", "evidence_found"), "has_evidence");

		JsonNode overallNode = objectOrNull(root, "overall", "overall_outcomes");
		MetricSet overall = readMetrics(overallNode == null ? root : overallNode, "overall", warnings);

		JsonNode rasNode = objectOrNull(root, "ras_mutant", "ras_mutant_outcomes");
		JsonNode nonRasNode = objectOrNull(root, "non_ras_mutant", "non_ras_mutant_outcomes", "ras_wild_type");
		MetricSet rasMutant = rasNode == null ? null : emptyToNull(readMetrics(rasNode, "ras_mutant", warnings));
		MetricSet nonRasMutant = nonRasNode == null ? null : emptyToNull(readMetrics(nonRasNode, "non_ras_mutant", warnings));

		Integer sampleSize = integerOrNull(firstPresent(
				field(root, "sample_size", "cmml_sample_size", "n"),
				overallNode == null ? null : field(overallNode, "sample_size")), "sample_size");
		Integer rasSampleSize = integerOrNull(firstPresent(
				field(root, "ras_mutant_sample_size"),
				rasNode == null ? null : field(rasNode, "sample_size")), "ras_mutant_sample_size");
		Integer nonRasSampleSize = integerOrNull(firstPresent(
				field(root, "non_ras_mutant_sample_size"),
				nonRasNode == null ? null : field(nonRasNode, "sample_size")), "non_ras_mutant_sample_size");

		StudyAttribution attribution = new StudyAttribution(
				textOrNull(field(root, "study_type")),
				textOrNull(field(root, "key_findings")),
				textOrNull(field(root, "patient_population")),
				textOrNull(field(root, "treatment_details")),
				textOrNull(field(root, "data_location"))
		);
		Double confidence = confidenceOrNull(
				numberOrNull(field(root, "extraction_confidence", "confidence"), "extraction_confidence", warnings), warnings);

		return new RawExtractionPayload(hasEvidence, overall, rasMutant, nonRasMutant, sampleSize, rasSampleSize,
				nonRasSampleSize, readQuotes(field(root, "supporting_quotes", "quotes")), confidence, attribution,
				warnings, model);
	}

	private MetricSet readMetrics(JsonNode node, String scope, List<String> warnings) {
		MetricSet.Builder builder = MetricSet.builder();
		for (Metric metric : Metric.values()) {
			JsonNode value = field(node, metric.acceptedNames());
			builder.put(metric, numberOrNull(value, scope + "." + metric.jsonName(), warnings));
		}
		return builder.build();
	}

	private Double numberOrNull(JsonNode value, String fieldName, List<String> warnings) {
		if (isAbsent(value)) {
			return null;
		}
		if (value.isArray() || value.isObject()) {
			List<Double> parts = new ArrayList<>();
			Iterator<JsonNode> elements = value.elements();
			while (elements.hasNext()) {
				Double part = scalarNumberOrNull(elements.next(), fieldName);
				if (part != null) {
					parts.add(part);
				}
			}
			if (parts.isEmpty()) {
				return null;
			}
			double sum = 0.0;
			for (Double part : parts) {
				sum += part;
			}
			double mean = sum / parts.size();
			warnings.add("Composite value for " + fieldName + " averaged over " + parts.size() + " entries (" + mean + ").");
			return mean;
		}
		return scalarNumberOrNull(value, fieldName);
	}

	private Double scalarNumberOrNull(JsonNode value, String fieldName) {
		if (isAbsent(value)) {
			return null;
		}
		if (value.isNumber()) {
			return value.doubleValue();
		}
		if (value.isTextual()) {
			String text = normalizeNumericText(value.asText());
			if (text == null) {
				return null;
			}
			Matcher matcher = NUMERIC_TEXT.matcher(text);
			if (matcher.matches()) {
				return Double.parseDouble(matcher.group(1));
			}
		}
		throw new LlmOutputException("Field " + fieldName + " is not numeric: " + abbreviate(value.toString()));
	}

	/**
	 * Confidence is a fraction. Values in (1, 100] were given as percentages; anything else
	 * outside [0, 1] is dropped so the heuristic applies.
	 */
	static Double confidenceOrNull(Double value, List<String> warnings) {
		if (value == null) {
			return null;
		}
		if (value >= 0.0 && value <= 1.0) {
			return value;
		}
		if (value > 1.0 && value <= 100.0) {
			return value / 100.0;
		}
		warnings.add("Ignored extraction_confidence " + value + "; expected a value between 0 and 1.");
		return null;
	}

	private Integer integerOrNull(JsonNode value, String fieldName) {
		if (isAbsent(value)) {
			return null;
		}
		if (value.isIntegralNumber() && value.canConvertToInt()) {
			return value.intValue();
		}
		if (value.isNumber() && value.doubleValue() == Math.rint(value.doubleValue())
				&& Math.abs(value.doubleValue()) <= Integer.MAX_VALUE) {
			return (int) value.doubleValue();
		}
		if (value.isTextual()) {
			String text = value.asText().trim().toLowerCase(Locale.ROOT);
			if (NULL_MARKERS.contains(text)) {
				return null;
			}
			Matcher matcher = SAMPLE_SIZE_TEXT.matcher(text);
			if (matcher.matches() && matcher.group(1).length() <= 9) {
				return Integer.parseInt(matcher.group(1));
			}
		}
		throw new LlmOutputException("Field " + fieldName + " is not a whole number: " + abbreviate(value.toString()));
	}

	private Boolean booleanOrNull(JsonNode value, String fieldName) {
		if (isAbsent(value)) {
			return null;
		}
		if (value.isBoolean()) {
			return value.booleanValue();
		}
		if (value.isTextual()) {
			String text = value.asText().trim().toLowerCase(Locale.ROOT);
			if (NULL_MARKERS.contains(text)) {
				return null;
			}
			if (text.equals("true") || text.equals("yes")) {
				return Boolean.TRUE;
			}
			if (text.equals("false") || text.equals("no")) {
				return Boolean.FALSE;
			}
		}
		throw new LlmOutputException("Field " + fieldName + " is not a boolean: " + abbreviate(value.toString()));
	}

	private String textOrNull(JsonNode value) {
		if (isAbsent(value)) {
			return null;
		}
		if (value.isArray()) {
			List<String> parts = new ArrayList<>();
			for (JsonNode element : value) {
				String part = textOrNull(element);
				if (part != null) {
					parts.add(part);
				}
			}
			return parts.isEmpty() ? null : String.join("; ", parts);
		}
		String text = value.asText().trim();
		return NULL_MARKERS.contains(text.toLowerCase(Locale.ROOT)) ? null : text;
	}

	private List<String> readQuotes(JsonNode value) {
		if (isAbsent(value)) {
			return List.of();
		}
		List<String> quotes = new ArrayList<>();
		if (value.isArray()) {
			for (JsonNode element : value) {
				String quote = textOrNull(element);
				if (quote != null && quotes.size() < maxSupportingQuotes) {
					quotes.add(quote);
				}
			}
		} else {
			String quote = textOrNull(value);
			if (quote != null && maxSupportingQuotes > 0) {
				quotes.add(quote);
			}
		}
		return quotes;
	}

	private static String normalizeNumericText(String raw) {
		String text = raw.trim().toLowerCase(Locale.ROOT);
		if (NULL_MARKERS.contains(text)) {
			return null;
		}
		text = text.replace("%", "")
				.replaceAll("\\s*(?:months?|mos?\\.?)$", "")
				.trim();
		if (text.indexOf('.') < 0 && text.matches("[-+]?\\d+,\\d+")) {
			text = text.replace(',', '.');
		}
		return text;
	}

	private static JsonNode field(JsonNode node, String... names) {
		if (node == null || !node.isObject()) {
			return null;
		}
		for (String name : names) {
			JsonNode value = node.get(name);
			if (!isAbsent(value)) {
				return value;
			}
		}
		return null;
	}

	private static JsonNode objectOrNull(JsonNode node, String... names) {
		JsonNode value = field(node, names);
		return value != null && value.isObject() ? value : null;
	}

	private static JsonNode firstPresent(JsonNode first, JsonNode second) {
		return isAbsent(first) ? second : first;
	}

	private static boolean isAbsent(JsonNode value) {
		return value == null || value.isNull() || value.isMissingNode();
	}

	private static MetricSet emptyToNull(MetricSet set) {
		return set.isEmpty() ? null : set;
	}

	private static String abbreviate(String text) {
		return text.length() <= 80 ? text : text.substring(0, 80) + "...";
	}

	private JsonSchema buildSchema(ObjectMapper mapper) {
		try {
			JsonNode schemaNode = mapper.readTree(SCHEMA_JSON);
			return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schemaNode);
		} catch (Exception ex) {
			logger.error("Failed to load extraction JSON schema", ex);
			throw new IllegalStateException("Failed to load extraction schema", ex);
		}
	}
}
