package my.cmmloutcomes.app.service.extraction;

public enum ExtractionMode {
	/** Generative extraction first, pattern extraction when it fails or is unavailable. */
	GENERATIVE_WITH_FALLBACK,
	PATTERN_ONLY
}
