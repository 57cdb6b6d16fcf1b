package my.cmmloutcomes.app.domain;

public enum ExtractionMethod {
	PATTERN,
	GENERATIVE
}
