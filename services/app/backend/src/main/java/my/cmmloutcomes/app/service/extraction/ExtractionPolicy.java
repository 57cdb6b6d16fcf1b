package my.cmmloutcomes.app.service.extraction;

import java.time.Duration;

public record ExtractionPolicy(
		boolean generativeEnabled,
		int maxAttempts,
		Duration retryBackoff,
		int maxSupportingQuotes
) {
	public ExtractionPolicy {
		maxAttempts = Math.max(1, maxAttempts);
		retryBackoff = retryBackoff == null || retryBackoff.isNegative() ? Duration.ZERO : retryBackoff;
		maxSupportingQuotes = Math.max(0, maxSupportingQuotes);
	}

	public static ExtractionPolicy defaults() {
		return new ExtractionPolicy(true, 1, Duration.ofSeconds(2), 10);
	}
}
