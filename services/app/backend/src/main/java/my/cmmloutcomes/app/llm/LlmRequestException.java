package my.cmmloutcomes.app.llm;

import java.util.List;
import java.util.Locale;

public class LlmRequestException extends RuntimeException {
	private static final List<String> QUOTA_MARKERS = List.of("quota", "rate limit", "rate_limit",
			"resource exhausted", "resource_exhausted", "too many requests");
	private static final List<String> AUTH_MARKERS = List.of("api key", "api_key", "unauthorized",
			"permission denied", "invalid_api_key");

	private final Integer statusCode;
	private final boolean retryable;

	public LlmRequestException(String message, Integer statusCode, boolean retryable, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.retryable = retryable;
	}

	public Integer getStatusCode() {
		return statusCode;
	}

	public boolean isRetryable() {
		return retryable;
	}

	public boolean isQuotaExceeded() {
		if (statusCode != null && statusCode == 429) {
			return true;
		}
		return messageContainsAny(QUOTA_MARKERS);
	}

	public boolean isAuthenticationFailure() {
		if (statusCode != null && (statusCode == 401 || statusCode == 403)) {
			return true;
		}
		return messageContainsAny(AUTH_MARKERS);
	}

	private boolean messageContainsAny(List<String> markers) {
		String message = getMessage();
		if (message == null) {
			return false;
		}
		String lower = message.toLowerCase(Locale.ROOT);
		for (String marker : markers) {
			if (lower.contains(marker)) {
				return true;
			}
		}
		return false;
	}
}
