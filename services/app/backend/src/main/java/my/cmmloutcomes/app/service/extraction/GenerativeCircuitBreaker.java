package my.cmmloutcomes.app.service.extraction;

import my.cmmloutcomes.app.llm.LlmRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide switch that disables generative extraction once the service reports an exhausted
 * quota or rejects the credentials. It stays open until {@link #reset()}.
 */
public class GenerativeCircuitBreaker {
	private static final Logger logger = LoggerFactory.getLogger(GenerativeCircuitBreaker.class);

	private volatile String openReason;

	public boolean isOpen() {
		return openReason != null;
	}

	public String getOpenReason() {
		return openReason;
	}

	/**
	 * @return true when this failure opened the breaker
	 */
	public boolean recordFailure(LlmRequestException ex) {
		if (isOpen() || ex == null) {
			return false;
		}
		String reason;
		if (ex.isQuotaExceeded()) {
			reason = "quota exceeded";
		} else if (ex.isAuthenticationFailure()) {
			reason = "authentication failed";
		} else {
			return false;
		}
		openReason = reason + " (" + ex.getMessage() + ")";
		logger.warn("Generative extraction disabled for the rest of the run: {}.", openReason);
		return true;
	}

	public void reset() {
		openReason = null;
	}
}
