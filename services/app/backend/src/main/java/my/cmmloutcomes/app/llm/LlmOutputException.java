package my.cmmloutcomes.app.llm;

/**
 * The model answered, but the answer is not usable: no JSON object, a schema mismatch, or a field
 * that cannot be coerced to its declared type.
 */
public class LlmOutputException extends RuntimeException {
	public static final String INVALID_OUTPUT = "invalid_output";

	private final String errorCode;

	public LlmOutputException(String message, String errorCode) {
		super(message);
		this.errorCode = errorCode;
	}

	public LlmOutputException(String message) {
		this(message, INVALID_OUTPUT);
	}

	public String getErrorCode() {
		return errorCode;
	}
}
