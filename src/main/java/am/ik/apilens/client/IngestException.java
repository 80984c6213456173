package am.ik.apilens.client;

/**
 * Thrown when a batch could not be delivered. Always considered retryable.
 */
public class IngestException extends Exception {

	private final int statusCode;

	public IngestException(String message, int statusCode) {
		super(message);
		this.statusCode = statusCode;
	}

	public IngestException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = 0;
	}

	/**
	 * HTTP status returned by the endpoint, or 0 for transport-level failures.
	 */
	public int statusCode() {
		return this.statusCode;
	}

}
