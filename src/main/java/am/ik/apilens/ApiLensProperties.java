package am.ik.apilens;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the API Lens telemetry client. Out-of-range values are
 * clamped to the nearest supported value; the API key is validated when the client is
 * created.
 */
@ConfigurationProperties(prefix = "apilens")
public record ApiLensProperties(String apiKey, @DefaultValue(DEFAULT_BASE_URL) String baseUrl,
		@DefaultValue(DEFAULT_INGEST_PATH) String ingestPath, @DefaultValue("production") String environment,
		@DefaultValue("200") int batchSize, @DefaultValue("3s") Duration flushInterval,
		@DefaultValue("5s") Duration timeout, @DefaultValue("10000") int maxQueueSize,
		@DefaultValue("3") int maxRetries, @DefaultValue("250ms") Duration retryBackoffBase,
		@DefaultValue("5s") Duration retryBackoffMax, @DefaultValue("true") boolean enabled,
		@DefaultValue(DEFAULT_USER_AGENT) String userAgent, @DefaultValue RequestLoggingProperties requestLogging) {

	public static final String DEFAULT_BASE_URL = "https://api.apilens.ai/api/v1";

	public static final String DEFAULT_INGEST_PATH = "ingest/requests";

	public static final String DEFAULT_USER_AGENT = "apilens-java-sdk/0.1.0";

	/**
	 * The ingest endpoint rejects batches above this size.
	 */
	public static final int MAX_BATCH_SIZE = 1000;

	private static final Duration MIN_FLUSH_INTERVAL = Duration.ofMillis(50);

	private static final Duration MIN_DURATION = Duration.ofMillis(1);

	public ApiLensProperties {
		apiKey = (apiKey != null) ? apiKey.trim() : "";
		baseUrl = (baseUrl != null && !baseUrl.isBlank()) ? baseUrl.trim() : DEFAULT_BASE_URL;
		ingestPath = (ingestPath != null && !ingestPath.isBlank()) ? ingestPath.trim() : DEFAULT_INGEST_PATH;
		environment = (environment != null && !environment.isBlank()) ? environment : "production";
		batchSize = Math.min(Math.max(batchSize, 1), MAX_BATCH_SIZE);
		flushInterval = atLeast(flushInterval, Duration.ofSeconds(3), MIN_FLUSH_INTERVAL);
		timeout = atLeast(timeout, Duration.ofSeconds(5), MIN_DURATION);
		maxQueueSize = Math.max(maxQueueSize, 1);
		maxRetries = Math.max(maxRetries, 0);
		retryBackoffBase = atLeast(retryBackoffBase, Duration.ofMillis(250), MIN_DURATION);
		retryBackoffMax = atLeast(retryBackoffMax, Duration.ofSeconds(5), MIN_DURATION);
		userAgent = (userAgent != null && !userAgent.isBlank()) ? userAgent : DEFAULT_USER_AGENT;
		requestLogging = (requestLogging != null) ? requestLogging : new RequestLoggingProperties(true, true, true, 8192);
	}

	/**
	 * Returns a builder initialized with the default values and the given API key.
	 */
	public static Builder builder(String apiKey) {
		return new Builder(apiKey);
	}

	private static Duration atLeast(Duration value, Duration defaultValue, Duration min) {
		Duration d = (value != null) ? value : defaultValue;
		return (d.compareTo(min) < 0) ? min : d;
	}

	/**
	 * Request and response body capture settings of the servlet filter.
	 */
	public record RequestLoggingProperties(@DefaultValue("true") boolean capturePayloads,
			@DefaultValue("true") boolean logRequestBody, @DefaultValue("true") boolean logResponseBody,
			@DefaultValue("8192") int maxPayloadBytes) {

		public RequestLoggingProperties {
			maxPayloadBytes = Math.max(maxPayloadBytes, 0);
		}

		/**
		 * Number of request body bytes to keep, 0 when request capture is off.
		 */
		public int requestCaptureLimit() {
			return (this.capturePayloads && this.logRequestBody) ? this.maxPayloadBytes : 0;
		}

		/**
		 * Number of response body bytes to keep, 0 when response capture is off.
		 */
		public int responseCaptureLimit() {
			return (this.capturePayloads && this.logResponseBody) ? this.maxPayloadBytes : 0;
		}

	}

	/**
	 * Builder for programmatic construction outside a Spring Boot application.
	 */
	public static final class Builder {

		private final String apiKey;

		private String baseUrl = DEFAULT_BASE_URL;

		private String ingestPath = DEFAULT_INGEST_PATH;

		private String environment = "production";

		private int batchSize = 200;

		private Duration flushInterval = Duration.ofSeconds(3);

		private Duration timeout = Duration.ofSeconds(5);

		private int maxQueueSize = 10_000;

		private int maxRetries = 3;

		private Duration retryBackoffBase = Duration.ofMillis(250);

		private Duration retryBackoffMax = Duration.ofSeconds(5);

		private boolean enabled = true;

		private String userAgent = DEFAULT_USER_AGENT;

		private RequestLoggingProperties requestLogging = new RequestLoggingProperties(true, true, true, 8192);

		private Builder(String apiKey) {
			this.apiKey = apiKey;
		}

		public Builder baseUrl(String baseUrl) {
			this.baseUrl = baseUrl;
			return this;
		}

		public Builder ingestPath(String ingestPath) {
			this.ingestPath = ingestPath;
			return this;
		}

		public Builder environment(String environment) {
			this.environment = environment;
			return this;
		}

		public Builder batchSize(int batchSize) {
			this.batchSize = batchSize;
			return this;
		}

		public Builder flushInterval(Duration flushInterval) {
			this.flushInterval = flushInterval;
			return this;
		}

		public Builder timeout(Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		public Builder maxQueueSize(int maxQueueSize) {
			this.maxQueueSize = maxQueueSize;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		public Builder retryBackoff(Duration base, Duration max) {
			this.retryBackoffBase = base;
			this.retryBackoffMax = max;
			return this;
		}

		public Builder enabled(boolean enabled) {
			this.enabled = enabled;
			return this;
		}

		public Builder userAgent(String userAgent) {
			this.userAgent = userAgent;
			return this;
		}

		public Builder requestLogging(RequestLoggingProperties requestLogging) {
			this.requestLogging = requestLogging;
			return this;
		}

		public ApiLensProperties build() {
			return new ApiLensProperties(this.apiKey, this.baseUrl, this.ingestPath, this.environment,
					this.batchSize, this.flushInterval, this.timeout, this.maxQueueSize, this.maxRetries,
					this.retryBackoffBase, this.retryBackoffMax, this.enabled, this.userAgent, this.requestLogging);
		}

	}

}
