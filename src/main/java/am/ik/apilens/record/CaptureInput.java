package am.ik.apilens.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loosely-typed capture input keyed by the ingest field names. Any subset of fields may
 * be present and values may be of the wrong type; {@link RecordNormalizer} turns it into
 * a complete {@link RequestRecord}.
 */
public final class CaptureInput {

	public static final String TIMESTAMP = "timestamp";

	public static final String ENVIRONMENT = "environment";

	public static final String METHOD = "method";

	public static final String PATH = "path";

	public static final String STATUS_CODE = "status_code";

	public static final String RESPONSE_TIME_MS = "response_time_ms";

	public static final String REQUEST_SIZE = "request_size";

	public static final String RESPONSE_SIZE = "response_size";

	public static final String IP_ADDRESS = "ip_address";

	public static final String USER_AGENT = "user_agent";

	public static final String CONSUMER_ID = "consumer_id";

	public static final String CONSUMER_NAME = "consumer_name";

	public static final String CONSUMER_GROUP = "consumer_group";

	public static final String REQUEST_PAYLOAD = "request_payload";

	public static final String RESPONSE_PAYLOAD = "response_payload";

	private static final CaptureInput EMPTY = new CaptureInput(Map.of());

	private final Map<String, Object> values;

	private CaptureInput(Map<String, Object> values) {
		this.values = values;
	}

	/**
	 * Creates an input from arbitrary key/value pairs. Null keys and values are ignored.
	 */
	public static CaptureInput of(Map<String, ?> values) {
		if (values == null || values.isEmpty()) {
			return EMPTY;
		}
		Map<String, Object> copy = new LinkedHashMap<>();
		values.forEach((key, value) -> {
			if (key != null && value != null) {
				copy.put(key, value);
			}
		});
		return new CaptureInput(Collections.unmodifiableMap(copy));
	}

	public static CaptureInput empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Returns the raw value for the given field, or {@code null} when absent.
	 */
	public Object get(String field) {
		return this.values.get(field);
	}

	public Map<String, Object> asMap() {
		return this.values;
	}

	@Override
	public String toString() {
		return "CaptureInput" + this.values;
	}

	/**
	 * Fluent builder for {@link CaptureInput}.
	 */
	public static final class Builder {

		private final Map<String, Object> values = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder timestamp(Object timestamp) {
			return put(TIMESTAMP, timestamp);
		}

		public Builder environment(String environment) {
			return put(ENVIRONMENT, environment);
		}

		public Builder method(String method) {
			return put(METHOD, method);
		}

		public Builder path(String path) {
			return put(PATH, path);
		}

		public Builder statusCode(Object statusCode) {
			return put(STATUS_CODE, statusCode);
		}

		public Builder responseTimeMs(Object responseTimeMs) {
			return put(RESPONSE_TIME_MS, responseTimeMs);
		}

		public Builder requestSize(Object requestSize) {
			return put(REQUEST_SIZE, requestSize);
		}

		public Builder responseSize(Object responseSize) {
			return put(RESPONSE_SIZE, responseSize);
		}

		public Builder ipAddress(String ipAddress) {
			return put(IP_ADDRESS, ipAddress);
		}

		public Builder userAgent(String userAgent) {
			return put(USER_AGENT, userAgent);
		}

		public Builder consumerId(String consumerId) {
			return put(CONSUMER_ID, consumerId);
		}

		public Builder consumerName(String consumerName) {
			return put(CONSUMER_NAME, consumerName);
		}

		public Builder consumerGroup(String consumerGroup) {
			return put(CONSUMER_GROUP, consumerGroup);
		}

		public Builder requestPayload(String requestPayload) {
			return put(REQUEST_PAYLOAD, requestPayload);
		}

		public Builder responsePayload(String responsePayload) {
			return put(RESPONSE_PAYLOAD, responsePayload);
		}

		public Builder put(String field, Object value) {
			if (value == null) {
				this.values.remove(field);
			}
			else {
				this.values.put(field, value);
			}
			return this;
		}

		public CaptureInput build() {
			return CaptureInput.of(this.values);
		}

	}

}
