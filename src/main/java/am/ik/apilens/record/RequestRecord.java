package am.ik.apilens.record;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single normalized observation of an HTTP request/response pair, in the shape the
 * ingest endpoint accepts.
 */
public record RequestRecord(Instant timestamp, String environment, String method, String path,
		@JsonProperty("status_code") int statusCode, @JsonProperty("response_time_ms") double responseTimeMs,
		@JsonProperty("request_size") long requestSize, @JsonProperty("response_size") long responseSize,
		@JsonProperty("ip_address") String ipAddress, @JsonProperty("user_agent") String userAgent,
		@JsonProperty("consumer_id") String consumerId, @JsonProperty("consumer_name") String consumerName,
		@JsonProperty("consumer_group") String consumerGroup, @JsonProperty("request_payload") String requestPayload,
		@JsonProperty("response_payload") String responsePayload) {
}
