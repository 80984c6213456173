package am.ik.apilens.client;

import java.net.URI;
import java.util.List;

import am.ik.apilens.record.RequestRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

/**
 * Serializes a batch as {@code {"requests": [...]}} and posts it to the ingest endpoint.
 * A non-2xx status or a transport failure is reported as an {@link IngestException}.
 */
public class HttpBatchSender implements BatchSender {

	public static final String API_KEY_HEADER = "X-API-Key";

	private final IngestTransport transport;

	private final URI endpoint;

	private final HttpHeaders headers;

	private final ObjectMapper objectMapper;

	public HttpBatchSender(IngestTransport transport, URI endpoint, String apiKey, String userAgent,
			ObjectMapper objectMapper) {
		this.transport = transport;
		this.endpoint = endpoint;
		this.objectMapper = objectMapper;
		HttpHeaders h = new HttpHeaders();
		h.setContentType(MediaType.APPLICATION_JSON);
		h.set(API_KEY_HEADER, apiKey);
		h.set(HttpHeaders.USER_AGENT, userAgent);
		this.headers = HttpHeaders.readOnlyHttpHeaders(h);
	}

	/**
	 * Creates the mapper used for the wire format. It is independent of any application
	 * {@code ObjectMapper} so host customizations cannot change field names or timestamp
	 * formats.
	 */
	public static ObjectMapper createObjectMapper() {
		return JsonMapper.builder()
			.addModule(new JavaTimeModule())
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
			.build();
	}

	@Override
	public void send(List<RequestRecord> records) throws IngestException {
		byte[] body;
		try {
			body = this.objectMapper.writeValueAsBytes(new IngestBatch(records));
		}
		catch (JsonProcessingException ex) {
			throw new IngestException("Failed to serialize batch of " + records.size() + " records", ex);
		}
		int status;
		try {
			status = this.transport.post(this.endpoint, this.headers, body);
		}
		catch (RuntimeException ex) {
			throw new IngestException("Ingest request to " + this.endpoint + " failed: " + ex.getMessage(), ex);
		}
		if (status < 200 || status >= 300) {
			throw new IngestException("Ingest request failed with status " + status, status);
		}
	}

	public URI endpoint() {
		return this.endpoint;
	}

	/**
	 * Request body accepted by the ingest endpoint.
	 */
	public record IngestBatch(List<RequestRecord> requests) {
	}

}
