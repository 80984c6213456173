package am.ik.apilens.client;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * {@link IngestTransport} backed by {@link RestClient} on the JDK {@link HttpClient}.
 * <p>
 * The configured timeout is applied separately to connection establishment and to
 * waiting for the response, so a single attempt against an endpoint that is slow in both
 * phases can take up to twice the timeout. {@link ApiLensClient} sizes its shutdown wait
 * accordingly.
 */
public class RestClientIngestTransport implements IngestTransport {

	private final RestClient restClient;

	public RestClientIngestTransport(RestClient.Builder restClientBuilder, Duration timeout) {
		HttpClient httpClient = HttpClient.newBuilder()
			.connectTimeout(timeout)
			.followRedirects(HttpClient.Redirect.NEVER)
			.build();
		JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
		requestFactory.setReadTimeout(timeout);
		this.restClient = restClientBuilder.requestFactory(requestFactory).build();
	}

	public static RestClientIngestTransport create(Duration timeout) {
		return new RestClientIngestTransport(RestClient.builder(), timeout);
	}

	@Override
	public int post(URI endpoint, HttpHeaders headers, byte[] body) {
		return this.restClient.post()
			.uri(endpoint)
			.headers((h) -> h.addAll(headers))
			.body(body)
			.exchange((request, response) -> response.getStatusCode().value());
	}

}
