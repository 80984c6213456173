package am.ik.apilens.client;

import java.net.URI;

import org.springframework.http.HttpHeaders;

/**
 * Performs the HTTP POST of a serialized batch. Implementations apply their own timeout
 * and abort the exchange when it elapses.
 */
@FunctionalInterface
public interface IngestTransport {

	/**
	 * Posts the body to the endpoint.
	 * @return the HTTP status code of the response
	 * @throws org.springframework.web.client.RestClientException or any other runtime
	 * exception on transport-level failure
	 */
	int post(URI endpoint, HttpHeaders headers, byte[] body);

}
