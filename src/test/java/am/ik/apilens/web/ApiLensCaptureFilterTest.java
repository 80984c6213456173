package am.ik.apilens.web;

import java.nio.charset.StandardCharsets;
import java.security.Principal;
import java.time.Instant;
import java.time.InstantSource;
import java.util.List;

import am.ik.apilens.ApiLensProperties;
import am.ik.apilens.ApiLensProperties.RequestLoggingProperties;
import am.ik.apilens.client.ApiLensClient;
import am.ik.apilens.record.RequestRecord;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.util.StreamUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApiLensCaptureFilterTest {

	static final Instant NOW = Instant.parse("2026-02-06T15:30:00.123Z");

	static final RequestLoggingProperties CAPTURE_ALL = new RequestLoggingProperties(true, true, true, 8192);

	ApiLensClient client;

	@BeforeEach
	void createClient() {
		this.client = createClient(true);
	}

	@AfterEach
	void shutdownClient() {
		this.client.shutdown(false);
	}

	ApiLensClient createClient(boolean enabled) {
		ApiLensClient c = new ApiLensClient(ApiLensProperties.builder("key")
			.baseUrl("http://localhost:1/api")
			.batchSize(1000)
			.environment("test")
			.enabled(enabled)
			.build(), (endpoint, headers, body) -> 202, InstantSource.fixed(NOW));
		c.stop();
		return c;
	}

	ApiLensCaptureFilter filter(RequestLoggingProperties requestLogging, ConsumerResolver resolver) {
		return new ApiLensCaptureFilter(this.client, requestLogging, resolver, InstantSource.fixed(NOW));
	}

	RequestRecord captured() {
		List<RequestRecord> records = this.client.queuedRecords();
		assertThat(records).hasSize(1);
		return records.get(0);
	}

	@Test
	void capturesOneRecordPerRequest() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("POST", "/orders");
		request.setContent("{\"item\":\"book\"}".getBytes(StandardCharsets.UTF_8));
		request.addHeader("User-Agent", "curl/8.0");
		request.setRemoteAddr("192.168.0.10");
		MockHttpServletResponse response = new MockHttpServletResponse();
		FilterChain chain = (req, res) -> {
			StreamUtils.copyToByteArray(req.getInputStream());
			((HttpServletResponse) res).setStatus(201);
			res.getOutputStream().write("{\"id\":1}".getBytes(StandardCharsets.UTF_8));
		};

		filter(CAPTURE_ALL, null).doFilter(request, response, chain);

		RequestRecord record = captured();
		assertThat(record.timestamp()).isEqualTo(NOW);
		assertThat(record.environment()).isEqualTo("test");
		assertThat(record.method()).isEqualTo("POST");
		assertThat(record.path()).isEqualTo("/orders");
		assertThat(record.statusCode()).isEqualTo(201);
		assertThat(record.responseTimeMs()).isGreaterThanOrEqualTo(0);
		assertThat(record.requestSize()).isEqualTo(15);
		assertThat(record.responseSize()).isEqualTo(8);
		assertThat(record.ipAddress()).isEqualTo("192.168.0.10");
		assertThat(record.userAgent()).isEqualTo("curl/8.0");
		assertThat(record.requestPayload()).isEqualTo("{\"item\":\"book\"}");
		assertThat(record.responsePayload()).isEqualTo("{\"id\":1}");
		assertThat(response.getContentAsString()).isEqualTo("{\"id\":1}");
	}

	@Test
	void optionsRequestsAreNeverCaptured() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("OPTIONS", "/orders");
		MockHttpServletResponse response = new MockHttpServletResponse();

		filter(CAPTURE_ALL, null).doFilter(request, response, (req, res) -> {
		});

		assertThat(this.client.queueSize()).isZero();
	}

	@Test
	void disabledClientSkipsCapture() throws Exception {
		this.client.shutdown(false);
		this.client = createClient(false);
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/orders");

		filter(CAPTURE_ALL, null).doFilter(request, new MockHttpServletResponse(), (req, res) -> {
		});

		assertThat(this.client.queueSize()).isZero();
	}

	@Test
	void writerOutputIsForwardedAndCounted() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/greeting");
		MockHttpServletResponse response = new MockHttpServletResponse();

		filter(CAPTURE_ALL, null).doFilter(request, response, (req, res) -> {
			res.setCharacterEncoding("UTF-8");
			res.getWriter().print("héllo");
			res.getWriter().println();
		});

		RequestRecord record = captured();
		String expected = "héllo" + System.lineSeparator();
		assertThat(response.getContentAsString()).isEqualTo(expected);
		assertThat(record.responseSize()).isEqualTo(expected.getBytes(StandardCharsets.UTF_8).length);
		assertThat(record.responsePayload()).isEqualTo(expected);
	}

	@Test
	void payloadCaptureStopsAtCeilingWhileSizeCountsAllBytes() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/big");
		MockHttpServletResponse response = new MockHttpServletResponse();
		RequestLoggingProperties limited = new RequestLoggingProperties(true, true, true, 10);

		filter(limited, null).doFilter(request, response, (req, res) -> {
			for (int i = 0; i < 100; i++) {
				res.getOutputStream().write("0123456789".getBytes(StandardCharsets.UTF_8));
			}
		});

		RequestRecord record = captured();
		assertThat(record.responseSize()).isEqualTo(1000);
		assertThat(record.responsePayload()).isEqualTo("0123456789");
		assertThat(response.getContentAsByteArray()).hasSize(1000);
	}

	@Test
	void resetResponseDiscardsCapturedBody() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/retry");
		MockHttpServletResponse response = new MockHttpServletResponse();

		filter(CAPTURE_ALL, null).doFilter(request, response, (req, res) -> {
			res.getOutputStream().write("discarded".getBytes(StandardCharsets.UTF_8));
			res.reset();
			res.getWriter().write("kept");
		});

		RequestRecord record = captured();
		assertThat(response.getContentAsString()).isEqualTo("kept");
		assertThat(record.responsePayload()).isEqualTo("kept");
		assertThat(record.responseSize()).isEqualTo(4);
	}

	@Test
	void resetBufferDiscardsCapturedBody() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/retry");

		filter(CAPTURE_ALL, null).doFilter(request, new MockHttpServletResponse(), (req, res) -> {
			res.getOutputStream().write("discarded".getBytes(StandardCharsets.UTF_8));
			res.resetBuffer();
			res.getOutputStream().write("ok".getBytes(StandardCharsets.UTF_8));
		});

		RequestRecord record = captured();
		assertThat(record.responsePayload()).isEqualTo("ok");
		assertThat(record.responseSize()).isEqualTo(2);
	}

	@Test
	void sendErrorDiscardsPartialBody() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/missing");

		filter(CAPTURE_ALL, null).doFilter(request, new MockHttpServletResponse(), (req, res) -> {
			res.getOutputStream().write("partial".getBytes(StandardCharsets.UTF_8));
			((HttpServletResponse) res).sendError(404);
		});

		RequestRecord record = captured();
		assertThat(record.statusCode()).isEqualTo(404);
		assertThat(record.responsePayload()).isEmpty();
		assertThat(record.responseSize()).isZero();
	}

	@Test
	void payloadCaptureCanBeDisabled() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("POST", "/orders");
		request.setContent("secret".getBytes(StandardCharsets.UTF_8));
		MockHttpServletResponse response = new MockHttpServletResponse();

		filter(new RequestLoggingProperties(false, true, true, 8192), null).doFilter(request, response, (req, res) -> {
			StreamUtils.copyToByteArray(req.getInputStream());
			res.getOutputStream().write("body".getBytes(StandardCharsets.UTF_8));
		});

		RequestRecord record = captured();
		assertThat(record.requestPayload()).isEmpty();
		assertThat(record.responsePayload()).isEmpty();
		assertThat(record.requestSize()).isEqualTo(6);
		assertThat(record.responseSize()).isEqualTo(4);
	}

	@Test
	void responseBodyOnlyCapture() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("POST", "/orders");
		request.setContent("secret".getBytes(StandardCharsets.UTF_8));

		filter(new RequestLoggingProperties(true, false, true, 8192), null).doFilter(request,
				new MockHttpServletResponse(), (req, res) -> {
					StreamUtils.copyToByteArray(req.getInputStream());
					res.getOutputStream().write("body".getBytes(StandardCharsets.UTF_8));
				});

		RequestRecord record = captured();
		assertThat(record.requestPayload()).isEmpty();
		assertThat(record.responsePayload()).isEqualTo("body");
	}

	@Test
	void declaredContentLengthWinsOverCountedBytes() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/head");
		MockHttpServletResponse response = new MockHttpServletResponse();

		filter(CAPTURE_ALL, null).doFilter(request, response, (req, res) -> res.setContentLength(512));

		assertThat(captured().responseSize()).isEqualTo(512);
	}

	@Test
	void requestSizeFallsBackToBytesReadWithoutContentLength() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/none");

		filter(CAPTURE_ALL, null).doFilter(request, new MockHttpServletResponse(), (req, res) -> {
		});

		assertThat(captured().requestSize()).isZero();
	}

	@Test
	void ipAddressPrefersForwardedHeaders() {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
		request.setRemoteAddr("10.0.0.1");
		assertThat(ApiLensCaptureFilter.resolveIpAddress(request)).isEqualTo("10.0.0.1");

		request.addHeader("X-Real-IP", "172.16.0.5");
		assertThat(ApiLensCaptureFilter.resolveIpAddress(request)).isEqualTo("172.16.0.5");

		request.addHeader("X-Forwarded-For", " 203.0.113.7 , 10.0.0.2");
		assertThat(ApiLensCaptureFilter.resolveIpAddress(request)).isEqualTo("203.0.113.7");
	}

	@Test
	void pathPrefersMatchedRoutePattern() {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/app/orders/42");
		request.setContextPath("/app");
		assertThat(ApiLensCaptureFilter.resolvePath(request)).isEqualTo("/orders/42");

		request.setAttribute(ApiLensCaptureFilter.BEST_MATCHING_PATTERN_ATTRIBUTE, "/orders/{id}");
		assertThat(ApiLensCaptureFilter.resolvePath(request)).isEqualTo("/orders/{id}");
	}

	@Test
	void consumerSetByHandlerIsRecorded() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/orders");

		filter(CAPTURE_ALL, (req) -> ApiConsumer.of("from-resolver")).doFilter(request, new MockHttpServletResponse(),
				(req, res) -> ApiLensConsumers.setConsumer(req, ApiConsumer.of("acct-42", "Acme", "enterprise")));

		RequestRecord record = captured();
		assertThat(record.consumerId()).isEqualTo("acct-42");
		assertThat(record.consumerName()).isEqualTo("Acme");
		assertThat(record.consumerGroup()).isEqualTo("enterprise");
	}

	@Test
	void plainStringConsumerHasEmptyNameAndGroup() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/orders");

		filter(CAPTURE_ALL, null).doFilter(request, new MockHttpServletResponse(),
				(req, res) -> req.setAttribute(ApiLensConsumers.CONSUMER_ATTRIBUTE, "acct-7"));

		RequestRecord record = captured();
		assertThat(record.consumerId()).isEqualTo("acct-7");
		assertThat(record.consumerName()).isEmpty();
		assertThat(record.consumerGroup()).isEmpty();
	}

	@Test
	void consumerResolverIsUsedWhenHandlerSetsNone() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/orders");
		Principal principal = () -> "alice";
		request.setUserPrincipal(principal);

		filter(CAPTURE_ALL, new PrincipalConsumerResolver()).doFilter(request, new MockHttpServletResponse(),
				(req, res) -> {
				});

		assertThat(captured().consumerId()).isEqualTo("alice");
	}

	@Test
	void failingConsumerResolverDoesNotBreakCapture() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/orders");

		filter(CAPTURE_ALL, (req) -> {
			throw new IllegalStateException("lookup failed");
		}).doFilter(request, new MockHttpServletResponse(), (req, res) -> {
		});

		assertThat(captured().consumerId()).isEmpty();
	}

	@Test
	void exceptionFromChainIsRecordedAsServerErrorAndRethrown() {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/boom");

		assertThatThrownBy(() -> filter(CAPTURE_ALL, null).doFilter(request, new MockHttpServletResponse(),
				(req, res) -> {
					throw new ServletException("handler failed");
				}))
			.isInstanceOf(ServletException.class)
			.hasMessage("handler failed");

		assertThat(captured().statusCode()).isEqualTo(500);
	}

	@Test
	void errorStatusSetBeforeExceptionIsKept() {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/missing");

		assertThatThrownBy(() -> filter(CAPTURE_ALL, null).doFilter(request, new MockHttpServletResponse(),
				(req, res) -> {
					((HttpServletResponse) res).setStatus(404);
					throw new IllegalStateException("not found");
				}))
			.isInstanceOf(IllegalStateException.class);

		assertThat(captured().statusCode()).isEqualTo(404);
	}

	@Test
	void asyncRequestIsCapturedOnCompletion() throws Exception {
		MockHttpServletRequest request = new MockHttpServletRequest("GET", "/async");
		request.setAsyncSupported(true);
		MockHttpServletResponse response = new MockHttpServletResponse();

		filter(CAPTURE_ALL, null).doFilter(request, response, (req, res) -> {
			req.startAsync(req, res);
		});

		assertThat(this.client.queueSize()).isZero();

		response.getOutputStream().write("late".getBytes(StandardCharsets.UTF_8));
		request.getAsyncContext().complete();

		RequestRecord record = captured();
		assertThat(record.path()).isEqualTo("/async");
		assertThat(record.statusCode()).isEqualTo(200);
	}

}
