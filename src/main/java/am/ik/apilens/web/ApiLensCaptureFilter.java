package am.ik.apilens.web;

import java.io.IOException;
import java.time.Instant;
import java.time.InstantSource;

import am.ik.apilens.ApiLensProperties.RequestLoggingProperties;
import am.ik.apilens.client.ApiLensClient;
import am.ik.apilens.record.CaptureInput;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that records one {@link CaptureInput} per handled request and hands it
 * to the {@link ApiLensClient}. {@code OPTIONS} requests are never captured.
 * <p>
 * The request and response are wrapped so that body bytes are counted as the
 * application reads and writes them. Asynchronous requests are captured when the async
 * cycle completes. Nothing that goes wrong while capturing reaches the caller.
 */
public class ApiLensCaptureFilter extends OncePerRequestFilter {

	private static final Logger log = LoggerFactory.getLogger(ApiLensCaptureFilter.class);

	static final String BEST_MATCHING_PATTERN_ATTRIBUTE = "org.springframework.web.servlet.HandlerMapping.bestMatchingPattern";

	static final String X_FORWARDED_FOR = "X-Forwarded-For";

	static final String X_REAL_IP = "X-Real-IP";

	private final ApiLensClient client;

	private final RequestLoggingProperties requestLogging;

	private final ConsumerResolver consumerResolver;

	private final InstantSource instantSource;

	public ApiLensCaptureFilter(ApiLensClient client, RequestLoggingProperties requestLogging,
			ConsumerResolver consumerResolver) {
		this(client, requestLogging, consumerResolver, InstantSource.system());
	}

	public ApiLensCaptureFilter(ApiLensClient client, RequestLoggingProperties requestLogging,
			ConsumerResolver consumerResolver, InstantSource instantSource) {
		this.client = client;
		this.requestLogging = requestLogging;
		this.consumerResolver = (consumerResolver != null) ? consumerResolver : (request) -> null;
		this.instantSource = instantSource;
	}

	@Override
	protected boolean shouldNotFilter(HttpServletRequest request) {
		return "OPTIONS".equalsIgnoreCase(request.getMethod()) || !this.client.isEnabled();
	}

	@Override
	protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
			throws ServletException, IOException {
		long startNanos = System.nanoTime();
		Instant startedAt = this.instantSource.instant();
		CapturingRequestWrapper requestWrapper = new CapturingRequestWrapper(request,
				this.requestLogging.requestCaptureLimit());
		CapturingResponseWrapper responseWrapper = new CapturingResponseWrapper(response,
				this.requestLogging.responseCaptureLimit());
		boolean failed = true;
		try {
			filterChain.doFilter(requestWrapper, responseWrapper);
			failed = false;
		}
		finally {
			if (!failed && requestWrapper.isAsyncStarted()) {
				requestWrapper.getAsyncContext()
					.addListener(new CaptureOnCompleteListener(requestWrapper, responseWrapper, startNanos, startedAt));
			}
			else {
				capture(requestWrapper, responseWrapper, startNanos, startedAt, failed);
			}
		}
	}

	private void capture(CapturingRequestWrapper request, CapturingResponseWrapper response, long startNanos,
			Instant startedAt, boolean failed) {
		try {
			double elapsedMs = (System.nanoTime() - startNanos) / 1_000_000.0;
			int status = response.getStatus();
			if (failed && status < 400) {
				status = HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
			}
			ApiConsumer consumer = resolveConsumer(request);
			CaptureInput.Builder input = CaptureInput.builder()
				.timestamp(startedAt)
				.method(request.getMethod())
				.path(resolvePath(request))
				.statusCode(status)
				.responseTimeMs(elapsedMs)
				.requestSize(requestSize(request))
				.responseSize(responseSize(response))
				.ipAddress(resolveIpAddress(request))
				.userAgent(request.getHeader(HttpHeaders.USER_AGENT))
				.requestPayload(request.capturedBody())
				.responsePayload(response.capturedBody());
			if (consumer != null) {
				input.consumerId(consumer.id()).consumerName(consumer.name()).consumerGroup(consumer.group());
			}
			this.client.capture(input.build());
		}
		catch (RuntimeException ex) {
			log.error("Error while capturing request in API Lens filter", ex);
		}
	}

	private ApiConsumer resolveConsumer(HttpServletRequest request) {
		ApiConsumer consumer = ApiLensConsumers.getConsumer(request);
		if (consumer != null) {
			return consumer;
		}
		try {
			return this.consumerResolver.resolve(request);
		}
		catch (RuntimeException ex) {
			log.warn("msg=\"Consumer resolver failed\" uri={}", request.getRequestURI(), ex);
			return null;
		}
	}

	/**
	 * Matched route pattern when Spring MVC handled the request, otherwise the request
	 * URI without context path and query string.
	 */
	static String resolvePath(HttpServletRequest request) {
		Object pattern = request.getAttribute(BEST_MATCHING_PATTERN_ATTRIBUTE);
		if (pattern instanceof String p && !p.isEmpty()) {
			return p;
		}
		String uri = request.getRequestURI();
		if (uri == null) {
			return "/";
		}
		String contextPath = request.getContextPath();
		if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
			uri = uri.substring(contextPath.length());
		}
		int query = uri.indexOf('?');
		return (query >= 0) ? uri.substring(0, query) : uri;
	}

	static String resolveIpAddress(HttpServletRequest request) {
		String forwardedFor = request.getHeader(X_FORWARDED_FOR);
		if (forwardedFor != null) {
			String first = forwardedFor.split(",", 2)[0].trim();
			if (!first.isEmpty()) {
				return first;
			}
		}
		String realIp = request.getHeader(X_REAL_IP);
		if (realIp != null && !realIp.isBlank()) {
			return realIp.trim();
		}
		return request.getRemoteAddr();
	}

	private static long requestSize(CapturingRequestWrapper request) {
		long declared = request.getContentLengthLong();
		return (declared >= 0) ? declared : request.bytesRead();
	}

	private static long responseSize(CapturingResponseWrapper response) {
		String contentLength = response.getHeader(HttpHeaders.CONTENT_LENGTH);
		if (contentLength != null) {
			try {
				long declared = Long.parseLong(contentLength.trim());
				if (declared > 0) {
					return declared;
				}
			}
			catch (NumberFormatException ex) {
				log.debug("Ignoring malformed Content-Length '{}'", contentLength);
			}
		}
		return response.bytesWritten();
	}

	private final class CaptureOnCompleteListener implements AsyncListener {

		private final CapturingRequestWrapper request;

		private final CapturingResponseWrapper response;

		private final long startNanos;

		private final Instant startedAt;

		private volatile boolean failed;

		CaptureOnCompleteListener(CapturingRequestWrapper request, CapturingResponseWrapper response, long startNanos,
				Instant startedAt) {
			this.request = request;
			this.response = response;
			this.startNanos = startNanos;
			this.startedAt = startedAt;
		}

		@Override
		public void onComplete(AsyncEvent event) {
			capture(this.request, this.response, this.startNanos, this.startedAt, this.failed);
		}

		@Override
		public void onTimeout(AsyncEvent event) {
			this.failed = true;
		}

		@Override
		public void onError(AsyncEvent event) {
			this.failed = true;
		}

		@Override
		public void onStartAsync(AsyncEvent event) {
			event.getAsyncContext().addListener(this);
		}

	}

}
