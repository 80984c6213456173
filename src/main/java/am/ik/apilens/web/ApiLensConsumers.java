package am.ik.apilens.web;

import jakarta.servlet.ServletRequest;

/**
 * Lets application code attach the consumer identity to the request being handled, so
 * {@link ApiLensCaptureFilter} can record it when the request completes.
 *
 * <pre class="code">
 * &#064;GetMapping("/orders")
 * List&lt;Order&gt; orders(HttpServletRequest request) {
 *     ApiLensConsumers.setConsumer(request, ApiConsumer.of("acct-42", "Acme", "enterprise"));
 *     ...
 * }
 * </pre>
 */
public final class ApiLensConsumers {

	public static final String CONSUMER_ATTRIBUTE = ApiLensConsumers.class.getName() + ".CONSUMER";

	private ApiLensConsumers() {
	}

	public static void setConsumer(ServletRequest request, String consumerId) {
		setConsumer(request, ApiConsumer.from(consumerId));
	}

	/**
	 * Attaches the consumer to the request; {@code null} clears it.
	 */
	public static void setConsumer(ServletRequest request, ApiConsumer consumer) {
		if (consumer == null) {
			request.removeAttribute(CONSUMER_ATTRIBUTE);
		}
		else {
			request.setAttribute(CONSUMER_ATTRIBUTE, consumer);
		}
	}

	/**
	 * Returns the consumer attached to the request. The attribute may also have been set
	 * directly to a string or a map.
	 */
	public static ApiConsumer getConsumer(ServletRequest request) {
		return ApiConsumer.from(request.getAttribute(CONSUMER_ATTRIBUTE));
	}

}
