package am.ik.apilens.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Looks up the consumer of a completed request when application code did not attach one
 * through {@link ApiLensConsumers}.
 */
@FunctionalInterface
public interface ConsumerResolver {

	/**
	 * @return the consumer, or {@code null} if unknown
	 */
	ApiConsumer resolve(HttpServletRequest request);

}
