package am.ik.apilens.web;

import java.security.Principal;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Uses the name of the authenticated {@link Principal} as the consumer identifier. Only
 * sees principals established before {@link ApiLensCaptureFilter} runs, such as
 * container-managed authentication.
 */
public class PrincipalConsumerResolver implements ConsumerResolver {

	@Override
	public ApiConsumer resolve(HttpServletRequest request) {
		Principal principal = request.getUserPrincipal();
		if (principal == null) {
			return null;
		}
		return ApiConsumer.from(principal.getName());
	}

}
