package am.ik.apilens.client;

import java.net.URI;
import java.util.regex.Pattern;

import am.ik.apilens.ApiLensProperties;

/**
 * Computes the ingest URL from a base URL and an ingest path. The ingest path is
 * interpreted, in order, as:
 * <ol>
 * <li>an absolute {@code http(s)://} URL, used as is;</li>
 * <li>a host-rooted path starting with {@code /}, resolved against the origin of the base
 * URL, ignoring its path;</li>
 * <li>a relative path, appended under the full path of the base URL.</li>
 * </ol>
 */
public final class IngestEndpointResolver {

	private static final Pattern ABSOLUTE_URL = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);

	private IngestEndpointResolver() {
	}

	/**
	 * Resolves the ingest endpoint.
	 * @param baseUrl API base URL, e.g. {@code https://api.apilens.ai/api/v1}
	 * @param ingestPath relative path, host-rooted path, or absolute URL
	 * @return the endpoint to POST batches to
	 * @throws IllegalArgumentException if the base URL or the result is not a valid
	 * absolute URL
	 */
	public static URI resolve(String baseUrl, String ingestPath) {
		String path = (ingestPath != null && !ingestPath.isBlank()) ? ingestPath.trim()
				: ApiLensProperties.DEFAULT_INGEST_PATH;
		if (ABSOLUTE_URL.matcher(path).find()) {
			return URI.create(path);
		}
		URI base = baseUri(baseUrl);
		if (path.startsWith("/")) {
			URI origin = URI.create(base.getScheme() + "://" + base.getRawAuthority() + "/");
			return origin.resolve(path);
		}
		return base.resolve(path);
	}

	private static URI baseUri(String baseUrl) {
		String base = (baseUrl != null) ? baseUrl.trim() : "";
		if (base.endsWith("/")) {
			base = base.substring(0, base.length() - 1);
		}
		URI uri = URI.create(base + "/");
		if (!uri.isAbsolute() || uri.getRawAuthority() == null) {
			throw new IllegalArgumentException("baseUrl must be an absolute http(s) URL: " + baseUrl);
		}
		return uri;
	}

}
