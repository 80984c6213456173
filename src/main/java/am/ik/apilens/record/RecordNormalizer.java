package am.ik.apilens.record;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.InstantSource;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a {@link CaptureInput} into the canonical {@link RequestRecord}. Never throws:
 * absent or malformed values degrade to empty strings, zero, or the current instant.
 */
public class RecordNormalizer {

	private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);

	public static final String DEFAULT_ENVIRONMENT = "production";

	public static final String DEFAULT_METHOD = "GET";

	private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(Instant::parse,
			(value) -> OffsetDateTime.parse(value).toInstant(),
			(value) -> LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant());

	private final String defaultEnvironment;

	private final int maxPayloadBytes;

	private final InstantSource instantSource;

	/**
	 * @param defaultEnvironment environment used when the input carries none
	 * @param maxPayloadBytes ceiling for request/response payload snapshots, in UTF-8
	 * bytes
	 * @param instantSource clock used when the timestamp is absent or unparsable
	 */
	public RecordNormalizer(String defaultEnvironment, int maxPayloadBytes, InstantSource instantSource) {
		this.defaultEnvironment = hasText(defaultEnvironment) ? defaultEnvironment : DEFAULT_ENVIRONMENT;
		this.maxPayloadBytes = Math.max(maxPayloadBytes, 0);
		this.instantSource = instantSource;
	}

	public RequestRecord normalize(CaptureInput input) {
		CaptureInput in = (input != null) ? input : CaptureInput.empty();
		String environment = text(in.get(CaptureInput.ENVIRONMENT));
		return new RequestRecord(toInstant(in.get(CaptureInput.TIMESTAMP)),
				hasText(environment) ? environment : this.defaultEnvironment,
				normalizeMethod(in.get(CaptureInput.METHOD)), normalizePath(in.get(CaptureInput.PATH)),
				(int) Math.min(toNonNegativeLong(in.get(CaptureInput.STATUS_CODE), 0), Integer.MAX_VALUE),
				toNonNegativeDouble(in.get(CaptureInput.RESPONSE_TIME_MS), 0),
				toNonNegativeLong(in.get(CaptureInput.REQUEST_SIZE), 0),
				toNonNegativeLong(in.get(CaptureInput.RESPONSE_SIZE), 0), text(in.get(CaptureInput.IP_ADDRESS)),
				text(in.get(CaptureInput.USER_AGENT)), text(in.get(CaptureInput.CONSUMER_ID)),
				text(in.get(CaptureInput.CONSUMER_NAME)), text(in.get(CaptureInput.CONSUMER_GROUP)),
				truncateUtf8(text(in.get(CaptureInput.REQUEST_PAYLOAD)), this.maxPayloadBytes),
				truncateUtf8(text(in.get(CaptureInput.RESPONSE_PAYLOAD)), this.maxPayloadBytes));
	}

	/**
	 * Returns {@code /} for a blank path, otherwise the trimmed path with a leading slash.
	 */
	public static String normalizePath(Object path) {
		String raw = text(path).trim();
		if (raw.isEmpty()) {
			return "/";
		}
		return raw.startsWith("/") ? raw : "/" + raw;
	}

	public static String normalizeMethod(Object method) {
		String raw = text(method).trim();
		return raw.isEmpty() ? DEFAULT_METHOD : raw.toUpperCase(Locale.ROOT);
	}

	/**
	 * Cuts the value to at most {@code maxBytes} UTF-8 bytes without splitting a
	 * multi-byte character.
	 */
	public static String truncateUtf8(String value, int maxBytes) {
		if (maxBytes <= 0 || value.isEmpty()) {
			return "";
		}
		if (value.length() * 3L <= maxBytes) {
			return value;
		}
		byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
		if (bytes.length <= maxBytes) {
			return value;
		}
		int cut = maxBytes;
		while (cut > 0 && (bytes[cut] & 0xC0) == 0x80) {
			cut--;
		}
		return new String(bytes, 0, cut, StandardCharsets.UTF_8);
	}

	Instant toInstant(Object value) {
		Instant instant = parseInstant(value);
		return ((instant != null) ? instant : this.instantSource.instant()).truncatedTo(ChronoUnit.MILLIS);
	}

	private static Instant parseInstant(Object value) {
		if (value instanceof Instant instant) {
			return instant;
		}
		if (value instanceof Date date) {
			return date.toInstant();
		}
		if (value instanceof TemporalAccessor temporal) {
			try {
				return Instant.from(temporal);
			}
			catch (RuntimeException ex) {
				log.debug("Unsupported temporal value '{}', using current time", value);
				return null;
			}
		}
		if (value instanceof Number number) {
			double millis = number.doubleValue();
			return Double.isFinite(millis) ? Instant.ofEpochMilli((long) millis) : null;
		}
		if (value instanceof CharSequence chars) {
			return parseInstant(chars.toString().trim());
		}
		return null;
	}

	private static Instant parseInstant(String value) {
		if (value.isEmpty()) {
			return null;
		}
		for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
			try {
				return parser.apply(value);
			}
			catch (DateTimeParseException ex) {
				log.trace("Timestamp '{}' did not match: {}", value, ex.getMessage());
			}
		}
		Double millis = parseDouble(value);
		if (millis != null) {
			return Instant.ofEpochMilli(millis.longValue());
		}
		log.debug("Failed to parse timestamp '{}', using current time", value);
		return null;
	}

	static long toNonNegativeLong(Object value, long fallback) {
		Double number = toDouble(value);
		if (number == null) {
			return fallback;
		}
		long floored = (long) Math.floor(number);
		return (floored >= 0) ? floored : fallback;
	}

	static double toNonNegativeDouble(Object value, double fallback) {
		Double number = toDouble(value);
		if (number == null) {
			return fallback;
		}
		return Math.max(number, 0);
	}

	private static Double toDouble(Object value) {
		if (value instanceof Number number) {
			double d = number.doubleValue();
			return Double.isFinite(d) ? d : null;
		}
		if (value instanceof CharSequence chars) {
			return parseDouble(chars.toString().trim());
		}
		return null;
	}

	private static Double parseDouble(String value) {
		if (value.isEmpty()) {
			return null;
		}
		try {
			double d = Double.parseDouble(value);
			return Double.isFinite(d) ? d : null;
		}
		catch (NumberFormatException ex) {
			return null;
		}
	}

	private static String text(Object value) {
		return (value != null) ? value.toString() : "";
	}

	private static boolean hasText(String value) {
		return value != null && !value.isBlank();
	}

}
