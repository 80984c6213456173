package am.ik.apilens.web;

import java.util.Map;

/**
 * Identity of the caller of the monitored API. Either a bare identifier or an
 * identifier with a display name and group.
 */
public sealed interface ApiConsumer permits ApiConsumer.Identifier, ApiConsumer.Detailed {

	String id();

	default String name() {
		return "";
	}

	default String group() {
		return "";
	}

	static ApiConsumer of(String id) {
		return new Identifier(id);
	}

	static ApiConsumer of(String id, String name, String group) {
		return new Detailed(id, name, group);
	}

	/**
	 * Interprets a loosely-typed consumer value: an {@link ApiConsumer} is returned as is,
	 * a non-blank string becomes an {@link Identifier}, and a map is read from the
	 * {@code id}/{@code identifier}/{@code consumer_id}, {@code name}/{@code consumer_name}
	 * and {@code group}/{@code consumer_group} keys.
	 * @return the consumer, or {@code null} when the value carries no identity
	 */
	static ApiConsumer from(Object value) {
		if (value instanceof ApiConsumer consumer) {
			return consumer;
		}
		if (value instanceof CharSequence chars) {
			String id = chars.toString().trim();
			return id.isEmpty() ? null : new Identifier(id);
		}
		if (value instanceof Map<?, ?> map) {
			String id = firstText(map, "id", "identifier", "consumer_id");
			String name = firstText(map, "name", "consumer_name");
			String group = firstText(map, "group", "consumer_group");
			if (id.isEmpty() && name.isEmpty() && group.isEmpty()) {
				return null;
			}
			return new Detailed(id, name, group);
		}
		return null;
	}

	private static String firstText(Map<?, ?> map, String... keys) {
		for (String key : keys) {
			Object value = map.get(key);
			if (value != null && !value.toString().isEmpty()) {
				return value.toString();
			}
		}
		return "";
	}

	/**
	 * A consumer known only by its identifier.
	 */
	record Identifier(String id) implements ApiConsumer {

		public Identifier {
			id = (id != null) ? id : "";
		}

	}

	/**
	 * A consumer with identifier, display name and group.
	 */
	record Detailed(String id, String name, String group) implements ApiConsumer {

		public Detailed {
			id = (id != null) ? id : "";
			name = (name != null) ? name : "";
			group = (group != null) ? group : "";
		}

	}

}
