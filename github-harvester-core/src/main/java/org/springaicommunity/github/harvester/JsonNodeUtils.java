package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Utility methods for JsonNode navigation. Missing nodes and JSON {@code null} both read
 * as empty.
 */
public final class JsonNodeUtils {

	private JsonNodeUtils() {
	}

	public static Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return isAbsent(target) ? Optional.empty() : Optional.of(target.asText());
	}

	public static Optional<Integer> getInt(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return isAbsent(target) || !target.canConvertToInt() ? Optional.empty() : Optional.of(target.asInt());
	}

	public static Optional<Boolean> getBoolean(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return isAbsent(target) ? Optional.empty() : Optional.of(target.asBoolean());
	}

	public static List<JsonNode> getArray(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);

		if (target.isArray()) {
			List<JsonNode> result = new ArrayList<>();
			target.forEach(result::add);
			return result;
		}

		return List.of();
	}

	private static JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

	private static boolean isAbsent(JsonNode target) {
		return target.isMissingNode() || target.isNull();
	}

}
