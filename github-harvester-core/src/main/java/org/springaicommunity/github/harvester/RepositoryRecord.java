package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * One row of the harvested table: a fixed projection of a repository search item.
 *
 * <p>
 * Values are copied from the upstream item as-is. Fields missing upstream (or JSON
 * {@code null}, which is common for {@code language}) stay {@code null}.
 *
 * @param name the repository name (without owner)
 * @param fullName the full repository name in "owner/repo" format
 * @param stargazersCount the star count at collection time
 * @param language the primary language reported by GitHub
 * @param createdAt the creation timestamp exactly as returned, e.g. "2014-01-02T10:00:00Z"
 */
@JsonPropertyOrder({ "name", "full_name", "stargazers_count", "language", "created_at" })
public record RepositoryRecord(@JsonProperty("name") @Nullable String name,
		@JsonProperty("full_name") @Nullable String fullName,
		@JsonProperty("stargazers_count") @Nullable Integer stargazersCount,
		@JsonProperty("language") @Nullable String language, @JsonProperty("created_at") @Nullable String createdAt) {

	/**
	 * Project a repository item from the {@code items} array of a search response.
	 * @param item the upstream repository object
	 * @return the projected record
	 */
	public static RepositoryRecord fromSearchItem(JsonNode item) {
		return new RepositoryRecord(JsonNodeUtils.getString(item, "name").orElse(null),
				JsonNodeUtils.getString(item, "full_name").orElse(null),
				JsonNodeUtils.getInt(item, "stargazers_count").orElse(null),
				JsonNodeUtils.getString(item, "language").orElse(null),
				JsonNodeUtils.getString(item, "created_at").orElse(null));
	}

}
