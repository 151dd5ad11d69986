package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Executes a single logical GET against the GitHub API and returns the parsed JSON body.
 *
 * <p>
 * Implementations may block and transparently re-issue the request while the API quota
 * is exhausted, but a returned body always belongs to a successful response.
 */
public interface RequestExecutor {

	/**
	 * Execute a GET request.
	 * @param path API path, e.g. "/search/repositories"
	 * @param queryParams query parameters in the order they should appear in the URL
	 * @return parsed response body
	 * @throws GitHubApiException on network failure, non-2xx status, or unparseable body
	 */
	JsonNode execute(String path, Map<String, String> queryParams);

}
