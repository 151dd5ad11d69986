package org.springaicommunity.github.harvester;

/**
 * Interface for raw GitHub REST API GET operations.
 *
 * <p>
 * Implementations perform exactly one network call per invocation and hand back the
 * status code, body and rate limit headers untouched. Status interpretation and
 * throttling belong to {@link RequestExecutor}, which keeps this seam small enough to mock
 * in tests.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string), e.g. "/search/repositories"
	 * @param queryString encoded query string (without leading ?), may be empty
	 * @return the response, whatever its status code
	 * @throws GitHubApiException if the request could not be performed at all
	 */
	GitHubResponse getWithQuery(String path, String queryString);

}
