package org.springaicommunity.github.harvester;

/**
 * A single HTTP response from the GitHub API.
 *
 * @param url the requested URL
 * @param statusCode the HTTP status code
 * @param body the response body
 * @param rateLimit rate limit headers read from this response
 */
public record GitHubResponse(String url, int statusCode, String body, RateLimitInfo rateLimit) {

	/**
	 * Returns true for any 2xx status.
	 * @return whether the request succeeded
	 */
	public boolean isSuccessful() {
		return statusCode >= 200 && statusCode < 300;
	}

}
