package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a GitHub API call fails, either at the network level or with a
 * non-success status code.
 *
 * <p>
 * Carries rate limit information when available so callers can log why a request was
 * refused.
 */
public class GitHubApiException extends RuntimeException {

	private final int statusCode;

	@Nullable
	private final String responseBody;

	private final int rateLimitRemaining;

	private final long resetEpochSeconds;

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
		this(message, statusCode, responseBody, -1, -1);
	}

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody, int rateLimitRemaining,
			long resetEpochSeconds) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.rateLimitRemaining = rateLimitRemaining;
		this.resetEpochSeconds = resetEpochSeconds;
	}

	public GitHubApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
		this.rateLimitRemaining = -1;
		this.resetEpochSeconds = -1;
	}

	/**
	 * Returns the HTTP status code, or -1 when the request never produced a response.
	 * @return the status code
	 */
	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

	public int getRateLimitRemaining() {
		return rateLimitRemaining;
	}

	public long getResetEpochSeconds() {
		return resetEpochSeconds;
	}

	/**
	 * Returns true if this exception represents a rate limit rejection (either 403 with
	 * remaining=0 or 429).
	 */
	public boolean isRateLimitError() {
		return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
	}

}
