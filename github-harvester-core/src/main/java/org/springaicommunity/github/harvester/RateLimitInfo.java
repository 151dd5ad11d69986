package org.springaicommunity.github.harvester;

import java.time.Instant;

/**
 * Rate limit information from a single GitHub API response.
 *
 * <p>
 * Each field is {@code -1} when the corresponding {@code X-RateLimit-*} header was absent
 * or unparseable. Instances are derived per response and never reused across requests.
 *
 * @param limit the maximum number of requests allowed in the current window
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 * @param used the number of requests used in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Rate limit info for a response that carried no rate limit headers.
	 * @return info with every field unknown
	 */
	public static RateLimitInfo unknown() {
		return new RateLimitInfo(-1, -1, -1, -1);
	}

	/**
	 * Returns true if the remaining quota header was present.
	 * @return whether {@link #remaining()} is known
	 */
	public boolean hasRemaining() {
		return remaining >= 0;
	}

	/**
	 * Returns true if the reset header was present.
	 * @return whether {@link #reset()} is known
	 */
	public boolean hasReset() {
		return reset >= 0;
	}

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

}
