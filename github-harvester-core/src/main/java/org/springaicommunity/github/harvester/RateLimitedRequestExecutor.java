package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link RequestExecutor} that throttles itself on the GitHub rate limit headers.
 *
 * <p>
 * Protocol for every call:
 * <ol>
 * <li>Issue the GET through the wrapped {@link GitHubClient}.</li>
 * <li>Read {@code X-RateLimit-Remaining}. A missing header is read as
 * {@value #ASSUMED_REMAINING_WHEN_ABSENT}, which never throttles.</li>
 * <li>If remaining is below the low-water mark ({@value #LOW_WATER_MARK}), sleep until
 * {@code X-RateLimit-Reset} plus one second and re-issue the identical request.</li>
 * <li>Otherwise fail on a non-2xx status, or parse and return the body.</li>
 * </ol>
 *
 * <p>
 * Network failures are logged and rethrown at once. Only throttling is retried, and only
 * up to {@code maxThrottleWaits} times per call.
 *
 * <pre>
 * {@code
 * RequestExecutor executor = RateLimitedRequestExecutor.builder()
 *     .client(new GitHubHttpClient(token))
 *     .objectMapper(ObjectMapperFactory.create())
 *     .build();
 * JsonNode body = executor.execute("/search/repositories", Map.of("q", "stars:>=100"));
 * }
 * </pre>
 */
public final class RateLimitedRequestExecutor implements RequestExecutor {

	private static final Logger logger = LoggerFactory.getLogger(RateLimitedRequestExecutor.class);

	/**
	 * Remaining quota below which the executor waits for the rate limit window to reset.
	 */
	public static final int LOW_WATER_MARK = 5;

	/**
	 * Remaining quota assumed when the response carries no {@code X-RateLimit-Remaining}
	 * header.
	 */
	public static final int ASSUMED_REMAINING_WHEN_ABSENT = 30;

	/**
	 * Upper bound for a single wait. GitHub windows reset within an hour, so anything
	 * longer points at clock skew.
	 */
	private static final long MAX_RESET_WAIT_SECONDS = 3600;

	private static final long RESET_BUFFER_SECONDS = 1;

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	private final Sleeper sleeper;

	private final int maxThrottleWaits;

	private RateLimitedRequestExecutor(Builder builder, GitHubClient client) {
		this.client = client;
		this.objectMapper = builder.objectMapper;
		this.clock = builder.clock;
		this.sleeper = builder.sleeper;
		this.maxThrottleWaits = builder.maxThrottleWaits;
	}

	/**
	 * Create a new builder for RateLimitedRequestExecutor.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public JsonNode execute(String path, Map<String, String> queryParams) {
		String queryString = encodeQuery(queryParams);

		for (int waits = 0;; waits++) {
			GitHubResponse response = client.getWithQuery(path, queryString);
			RateLimitInfo rateLimit = response.rateLimit();
			int remaining = rateLimit.hasRemaining() ? rateLimit.remaining() : ASSUMED_REMAINING_WHEN_ABSENT;

			if (remaining < LOW_WATER_MARK) {
				if (waits >= maxThrottleWaits) {
					logger.error("Rate limit still at {} remaining for {} after {} waits", remaining, response.url(),
							waits);
					throw new GitHubApiException("Rate limit not restored after " + waits + " waits: " + response.url(),
							response.statusCode(), response.body(), remaining, rateLimit.reset());
				}
				Duration wait = computeWaitTime(rateLimit);
				logger.warn("Search API limit reached ({} remaining). Sleeping for {} seconds...", remaining,
						wait.toSeconds());
				sleep(wait);
				continue;
			}

			if (!response.isSuccessful()) {
				GitHubApiException failure = new GitHubApiException(
						"GitHub API error " + response.statusCode() + " for " + response.url(), response.statusCode(),
						response.body(), rateLimit.remaining(), rateLimit.reset());
				logger.error("Error making request to {}: status {}{}", response.url(), response.statusCode(),
						failure.isRateLimitError() ? " (rate limited)" : "");
				throw failure;
			}

			return parse(response);
		}
	}

	/**
	 * Wait until the reset epoch plus a one second buffer, never negative and never longer
	 * than an hour. Without a reset header only the buffer is waited.
	 */
	Duration computeWaitTime(RateLimitInfo rateLimit) {
		if (!rateLimit.hasReset()) {
			return Duration.ofSeconds(RESET_BUFFER_SECONDS);
		}
		long nowSeconds = clock.instant().getEpochSecond();
		long waitSeconds = rateLimit.reset() - nowSeconds + RESET_BUFFER_SECONDS;
		if (waitSeconds > MAX_RESET_WAIT_SECONDS) {
			logger.warn("Rate limit reset is {} seconds away (> 1hr), capping wait", waitSeconds);
			waitSeconds = MAX_RESET_WAIT_SECONDS;
		}
		return Duration.ofSeconds(Math.max(0, waitSeconds));
	}

	private JsonNode parse(GitHubResponse response) {
		try {
			return objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			logger.error("Error parsing response from {}: {}", response.url(), e.getOriginalMessage());
			throw new GitHubApiException("Unparseable response body from " + response.url(), e);
		}
	}

	private void sleep(Duration duration) {
		try {
			sleeper.sleep(duration);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("Rate limit wait interrupted", e);
		}
	}

	static String encodeQuery(Map<String, String> queryParams) {
		return queryParams.entrySet()
			.stream()
			.map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
					+ URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
			.collect(Collectors.joining("&"));
	}

	/**
	 * Builder for {@link RateLimitedRequestExecutor}.
	 *
	 * <p>
	 * Defaults:
	 * <ul>
	 * <li>objectMapper: {@link ObjectMapperFactory#create()}</li>
	 * <li>clock: system UTC clock</li>
	 * <li>sleeper: {@link Sleeper#SYSTEM}</li>
	 * <li>maxThrottleWaits: 10</li>
	 * </ul>
	 */
	public static class Builder {

		@Nullable
		private GitHubClient client;

		private ObjectMapper objectMapper = ObjectMapperFactory.create();

		private Clock clock = Clock.systemUTC();

		private Sleeper sleeper = Sleeper.SYSTEM;

		private int maxThrottleWaits = CollectionProperties.DEFAULT_MAX_THROTTLE_WAITS;

		private Builder() {
		}

		/**
		 * Set the client that performs the HTTP calls.
		 * @param client the GitHubClient to use (required)
		 * @return this builder
		 */
		public Builder client(GitHubClient client) {
			this.client = client;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * Set the clock used to compute the time left until the rate limit reset.
		 * @param clock the clock
		 * @return this builder
		 */
		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Set how many times a single call may wait for the rate limit to reset before
		 * giving up.
		 * @param maxThrottleWaits maximum waits per call (default: 10)
		 * @return this builder
		 */
		public Builder maxThrottleWaits(int maxThrottleWaits) {
			this.maxThrottleWaits = maxThrottleWaits;
			return this;
		}

		/**
		 * Build the RateLimitedRequestExecutor.
		 * @return configured executor
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RateLimitedRequestExecutor build() {
			if (client == null) {
				throw new IllegalStateException("A GitHubClient is required. Call client() first.");
			}
			if (objectMapper == null || clock == null || sleeper == null) {
				throw new IllegalStateException("objectMapper, clock and sleeper must not be null");
			}
			if (maxThrottleWaits < 0) {
				throw new IllegalStateException("maxThrottleWaits must be non-negative");
			}
			return new RateLimitedRequestExecutor(this, client);
		}

	}

}
