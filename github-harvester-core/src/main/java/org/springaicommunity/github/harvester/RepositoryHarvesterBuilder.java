package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;

/**
 * Builder for wiring the harvester components.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Token from GITHUB_TOKEN (environment or .env)
 * RepositoryCollectionService collector = RepositoryHarvesterBuilder.create()
 *     .tokenFromEnv()
 *     .buildCollector();
 *
 * // With custom configuration
 * CollectionProperties props = new CollectionProperties();
 * props.setMaxRepos(1000);
 * props.setHistoryStart(LocalDate.of(2020, 1, 1));
 *
 * RepositoryCollectionService collector = RepositoryHarvesterBuilder.create()
 *     .token("ghp_xxxxx")
 *     .properties(props)
 *     .buildCollector();
 *
 * CollectionResult result = collector.collect("is:public stars:>=100", 1000);
 *
 * // For testing with a mock HTTP client and no real sleeping
 * RepositoryCollectionService testCollector = RepositoryHarvesterBuilder.create()
 *     .httpClient(mockClient)
 *     .sleeper(duration -> {})
 *     .buildCollector();
 * }
 * </pre>
 */
public class RepositoryHarvesterBuilder {

	@Nullable
	private String token;

	private CollectionProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private GitHubClient httpClient;

	private Clock clock = Clock.systemUTC();

	private Sleeper sleeper = Sleeper.SYSTEM;

	private RepositoryHarvesterBuilder() {
		this.properties = new CollectionProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new RepositoryHarvesterBuilder
	 */
	public static RepositoryHarvesterBuilder create() {
		return new RepositoryHarvesterBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public RepositoryHarvesterBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN} via {@link EnvironmentSupport}.
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public RepositoryHarvesterBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.require(EnvironmentSupport.GITHUB_TOKEN);
		return this;
	}

	/**
	 * Set collection properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public RepositoryHarvesterBuilder properties(@Nullable CollectionProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	public RepositoryHarvesterBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks.
	 *
	 * <p>
	 * When a custom client is provided, the token is not required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public RepositoryHarvesterBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set the clock used for "today", rate limit reset arithmetic and the deadline.
	 * @param clock the clock
	 * @return this builder
	 */
	public RepositoryHarvesterBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	public RepositoryHarvesterBuilder sleeper(Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	/**
	 * Build the rate limited request executor directly (for advanced usage).
	 * @return configured executor
	 */
	public RequestExecutor buildExecutor() {
		validate();
		GitHubClient client = this.httpClient != null ? this.httpClient
				: new GitHubHttpClient(token, properties.getApiBaseUrl(), properties.getRequestTimeout());
		return RateLimitedRequestExecutor.builder()
			.client(client)
			.objectMapper(objectMapper != null ? objectMapper : ObjectMapperFactory.create())
			.clock(clock)
			.sleeper(sleeper)
			.maxThrottleWaits(properties.getMaxThrottleWaits())
			.build();
	}

	/**
	 * Build a RepositoryCollectionService.
	 * @return configured collector
	 * @throws IllegalStateException if no token is configured and no client was supplied
	 * @throws IllegalArgumentException if the properties are invalid
	 */
	public RepositoryCollectionService buildCollector() {
		RequestExecutor executor = buildExecutor();
		return new RepositoryCollectionService(executor, new SearchWindowPlanner(), properties, clock);
	}

	private void validate() {
		properties.validate();
		// Skip token validation if a custom httpClient is provided
		if (httpClient != null) {
			return;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
	}

}
