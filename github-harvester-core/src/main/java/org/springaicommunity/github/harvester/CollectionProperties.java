package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for repository harvesting.
 *
 * <p>
 * Properties can be set directly via setters or passed to
 * {@link RepositoryHarvesterBuilder}. Defaults reproduce a full crawl of public
 * repositories with at least 100 stars since 2014.
 *
 * <p>
 * Search constants that GitHub imposes are not configurable: page size
 * ({@link RepositoryCollectionService#PAGE_SIZE}), page-depth ceiling
 * ({@link PageCursor#MAX_PAGES}) and the rate limit low-water mark
 * ({@link RateLimitedRequestExecutor#LOW_WATER_MARK}).
 */
public class CollectionProperties {

	public static final String DEFAULT_BASE_QUERY = "is:public stars:>=100";

	public static final int DEFAULT_MAX_REPOS = 5000;

	public static final LocalDate DEFAULT_HISTORY_START = LocalDate.of(2014, 1, 1);

	public static final int DEFAULT_MAX_THROTTLE_WAITS = 10;

	/**
	 * Search query every window query starts from.
	 */
	private String baseQuery = DEFAULT_BASE_QUERY;

	/**
	 * Number of rows after which collection stops.
	 */
	private int maxRepos = DEFAULT_MAX_REPOS;

	/**
	 * Earliest repository creation date searched.
	 */
	private LocalDate historyStart = DEFAULT_HISTORY_START;

	/**
	 * Latest repository creation date searched; {@code null} means today.
	 */
	@Nullable
	private LocalDate historyEnd = null;

	/**
	 * CSV file the CLI writes the table to.
	 */
	private String outputFile = "github_repositories.csv";

	/**
	 * Timeout for a single HTTP request.
	 */
	private Duration requestTimeout = Duration.ofSeconds(30);

	/**
	 * Overall time budget for one collection run; {@code null} means unbounded.
	 */
	@Nullable
	private Duration deadline = null;

	/**
	 * Maximum rate limit waits for a single request before it fails.
	 */
	private int maxThrottleWaits = DEFAULT_MAX_THROTTLE_WAITS;

	/**
	 * GitHub REST API base URL.
	 */
	private String apiBaseUrl = GitHubHttpClient.GITHUB_API_BASE;

	/**
	 * Enable debug-level logging output.
	 */
	private boolean verbose = false;

	public String getBaseQuery() {
		return baseQuery;
	}

	public void setBaseQuery(String baseQuery) {
		this.baseQuery = baseQuery;
	}

	public int getMaxRepos() {
		return maxRepos;
	}

	public void setMaxRepos(int maxRepos) {
		this.maxRepos = maxRepos;
	}

	public LocalDate getHistoryStart() {
		return historyStart;
	}

	public void setHistoryStart(LocalDate historyStart) {
		this.historyStart = historyStart;
	}

	@Nullable
	public LocalDate getHistoryEnd() {
		return historyEnd;
	}

	/**
	 * Sets the latest creation date searched.
	 * @param historyEnd the end date, or {@code null} for "today"
	 */
	public void setHistoryEnd(@Nullable LocalDate historyEnd) {
		this.historyEnd = historyEnd;
	}

	public String getOutputFile() {
		return outputFile;
	}

	public void setOutputFile(String outputFile) {
		this.outputFile = outputFile;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

	@Nullable
	public Duration getDeadline() {
		return deadline;
	}

	/**
	 * Sets the overall time budget for a run.
	 * @param deadline the budget, or {@code null} for no limit
	 */
	public void setDeadline(@Nullable Duration deadline) {
		this.deadline = deadline;
	}

	public int getMaxThrottleWaits() {
		return maxThrottleWaits;
	}

	public void setMaxThrottleWaits(int maxThrottleWaits) {
		this.maxThrottleWaits = maxThrottleWaits;
	}

	public String getApiBaseUrl() {
		return apiBaseUrl;
	}

	public void setApiBaseUrl(String apiBaseUrl) {
		this.apiBaseUrl = apiBaseUrl;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

	/**
	 * Check every property and report all problems at once.
	 * @throws IllegalArgumentException if any property is invalid
	 */
	public void validate() {
		List<String> errors = new ArrayList<>();

		if (baseQuery == null || baseQuery.isBlank()) {
			errors.add("Base query cannot be empty");
		}
		if (maxRepos <= 0) {
			errors.add("Max repos must be positive (got: " + maxRepos + ")");
		}
		if (historyStart == null) {
			errors.add("History start date is required");
		}
		else if (historyEnd != null && historyEnd.isBefore(historyStart)) {
			errors.add("History end " + historyEnd + " is before history start " + historyStart);
		}
		if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
			errors.add("Request timeout must be positive");
		}
		if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
			errors.add("Deadline must be positive");
		}
		if (maxThrottleWaits < 0) {
			errors.add("Max throttle waits must be non-negative (got: " + maxThrottleWaits + ")");
		}
		if (apiBaseUrl == null || !apiBaseUrl.startsWith("http")) {
			errors.add("API base URL must be an http(s) URL");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
