package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Harvests repositories from the GitHub Search API into an ordered table.
 *
 * <p>
 * The configured history range is split into 30-day windows by
 * {@link SearchWindowPlanner}. Each window is queried with the base query plus a
 * {@code created:} qualifier, sorted by stars descending, and paginated 100 items at a
 * time up to {@link PageCursor#MAX_PAGES} pages. Rows are appended in fetch order and
 * collection stops as soon as {@code maxRepos} rows exist, even in the middle of a page.
 *
 * <p>
 * A failed page request abandons the rest of its window only; rows gathered so far are
 * always returned. Windows whose tenth page is still full are reported in
 * {@link CollectionStats#windowsTruncatedAtCap()}.
 */
public class RepositoryCollectionService {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryCollectionService.class);

	public static final String SEARCH_PATH = "/search/repositories";

	/**
	 * Items per page, the Search API maximum.
	 */
	public static final int PAGE_SIZE = 100;

	private final RequestExecutor executor;

	private final SearchWindowPlanner planner;

	private final CollectionProperties properties;

	private final Clock clock;

	public RepositoryCollectionService(RequestExecutor executor, SearchWindowPlanner planner,
			CollectionProperties properties, Clock clock) {
		this.executor = executor;
		this.planner = planner;
		this.properties = properties;
		this.clock = clock;
	}

	/**
	 * Collect using the base query and target count from the configured properties.
	 * @return the collected rows and run statistics
	 */
	public CollectionResult collect() {
		return collect(properties.getBaseQuery(), properties.getMaxRepos());
	}

	/**
	 * Collect up to {@code maxRepos} repositories matching {@code baseQuery}.
	 * @param baseQuery GitHub search query without a {@code created:} qualifier
	 * @param maxRepos maximum number of rows to collect
	 * @return the collected rows and run statistics
	 * @throws IllegalArgumentException if the query is blank or maxRepos is not positive
	 */
	public CollectionResult collect(String baseQuery, int maxRepos) {
		if (baseQuery.isBlank()) {
			throw new IllegalArgumentException("Base query cannot be empty");
		}
		if (maxRepos <= 0) {
			throw new IllegalArgumentException("maxRepos must be positive, got: " + maxRepos);
		}

		LocalDate end = properties.getHistoryEnd() != null ? properties.getHistoryEnd() : LocalDate.now(clock);
		List<SearchWindow> windows = planner.planWindows(properties.getHistoryStart(), end);
		Instant deadline = computeDeadline(properties.getDeadline());

		logger.info("Collecting up to {} repositories for query '{}' across {} windows ({} to {})", maxRepos,
				baseQuery, windows.size(), properties.getHistoryStart(), end);

		RunState state = new RunState(maxRepos);

		for (SearchWindow window : windows) {
			if (state.isFull()) {
				break;
			}
			if (Thread.currentThread().isInterrupted()) {
				logger.warn("Collection interrupted before window {}", window);
				break;
			}
			if (isPastDeadline(deadline)) {
				logger.warn("Collection deadline reached before window {}; returning {} repositories", window,
						state.repositories.size());
				state.deadlineReached = true;
				break;
			}
			collectWindow(baseQuery, window, state, deadline);
		}

		CollectionStats stats = new CollectionStats(state.windowsSearched, state.pagesFetched,
				state.windowsTruncatedAtCap, state.windowsAborted, state.deadlineReached);

		logger.info("Collected {} repositories from {} windows ({} pages, {} truncated at cap, {} aborted)",
				state.repositories.size(), stats.windowsSearched(), stats.pagesFetched(),
				stats.windowsTruncatedAtCap(), stats.windowsAborted());

		return new CollectionResult(state.repositories, stats);
	}

	private void collectWindow(String baseQuery, SearchWindow window, RunState state, @Nullable Instant deadline) {
		String query = baseQuery + " " + window.toCreatedQualifier();
		PageCursor cursor = PageCursor.first(window);

		while (!state.isFull()) {
			if (isPastDeadline(deadline)) {
				logger.warn("Collection deadline reached in window {} at page {}", window, cursor.pageNumber());
				state.deadlineReached = true;
				return;
			}

			if (cursor.pageNumber() == 1) {
				state.windowsSearched++;
			}
			logger.info("Fetching page {} for date range {}", cursor.pageNumber(), window.toCreatedQualifier());

			JsonNode response;
			try {
				response = executor.execute(SEARCH_PATH, searchParams(query, cursor));
			}
			catch (RuntimeException e) {
				logger.warn("Abandoning window {} at page {}: {}", window, cursor.pageNumber(), e.getMessage());
				state.windowsAborted++;
				return;
			}

			List<JsonNode> items = JsonNodeUtils.getArray(response, "items");
			if (items.isEmpty()) {
				logger.debug("Window {} exhausted at page {}", window, cursor.pageNumber());
				return;
			}
			if (JsonNodeUtils.getBoolean(response, "incomplete_results").orElse(false)) {
				logger.warn("GitHub reported incomplete results for window {} page {}", window, cursor.pageNumber());
			}

			for (JsonNode item : items) {
				state.repositories.add(RepositoryRecord.fromSearchItem(item));
				if (state.isFull()) {
					break;
				}
			}
			state.pagesFetched++;

			if (cursor.isLastPage()) {
				if (items.size() >= PAGE_SIZE && !state.isFull()) {
					logger.warn("Window {} reached the {}-result search cap; later matches were skipped", window,
							PageCursor.MAX_PAGES * PAGE_SIZE);
					state.windowsTruncatedAtCap++;
				}
				return;
			}
			cursor = cursor.next();
		}
	}

	static Map<String, String> searchParams(String query, PageCursor cursor) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("q", query);
		params.put("sort", "stars");
		params.put("order", "desc");
		params.put("per_page", String.valueOf(PAGE_SIZE));
		params.put("page", String.valueOf(cursor.pageNumber()));
		return params;
	}

	@Nullable
	private Instant computeDeadline(@Nullable Duration budget) {
		return budget != null ? clock.instant().plus(budget) : null;
	}

	private boolean isPastDeadline(@Nullable Instant deadline) {
		return deadline != null && !clock.instant().isBefore(deadline);
	}

	/**
	 * Mutable accumulator and counters, owned by a single collect() call.
	 */
	private static final class RunState {

		private final int maxRepos;

		private final List<RepositoryRecord> repositories = new ArrayList<>();

		private int windowsSearched;

		private int pagesFetched;

		private int windowsTruncatedAtCap;

		private int windowsAborted;

		private boolean deadlineReached;

		private RunState(int maxRepos) {
			this.maxRepos = maxRepos;
		}

		private boolean isFull() {
			return repositories.size() >= maxRepos;
		}

	}

}
