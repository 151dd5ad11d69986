package org.springaicommunity.github.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Plans fixed-width time windows for GitHub Search API collection.
 *
 * <p>
 * The GitHub Search API returns a maximum of 1,000 results per query regardless of
 * pagination. Splitting a multi-year range into short creation-date windows keeps most
 * queries under that cap.
 *
 * <p>
 * Each window spans {@code windowDays} days from its start date, clipped to the overall
 * end; the next window starts the day after. Windows are contiguous, non-overlapping and
 * ascending.
 *
 * <pre>{@code
 * var planner = new SearchWindowPlanner();
 * List<SearchWindow> windows = planner.planWindows(LocalDate.of(2014, 1, 1), LocalDate.now());
 * }</pre>
 */
public class SearchWindowPlanner {

	private static final Logger logger = LoggerFactory.getLogger(SearchWindowPlanner.class);

	/**
	 * Default window width in days.
	 */
	public static final int DEFAULT_WINDOW_DAYS = 30;

	private final int windowDays;

	public SearchWindowPlanner() {
		this(DEFAULT_WINDOW_DAYS);
	}

	public SearchWindowPlanner(int windowDays) {
		if (windowDays <= 0) {
			throw new IllegalArgumentException("windowDays must be positive, got: " + windowDays);
		}
		this.windowDays = windowDays;
	}

	/**
	 * Plan windows covering {@code [start, end]}.
	 * @param start first creation date to cover (inclusive)
	 * @param end last creation date to cover (inclusive)
	 * @return ordered windows; empty when {@code start} is after {@code end}
	 */
	public List<SearchWindow> planWindows(LocalDate start, LocalDate end) {
		List<SearchWindow> windows = new ArrayList<>();
		LocalDate windowStart = start;

		while (!windowStart.isAfter(end)) {
			LocalDate windowEnd = windowStart.plusDays(windowDays);
			if (windowEnd.isAfter(end)) {
				windowEnd = end;
			}
			windows.add(new SearchWindow(windowStart, windowEnd));
			windowStart = windowEnd.plusDays(1);
		}

		logger.debug("Planned {} windows of {} days from {} to {}", windows.size(), windowDays, start, end);
		return windows;
	}

}
