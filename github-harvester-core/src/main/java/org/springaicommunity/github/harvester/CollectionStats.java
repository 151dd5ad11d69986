package org.springaicommunity.github.harvester;

/**
 * Counters describing how a collection run went.
 *
 * @param windowsSearched number of windows at least one page was requested for
 * @param pagesFetched number of pages successfully fetched
 * @param windowsTruncatedAtCap windows whose last enumerable page was full, so matches
 * beyond the 1,000 result cap were not collected
 * @param windowsAborted windows abandoned because a page request failed
 * @param deadlineReached whether the run stopped on the overall deadline
 */
public record CollectionStats(int windowsSearched, int pagesFetched, int windowsTruncatedAtCap, int windowsAborted,
		boolean deadlineReached) {
}
