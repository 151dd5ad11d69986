package org.springaicommunity.github.harvester;

import java.util.List;

/**
 * Results of a collection operation.
 *
 * @param repositories the harvested rows in fetch order
 * @param stats counters for the run
 */
public record CollectionResult(List<RepositoryRecord> repositories, CollectionStats stats) {

	public CollectionResult {
		repositories = List.copyOf(repositories);
	}

	public int size() {
		return repositories.size();
	}

}
