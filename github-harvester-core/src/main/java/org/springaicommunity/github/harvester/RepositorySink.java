package org.springaicommunity.github.harvester;

import java.util.List;

/**
 * Receives the finished table of a collection run.
 */
public interface RepositorySink {

	/**
	 * Write all rows in order.
	 * @param repositories the harvested rows
	 * @return a description of where the rows went (e.g. a file path)
	 */
	String write(List<RepositoryRecord> repositories);

}
