package org.springaicommunity.github.harvester;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Search settings
	public String baseQuery;

	public int maxRepos;

	// Date range (ISO date format: YYYY-MM-DD)
	public LocalDate startDate;

	public LocalDate endDate = null; // null = today

	// Output
	public String outputFile;

	// Hardening
	public Integer timeoutSeconds; // per request

	public Integer deadlineMinutes = null; // null = no overall deadline

	public int maxThrottleWaits;

	// Mode flags
	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(CollectionProperties defaultProperties) {
		// Initialize with defaults
		this.baseQuery = defaultProperties.getBaseQuery();
		this.maxRepos = defaultProperties.getMaxRepos();
		this.startDate = defaultProperties.getHistoryStart();
		this.endDate = defaultProperties.getHistoryEnd();
		this.outputFile = defaultProperties.getOutputFile();
		this.timeoutSeconds = (int) defaultProperties.getRequestTimeout().toSeconds();
		this.maxThrottleWaits = defaultProperties.getMaxThrottleWaits();
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * Copy the parsed values onto a properties object.
	 * @param properties the properties to update
	 * @return the same properties instance
	 */
	public CollectionProperties applyTo(CollectionProperties properties) {
		properties.setBaseQuery(baseQuery);
		properties.setMaxRepos(maxRepos);
		properties.setHistoryStart(startDate);
		properties.setHistoryEnd(endDate);
		properties.setOutputFile(outputFile);
		properties.setRequestTimeout(Duration.ofSeconds(timeoutSeconds));
		properties.setDeadline(deadlineMinutes != null ? Duration.ofMinutes(deadlineMinutes) : null);
		properties.setMaxThrottleWaits(maxThrottleWaits);
		properties.setVerbose(verbose);
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "baseQuery='" + baseQuery + '\'' + ", maxRepos=" + maxRepos + ", startDate="
				+ startDate + ", endDate=" + endDate + ", outputFile='" + outputFile + '\'' + ", timeoutSeconds="
				+ timeoutSeconds + ", deadlineMinutes=" + deadlineMinutes + ", maxThrottleWaits=" + maxThrottleWaits
				+ ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}
