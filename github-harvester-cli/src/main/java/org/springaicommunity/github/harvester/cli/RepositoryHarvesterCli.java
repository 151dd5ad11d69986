package org.springaicommunity.github.harvester.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.harvester.*;

import java.nio.file.Paths;

/**
 * GitHub Repository Harvester CLI Application
 *
 * Plain Java command-line application that searches GitHub repositories window by window
 * and writes the collected rows to a CSV file. Uses RepositoryHarvesterBuilder for
 * service wiring.
 *
 * Usage: java -jar github-harvester-cli.jar [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub personal access token for authentication
 *
 * Examples: java -jar github-harvester-cli.jar --query "is:public stars:>=100" java -jar
 * github-harvester-cli.jar --max-repos 250 --start-date 2020-01-01 -o repos.csv
 */
public class RepositoryHarvesterCli {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryHarvesterCli.class);

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Collection failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	public static int run(String[] args) {
		CollectionProperties properties = new CollectionProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		config.applyTo(properties);
		if (config.verbose) {
			enableDebugLogging();
		}

		// Credential problems must surface before any request is made
		argumentParser.validateEnvironment();

		logConfiguration(config);

		RepositoryCollectionService collector = RepositoryHarvesterBuilder.create()
			.tokenFromEnv()
			.properties(properties)
			.buildCollector();

		CollectionResult result = collector.collect(properties.getBaseQuery(), properties.getMaxRepos());

		RepositorySink sink = new CsvRepositorySink(Paths.get(properties.getOutputFile()));
		String location = sink.write(result.repositories());

		logResults(result, location);
		return 0;
	}

	private static void enableDebugLogging() {
		Logger harvesterLogger = LoggerFactory.getLogger("org.springaicommunity.github.harvester");
		if (harvesterLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Query: {}", config.baseQuery);
		logger.info("  Max repos: {}", config.maxRepos);
		logger.info("  Start date: {}", config.startDate);
		logger.info("  End date: {}", config.endDate != null ? config.endDate : "(today)");
		logger.info("  Output file: {}", config.outputFile);
		logger.info("  Request timeout: {}s", config.timeoutSeconds);
		logger.info("  Deadline: {}", config.deadlineMinutes != null ? config.deadlineMinutes + " min" : "(none)");
		logger.info("  Max throttle waits: {}", config.maxThrottleWaits);
		logger.info("  Verbose: {}", config.verbose);
	}

	private static void logResults(CollectionResult result, String location) {
		CollectionStats stats = result.stats();
		logger.info("Collection completed successfully!");
		logger.info("Collected data for {} repositories", result.size());
		logger.info("Output file: {}", location);
		logger.info("Windows searched: {}", stats.windowsSearched());
		logger.info("Pages fetched: {}", stats.pagesFetched());
		if (stats.windowsTruncatedAtCap() > 0) {
			logger.warn("Windows truncated at the 1000-result cap: {}", stats.windowsTruncatedAtCap());
		}
		if (stats.windowsAborted() > 0) {
			logger.warn("Windows abandoned after errors: {}", stats.windowsAborted());
		}
		if (stats.deadlineReached()) {
			logger.warn("Deadline reached; the table is partial");
		}
	}

}
