package org.springaicommunity.github.harvester;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the repository harvester. Pure Java with no framework
 * dependencies for maximum testability.
 */
public class ArgumentParser {

	private final CollectionProperties defaultProperties;

	public ArgumentParser(CollectionProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-q", "--query":
					config.baseQuery = getRequiredValue(args, i, "query");
					i++; // Skip next argument since we consumed it
					break;

				case "-m", "--max-repos":
					config.maxRepos = parsePositiveInt(getRequiredValue(args, i, "max-repos"), "max repos");
					i++;
					break;

				case "--start-date":
					config.startDate = parseDate(getRequiredValue(args, i, "start-date"));
					i++;
					break;

				case "--end-date":
					config.endDate = parseDate(getRequiredValue(args, i, "end-date"));
					i++;
					break;

				case "-o", "--output":
					config.outputFile = getRequiredValue(args, i, "output");
					i++;
					break;

				case "--timeout":
					config.timeoutSeconds = parsePositiveInt(getRequiredValue(args, i, "timeout"), "timeout");
					i++;
					break;

				case "--deadline":
					config.deadlineMinutes = parsePositiveInt(getRequiredValue(args, i, "deadline"), "deadline");
					i++;
					break;

				case "--max-throttle-waits":
					String waitsStr = getRequiredValue(args, i, "max-throttle-waits");
					try {
						config.maxThrottleWaits = Integer.parseInt(waitsStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid max throttle waits '" + waitsStr + "': must be a non-negative integer");
					}
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-harvester [OPTIONS]\n");
		help.append("\n");
		help.append("Collect GitHub repositories matching a search query into a CSV file.\n");
		help.append("The history range is searched in 30-day windows, most-starred first.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                  Show this help message\n");
		help.append("    -q, --query QUERY           Search query (default: ")
			.append(defaultProperties.getBaseQuery())
			.append(")\n");
		help.append("    -m, --max-repos COUNT       Stop after COUNT repositories (default: ")
			.append(defaultProperties.getMaxRepos())
			.append(")\n");
		help.append("    -o, --output FILE           CSV output file (default: ")
			.append(defaultProperties.getOutputFile())
			.append(")\n");
		help.append("    -v, --verbose               Enable debug logging\n");
		help.append("\n");
		help.append("DATE RANGE OPTIONS:\n");
		help.append("    --start-date DATE           Earliest creation date searched, YYYY-MM-DD (default: ")
			.append(defaultProperties.getHistoryStart())
			.append(")\n");
		help.append("    --end-date DATE             Latest creation date searched, YYYY-MM-DD (default: today)\n");
		help.append("\n");
		help.append("LIMIT OPTIONS:\n");
		help.append("    --timeout SECONDS           Timeout for a single HTTP request (default: ")
			.append(defaultProperties.getRequestTimeout().toSeconds())
			.append(")\n");
		help.append("    --deadline MINUTES          Stop collecting after MINUTES and keep what was found\n");
		help.append("    --max-throttle-waits N      Rate limit waits allowed per request (default: ")
			.append(defaultProperties.getMaxThrottleWaits())
			.append(")\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN                GitHub personal access token (required, may come from .env)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-harvester --query \"is:public stars:>=100\" --max-repos 5000\n");
		help.append("    github-harvester -q \"language:java stars:>=500\" --start-date 2020-01-01 -o java.csv\n");
		help.append("    github-harvester --max-repos 200 --end-date 2015-12-31 --deadline 10\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate environment (GitHub token).
	 * @throws IllegalStateException if environment is invalid
	 */
	public void validateEnvironment() {
		EnvironmentSupport.require(EnvironmentSupport.GITHUB_TOKEN);
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parsePositiveInt(String value, String label) {
		int parsed;
		try {
			parsed = Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + label + " '" + value + "': must be a positive integer");
		}
		if (parsed <= 0) {
			throw new IllegalArgumentException("Invalid " + label + " '" + value + "': must be a positive integer");
		}
		return parsed;
	}

	private LocalDate parseDate(String value) {
		if (!value.matches("\\d{4}-\\d{2}-\\d{2}")) {
			throw new IllegalArgumentException("Invalid date '" + value + "': must be YYYY-MM-DD format");
		}
		try {
			return LocalDate.parse(value);
		}
		catch (DateTimeParseException e) {
			throw new IllegalArgumentException("Invalid date '" + value + "': " + e.getMessage());
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.baseQuery == null || config.baseQuery.trim().isEmpty()) {
			errors.add("Query cannot be empty");
		}
		else if (config.baseQuery.contains("created:")) {
			errors.add("Query must not contain a created: qualifier (use --start-date/--end-date)");
		}

		if (config.endDate != null && config.endDate.isBefore(config.startDate)) {
			errors.add("End date " + config.endDate + " is before start date " + config.startDate);
		}

		if (config.maxThrottleWaits < 0) {
			errors.add("Max throttle waits must be non-negative (got: " + config.maxThrottleWaits + ")");
		}

		if (config.outputFile == null || config.outputFile.trim().isEmpty()) {
			errors.add("Output file cannot be empty");
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
