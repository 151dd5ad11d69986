package org.springaicommunity.github.harvester.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

/**
 * Exercises the CLI entry point up to the point where a token would be needed.
 */
@DisplayName("RepositoryHarvesterCli Tests")
class RepositoryHarvesterCliTest {

	private final ByteArrayOutputStream captured = new ByteArrayOutputStream();

	private PrintStream originalOut;

	@BeforeEach
	void captureStdout() {
		originalOut = System.out;
		System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
	}

	@AfterEach
	void restoreStdout() {
		System.setOut(originalOut);
	}

	@Test
	@DisplayName("Should print usage and succeed for --help")
	void shouldPrintHelp() {
		int exitCode = RepositoryHarvesterCli.run(new String[] { "--max-repos", "10", "--help" });

		assertThat(exitCode).isZero();
		assertThat(captured.toString(StandardCharsets.UTF_8)).contains("Usage: github-harvester [OPTIONS]")
			.contains("GITHUB_TOKEN");
	}

	@Test
	@DisplayName("Should reject invalid arguments before touching the network")
	void shouldRejectInvalidArguments() {
		assertThatThrownBy(() -> RepositoryHarvesterCli.run(new String[] { "--bogus" }))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessage("Unknown option: --bogus");
		assertThatThrownBy(() -> RepositoryHarvesterCli.run(new String[] { "-v", "--max-repos", "zero" }))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("must be a positive integer");
	}

}
