package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link RepositorySink} that writes the table as CSV.
 *
 * <p>
 * The first line is the header {@code name,full_name,stargazers_count,language,created_at};
 * rows follow in insertion order with no index column. Null values become empty cells.
 */
public class CsvRepositorySink implements RepositorySink {

	private static final Logger logger = LoggerFactory.getLogger(CsvRepositorySink.class);

	private final Path outputFile;

	private final CsvSchema schema;

	private final ObjectWriter writer;

	public CsvRepositorySink(Path outputFile) {
		this(outputFile, ObjectMapperFactory.createCsvMapper());
	}

	public CsvRepositorySink(Path outputFile, CsvMapper csvMapper) {
		this.outputFile = outputFile;
		this.schema = csvMapper.schemaFor(RepositoryRecord.class).withHeader();
		this.writer = csvMapper.writer(schema);
	}

	@Override
	public String write(List<RepositoryRecord> repositories) {
		try {
			Path parent = outputFile.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			try (Writer out = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
				writeTo(repositories, out);
			}
			logger.info("Wrote {} repositories to {}", repositories.size(), outputFile);
			return outputFile.toString();
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write CSV output: " + outputFile, e);
		}
	}

	/**
	 * Write the table to an arbitrary writer. The writer is left open.
	 * @param repositories the rows
	 * @param out destination
	 * @throws IOException if writing fails
	 */
	public void writeTo(List<RepositoryRecord> repositories, Writer out) throws IOException {
		if (repositories.isEmpty()) {
			// Jackson only emits the header together with the first row
			out.write(String.join(String.valueOf(schema.getColumnSeparator()), schema.getColumnNames()));
			out.write(schema.getLineSeparator());
		}
		else {
			out.write(writer.writeValueAsString(repositories));
		}
		out.flush();
	}

}
