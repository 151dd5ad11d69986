package org.springaicommunity.github.harvester;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;

/**
 * Factory for creating consistently configured Jackson mappers.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new {@link ObjectMapper} for reading GitHub API responses.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		return mapper;
	}

	/**
	 * Create a new {@link CsvMapper} for writing the harvested table. Strings are quoted
	 * only when they contain separators, quotes or line breaks.
	 * @return configured CsvMapper
	 */
	public static CsvMapper createCsvMapper() {
		CsvMapper mapper = new CsvMapper();
		mapper.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
		return mapper;
	}

}
