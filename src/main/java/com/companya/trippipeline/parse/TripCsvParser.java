package com.companya.trippipeline.parse;

import com.companya.trippipeline.exception.TripFileParseException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Reads a delimited trip file whose first line names the columns. Header names
 * are used verbatim as row keys and every value stays a string.
 */
@Component
public class TripCsvParser {

    private final ObjectReader reader;

    public TripCsvParser() {
        this(',');
    }

    public TripCsvParser(char separator) {
        CsvMapper mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.FAIL_ON_MISSING_COLUMNS)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
        CsvSchema schema = CsvSchema.emptySchema()
                .withHeader()
                .withColumnSeparator(separator);
        this.reader = mapper.readerForMapOf(String.class).with(schema);
    }

    /**
     * Parses the whole file. A row whose column count differs from the header
     * fails the file; no rows are returned in that case.
     *
     * @throws TripFileParseException on any malformed row
     */
    public List<Map<String, String>> parse(byte[] content) {
        try (MappingIterator<Map<String, String>> rows = reader.readValues(content)) {
            return rows.readAll();
        } catch (IOException | RuntimeJsonMappingException ex) {
            throw new TripFileParseException("Malformed trip file: " + ex.getMessage(), ex);
        }
    }
}
