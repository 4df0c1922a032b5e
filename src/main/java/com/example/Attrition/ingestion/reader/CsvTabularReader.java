package com.example.Attrition.ingestion.reader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class CsvTabularReader implements TabularReader {

    private static final TypeReference<Map<String, String>> ROW_TYPE = new TypeReference<>() {
    };

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    @Override
    public Set<String> extensions() {
        return Set.of("csv");
    }

    @Override
    public TabularData read(byte[] content) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> iterator = csvMapper.readerFor(ROW_TYPE)
                .with(schema)
                .readValues(content)) {

            List<TabularRow> rows = new ArrayList<>();
            int index = 0;
            while (iterator.hasNextValue()) {
                rows.add(new TabularRow(index + 2, iterator.nextValue()));
                index++;
            }

            List<String> header = new ArrayList<>();
            CsvSchema parsed = iterator.getParser() == null ? null : (CsvSchema) iterator.getParser().getSchema();
            if (parsed != null) {
                parsed.forEach(column -> header.add(column.getName()));
            }
            return new TabularData(header, rows);
        } catch (RuntimeJsonMappingException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
}
