package org.sans.util;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/** Reads CSV text into rows of strings.  The first row is the header. */
public class CsvText {
    private CsvText() {}

    static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();

    /** Header and data rows.  Rows shorter than the header are padded with empty strings. */
    public static List<List<String>> read(String text) throws IOException {
        List<List<String>> result = new ArrayList<>();
        try (MappingIterator<String[]> iterator = MAPPER.readerFor(String[].class).readValues(text)) {
            int width = -1;
            while (iterator.hasNext()) {
                List<String> row = new ArrayList<>(Arrays.asList(iterator.next()));
                if (width < 0)
                    width = row.size();
                while (row.size() < width)
                    row.add("");
                result.add(row);
            }
        }
        return result;
    }
}
