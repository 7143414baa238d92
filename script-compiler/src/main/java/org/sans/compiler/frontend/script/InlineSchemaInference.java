package org.sans.compiler.frontend.script;

import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.ir.type.Column;
import org.sans.compiler.ir.type.ScalarType;
import org.sans.compiler.ir.type.Schema;
import org.sans.util.CsvText;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Infers the column types of inline CSV text.  Empty cells are missing values
 * and do not constrain the type.  A column is int if every value is an integer,
 * decimal if every value is a number, bool if every value is true or false,
 * and string otherwise. */
public class InlineSchemaInference {
    static final Pattern INTEGER = Pattern.compile("^[-+]?\\d+$");

    private InlineSchemaInference() {}

    static ScalarType typeOf(String value) {
        if (INTEGER.matcher(value).matches()) {
            try {
                Long.parseLong(value);
                return ScalarType.INT;
            } catch (NumberFormatException ex) {
                return ScalarType.DECIMAL;
            }
        }
        try {
            new BigDecimal(value);
            return ScalarType.DECIMAL;
        } catch (NumberFormatException ex) {
            // not a number
        }
        if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false"))
            return ScalarType.BOOL;
        return ScalarType.STRING;
    }

    static ScalarType combine(ScalarType current, ScalarType value) {
        if (current == ScalarType.NULL || current == value)
            return value;
        if (current.isNumeric() && value.isNumeric())
            return ScalarType.DECIMAL;
        return ScalarType.STRING;
    }

    public static Schema infer(String csvText, SourcePositionRange range) {
        List<List<String>> rows;
        try {
            rows = CsvText.read(csvText);
        } catch (IOException ex) {
            throw new CompilationError(ErrorCode.DATASOURCE_MALFORMED,
                    "Cannot parse inline CSV: " + ex.getMessage(), range);
        }
        if (rows.isEmpty())
            throw new CompilationError(ErrorCode.DATASOURCE_MALFORMED, "Inline CSV without header", range);
        List<String> header = rows.get(0);
        List<ScalarType> types = new ArrayList<>();
        for (int i = 0; i < header.size(); i++)
            types.add(ScalarType.NULL);
        for (List<String> row: rows.subList(1, rows.size())) {
            if (row.size() > header.size())
                throw new CompilationError(ErrorCode.DATASOURCE_MALFORMED,
                        "Inline CSV row has more cells than the header: " + row, range);
            for (int i = 0; i < row.size(); i++) {
                String value = row.get(i);
                if (value.isEmpty())
                    continue;
                types.set(i, combine(types.get(i), typeOf(value)));
            }
        }
        List<Column> columns = new ArrayList<>();
        for (int i = 0; i < header.size(); i++) {
            ScalarType type = types.get(i) == ScalarType.NULL ? ScalarType.STRING : types.get(i);
            columns.add(new Column(header.get(i), type));
        }
        return new Schema(columns);
    }
}
