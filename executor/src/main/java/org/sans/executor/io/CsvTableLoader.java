package org.sans.executor.io;

import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.Datasource;
import org.sans.compiler.ir.type.Column;
import org.sans.compiler.ir.type.ScalarType;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.ExecutionError;
import org.sans.executor.Row;
import org.sans.executor.Table;
import org.sans.util.CsvText;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Materializes typed tables from CSV text.  The first line is the header;
 * an empty cell is a missing value.  Columns are matched by name, so the
 * CSV may order them differently from the schema.
 */
public class CsvTableLoader {
    private CsvTableLoader() {}

    static ExecutionError invalid(String text, Column column, int line) {
        return new ExecutionError(ErrorCode.RUNTIME_TYPE_MISMATCH,
                "Line " + line + ": '" + text + "' is not a valid " + column.type + " for column " + column.name);
    }

    @Nullable
    static Object parse(String text, Column column, int line) {
        if (text.isEmpty())
            return null;
        try {
            switch (column.type) {
                case STRING:
                    return text;
                case INT:
                    return Long.parseLong(text.startsWith("+") ? text.substring(1) : text);
                case DECIMAL:
                    return new BigDecimal(text);
                case BOOL:
                    switch (text.toLowerCase()) {
                        case "true": case "1": case "yes":
                            return true;
                        case "false": case "0": case "no":
                            return false;
                        default:
                            throw invalid(text, column, line);
                    }
                default:
                    throw new ExecutionError(ErrorCode.RUNTIME_UNTYPED_INPUT,
                            "Column " + column.name + " has type " + column.type + " which cannot be loaded");
            }
        } catch (NumberFormatException e) {
            throw invalid(text, column, line);
        }
    }

    /** Load CSV text with the given schema; every schema column must appear in the header. */
    public static Table load(String text, Schema schema) {
        if (!schema.isConcrete())
            throw new ExecutionError(ErrorCode.RUNTIME_UNTYPED_INPUT,
                    "Cannot load a table without concrete column types: " + schema);
        List<List<String>> lines;
        try {
            lines = CsvText.read(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (lines.isEmpty())
            return new Table(schema, List.of());
        List<String> header = lines.get(0);
        List<Integer> positions = new ArrayList<>();
        for (Column column: schema.getColumns()) {
            int position = header.indexOf(column.name);
            if (position < 0)
                throw new ExecutionError(ErrorCode.RUNTIME_SCHEMA_MISMATCH,
                        "Column " + column.name + " is missing from the CSV header " + header);
            positions.add(position);
        }
        List<Row> rows = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            List<String> line = lines.get(i);
            List<Object> values = new ArrayList<>(schema.size());
            for (int c = 0; c < schema.size(); c++) {
                int position = positions.get(c);
                String cell = position < line.size() ? line.get(position) : "";
                values.add(parse(cell, schema.get(c), i + 1));
            }
            rows.add(new Row(values));
        }
        return new Table(schema, rows);
    }

    /** Load a CSV with a header whose columns are all strings. */
    public static Table loadStrings(String text) {
        List<List<String>> lines;
        try {
            lines = CsvText.read(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        List<Column> columns = new ArrayList<>();
        if (!lines.isEmpty())
            for (String name: lines.get(0))
                columns.add(new Column(name, ScalarType.STRING));
        return load(text, new Schema(columns));
    }

    /** Load the text of an inline datasource with its declared columns. */
    public static Table load(Datasource datasource) {
        if (datasource.inlineText == null)
            throw new ExecutionError(ErrorCode.RUNTIME_TABLE_UNDEFINED,
                    "Datasource " + datasource.name + " has no inline text; bind it explicitly");
        return load(datasource.inlineText, datasource.getSchema());
    }
}
