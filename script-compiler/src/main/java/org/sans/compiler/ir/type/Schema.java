package org.sans.compiler.ir.type;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.InternalCompilerError;
import org.sans.util.Linq;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** An ordered list of uniquely named columns.  Immutable.
 * An open schema is one whose columns are not known; every column
 * reference against an open schema has type UNKNOWN. */
public final class Schema {
    private final List<Column> columns;
    private final Map<String, Integer> index;
    public final boolean open;

    public static final Schema OPEN = new Schema(Collections.emptyList(), true);
    public static final Schema EMPTY = new Schema(Collections.emptyList(), false);

    private Schema(List<Column> columns, boolean open) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.open = open;
        this.index = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            Integer previous = this.index.put(columns.get(i).name, i);
            if (previous != null)
                throw new CompilationError(ErrorCode.COLUMN_EXISTS,
                        "Duplicate column " + columns.get(i).name + " in schema");
        }
    }

    public Schema(List<Column> columns) {
        this(columns, false);
    }

    public static Schema of(Column... columns) {
        List<Column> list = new ArrayList<>();
        Collections.addAll(list, columns);
        return new Schema(list);
    }

    public List<Column> getColumns() {
        return this.columns;
    }

    public int size() {
        return this.columns.size();
    }

    public List<String> names() {
        return Linq.map(this.columns, c -> c.name);
    }

    public boolean contains(String name) {
        return this.index.containsKey(name);
    }

    /** Index of a column, or -1. */
    public int indexOf(String name) {
        Integer result = this.index.get(name);
        return result == null ? -1 : result;
    }

    public Column get(int index) {
        return this.columns.get(index);
    }

    /** The column with the specified name, or null if it does not exist. */
    @Nullable
    public Column find(String name) {
        int index = this.indexOf(name);
        if (index < 0)
            return null;
        return this.columns.get(index);
    }

    /** The type of a referenced column.
     * UNKNOWN for open schemas, an error for missing columns of closed schemas. */
    public ScalarType typeOf(String name) {
        Column column = this.find(name);
        if (column != null)
            return column.type;
        if (this.open)
            return ScalarType.UNKNOWN;
        throw new CompilationError(ErrorCode.COLUMN_NOT_FOUND,
                "Column " + name + " does not exist; available columns: " + this.names());
    }

    /** Check that a column exists; trivially true for open schemas. */
    public void require(String name) {
        this.typeOf(name);
    }

    /** True if all columns have a known type. */
    public boolean isConcrete() {
        return !this.open && Linq.all(this.columns, c -> c.type.isConcrete());
    }

    /** Append a column that must not exist yet. */
    public Schema add(Column column) {
        if (this.open)
            return this;
        List<Column> result = new ArrayList<>(this.columns);
        result.add(column);
        return new Schema(result);
    }

    /** Replace the type of an existing column, or append a new column. */
    public Schema put(Column column) {
        if (this.open)
            return this;
        List<Column> result = new ArrayList<>(this.columns);
        int index = this.indexOf(column.name);
        if (index < 0)
            result.add(column);
        else
            result.set(index, column);
        return new Schema(result);
    }

    /** Keep only the named columns, in the order given. */
    public Schema project(List<String> names) {
        if (this.open)
            return this;
        List<Column> result = new ArrayList<>();
        for (String name: names) {
            this.require(name);
            result.add(this.find(name));
        }
        return new Schema(result);
    }

    /** Remove the named columns. */
    public Schema drop(List<String> names) {
        if (this.open)
            return this;
        for (String name: names)
            this.require(name);
        return new Schema(Linq.where(this.columns, c -> !names.contains(c.name)));
    }

    /** Rename columns; order is preserved. */
    public Schema rename(Map<String, String> map) {
        if (this.open)
            return this;
        for (String name: map.keySet())
            this.require(name);
        List<Column> result = new ArrayList<>();
        for (Column column: this.columns) {
            String newName = map.get(column.name);
            result.add(newName == null ? column : column.withName(newName));
        }
        return new Schema(result);
    }

    public ArrayNode toJson() {
        ArrayNode result = JsonNodeFactory.instance.arrayNode();
        for (Column column: this.columns)
            result.add(column.toJson());
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schema schema = (Schema) o;
        return this.open == schema.open && this.columns.equals(schema.columns);
    }

    @Override
    public int hashCode() {
        return 31 * this.columns.hashCode() + (this.open ? 1 : 0);
    }

    @Override
    public String toString() {
        if (this.open)
            return "(open)";
        return this.columns.toString();
    }

    /** Build a schema from names and types given in parallel. */
    public static Schema fromLists(List<String> names, List<ScalarType> types) {
        if (names.size() != types.size())
            throw new InternalCompilerError("Mismatched schema lists " + names + " and " + types);
        List<Column> columns = new ArrayList<>();
        for (int i = 0; i < names.size(); i++)
            columns.add(new Column(names.get(i), types.get(i)));
        return new Schema(columns);
    }
}
