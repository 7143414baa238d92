package org.sans.executor;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** An immutable tuple of values aligned to the schema of its table. */
public final class Row {
    private final List<Object> values;

    public Row(List<Object> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public Row(Object... values) {
        this(Arrays.asList(values));
    }

    @Nullable
    public Object get(int index) {
        return this.values.get(index);
    }

    public int size() {
        return this.values.size();
    }

    public List<Object> getValues() {
        return this.values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Row row = (Row) o;
        return this.values.equals(row.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.values);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        boolean first = true;
        builder.append("[");
        for (Object value: this.values) {
            if (!first)
                builder.append(", ");
            first = false;
            builder.append(value == null ? "NULL" : Values.keyText(value));
        }
        builder.append("]");
        return builder.toString();
    }
}
