package org.sans.compiler.ir;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Derived knowledge about a table.  Recomputed by every validation. */
public final class TableFact {
    /** Columns the table is known to be sorted by; null if unknown. */
    @Nullable
    public final List<String> sortedBy;

    public static final TableFact NONE = new TableFact(null);

    public TableFact(@Nullable List<String> sortedBy) {
        this.sortedBy = sortedBy == null ? null : Collections.unmodifiableList(sortedBy);
    }

    /** True if the table is sorted by a prefix covering all the keys. */
    public boolean isSortedBy(List<String> keys) {
        if (this.sortedBy == null || this.sortedBy.size() < keys.size())
            return false;
        return this.sortedBy.subList(0, keys.size()).equals(keys);
    }

    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        if (this.sortedBy == null) {
            result.putNull("sorted_by");
        } else {
            ArrayNode array = result.putArray("sorted_by");
            this.sortedBy.forEach(array::add);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(this.sortedBy, ((TableFact) o).sortedBy);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.sortedBy);
    }

    @Override
    public String toString() {
        return "sorted_by=" + this.sortedBy;
    }
}
