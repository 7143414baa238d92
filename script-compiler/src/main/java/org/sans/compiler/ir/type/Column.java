package org.sans.compiler.ir.type;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/** A named, typed column. */
public final class Column {
    public final String name;
    public final ScalarType type;

    public Column(String name, ScalarType type) {
        this.name = name;
        this.type = type;
    }

    public Column withName(String name) {
        return new Column(name, this.type);
    }

    public Column withType(ScalarType type) {
        return new Column(this.name, type);
    }

    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("name", this.name);
        result.put("type", this.type.text);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Column column = (Column) o;
        return this.name.equals(column.name) && this.type == column.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.type);
    }

    @Override
    public String toString() {
        return this.name + ":" + this.type;
    }
}
