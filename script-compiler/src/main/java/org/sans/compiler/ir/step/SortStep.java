package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.util.Linq;

import java.util.Collections;
import java.util.List;

/** Stable sort with missing values first; optionally keeps only the first row per key. */
public final class SortStep extends OpStep {
    public static final class SortKey {
        public final String column;
        public final boolean descending;

        public SortKey(String column, boolean descending) {
            this.column = column;
            this.descending = descending;
        }

        @Override
        public String toString() {
            return (this.descending ? "descending " : "") + this.column;
        }
    }

    public final List<SortKey> by;
    public final boolean nodupkey;

    public SortStep(SourcePositionRange range, String input, String output,
                    List<SortKey> by, boolean nodupkey) {
        super(range, List.of(input), List.of(output));
        this.by = Collections.unmodifiableList(by);
        this.nodupkey = nodupkey;
    }

    public List<String> keyNames() {
        return Linq.map(this.by, k -> k.column);
    }

    @Override
    public OpKind getKind() {
        return OpKind.SORT;
    }

    @Override
    public ObjectNode paramsToJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        ArrayNode by = result.putArray("by");
        for (SortKey key: this.by) {
            ObjectNode k = by.addObject();
            k.put("col", key.column);
            k.put("desc", key.descending);
        }
        result.put("nodupkey", this.nodupkey);
        return result;
    }

    @Override
    public <T> T accept(StepVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public OpStep withOutputs(List<String> outputs) {
        return new SortStep(this.range, this.getInput(), outputs.get(0), this.by, this.nodupkey);
    }
}
