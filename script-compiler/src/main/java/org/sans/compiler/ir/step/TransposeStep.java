package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.SourcePositionRange;

import java.util.Collections;
import java.util.List;

/** Pivot: one output row per BY group; the values of the ID column become
 * column names holding the values of the VAR column.  Within a group the
 * last value for an ID wins. */
public final class TransposeStep extends OpStep {
    public final List<String> by;
    public final String id;
    public final String var;

    public TransposeStep(SourcePositionRange range, String input, String output,
                         List<String> by, String id, String var) {
        super(range, List.of(input), List.of(output));
        this.by = Collections.unmodifiableList(by);
        this.id = id;
        this.var = var;
    }

    @Override
    public OpKind getKind() {
        return OpKind.TRANSPOSE;
    }

    @Override
    public ObjectNode paramsToJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.set("by", stringArray(this.by));
        result.put("id", this.id);
        result.put("var", this.var);
        result.put("last_wins", true);
        return result;
    }

    @Override
    public <T> T accept(StepVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public OpStep withOutputs(List<String> outputs) {
        return new TransposeStep(this.range, this.getInput(), outputs.get(0), this.by, this.id, this.var);
    }
}
