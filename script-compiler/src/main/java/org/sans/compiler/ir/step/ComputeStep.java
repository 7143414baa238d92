package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.ir.expression.Expression;

import java.util.Collections;
import java.util.List;

/** Evaluates assignments left to right; each sees the results of the previous ones. */
public final class ComputeStep extends OpStep {
    public enum Mode {
        /** Every target must be a new column. */
        DERIVE("derive"),
        /** Every target must be an existing column. */
        UPDATE("update"),
        /** Legacy data step assignment: creates or overwrites. */
        ASSIGN("assign");

        public final String text;

        Mode(String text) {
            this.text = text;
        }
    }

    public static final class Assignment {
        public final String column;
        public final Expression expression;

        public Assignment(String column, Expression expression) {
            this.column = column;
            this.expression = expression;
        }

        ObjectNode toJson() {
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            result.put("col", this.column);
            result.set("expr", this.expression.toJson());
            return result;
        }

        @Override
        public String toString() {
            return this.column + " = " + this.expression;
        }
    }

    public final Mode mode;
    public final List<Assignment> assignments;

    public ComputeStep(SourcePositionRange range, String input, String output,
                       Mode mode, List<Assignment> assignments) {
        super(range, List.of(input), List.of(output));
        this.mode = mode;
        this.assignments = Collections.unmodifiableList(assignments);
    }

    @Override
    public OpKind getKind() {
        return OpKind.COMPUTE;
    }

    @Override
    public ObjectNode paramsToJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("mode", this.mode.text);
        ArrayNode array = result.putArray("assign");
        for (Assignment assignment: this.assignments)
            array.add(assignment.toJson());
        return result;
    }

    @Override
    public <T> T accept(StepVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public OpStep withOutputs(List<String> outputs) {
        return new ComputeStep(this.range, this.getInput(), outputs.get(0), this.mode, this.assignments);
    }
}
