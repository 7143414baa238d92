package org.sans.executor.operators;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.ir.step.OpStep;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.ExpressionEvaluator;
import org.sans.executor.Table;
import org.sans.util.ICastable;
import org.sans.util.IWritesLogs;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Implementation of one step of a plan.
 * An operator reads its input tables and builds a new output table;
 * inputs are never modified.
 */
public abstract class BaseOperator<S extends OpStep> implements ICastable, IWritesLogs {
    public final S step;
    final ExpressionEvaluator evaluator;
    /** Operation-specific counters reported in the step evidence. */
    final ObjectNode counters;
    final List<String> warnings;

    protected BaseOperator(S step, ExpressionEvaluator evaluator) {
        this.step = step;
        this.evaluator = evaluator;
        this.counters = JsonNodeFactory.instance.objectNode();
        this.warnings = new ArrayList<>();
    }

    /**
     * Compute the output of the step.
     * @param inputs  Input tables, in the order of the step inputs.
     * @param output  Schema of the output, derived from the input schemas;
     *                null when the columns depend on the data.
     */
    public abstract Table apply(List<Table> inputs, @Nullable Schema output);

    public ObjectNode getCounters() {
        return this.counters;
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(this.warnings);
    }

    static Schema required(@Nullable Schema output) {
        if (output == null)
            throw new IllegalStateException("Output schema is required");
        return output;
    }
}
