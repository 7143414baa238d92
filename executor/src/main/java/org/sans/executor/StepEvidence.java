package org.sans.executor;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.ir.step.OpKind;
import org.sans.util.HashString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** What happened when one step ran. */
public final class StepEvidence {
    /** Position of the step in the plan. */
    public final int index;
    public final OpKind op;
    /** Hash of the canonical operation and parameters; independent of table names. */
    public final HashString stepId;
    public final List<String> inputs;
    public final List<String> outputs;
    public final Map<String, Integer> rowCounts;
    public final List<String> warnings;
    /** Operation-specific counters, e.g. the number of values a cast set to missing. */
    public final ObjectNode counters;

    public StepEvidence(int index, OpKind op, HashString stepId, List<String> inputs, List<String> outputs,
                        Map<String, Integer> rowCounts, List<String> warnings, ObjectNode counters) {
        this.index = index;
        this.op = op;
        this.stepId = stepId;
        this.inputs = inputs;
        this.outputs = outputs;
        this.rowCounts = Collections.unmodifiableMap(new LinkedHashMap<>(rowCounts));
        this.warnings = Collections.unmodifiableList(warnings);
        this.counters = counters;
    }

    public int getRowCount(String table) {
        return this.rowCounts.getOrDefault(table, -1);
    }

    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("step_index", this.index);
        result.put("step_id", this.stepId.value());
        result.put("op", this.op.opName);
        ArrayNode inputs = result.putArray("inputs");
        this.inputs.forEach(inputs::add);
        ArrayNode outputs = result.putArray("outputs");
        this.outputs.forEach(outputs::add);
        ObjectNode counts = result.putObject("row_counts");
        for (Map.Entry<String, Integer> entry: this.rowCounts.entrySet())
            counts.put(entry.getKey(), entry.getValue());
        ArrayNode warnings = result.putArray("warnings");
        this.warnings.forEach(warnings::add);
        result.setAll(this.counters);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepEvidence that = (StepEvidence) o;
        return this.toJson().equals(that.toJson());
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.index, this.stepId, this.rowCounts);
    }

    @Override
    public String toString() {
        return this.toJson().toString();
    }
}
