package org.sans.executor;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.sans.util.Utilities;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Tables produced by a plan, in the order they were produced, and the evidence of every step. */
public final class ExecutionResult {
    public final Map<String, Table> outputs;
    public final List<StepEvidence> evidence;

    public ExecutionResult(Map<String, Table> outputs, List<StepEvidence> evidence) {
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        this.evidence = Collections.unmodifiableList(evidence);
    }

    public Table getOutput(String table) {
        return Utilities.getExists(this.outputs, table);
    }

    public ArrayNode evidenceToJson() {
        ArrayNode result = JsonNodeFactory.instance.arrayNode();
        for (StepEvidence step: this.evidence)
            result.add(step.toJson());
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionResult that = (ExecutionResult) o;
        return this.outputs.equals(that.outputs) && this.evidence.equals(that.evidence);
    }

    @Override
    public int hashCode() {
        return this.outputs.hashCode();
    }
}
