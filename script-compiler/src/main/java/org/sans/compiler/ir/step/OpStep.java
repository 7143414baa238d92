package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.util.HashString;
import org.sans.util.Utilities;

import java.util.Collections;
import java.util.List;

/** A single operation of the plan. */
public abstract class OpStep extends IRStep {
    public final List<String> inputs;
    public final List<String> outputs;

    protected OpStep(SourcePositionRange range, List<String> inputs, List<String> outputs) {
        super(range);
        this.inputs = Collections.unmodifiableList(inputs);
        this.outputs = Collections.unmodifiableList(outputs);
    }

    public abstract OpKind getKind();

    /** The op-specific parameters.  Together with the op name they
     * define the semantic identity of the step. */
    public abstract ObjectNode paramsToJson();

    public abstract <T> T accept(StepVisitor<T> visitor);

    /** Copy of this step with different outputs. */
    public abstract OpStep withOutputs(List<String> outputs);

    public String getOutput() {
        Utilities.enforce(this.outputs.size() == 1, this + " does not have exactly one output");
        return this.outputs.get(0);
    }

    public String getInput() {
        Utilities.enforce(this.inputs.size() == 1, this + " does not have exactly one input");
        return this.inputs.get(0);
    }

    /** Key-sorted, compact JSON of {op, params}: no table names, no positions. */
    public String canonicalJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("op", this.getKind().opName);
        node.set("params", this.paramsToJson());
        return Utilities.canonicalJson(node);
    }

    /** SHA-256 of the canonical JSON; steps with identical semantics share ids. */
    public HashString getStepId() {
        return HashString.sha256(this.canonicalJson());
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("kind", "op");
        result.put("op", this.getKind().opName);
        ArrayNode in = result.putArray("inputs");
        this.inputs.forEach(in::add);
        ArrayNode out = result.putArray("outputs");
        this.outputs.forEach(out::add);
        result.set("params", this.paramsToJson());
        this.range.appendAsJson(result.putObject("loc"));
        return result;
    }

    protected static ArrayNode stringArray(List<String> values) {
        ArrayNode result = JsonNodeFactory.instance.arrayNode();
        values.forEach(result::add);
        return result;
    }

    @Override
    public String toString() {
        return this.getKind().opName + " " + this.inputs + " -> " + this.outputs;
    }
}
