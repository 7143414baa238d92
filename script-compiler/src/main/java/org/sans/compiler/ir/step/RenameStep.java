package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.SourcePositionRange;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Renames columns; column order is unchanged. */
public final class RenameStep extends OpStep {
    /** Old name to new name, in source order. */
    public final Map<String, String> map;

    public RenameStep(SourcePositionRange range, String input, String output, Map<String, String> map) {
        super(range, List.of(input), List.of(output));
        this.map = Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    @Override
    public OpKind getKind() {
        return OpKind.RENAME;
    }

    @Override
    public ObjectNode paramsToJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        ObjectNode map = result.putObject("map");
        for (Map.Entry<String, String> entry: this.map.entrySet())
            map.put(entry.getKey(), entry.getValue());
        return result;
    }

    @Override
    public <T> T accept(StepVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public OpStep withOutputs(List<String> outputs) {
        return new RenameStep(this.range, this.getInput(), outputs.get(0), this.map);
    }
}
