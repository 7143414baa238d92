package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.SourcePositionRange;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Declares a lookup table.  With an 'other' arm the map is total;
 * without one a lookup miss is a runtime failure. */
public final class FormatStep extends OpStep {
    /** Prefix of the pseudo-table produced by a format declaration. */
    public static final String OUTPUT_PREFIX = "__format__";

    public final String name;
    public final Map<String, String> map;
    @Nullable
    public final String other;

    public FormatStep(SourcePositionRange range, String name, Map<String, String> map, @Nullable String other) {
        super(range, List.of(), List.of(outputName(name)));
        this.name = name;
        this.map = Collections.unmodifiableMap(new LinkedHashMap<>(map));
        this.other = other;
    }

    public static String outputName(String format) {
        return OUTPUT_PREFIX + format;
    }

    public static boolean isFormatTable(String table) {
        return table.startsWith(OUTPUT_PREFIX);
    }

    public boolean isTotal() {
        return this.other != null;
    }

    @Override
    public OpKind getKind() {
        return OpKind.FORMAT;
    }

    @Override
    public ObjectNode paramsToJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("name", this.name);
        ObjectNode map = result.putObject("map");
        for (Map.Entry<String, String> entry: this.map.entrySet())
            map.put(entry.getKey(), entry.getValue());
        if (this.other == null)
            result.putNull("other");
        else
            result.put("other", this.other);
        return result;
    }

    @Override
    public <T> T accept(StepVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public OpStep withOutputs(List<String> outputs) {
        return this;
    }
}
