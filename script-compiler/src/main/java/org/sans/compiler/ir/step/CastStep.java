package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.ir.type.ScalarType;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;

/** Explicit per-column type conversion. */
public final class CastStep extends OpStep {
    public enum Target {
        STR("str", ScalarType.STRING),
        INT("int", ScalarType.INT),
        DECIMAL("decimal", ScalarType.DECIMAL),
        BOOL("bool", ScalarType.BOOL),
        /** ISO date, kept as a string. */
        DATE("date", ScalarType.STRING),
        /** ISO date-time, kept as a string. */
        DATETIME("datetime", ScalarType.STRING);

        public final String text;
        public final ScalarType type;

        Target(String text, ScalarType type) {
            this.text = text;
            this.type = type;
        }

        @Nullable
        public static Target fromText(String text) {
            for (Target target: values())
                if (target.text.equalsIgnoreCase(text))
                    return target;
            if (text.equalsIgnoreCase("string"))
                return STR;
            return null;
        }
    }

    public enum OnError {
        /** The step fails on the first value that cannot be converted. */
        FAIL("fail"),
        /** Values that cannot be converted become missing and are counted. */
        NULL("null");

        public final String text;

        OnError(String text) {
            this.text = text;
        }
    }

    public static final class CastSpec {
        public final String column;
        public final Target target;
        public final OnError onError;
        public final boolean trim;

        public CastSpec(String column, Target target, OnError onError, boolean trim) {
            this.column = column;
            this.target = target;
            this.onError = onError;
            this.trim = trim;
        }
    }

    public final List<CastSpec> casts;

    public CastStep(SourcePositionRange range, String input, String output, List<CastSpec> casts) {
        super(range, List.of(input), List.of(output));
        this.casts = Collections.unmodifiableList(casts);
    }

    @Override
    public OpKind getKind() {
        return OpKind.CAST;
    }

    @Override
    public ObjectNode paramsToJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        ArrayNode casts = result.putArray("casts");
        for (CastSpec spec: this.casts) {
            ObjectNode c = casts.addObject();
            c.put("col", spec.column);
            c.put("to", spec.target.text);
            c.put("on_error", spec.onError.text);
            c.put("trim", spec.trim);
        }
        return result;
    }

    @Override
    public <T> T accept(StepVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public OpStep withOutputs(List<String> outputs) {
        return new CastStep(this.range, this.getInput(), outputs.get(0), this.casts);
    }
}
