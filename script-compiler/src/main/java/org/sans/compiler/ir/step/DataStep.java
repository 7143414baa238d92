package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.util.Linq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Row-at-a-time iteration with BY groups, retained variables and
 * optionally a merge of several inputs by key. */
public final class DataStep extends OpStep {
    public enum Mode {
        SET("set"),
        MERGE("merge");

        public final String text;

        Mode(String text) {
            this.text = text;
        }
    }

    /** Prefixes of the automatic group boundary flags. */
    public static final String FIRST_PREFIX = "first.";
    public static final String LAST_PREFIX = "last.";

    public final Mode mode;
    public final List<DatasetSpec> specs;
    public final List<String> by;
    public final List<String> retain;
    public final List<String> keep;
    public final List<DataStatement> statements;
    /** If true only 'output' statements emit rows; otherwise every row position
     * that reaches the end of the statements is emitted. */
    public final boolean explicitOutput;

    public DataStep(SourcePositionRange range, String output, Mode mode, List<DatasetSpec> specs,
                    List<String> by, List<String> retain, List<String> keep,
                    List<DataStatement> statements, boolean explicitOutput) {
        super(range, Linq.map(specs, s -> s.table), List.of(output));
        this.mode = mode;
        this.specs = Collections.unmodifiableList(specs);
        this.by = Collections.unmodifiableList(by);
        this.retain = Collections.unmodifiableList(retain);
        this.keep = Collections.unmodifiableList(keep);
        this.statements = Collections.unmodifiableList(statements);
        this.explicitOutput = explicitOutput;
    }

    /** Names of the first./last. flags for all BY variables. */
    public List<String> groupFlags() {
        List<String> result = new ArrayList<>();
        for (String key: this.by) {
            result.add(FIRST_PREFIX + key);
            result.add(LAST_PREFIX + key);
        }
        return result;
    }

    /** Names of the presence flags declared with in=. */
    public List<String> inFlags() {
        List<String> result = new ArrayList<>();
        for (DatasetSpec spec: this.specs)
            if (spec.inFlag != null)
                result.add(spec.inFlag);
        return result;
    }

    @Override
    public OpKind getKind() {
        return OpKind.DATA_STEP;
    }

    @Override
    public ObjectNode paramsToJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("mode", this.mode.text);
        ArrayNode inputs = result.putArray("inputs");
        for (DatasetSpec spec: this.specs)
            inputs.add(spec.toJson());
        result.set("by", stringArray(this.by));
        result.set("retain", stringArray(this.retain));
        result.set("keep", stringArray(this.keep));
        ArrayNode statements = result.putArray("statements");
        for (DataStatement statement: this.statements)
            statements.add(statement.toJson());
        result.put("explicit_output", this.explicitOutput);
        return result;
    }

    @Override
    public <T> T accept(StepVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public OpStep withOutputs(List<String> outputs) {
        return new DataStep(this.range, outputs.get(0), this.mode, this.specs, this.by,
                this.retain, this.keep, this.statements, this.explicitOutput);
    }
}
