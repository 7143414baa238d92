package org.sans.compiler.ir;

import org.sans.compiler.ir.step.FormatStep;
import org.sans.compiler.ir.step.IRStep;
import org.sans.compiler.ir.step.OpStep;
import org.sans.compiler.ir.step.RefusedBlock;
import org.sans.compiler.ir.type.Schema;
import org.sans.util.HashString;
import org.sans.util.ICastable;
import org.sans.util.Linq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The intermediate representation of a script: declared datasources,
 * predeclared tables and the ordered list of steps. */
public final class Plan {
    public final Map<String, Datasource> datasources;
    /** Tables that exist before the first step.  Open schemas mean "types not known". */
    public final Map<String, Schema> predeclared;
    public final List<IRStep> steps;

    /** Separates a table name from the index of an intermediate table computed for it.
     * Never part of an identifier, so intermediate names cannot clash with script names. */
    public static final String TEMPORARY_SEPARATOR = "#";

    public Plan(Map<String, Datasource> datasources, Map<String, Schema> predeclared, List<IRStep> steps) {
        this.datasources = Collections.unmodifiableMap(new LinkedHashMap<>(datasources));
        this.predeclared = Collections.unmodifiableMap(new LinkedHashMap<>(predeclared));
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    /** Name of the index-th intermediate table computed on the way to a table. */
    public static String temporaryTable(String table, int index) {
        return table + TEMPORARY_SEPARATOR + index;
    }

    /** True for tables named by the script; false for intermediate and format tables. */
    public static boolean isNamedTable(String table) {
        return !table.contains(TEMPORARY_SEPARATOR) && !FormatStep.isFormatTable(table);
    }

    public List<OpStep> getOpSteps() {
        List<OpStep> result = new ArrayList<>();
        for (IRStep step: this.steps) {
            OpStep op = step.as(OpStep.class);
            if (op != null)
                result.add(op);
        }
        return result;
    }

    public List<RefusedBlock> getRefusals() {
        return Linq.map(
                Linq.where(this.steps, s -> s.is(RefusedBlock.class)),
                s -> ICastable.as(s, RefusedBlock.class));
    }

    /** SHA-256 over the ordered step identities. */
    public HashString fingerprint() {
        StringBuilder builder = new StringBuilder();
        for (OpStep step: this.getOpSteps())
            builder.append(step.getStepId()).append("\n");
        return HashString.sha256(builder.toString());
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (IRStep step: this.steps)
            builder.append(step).append(System.lineSeparator());
        return builder.toString();
    }
}
