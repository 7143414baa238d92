package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.ir.expression.Expression;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** An input of a data step with its dataset options.
 * Options apply in the order where, keep/drop, rename. */
public final class DatasetSpec {
    public final String table;
    /** Name of the presence flag (in=), if any. */
    @Nullable
    public final String inFlag;
    public final List<String> keep;
    public final List<String> drop;
    public final Map<String, String> rename;
    @Nullable
    public final Expression where;

    public DatasetSpec(String table, @Nullable String inFlag, List<String> keep, List<String> drop,
                       Map<String, String> rename, @Nullable Expression where) {
        this.table = table;
        this.inFlag = inFlag;
        this.keep = Collections.unmodifiableList(keep);
        this.drop = Collections.unmodifiableList(drop);
        this.rename = Collections.unmodifiableMap(new LinkedHashMap<>(rename));
        this.where = where;
    }

    public static DatasetSpec plain(String table) {
        return new DatasetSpec(table, null, List.of(), List.of(), Map.of(), null);
    }

    public boolean hasOptions() {
        return !this.keep.isEmpty() || !this.drop.isEmpty() || !this.rename.isEmpty() || this.where != null;
    }

    /** The options only; the table is wiring. */
    ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        if (this.inFlag == null)
            result.putNull("in");
        else
            result.put("in", this.inFlag);
        result.set("keep", OpStep.stringArray(this.keep));
        result.set("drop", OpStep.stringArray(this.drop));
        ObjectNode rename = result.putObject("rename");
        for (Map.Entry<String, String> entry: this.rename.entrySet())
            rename.put(entry.getKey(), entry.getValue());
        if (this.where == null)
            result.putNull("where");
        else
            result.set("where", this.where.toJson());
        return result;
    }
}
