package org.sans.compiler;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.ir.Plan;
import org.sans.compiler.ir.PlanJson;
import org.sans.compiler.ir.TableFact;
import org.sans.compiler.ir.step.RefusedBlock;
import org.sans.compiler.ir.type.Schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A plan which passed validation, together with the facts derived for every table. */
public final class ValidatedPlan {
    public final Plan plan;
    /** Ordering facts, for predeclared tables, datasources and all step outputs. */
    public final Map<String, TableFact> facts;
    /** Inferred schemas; open where the columns are not known statically. */
    public final Map<String, Schema> schemas;
    /** Non-fatal refusals; the blocks they cover were not compiled. */
    public final List<RefusedBlock> warnings;

    public ValidatedPlan(Plan plan, Map<String, TableFact> facts, Map<String, Schema> schemas,
                         List<RefusedBlock> warnings) {
        this.plan = plan;
        this.facts = Collections.unmodifiableMap(new LinkedHashMap<>(facts));
        this.schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public ObjectNode toJson() {
        ObjectNode result = PlanJson.toJson(this.plan);
        ObjectNode facts = result.putObject("table_facts");
        for (Map.Entry<String, TableFact> entry: this.facts.entrySet())
            facts.set(entry.getKey(), entry.getValue().toJson());
        ObjectNode schemas = result.putObject("schemas");
        for (Map.Entry<String, Schema> entry: this.schemas.entrySet()) {
            if (entry.getValue().open)
                schemas.putNull(entry.getKey());
            else
                schemas.set(entry.getKey(), entry.getValue().toJson());
        }
        ArrayNode warnings = result.putArray("warnings");
        for (RefusedBlock warning: this.warnings)
            warnings.add(warning.toJson());
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidatedPlan that = (ValidatedPlan) o;
        return this.facts.equals(that.facts) && this.schemas.equals(that.schemas) &&
                this.plan.fingerprint().equals(that.plan.fingerprint());
    }

    @Override
    public int hashCode() {
        return this.facts.hashCode() * 31 + this.schemas.hashCode();
    }
}
