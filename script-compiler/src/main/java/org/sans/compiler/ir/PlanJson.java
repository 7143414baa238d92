package org.sans.compiler.ir;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.ir.step.IRStep;
import org.sans.compiler.ir.step.OpStep;
import org.sans.compiler.ir.type.Schema;
import org.sans.util.Utilities;

import java.util.Map;

/** Deterministic JSON rendering of a plan. */
public class PlanJson {
    private PlanJson() {}

    public static ObjectNode toJson(Plan plan) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        ObjectNode datasources = result.putObject("datasources");
        for (Map.Entry<String, Datasource> e: plan.datasources.entrySet())
            datasources.set(e.getKey(), e.getValue().toJson());
        ObjectNode tables = result.putObject("tables");
        for (Map.Entry<String, Schema> e: plan.predeclared.entrySet()) {
            if (e.getValue().open)
                tables.putNull(e.getKey());
            else
                tables.set(e.getKey(), e.getValue().toJson());
        }
        ArrayNode steps = result.putArray("steps");
        for (IRStep step: plan.steps) {
            ObjectNode node = step.toJson();
            OpStep op = step.as(OpStep.class);
            if (op != null)
                node.put("step_id", op.getStepId().toString());
            steps.add(node);
        }
        result.put("fingerprint", plan.fingerprint().toString());
        return result;
    }

    /** Compact, key-sorted text of {@link #toJson(Plan)}. */
    public static String toCanonicalString(Plan plan) {
        return Utilities.canonicalJson(toJson(plan));
    }
}
