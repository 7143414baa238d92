package org.sans.compiler.validator;

import org.sans.compiler.ValidatedPlan;
import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.Datasource;
import org.sans.compiler.ir.Plan;
import org.sans.compiler.ir.TableFact;
import org.sans.compiler.ir.step.IRStep;
import org.sans.compiler.ir.step.OpStep;
import org.sans.compiler.ir.step.RefusedBlock;
import org.sans.compiler.ir.type.Schema;
import org.sans.util.IWritesLogs;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks the static invariants of a plan and derives the facts of every table.
 * Validation never changes the plan; running it twice gives identical results.
 *
 * <p>For each step, in order: all inputs are defined, the parameters have
 * canonical shape, the output name is new, order requirements are met by the
 * input facts, and expressions type-check against the inferred input schemas.
 * The first violation is thrown as a {@link CompilationError} located at the step.
 */
public class PlanValidator implements IWritesLogs {
    public ValidatedPlan validate(Plan plan) {
        Map<String, TableFact> facts = new LinkedHashMap<>();
        Map<String, Schema> schemas = new LinkedHashMap<>();
        List<RefusedBlock> warnings = new ArrayList<>();

        for (Map.Entry<String, Schema> entry: plan.predeclared.entrySet()) {
            facts.put(entry.getKey(), TableFact.NONE);
            schemas.put(entry.getKey(), entry.getValue());
        }
        for (Datasource datasource: plan.datasources.values()) {
            facts.put(datasource.getInputName(), TableFact.NONE);
            schemas.put(datasource.getInputName(), datasource.getSchema());
        }

        FactPropagation factPropagation = new FactPropagation(facts);
        SchemaInference schemaInference = new SchemaInference(schemas);
        for (IRStep step: plan.steps) {
            RefusedBlock refused = step.as(RefusedBlock.class);
            if (refused != null) {
                if (refused.isFatal())
                    throw refused.toError();
                warnings.add(refused);
                continue;
            }
            OpStep op = step.to(OpStep.class);
            try {
                this.checkInputs(op, plan, facts);
                CanonicalShape.INSTANCE.check(op);
                String output = op.getOutput();
                if (facts.containsKey(output))
                    throw new CompilationError(ErrorCode.OUTPUT_TABLE_COLLISION,
                            "Output table " + output + " produced by " + op.getKind().opName + " already exists");
                TableFact fact = op.accept(factPropagation);
                Schema schema = op.accept(schemaInference);
                facts.put(output, fact);
                schemas.put(output, schema);
                this.getDebugStream(1)
                        .append(op.getKind().opName)
                        .append(" -> ")
                        .append(output)
                        .append(" ")
                        .append(fact.toString())
                        .append(" ")
                        .append(schema.toString())
                        .newline();
            } catch (CompilationError e) {
                if (e.range.isValid())
                    throw e;
                throw new CompilationError(e.code, e.getMessage(), op.range);
            }
        }
        return new ValidatedPlan(plan, facts, schemas, warnings);
    }

    void checkInputs(OpStep step, Plan plan, Map<String, TableFact> facts) {
        for (String input: step.inputs) {
            if (Datasource.isDatasourceInput(input)) {
                String name = Datasource.nameFromInput(input);
                if (!plan.datasources.containsKey(name))
                    throw new CompilationError(ErrorCode.DATASOURCE_UNDEFINED,
                            "Datasource " + name + " used by " + step.getKind().opName + " is not defined");
                continue;
            }
            if (!facts.containsKey(input))
                throw new CompilationError(ErrorCode.TABLE_UNDEFINED,
                        "Input table " + input + " used by " + step.getKind().opName + " is not defined");
        }
    }
}
