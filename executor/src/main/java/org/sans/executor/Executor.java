package org.sans.executor;

import org.sans.compiler.ValidatedPlan;
import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.Datasource;
import org.sans.compiler.ir.Plan;
import org.sans.compiler.ir.step.AggregateStep;
import org.sans.compiler.ir.step.CastStep;
import org.sans.compiler.ir.step.ComputeStep;
import org.sans.compiler.ir.step.DataStep;
import org.sans.compiler.ir.step.FilterStep;
import org.sans.compiler.ir.step.FormatStep;
import org.sans.compiler.ir.step.IRStep;
import org.sans.compiler.ir.step.IdentityStep;
import org.sans.compiler.ir.step.OpStep;
import org.sans.compiler.ir.step.RenameStep;
import org.sans.compiler.ir.step.SelectStep;
import org.sans.compiler.ir.step.SortStep;
import org.sans.compiler.ir.step.SqlSelectStep;
import org.sans.compiler.ir.step.StepVisitor;
import org.sans.compiler.ir.step.TransposeStep;
import org.sans.compiler.ir.type.Schema;
import org.sans.compiler.validator.SchemaInference;
import org.sans.executor.io.CsvTableLoader;
import org.sans.executor.operators.AggregateOperator;
import org.sans.executor.operators.BaseOperator;
import org.sans.executor.operators.CastOperator;
import org.sans.executor.operators.ComputeOperator;
import org.sans.executor.operators.DataStepOperator;
import org.sans.executor.operators.FilterOperator;
import org.sans.executor.operators.FormatOperator;
import org.sans.executor.operators.IdentityOperator;
import org.sans.executor.operators.RenameOperator;
import org.sans.executor.operators.SelectOperator;
import org.sans.executor.operators.SortOperator;
import org.sans.executor.operators.SqlSelectOperator;
import org.sans.executor.operators.TransposeOperator;
import org.sans.util.IWritesLogs;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a validated plan over materialized tables.
 *
 * <p>Inputs are bound by name: a predeclared table by its own name, a datasource
 * by the datasource name.  Inline datasources need no binding.
 * Every bound column must have a concrete type.
 * Steps run in plan order; each produces a new table and a {@link StepEvidence}.
 * Only tables named by the script are returned; intermediate tables appear in the evidence.
 * The first failure aborts the run with an {@link ExecutionError} located at the
 * failing step.  Nothing here reads files or clocks, so identical inputs give
 * identical results.
 */
public class Executor implements IWritesLogs {
    /** Creates the operator implementing a step. */
    static final class OperatorFactory implements StepVisitor<BaseOperator<?>> {
        final ExpressionEvaluator evaluator;

        OperatorFactory(ExpressionEvaluator evaluator) {
            this.evaluator = evaluator;
        }

        @Override
        public BaseOperator<?> visit(IdentityStep step) {
            return new IdentityOperator(step, this.evaluator);
        }

        @Override
        public BaseOperator<?> visit(ComputeStep step) {
            return new ComputeOperator(step, this.evaluator);
        }

        @Override
        public BaseOperator<?> visit(FilterStep step) {
            return new FilterOperator(step, this.evaluator);
        }

        @Override
        public BaseOperator<?> visit(SelectStep step) {
            return new SelectOperator(step, this.evaluator);
        }

        @Override
        public BaseOperator<?> visit(RenameStep step) {
            return new RenameOperator(step, this.evaluator);
        }

        @Override
        public BaseOperator<?> visit(SortStep step) {
            return new SortOperator(step, this.evaluator);
        }

        @Override
        public BaseOperator<?> visit(DataStep step) {
            return new DataStepOperator(step, this.evaluator);
        }

        @Override
        public BaseOperator<?> visit(TransposeStep step) {
            return new TransposeOperator(step, this.evaluator);
        }

        @Override
        public BaseOperator<?> visit(SqlSelectStep step) {
            return new SqlSelectOperator(step, this.evaluator);
        }

        @Override
        public BaseOperator<?> visit(FormatStep step) {
            return new FormatOperator(step, this.evaluator);
        }

        @Override
        public BaseOperator<?> visit(AggregateStep step) {
            return new AggregateOperator(step, this.evaluator);
        }

        @Override
        public BaseOperator<?> visit(CastStep step) {
            return new CastOperator(step, this.evaluator);
        }
    }

    /** Tables available to the steps, by table name. */
    final Map<String, Table> tables = new HashMap<>();
    final Map<String, Schema> schemas = new HashMap<>();

    static void checkBinding(String name, Table table, Schema declared) {
        if (!table.schema.isConcrete())
            throw new ExecutionError(ErrorCode.RUNTIME_UNTYPED_INPUT,
                    "Input " + name + " has columns without a concrete type: " + table.schema);
        if (!declared.open && !declared.equals(table.schema))
            throw new ExecutionError(ErrorCode.RUNTIME_SCHEMA_MISMATCH,
                    "Input " + name + " has schema " + table.schema + " but " + declared + " was declared");
    }

    /** The table named by a step input, binding it on first use. */
    Table input(String name, Plan plan, Map<String, Table> bindings) {
        Table table = this.tables.get(name);
        if (table != null)
            return table;
        Schema declared;
        String bindingName;
        if (Datasource.isDatasourceInput(name)) {
            bindingName = Datasource.nameFromInput(name);
            Datasource datasource = plan.datasources.get(bindingName);
            declared = datasource == null ? null : datasource.getSchema();
            table = bindings.get(bindingName);
            // Inline data travels with the plan.
            if (table == null && datasource != null && datasource.inlineText != null)
                table = CsvTableLoader.load(datasource);
        } else {
            bindingName = name;
            declared = plan.predeclared.get(name);
            table = bindings.get(bindingName);
        }
        if (declared == null || table == null)
            throw new ExecutionError(ErrorCode.RUNTIME_TABLE_UNDEFINED,
                    "Input table " + bindingName + " is not bound");
        checkBinding(bindingName, table, declared);
        this.define(name, table);
        this.getDebugStream(1)
                .append("Bound ")
                .append(bindingName)
                .append(" with ")
                .append(table.size())
                .append(" rows")
                .newline();
        return table;
    }

    void define(String name, Table table) {
        this.tables.put(name, table);
        this.schemas.put(name, table.schema);
    }

    /** The runtime counterpart of a static error found on the bound schemas. */
    static ErrorCode runtimeCode(ErrorCode code) {
        switch (code) {
            case COLUMN_NOT_FOUND:
                return ErrorCode.RUNTIME_SCHEMA_MISMATCH;
            case SQL_AMBIGUOUS_COLUMN:
                return ErrorCode.RUNTIME_SQL_AMBIGUOUS_COLUMN;
            default:
                return ErrorCode.RUNTIME_TYPE_MISMATCH;
        }
    }

    /** Schema of the output computed from the actual input schemas; null if data dependent. */
    @Nullable
    Schema outputSchema(OpStep op) {
        try {
            Schema schema = op.accept(new SchemaInference(this.schemas));
            return schema.open ? null : schema;
        } catch (CompilationError e) {
            throw new ExecutionError(runtimeCode(e.code), e.getMessage(), op.range);
        }
    }

    StepEvidence run(int index, OpStep op, Plan plan, Map<String, Table> bindings,
                     ExpressionEvaluator evaluator, Map<String, Table> outputs) {
        List<Table> inputs = new ArrayList<>();
        for (String input: op.inputs)
            inputs.add(this.input(input, plan, bindings));
        Schema schema = this.outputSchema(op);
        BaseOperator<?> operator = op.accept(new OperatorFactory(evaluator));
        Table result = operator.apply(inputs, schema);
        String output = op.getOutput();
        this.define(output, result);
        if (Plan.isNamedTable(output))
            outputs.put(output, result);

        Map<String, Integer> rowCounts = new LinkedHashMap<>();
        rowCounts.put(output, result.size());
        this.getDebugStream(1)
                .append(index)
                .append(": ")
                .append(op.getKind().opName)
                .append(" -> ")
                .append(output)
                .append(" (")
                .append(result.size())
                .append(" rows)")
                .newline();
        return new StepEvidence(index, op.getKind(), op.getStepId(), op.inputs, op.outputs,
                rowCounts, operator.getWarnings(), operator.getCounters());
    }

    /**
     * Run a plan.
     * @param plan      A plan which passed validation.
     * @param bindings  Materialized input tables, by predeclared table or datasource name.
     */
    public ExecutionResult execute(ValidatedPlan plan, Map<String, Table> bindings) {
        this.tables.clear();
        this.schemas.clear();
        ExpressionEvaluator evaluator = new ExpressionEvaluator(new HashMap<>());
        Map<String, Table> outputs = new LinkedHashMap<>();
        List<StepEvidence> evidence = new ArrayList<>();
        List<IRStep> steps = plan.plan.steps;
        for (int index = 0; index < steps.size(); index++) {
            OpStep op = steps.get(index).as(OpStep.class);
            if (op == null)
                // Refused blocks which are only warnings.
                continue;
            try {
                evidence.add(this.run(index, op, plan.plan, bindings, evaluator, outputs));
            } catch (ExecutionError e) {
                throw e.at(op.range);
            } catch (CompilationError e) {
                throw new ExecutionError(ErrorCode.RUNTIME_SCHEMA_MISMATCH, e.getMessage(), op.range);
            }
        }
        return new ExecutionResult(outputs, evidence);
    }
}
