package org.sans.compiler.validator;

import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.expression.ColumnCollector;
import org.sans.compiler.ir.expression.Expression;
import org.sans.compiler.ir.step.DataStatement;
import org.sans.compiler.ir.step.DataStep;
import org.sans.compiler.ir.step.DatasetSpec;
import org.sans.compiler.ir.type.Column;
import org.sans.compiler.ir.type.ScalarType;
import org.sans.compiler.ir.type.Schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Computes the output schema of a data step.
 *
 * <p>Variables assigned in the step may be referenced before the statement
 * that defines them (for example a retained running value).  Their types are
 * found by iterating over the statements until no type changes; an
 * expression that mentions a variable whose type is not yet known is skipped
 * in that pass.  A final pass checks every expression against the settled
 * types and reports the first real error.
 */
final class DataStepTyping {
    final DataStep step;
    /** Schemas of the tables read by the step, before dataset options. */
    final Function<String, Schema> tables;
    /** Input columns after dataset options, in order of first appearance. */
    final Map<String, ScalarType> inputColumns = new LinkedHashMap<>();
    /** Flags visible to expressions; never written to the output. */
    final Set<String> flags = new LinkedHashSet<>();
    /** Assigned variables that are not input columns, in order of first assignment. */
    final Set<String> targets = new LinkedHashSet<>();
    /** Types of assigned variables found so far. */
    final Map<String, ScalarType> assigned = new LinkedHashMap<>();

    DataStepTyping(DataStep step, Function<String, Schema> tables) {
        this.step = step;
        this.tables = tables;
    }

    /** The schema a single input contributes after its dataset options. */
    static Schema applyOptions(DatasetSpec spec, Schema input) {
        Schema result = input;
        if (spec.where != null)
            ExpressionTypeChecker.requireBool(spec.where, result, "where= on " + spec.table);
        if (!spec.keep.isEmpty())
            result = result.project(spec.keep);
        if (!spec.drop.isEmpty())
            result = result.drop(spec.drop);
        if (!spec.rename.isEmpty())
            result = result.rename(spec.rename);
        return result;
    }

    /** The output schema; open if any input has an open schema. */
    Schema infer() {
        for (DatasetSpec spec: this.step.specs) {
            Schema input = this.tables.apply(spec.table);
            if (input.open)
                return Schema.OPEN;
            Schema options = applyOptions(spec, input);
            for (Column column: options.getColumns()) {
                ScalarType previous = this.inputColumns.get(column.name);
                this.inputColumns.put(column.name, previous == null ? column.type :
                        ScalarType.unify(previous, column.type, "merge of column " + column.name));
            }
        }
        for (String key: this.step.by) {
            if (!this.inputColumns.containsKey(key))
                throw new CompilationError(ErrorCode.COLUMN_NOT_FOUND,
                        "BY variable " + key + " is not a column of every input");
        }
        this.flags.addAll(this.step.inFlags());
        this.flags.addAll(this.step.groupFlags());
        for (DataStatement statement: this.step.statements)
            this.collectTargets(statement);

        // Each pass can only widen a type, so this terminates.
        boolean changed = true;
        while (changed) {
            changed = false;
            for (DataStatement statement: this.step.statements)
                changed |= this.pass(statement, false);
        }
        for (DataStatement statement: this.step.statements)
            this.pass(statement, true);
        return this.output();
    }

    void collectTargets(DataStatement statement) {
        DataStatement.Assign assign = statement.as(DataStatement.Assign.class);
        if (assign != null) {
            if (this.flags.contains(assign.target))
                throw new CompilationError(ErrorCode.TYPE,
                        "Cannot assign to automatic variable " + assign.target);
            if (!this.inputColumns.containsKey(assign.target))
                this.targets.add(assign.target);
            return;
        }
        DataStatement.IfThen ifThen = statement.as(DataStatement.IfThen.class);
        if (ifThen != null) {
            this.collectTargets(ifThen.then);
            if (ifThen.otherwise != null)
                this.collectTargets(ifThen.otherwise);
        }
    }

    /** Schema visible to expressions, given the assigned types found so far. */
    Schema environment() {
        List<Column> columns = new ArrayList<>();
        for (Map.Entry<String, ScalarType> entry: this.inputColumns.entrySet()) {
            ScalarType type = entry.getValue();
            ScalarType other = this.assigned.get(entry.getKey());
            if (other != null)
                type = ScalarType.unify(type, other, "assignment to " + entry.getKey());
            columns.add(new Column(entry.getKey(), type));
        }
        for (String flag: this.flags)
            columns.add(new Column(flag, ScalarType.BOOL));
        for (String target: this.targets) {
            ScalarType type = this.assigned.get(target);
            if (type != null)
                columns.add(new Column(target, type));
            else if (this.step.retain.contains(target))
                columns.add(new Column(target, ScalarType.NULL));
            else
                columns.add(new Column(target, ScalarType.UNKNOWN));
        }
        for (String retained: this.step.retain) {
            if (!this.inputColumns.containsKey(retained) && !this.targets.contains(retained))
                columns.add(new Column(retained, ScalarType.NULL));
        }
        return new Schema(columns);
    }

    /** True if the expression only mentions variables with a settled type. */
    boolean ready(Expression expression) {
        for (String name: ColumnCollector.collect(expression)) {
            if (!this.targets.contains(name))
                continue;
            ScalarType type = this.assigned.get(name);
            if (type == null || type == ScalarType.NULL)
                return false;
        }
        return true;
    }

    /** Type one statement; returns true if some assigned type changed. */
    boolean pass(DataStatement statement, boolean strict) {
        if (statement.is(DataStatement.Output.class))
            return false;
        DataStatement.Filter filter = statement.as(DataStatement.Filter.class);
        if (filter != null) {
            if (strict)
                ExpressionTypeChecker.requireBool(filter.predicate, this.environment(), "if");
            return false;
        }
        DataStatement.IfThen ifThen = statement.as(DataStatement.IfThen.class);
        if (ifThen != null) {
            if (strict)
                ExpressionTypeChecker.requireBool(ifThen.predicate, this.environment(), "if");
            boolean changed = this.pass(ifThen.then, strict);
            if (ifThen.otherwise != null)
                changed |= this.pass(ifThen.otherwise, strict);
            return changed;
        }
        DataStatement.Assign assign = statement.to(DataStatement.Assign.class);
        if (!strict && !this.ready(assign.expression))
            return false;
        ScalarType type = ExpressionTypeChecker.typeOf(assign.expression, this.environment());
        if (type == ScalarType.UNKNOWN)
            throw new CompilationError(ErrorCode.TYPE_UNKNOWN,
                    "Cannot determine the type of " + assign.target);
        ScalarType previous = this.assigned.get(assign.target);
        ScalarType next = previous == null ? type :
                ScalarType.unify(previous, type, "assignment to " + assign.target);
        ScalarType input = this.inputColumns.get(assign.target);
        if (input != null)
            ScalarType.unify(input, next, "assignment to " + assign.target);
        this.assigned.put(assign.target, next);
        return next != previous;
    }

    Schema output() {
        Schema environment = this.environment();
        List<Column> columns = new ArrayList<>();
        for (String name: this.inputColumns.keySet())
            columns.add(environment.find(name));
        for (String retained: this.step.retain) {
            if (!this.inputColumns.containsKey(retained))
                columns.add(environment.find(retained));
        }
        for (String target: this.targets) {
            if (!this.step.retain.contains(target))
                columns.add(environment.find(target));
        }
        Schema result = new Schema(columns);
        if (!this.step.keep.isEmpty())
            result = result.project(this.step.keep);
        return result;
    }
}
