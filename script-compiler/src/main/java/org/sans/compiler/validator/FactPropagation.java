package org.sans.compiler.validator;

import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.step.AggregateStep;
import org.sans.compiler.ir.step.CastStep;
import org.sans.compiler.ir.step.ComputeStep;
import org.sans.compiler.ir.step.DataStatement;
import org.sans.compiler.ir.step.DataStep;
import org.sans.compiler.ir.step.DatasetSpec;
import org.sans.compiler.ir.step.FilterStep;
import org.sans.compiler.ir.step.FormatStep;
import org.sans.compiler.ir.step.IdentityStep;
import org.sans.compiler.ir.step.RenameStep;
import org.sans.compiler.ir.step.SelectStep;
import org.sans.compiler.ir.step.SortStep;
import org.sans.compiler.ir.step.SqlSelectStep;
import org.sans.compiler.ir.step.StepVisitor;
import org.sans.compiler.ir.step.TransposeStep;
import org.sans.compiler.ir.TableFact;
import org.sans.util.Linq;
import org.sans.util.Utilities;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the ordering fact of the output of a step, and checks that the
 * inputs of order-dependent steps are already sorted.  A step which cannot
 * show that it keeps the order of its input produces {@link TableFact#NONE}.
 */
public class FactPropagation implements StepVisitor<TableFact> {
    final Map<String, TableFact> facts;

    public FactPropagation(Map<String, TableFact> facts) {
        this.facts = facts;
    }

    TableFact factOf(String table) {
        return Utilities.getExists(this.facts, table);
    }

    /** The input fact, kept only if none of the columns is among the keys. */
    TableFact inheritUnless(String input, Set<String> changed) {
        TableFact fact = this.factOf(input);
        if (fact.sortedBy == null || Linq.any(fact.sortedBy, changed::contains))
            return TableFact.NONE;
        return fact;
    }

    /** The fact of an input as seen through its dataset options. */
    static TableFact throughOptions(TableFact fact, DatasetSpec spec) {
        if (fact.sortedBy == null)
            return fact;
        List<String> result = new ArrayList<>();
        for (String key: fact.sortedBy) {
            if (!spec.keep.isEmpty() && !spec.keep.contains(key))
                break;
            if (spec.drop.contains(key))
                break;
            result.add(spec.rename.getOrDefault(key, key));
        }
        if (result.isEmpty())
            return TableFact.NONE;
        return new TableFact(result);
    }

    static void assignedIn(DataStatement statement, Set<String> result) {
        DataStatement.Assign assign = statement.as(DataStatement.Assign.class);
        if (assign != null) {
            result.add(assign.target);
            return;
        }
        DataStatement.IfThen ifThen = statement.as(DataStatement.IfThen.class);
        if (ifThen != null) {
            assignedIn(ifThen.then, result);
            if (ifThen.otherwise != null)
                assignedIn(ifThen.otherwise, result);
        }
    }

    @Override
    public TableFact visit(IdentityStep step) {
        return this.factOf(step.getInput());
    }

    @Override
    public TableFact visit(ComputeStep step) {
        Set<String> changed = new LinkedHashSet<>();
        for (ComputeStep.Assignment assignment: step.assignments)
            changed.add(assignment.column);
        return this.inheritUnless(step.getInput(), changed);
    }

    @Override
    public TableFact visit(FilterStep step) {
        return this.factOf(step.getInput());
    }

    @Override
    public TableFact visit(SelectStep step) {
        TableFact fact = this.factOf(step.getInput());
        if (fact.sortedBy == null)
            return fact;
        if (!step.keep.isEmpty())
            return step.keep.containsAll(fact.sortedBy) ? fact : TableFact.NONE;
        return Linq.any(fact.sortedBy, step.drop::contains) ? TableFact.NONE : fact;
    }

    @Override
    public TableFact visit(RenameStep step) {
        return TableFact.NONE;
    }

    @Override
    public TableFact visit(SortStep step) {
        if (step.by.isEmpty())
            throw new CompilationError(ErrorCode.SORT_WITHOUT_KEYS, "sort requires a non-empty key list");
        for (SortStep.SortKey key: step.by)
            if (key.descending)
                throw new CompilationError(ErrorCode.SORT_DESCENDING,
                        "Descending sort on " + key.column + " is not supported");
        return new TableFact(step.keyNames());
    }

    @Override
    public TableFact visit(DataStep step) {
        if (step.mode == DataStep.Mode.MERGE && step.by.isEmpty())
            throw new CompilationError(ErrorCode.KEYS_REQUIRED, "merge requires BY variables");
        Set<String> assigned = new LinkedHashSet<>();
        for (DataStatement statement: step.statements)
            assignedIn(statement, assigned);
        if (!step.by.isEmpty()) {
            for (DatasetSpec spec: step.specs) {
                TableFact fact = throughOptions(this.factOf(spec.table), spec);
                if (!fact.isSortedBy(step.by))
                    throw new CompilationError(ErrorCode.ORDER_REQUIRED,
                            "Input table " + spec.table + " must be sorted by " + step.by +
                                    " for BY-group processing; it is " + fact);
            }
            if (!step.keep.isEmpty() && !step.keep.containsAll(step.by))
                return TableFact.NONE;
            if (Linq.any(step.by, assigned::contains))
                return TableFact.NONE;
            return new TableFact(step.by);
        }
        if (step.specs.size() != 1)
            return TableFact.NONE;
        TableFact fact = throughOptions(this.factOf(step.specs.get(0).table), step.specs.get(0));
        if (fact.sortedBy == null)
            return fact;
        if (!step.keep.isEmpty() && !step.keep.containsAll(fact.sortedBy))
            return TableFact.NONE;
        if (Linq.any(fact.sortedBy, assigned::contains))
            return TableFact.NONE;
        return fact;
    }

    @Override
    public TableFact visit(TransposeStep step) {
        if (step.by.isEmpty())
            throw new CompilationError(ErrorCode.KEYS_REQUIRED, "transpose requires BY variables");
        TableFact fact = this.factOf(step.getInput());
        if (!fact.isSortedBy(step.by))
            throw new CompilationError(ErrorCode.ORDER_REQUIRED,
                    "Input table " + step.getInput() + " must be sorted by " + step.by +
                            " for transpose; it is " + fact);
        return new TableFact(step.by);
    }

    @Override
    public TableFact visit(SqlSelectStep step) {
        if (step.groupBy.isEmpty())
            return TableFact.NONE;
        // Output rows are ordered by the grouping keys, under their output names.
        List<String> keys = new ArrayList<>();
        for (String key: step.groupBy) {
            String alias = null;
            for (SqlSelectStep.SelectItem item: step.select)
                if (!item.isStar() && !item.isAggregate() && item.column.equals(key)) {
                    alias = item.alias;
                    break;
                }
            if (alias == null)
                break;
            keys.add(alias);
        }
        if (keys.isEmpty())
            return TableFact.NONE;
        return new TableFact(keys);
    }

    @Override
    public TableFact visit(FormatStep step) {
        return TableFact.NONE;
    }

    @Override
    public TableFact visit(AggregateStep step) {
        if (step.groupBy.isEmpty())
            return TableFact.NONE;
        return new TableFact(step.groupBy);
    }

    @Override
    public TableFact visit(CastStep step) {
        Set<String> changed = new LinkedHashSet<>();
        for (CastStep.CastSpec cast: step.casts)
            changed.add(cast.column);
        return this.inheritUnless(step.getInput(), changed);
    }
}
