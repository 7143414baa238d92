package org.sans.compiler.validator;

import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.step.AggregateStep;
import org.sans.compiler.ir.step.CastStep;
import org.sans.compiler.ir.step.ComputeStep;
import org.sans.compiler.ir.step.DataStep;
import org.sans.compiler.ir.step.FilterStep;
import org.sans.compiler.ir.step.FormatStep;
import org.sans.compiler.ir.step.IdentityStep;
import org.sans.compiler.ir.step.OpStep;
import org.sans.compiler.ir.step.RenameStep;
import org.sans.compiler.ir.step.SelectStep;
import org.sans.compiler.ir.step.SortStep;
import org.sans.compiler.ir.step.SqlSelectStep;
import org.sans.compiler.ir.step.StepVisitor;
import org.sans.compiler.ir.step.TransposeStep;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Asserts that step parameters have the shape produced by the frontends.
 * The validator never normalizes parameters; a violation is a broken
 * contract between frontend and validator.
 */
public class CanonicalShape implements StepVisitor<Void> {
    public static final CanonicalShape INSTANCE = new CanonicalShape();

    static void shape(boolean condition, OpStep step, String detail) {
        if (!condition)
            throw new CompilationError(ErrorCode.CANON_SHAPE,
                    step.getKind().opName + ": non-canonical parameters: " + detail);
    }

    static boolean distinct(Collection<String> values) {
        Set<String> seen = new HashSet<>();
        for (String value: values)
            if (!seen.add(value))
                return false;
        return true;
    }

    public void check(OpStep step) {
        if (step.outputs.isEmpty())
            throw new CompilationError(ErrorCode.INTERNAL,
                    "Operation " + step.getKind().opName + " does not define an output table");
        shape(step.outputs.size() == 1, step, "exactly one output expected");
        step.accept(this);
    }

    @Override
    public Void visit(IdentityStep step) {
        shape(step.inputs.size() == 1, step, "one input");
        return null;
    }

    @Override
    public Void visit(ComputeStep step) {
        shape(!step.assignments.isEmpty(), step, "no assignments");
        return null;
    }

    @Override
    public Void visit(FilterStep step) {
        return null;
    }

    @Override
    public Void visit(SelectStep step) {
        shape(step.keep.isEmpty() != step.drop.isEmpty(), step, "exactly one of keep and drop");
        shape(distinct(step.keep) && distinct(step.drop), step, "duplicate columns");
        return null;
    }

    @Override
    public Void visit(RenameStep step) {
        shape(!step.map.isEmpty(), step, "empty mapping");
        shape(distinct(step.map.values()), step, "two columns renamed to the same name");
        return null;
    }

    @Override
    public Void visit(SortStep step) {
        shape(distinct(step.keyNames()), step, "duplicate sort keys");
        return null;
    }

    @Override
    public Void visit(DataStep step) {
        shape(!step.specs.isEmpty(), step, "no inputs");
        shape(distinct(step.by), step, "duplicate BY variables");
        shape(distinct(step.inFlags()), step, "duplicate in= flags");
        return null;
    }

    @Override
    public Void visit(TransposeStep step) {
        shape(!step.id.equals(step.var), step, "id and var must differ");
        return null;
    }

    @Override
    public Void visit(SqlSelectStep step) {
        shape(!step.select.isEmpty(), step, "empty select list");
        shape(distinct(step.groupBy), step, "duplicate group by columns");
        List<SqlSelectStep.TableRef> tables = step.tables();
        Set<String> aliases = new HashSet<>();
        for (SqlSelectStep.TableRef ref: tables)
            shape(aliases.add(ref.alias), step, "duplicate table alias " + ref.alias);
        return null;
    }

    @Override
    public Void visit(FormatStep step) {
        shape(step.inputs.isEmpty(), step, "format takes no inputs");
        shape(!step.map.isEmpty() || step.other != null, step, "empty format");
        return null;
    }

    @Override
    public Void visit(AggregateStep step) {
        shape(!step.metrics.isEmpty(), step, "no statistics");
        shape(distinct(step.groupBy), step, "duplicate group columns");
        return null;
    }

    @Override
    public Void visit(CastStep step) {
        shape(!step.casts.isEmpty(), step, "no casts");
        List<String> columns = new ArrayList<>();
        for (CastStep.CastSpec cast: step.casts)
            columns.add(cast.column);
        shape(distinct(columns), step, "a column is cast twice");
        return null;
    }
}
