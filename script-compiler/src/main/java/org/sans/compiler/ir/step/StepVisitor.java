package org.sans.compiler.ir.step;

/** Visitor over the closed set of operations.
 * Adding an operation forces every visitor to handle it. */
public interface StepVisitor<T> {
    T visit(IdentityStep step);
    T visit(ComputeStep step);
    T visit(FilterStep step);
    T visit(SelectStep step);
    T visit(RenameStep step);
    T visit(SortStep step);
    T visit(DataStep step);
    T visit(TransposeStep step);
    T visit(SqlSelectStep step);
    T visit(FormatStep step);
    T visit(AggregateStep step);
    T visit(CastStep step);
}
