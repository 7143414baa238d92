package org.sans.compiler.ir.expression;

/** Visitor over the closed set of expression nodes. */
public interface ExpressionVisitor<T> {
    T visit(LiteralExpression expression);
    T visit(ColumnExpression expression);
    T visit(UnaryExpression expression);
    T visit(BinaryExpression expression);
    T visit(BoolExpression expression);
    T visit(CallExpression expression);
    T visit(LookupExpression expression);
}
