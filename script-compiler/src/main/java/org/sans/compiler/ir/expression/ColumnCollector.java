package org.sans.compiler.ir.expression;

import java.util.LinkedHashSet;
import java.util.Set;

/** Collects the names of all columns referenced by an expression, in order of appearance. */
public class ColumnCollector implements ExpressionVisitor<Void> {
    public final Set<String> columns = new LinkedHashSet<>();

    public static Set<String> collect(Expression expression) {
        ColumnCollector collector = new ColumnCollector();
        expression.accept(collector);
        return collector.columns;
    }

    @Override
    public Void visit(LiteralExpression expression) {
        return null;
    }

    @Override
    public Void visit(ColumnExpression expression) {
        this.columns.add(expression.name);
        return null;
    }

    @Override
    public Void visit(UnaryExpression expression) {
        expression.source.accept(this);
        return null;
    }

    @Override
    public Void visit(BinaryExpression expression) {
        expression.left.accept(this);
        expression.right.accept(this);
        return null;
    }

    @Override
    public Void visit(BoolExpression expression) {
        for (Expression arg: expression.args)
            arg.accept(this);
        return null;
    }

    @Override
    public Void visit(CallExpression expression) {
        for (Expression arg: expression.args)
            arg.accept(this);
        return null;
    }

    @Override
    public Void visit(LookupExpression expression) {
        expression.key.accept(this);
        return null;
    }
}
