package org.sans.compiler.validator;

import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.expression.BinaryExpression;
import org.sans.compiler.ir.expression.BoolExpression;
import org.sans.compiler.ir.expression.CallExpression;
import org.sans.compiler.ir.expression.ColumnExpression;
import org.sans.compiler.ir.expression.Expression;
import org.sans.compiler.ir.expression.ExpressionVisitor;
import org.sans.compiler.ir.expression.LiteralExpression;
import org.sans.compiler.ir.expression.LookupExpression;
import org.sans.compiler.ir.expression.UnaryExpression;
import org.sans.compiler.ir.type.ScalarType;
import org.sans.compiler.ir.type.Schema;

/**
 * Computes the type of an expression over a schema.
 * Used by the validator over inferred schemas and by the executor
 * over the concrete schemas of materialized tables.
 * Missing values are never silently propagated through arithmetic at the
 * type level: a null operand of an arithmetic operator is a type error.
 * Any arithmetic, ordering or boolean use of an unknown type is reported
 * with a separate code.
 */
public class ExpressionTypeChecker implements ExpressionVisitor<ScalarType> {
    private final Schema schema;

    public ExpressionTypeChecker(Schema schema) {
        this.schema = schema;
    }

    public static ScalarType typeOf(Expression expression, Schema schema) {
        return expression.accept(new ExpressionTypeChecker(schema));
    }

    /** Check that an expression used as a predicate has type bool. */
    public static void requireBool(Expression expression, Schema schema, String context) {
        ScalarType type = typeOf(expression, schema);
        if (type == ScalarType.BOOL)
            return;
        if (type == ScalarType.UNKNOWN)
            throw new CompilationError(ErrorCode.TYPE_UNKNOWN,
                    context + ": predicate " + expression + " has unknown type");
        throw new CompilationError(ErrorCode.TYPE,
                context + ": predicate " + expression + " must be bool, got " + type);
    }

    static CompilationError error(String operator, ScalarType left, ScalarType right, String detail) {
        return new CompilationError(ErrorCode.TYPE, "Type error for '" + operator + "': " + detail +
                " (left=" + left + ", right=" + right + ")");
    }

    static CompilationError unknown(String operator, ScalarType left, ScalarType right, String detail) {
        return new CompilationError(ErrorCode.TYPE_UNKNOWN, "Type error for '" + operator + "': " + detail +
                " (left=" + left + ", right=" + right + ")");
    }

    static void requireBoolOperand(String operator, ScalarType type) {
        if (type == ScalarType.BOOL)
            return;
        if (type == ScalarType.UNKNOWN)
            throw unknown(operator, type, type, "operand must be bool");
        throw error(operator, type, type, "operand must be bool");
    }

    static ScalarType arithmetic(String operator, ScalarType left, ScalarType right, boolean divide) {
        if (left == ScalarType.NULL || right == ScalarType.NULL)
            throw error(operator, left, right, "null is not permitted in arithmetic");
        if (left == ScalarType.UNKNOWN || right == ScalarType.UNKNOWN)
            throw unknown(operator, left, right, "unknown is not permitted in arithmetic");
        if (!left.isNumeric() || !right.isNumeric())
            throw error(operator, left, right, "arithmetic requires numeric operands");
        if (divide)
            return ScalarType.DECIMAL;
        if (left == ScalarType.INT && right == ScalarType.INT)
            return ScalarType.INT;
        return ScalarType.DECIMAL;
    }

    static ScalarType equality(String operator, ScalarType left, ScalarType right) {
        if (left == ScalarType.UNKNOWN || right == ScalarType.UNKNOWN) {
            ScalarType other = left == ScalarType.UNKNOWN ? right : left;
            if (other == ScalarType.UNKNOWN || other == ScalarType.NULL)
                return ScalarType.BOOL;
            throw unknown(operator, left, right, "unknown comparability");
        }
        if (left == ScalarType.NULL || right == ScalarType.NULL)
            return ScalarType.BOOL;
        if (left == right || (left.isNumeric() && right.isNumeric()))
            return ScalarType.BOOL;
        throw error(operator, left, right, "operands must be comparable");
    }

    static ScalarType ordering(String operator, ScalarType left, ScalarType right) {
        if (left == ScalarType.NULL || right == ScalarType.NULL)
            throw error(operator, left, right, "null is not permitted in ordered comparisons");
        if (left == ScalarType.UNKNOWN || right == ScalarType.UNKNOWN)
            throw unknown(operator, left, right, "unknown comparability");
        if (left.isNumeric() && right.isNumeric())
            return ScalarType.BOOL;
        if (left == ScalarType.STRING && right == ScalarType.STRING)
            return ScalarType.BOOL;
        throw error(operator, left, right, "operands must be comparable");
    }

    @Override
    public ScalarType visit(LiteralExpression expression) {
        return expression.type;
    }

    @Override
    public ScalarType visit(ColumnExpression expression) {
        return this.schema.typeOf(expression.name);
    }

    @Override
    public ScalarType visit(UnaryExpression expression) {
        ScalarType source = expression.source.accept(this);
        String operator = expression.opcode.text;
        if (expression.opcode == UnaryExpression.Opcode.NOT) {
            requireBoolOperand(operator, source);
            return ScalarType.BOOL;
        }
        if (source == ScalarType.NULL)
            throw error(operator, source, source, "null is not permitted in arithmetic");
        if (source == ScalarType.UNKNOWN)
            throw unknown(operator, source, source, "unknown is not permitted in arithmetic");
        if (!source.isNumeric())
            throw error(operator, source, source, "arithmetic requires numeric operands");
        return source;
    }

    @Override
    public ScalarType visit(BinaryExpression expression) {
        ScalarType left = expression.left.accept(this);
        ScalarType right = expression.right.accept(this);
        String operator = expression.opcode.text;
        if (expression.opcode.isArithmetic())
            return arithmetic(operator, left, right, expression.opcode == BinaryExpression.Opcode.DIV);
        if (expression.opcode.isEquality())
            return equality(operator, left, right);
        return ordering(operator, left, right);
    }

    @Override
    public ScalarType visit(BoolExpression expression) {
        for (Expression arg: expression.args)
            requireBoolOperand(expression.opcode.text, arg.accept(this));
        return ScalarType.BOOL;
    }

    @Override
    public ScalarType visit(CallExpression expression) {
        switch (expression.function) {
            case IF: {
                requireBoolOperand("if", expression.args.get(0).accept(this));
                ScalarType then = expression.args.get(1).accept(this);
                ScalarType otherwise = expression.args.get(2).accept(this);
                if (then == ScalarType.UNKNOWN || otherwise == ScalarType.UNKNOWN)
                    return ScalarType.UNKNOWN;
                return ScalarType.unify(then, otherwise, "if");
            }
            case COALESCE: {
                ScalarType result = null;
                for (Expression arg: expression.args) {
                    ScalarType type = arg.accept(this);
                    if (type == ScalarType.UNKNOWN)
                        return ScalarType.UNKNOWN;
                    result = result == null ? type : ScalarType.unify(result, type, "coalesce");
                }
                return result == null ? ScalarType.NULL : result;
            }
            case INPUT:
                expression.args.get(0).accept(this);
                return ScalarType.DECIMAL;
            default:
                throw new CompilationError(ErrorCode.EXPRESSION_ERROR, "Unexpected function " + expression.function);
        }
    }

    @Override
    public ScalarType visit(LookupExpression expression) {
        expression.key.accept(this);
        return ScalarType.STRING;
    }
}
