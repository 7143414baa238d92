package org.sans.executor;

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
import org.sans.compiler.ir.step.FormatStep;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Evaluates expressions over the values visible in one row.
 * Missing values propagate through arithmetic; comparisons treat missing as
 * the smallest value; 'and' and 'or' use three-valued logic.
 * A value of the wrong type is never returned: it is a runtime failure.
 */
public class ExpressionEvaluator implements ExpressionVisitor<Object> {
    /** Resolves column references. */
    public interface IRowScope {
        @Nullable
        Object get(String column);
    }

    /** Scope backed by a map; names that are absent are missing. */
    public static IRowScope of(Map<String, Object> values) {
        return values::get;
    }

    static final Pattern BEST = Pattern.compile("best[0-9]*");

    /** Formats declared so far, by normalized name. */
    final Map<String, FormatStep> formats;
    IRowScope scope;

    public ExpressionEvaluator(Map<String, FormatStep> formats) {
        this.formats = formats;
        this.scope = column -> null;
    }

    /** The name under which a format is registered and looked up. */
    public static String formatKey(String name) {
        String result = name.toLowerCase();
        if (result.startsWith("$"))
            result = result.substring(1);
        if (result.endsWith("."))
            result = result.substring(0, result.length() - 1);
        return result;
    }

    /** Make a format available to later lookups; a later declaration replaces an earlier one. */
    public void define(FormatStep format) {
        this.formats.put(formatKey(format.name), format);
    }

    @Nullable
    public Object evaluate(Expression expression, IRowScope scope) {
        IRowScope saved = this.scope;
        this.scope = scope;
        try {
            return expression.accept(this);
        } finally {
            this.scope = saved;
        }
    }

    /** Evaluate a predicate; missing counts as false. */
    public boolean test(Expression predicate, IRowScope scope) {
        return Values.isTrue(this.evaluate(predicate, scope));
    }

    @Nullable
    Object eval(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public Object visit(LiteralExpression expression) {
        return expression.value;
    }

    @Override
    public Object visit(ColumnExpression expression) {
        return this.scope.get(expression.name);
    }

    @Override
    public Object visit(UnaryExpression expression) {
        Object value = this.eval(expression.source);
        if (value == null)
            return null;
        switch (expression.opcode) {
            case NOT:
                return !Values.asBool(value);
            case PLUS:
                Values.toDecimal(value);
                return value;
            case MINUS:
                if (value instanceof Long) {
                    try {
                        return Math.negateExact((Long) value);
                    } catch (ArithmeticException e) {
                        throw Values.mismatch("Integer overflow in -" + value);
                    }
                }
                return Values.toDecimal(value).negate();
            default:
                throw new ExecutionError(ErrorCode.INTERNAL, "Unexpected operator " + expression.opcode);
        }
    }

    @Nullable
    static Object arithmetic(BinaryExpression.Opcode opcode, @Nullable Object left, @Nullable Object right) {
        if (left == null || right == null)
            return null;
        if (opcode == BinaryExpression.Opcode.DIV) {
            BigDecimal divisor = Values.toDecimal(right);
            if (divisor.signum() == 0)
                return null;
            return Values.toDecimal(left).divide(divisor, MathContext.DECIMAL128);
        }
        if (left instanceof Long && right instanceof Long) {
            long l = (Long) left;
            long r = (Long) right;
            try {
                switch (opcode) {
                    case ADD: return Math.addExact(l, r);
                    case SUB: return Math.subtractExact(l, r);
                    case MUL: return Math.multiplyExact(l, r);
                    default: break;
                }
            } catch (ArithmeticException e) {
                throw Values.mismatch("Integer overflow in " + l + " " + opcode.text + " " + r);
            }
        }
        BigDecimal l = Values.toDecimal(left);
        BigDecimal r = Values.toDecimal(right);
        switch (opcode) {
            case ADD: return l.add(r);
            case SUB: return l.subtract(r);
            case MUL: return l.multiply(r);
            default:
                throw new ExecutionError(ErrorCode.INTERNAL, "Unexpected operator " + opcode);
        }
    }

    static boolean compare(BinaryExpression.Opcode opcode, @Nullable Object left, @Nullable Object right) {
        int compare = Values.compare(left, right);
        switch (opcode) {
            case EQ: return compare == 0;
            case NEQ: return compare != 0;
            case LT: return compare < 0;
            case LTE: return compare <= 0;
            case GT: return compare > 0;
            case GTE: return compare >= 0;
            default:
                throw new ExecutionError(ErrorCode.INTERNAL, "Unexpected operator " + opcode);
        }
    }

    @Override
    public Object visit(BinaryExpression expression) {
        Object left = this.eval(expression.left);
        Object right = this.eval(expression.right);
        if (expression.opcode.isArithmetic())
            return arithmetic(expression.opcode, left, right);
        return compare(expression.opcode, left, right);
    }

    @Override
    public Object visit(BoolExpression expression) {
        // A decisive operand wins over missing ones.
        boolean decisive = expression.opcode == BoolExpression.Opcode.OR;
        boolean missing = false;
        for (Expression arg: expression.args) {
            Boolean value = Values.asBool(this.eval(arg));
            if (value == null)
                missing = true;
            else if (value == decisive)
                return decisive;
        }
        if (missing)
            return null;
        return !decisive;
    }

    @Override
    public Object visit(CallExpression expression) {
        switch (expression.function) {
            case COALESCE:
                for (Expression arg: expression.args) {
                    Object value = this.eval(arg);
                    if (value != null)
                        return value;
                }
                return null;
            case IF:
                if (Values.isTrue(this.eval(expression.args.get(0))))
                    return this.eval(expression.args.get(1));
                return this.eval(expression.args.get(2));
            case INPUT: {
                Object informat = this.eval(expression.args.get(1));
                return input(this.eval(expression.args.get(0)), String.valueOf(informat));
            }
            default:
                throw new ExecutionError(ErrorCode.INTERNAL, "Unexpected function " + expression.function);
        }
    }

    /** Read a decimal with an informat.  Only the 'best' family is supported. */
    @Nullable
    static Object input(@Nullable Object value, String informat) {
        if (!BEST.matcher(formatKey(informat)).matches())
            throw new ExecutionError(ErrorCode.RUNTIME_INFORMAT_UNSUPPORTED,
                    "Informat " + informat + " is not supported; only best is");
        if (value == null)
            return null;
        if (Values.isNumeric(value))
            return Values.toDecimal(value);
        String text = value.toString().strip();
        if (text.isEmpty())
            return null;
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public Object visit(LookupExpression expression) {
        FormatStep format = this.formats.get(formatKey(expression.format));
        if (format == null)
            throw new ExecutionError(ErrorCode.RUNTIME_FORMAT_UNDEFINED,
                    "Format " + expression.format + " is not defined");
        Object key = this.eval(expression.key);
        if (key == null)
            return format.other;
        String label = format.map.get(Values.keyText(key));
        if (label != null)
            return label;
        if (format.other != null)
            return format.other;
        throw new ExecutionError(ErrorCode.RUNTIME_FORMAT_MISS,
                "Value " + Values.keyText(key) + " has no label in format " + expression.format +
                        ", which has no 'other' entry");
    }
}
