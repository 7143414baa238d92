package org.sans.compiler.ir.expression;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.InternalCompilerError;
import org.sans.compiler.ir.type.ScalarType;
import org.sans.util.IIndentStream;
import org.sans.util.Utilities;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.Objects;

/** A constant.  The value is null, a Boolean, a Long, a BigDecimal or a String,
 * according to the type. */
public final class LiteralExpression extends Expression {
    public final ScalarType type;
    @Nullable
    public final Object value;

    public static final LiteralExpression NULL = new LiteralExpression(ScalarType.NULL, null);

    public LiteralExpression(ScalarType type, @Nullable Object value) {
        this.type = type;
        this.value = value;
        boolean ok;
        switch (type) {
            case NULL: ok = value == null; break;
            case BOOL: ok = value instanceof Boolean; break;
            case INT: ok = value instanceof Long; break;
            case DECIMAL: ok = value instanceof BigDecimal; break;
            case STRING: ok = value instanceof String; break;
            default: ok = false;
        }
        if (!ok)
            throw new InternalCompilerError("Literal " + value + " does not have type " + type);
    }

    public static LiteralExpression of(long value) {
        return new LiteralExpression(ScalarType.INT, value);
    }

    public static LiteralExpression of(BigDecimal value) {
        return new LiteralExpression(ScalarType.DECIMAL, value);
    }

    public static LiteralExpression of(String value) {
        return new LiteralExpression(ScalarType.STRING, value);
    }

    public static LiteralExpression of(boolean value) {
        return new LiteralExpression(ScalarType.BOOL, value);
    }

    /** Canonical text of a decimal: plain notation without trailing zeros. */
    public static String canonicalDecimal(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.signum() == 0)
            return "0";
        return stripped.toPlainString();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("type", "lit");
        switch (this.type) {
            case NULL:
                result.putNull("value");
                break;
            case BOOL:
                result.put("value", (Boolean) Objects.requireNonNull(this.value));
                break;
            case INT:
                result.put("value", (Long) Objects.requireNonNull(this.value));
                break;
            case DECIMAL: {
                // Decimals are encoded as strings so that no binary rounding can occur
                ObjectNode dec = result.putObject("value");
                dec.put("type", "decimal");
                dec.put("value", canonicalDecimal((BigDecimal) Objects.requireNonNull(this.value)));
                break;
            }
            case STRING:
                result.put("value", (String) Objects.requireNonNull(this.value));
                break;
            default:
                throw new InternalCompilerError("Unexpected literal type " + this.type);
        }
        return result;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        switch (this.type) {
            case NULL: return builder.append("null");
            case STRING: return builder.append(Utilities.doubleQuote((String) Objects.requireNonNull(this.value)));
            case DECIMAL: return builder.append(canonicalDecimal((BigDecimal) Objects.requireNonNull(this.value)));
            default: return builder.append(String.valueOf(this.value));
        }
    }
}
