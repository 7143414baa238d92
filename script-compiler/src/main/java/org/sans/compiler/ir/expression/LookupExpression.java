package org.sans.compiler.ir.expression;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.util.IIndentStream;

/** Apply a declared format (a lookup table) to a value: put(value, $name.) */
public final class LookupExpression extends Expression {
    /** Format name, lowercase, without the trailing dot; character formats keep the leading '$'. */
    public final String format;
    public final Expression key;

    public LookupExpression(String format, Expression key) {
        this.format = format;
        this.key = key;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("type", "lookup");
        result.put("format", this.format);
        result.set("arg", this.key.toJson());
        return result;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("put(")
                .append(this.key)
                .append(", ")
                .append(this.format)
                .append(".)");
    }
}
