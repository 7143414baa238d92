package org.sans.compiler.ir.expression;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.util.IIndentStream;

/** Reference to a column of the current row.  Names may be qualified,
 * as in "first.subjid" or "a.subjid". */
public final class ColumnExpression extends Expression {
    public final String name;

    public ColumnExpression(String name) {
        this.name = name;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("type", "col");
        result.put("name", this.name);
        return result;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }
}
