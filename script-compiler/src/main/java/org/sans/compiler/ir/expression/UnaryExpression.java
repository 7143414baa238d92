package org.sans.compiler.ir.expression;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.util.IIndentStream;

public final class UnaryExpression extends Expression {
    public enum Opcode {
        NOT("not"),
        PLUS("+"),
        MINUS("-");

        public final String text;

        Opcode(String text) {
            this.text = text;
        }

        @Override
        public String toString() {
            return this.text;
        }
    }

    public final Opcode opcode;
    public final Expression source;

    public UnaryExpression(Opcode opcode, Expression source) {
        this.opcode = opcode;
        this.source = source;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("type", "unop");
        result.put("op", this.opcode.text);
        result.set("arg", this.source.toJson());
        return result;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.opcode.text)
                .append(this.opcode == Opcode.NOT ? " " : "")
                .append(this.source)
                .append(")");
    }
}
