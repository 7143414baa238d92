package org.sans.compiler.ir.expression;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.util.IIndentStream;

import javax.annotation.Nullable;

/** Arithmetic or comparison. */
public final class BinaryExpression extends Expression {
    public enum Opcode {
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        EQ("=="),
        NEQ("!="),
        LT("<"),
        LTE("<="),
        GT(">"),
        GTE(">=");

        public final String text;

        Opcode(String text) {
            this.text = text;
        }

        public boolean isArithmetic() {
            return this == ADD || this == SUB || this == MUL || this == DIV;
        }

        public boolean isEquality() {
            return this == EQ || this == NEQ;
        }

        public boolean isOrdering() {
            return this == LT || this == LTE || this == GT || this == GTE;
        }

        @Nullable
        public static Opcode fromText(String text) {
            for (Opcode opcode: values())
                if (opcode.text.equals(text))
                    return opcode;
            return null;
        }

        @Override
        public String toString() {
            return this.text;
        }
    }

    public final Opcode opcode;
    public final Expression left;
    public final Expression right;

    public BinaryExpression(Opcode opcode, Expression left, Expression right) {
        this.opcode = opcode;
        this.left = left;
        this.right = right;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("type", "binop");
        result.put("op", this.opcode.text);
        result.set("left", this.left.toJson());
        result.set("right", this.right.toJson());
        return result;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.left)
                .append(" ")
                .append(this.opcode.text)
                .append(" ")
                .append(this.right)
                .append(")");
    }
}
