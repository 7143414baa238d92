package org.sans.compiler.ir.expression;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.util.IIndentStream;
import org.sans.util.Utilities;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** N-ary conjunction or disjunction.  Nested chains of the same
 * operator are flattened into a single node. */
public final class BoolExpression extends Expression {
    public enum Opcode {
        AND("and"),
        OR("or");

        public final String text;

        Opcode(String text) {
            this.text = text;
        }
    }

    public final Opcode opcode;
    public final List<Expression> args;

    public BoolExpression(Opcode opcode, List<Expression> args) {
        Utilities.enforce(args.size() >= 2, "Boolean expression with fewer than 2 arguments");
        this.opcode = opcode;
        List<Expression> flat = new ArrayList<>();
        for (Expression arg: args) {
            BoolExpression nested = arg.as(BoolExpression.class);
            if (nested != null && nested.opcode == opcode)
                flat.addAll(nested.args);
            else
                flat.add(arg);
        }
        this.args = Collections.unmodifiableList(flat);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("type", "boolop");
        result.put("op", this.opcode.text);
        ArrayNode array = result.putArray("args");
        for (Expression arg: this.args)
            array.add(arg.toJson());
        return result;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("(");
        boolean first = true;
        for (Expression arg: this.args) {
            if (!first)
                builder.append(" ").append(this.opcode.text).append(" ");
            first = false;
            builder.append(arg);
        }
        return builder.append(")");
    }
}
