package org.sans.compiler.ir.expression;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;

/** Call of one of the few functions that are allowed in expressions. */
public final class CallExpression extends Expression {
    public enum Function {
        /** First argument which is not missing. */
        COALESCE("coalesce"),
        /** if(condition, then, else) */
        IF("if"),
        /** input(value, informat): parse a string as a number. */
        INPUT("input");

        public final String text;

        Function(String text) {
            this.text = text;
        }

        @Nullable
        public static Function fromText(String text) {
            for (Function function: values())
                if (function.text.equalsIgnoreCase(text))
                    return function;
            return null;
        }
    }

    public final Function function;
    public final List<Expression> args;

    public CallExpression(Function function, List<Expression> args) {
        this.function = function;
        this.args = Collections.unmodifiableList(args);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("type", "call");
        result.put("name", this.function.text);
        ArrayNode array = result.putArray("args");
        for (Expression arg: this.args)
            array.add(arg.toJson());
        return result;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.function.text).append("(");
        boolean first = true;
        for (Expression arg: this.args) {
            if (!first)
                builder.append(", ");
            first = false;
            builder.append(arg);
        }
        return builder.append(")");
    }
}
