package org.sans.compiler.ir.expression;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.util.ICastable;
import org.sans.util.IndentStream;
import org.sans.util.ToIndentableString;

/** Base class for all expression nodes.  Expressions are immutable trees. */
public abstract class Expression implements ICastable, ToIndentableString {
    public abstract <T> T accept(ExpressionVisitor<T> visitor);

    /** Canonical JSON representation; part of step identities. */
    public abstract ObjectNode toJson();

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        IndentStream stream = new IndentStream(builder);
        this.toString(stream);
        return builder.toString();
    }
}
