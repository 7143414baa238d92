package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.ir.expression.Expression;
import org.sans.util.ICastable;

import javax.annotation.Nullable;

/** A statement executed for every row position of a data step. */
public abstract class DataStatement implements ICastable {
    public abstract ObjectNode toJson();

    /** target = expression */
    public static final class Assign extends DataStatement {
        public final String target;
        public final Expression expression;

        public Assign(String target, Expression expression) {
            this.target = target;
            this.expression = expression;
        }

        @Override
        public ObjectNode toJson() {
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            result.put("type", "assign");
            result.put("target", this.target);
            result.set("expr", this.expression.toJson());
            return result;
        }

        @Override
        public String toString() {
            return this.target + " = " + this.expression;
        }
    }

    /** Subsetting if: when the predicate is not true the row is abandoned. */
    public static final class Filter extends DataStatement {
        public final Expression predicate;

        public Filter(Expression predicate) {
            this.predicate = predicate;
        }

        @Override
        public ObjectNode toJson() {
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            result.put("type", "filter");
            result.set("predicate", this.predicate.toJson());
            return result;
        }

        @Override
        public String toString() {
            return "if " + this.predicate;
        }
    }

    /** Emit the current row. */
    public static final class Output extends DataStatement {
        public static final Output INSTANCE = new Output();

        private Output() {}

        @Override
        public ObjectNode toJson() {
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            result.put("type", "output");
            return result;
        }

        @Override
        public String toString() {
            return "output";
        }
    }

    /** if predicate then action [else action] */
    public static final class IfThen extends DataStatement {
        public final Expression predicate;
        public final DataStatement then;
        @Nullable
        public final DataStatement otherwise;

        public IfThen(Expression predicate, DataStatement then, @Nullable DataStatement otherwise) {
            this.predicate = predicate;
            this.then = then;
            this.otherwise = otherwise;
        }

        public IfThen withElse(DataStatement otherwise) {
            return new IfThen(this.predicate, this.then, otherwise);
        }

        @Override
        public ObjectNode toJson() {
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            result.put("type", "if_then");
            result.set("predicate", this.predicate.toJson());
            result.set("then", this.then.toJson());
            if (this.otherwise == null)
                result.putNull("else");
            else
                result.set("else", this.otherwise.toJson());
            return result;
        }

        @Override
        public String toString() {
            return "if " + this.predicate + " then " + this.then +
                    (this.otherwise != null ? " else " + this.otherwise : "");
        }
    }
}
