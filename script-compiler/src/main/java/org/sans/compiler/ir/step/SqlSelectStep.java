package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.ir.expression.Expression;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A restricted SELECT: a base table, inner/left joins evaluated left to right,
 * an optional WHERE, and an optional GROUP BY with simple aggregates. */
public final class SqlSelectStep extends OpStep {
    public static final class TableRef {
        public final String table;
        public final String alias;

        public TableRef(String table, String alias) {
            this.table = table;
            this.alias = alias;
        }

        /** Only the alias: table names are wiring, not semantics. */
        ObjectNode toJson() {
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            result.put("alias", this.alias);
            return result;
        }
    }

    public enum JoinType {
        INNER("inner"),
        LEFT("left");

        public final String text;

        JoinType(String text) {
            this.text = text;
        }
    }

    public static final class Join {
        public final JoinType type;
        public final TableRef table;
        public final Expression on;

        public Join(JoinType type, TableRef table, Expression on) {
            this.type = type;
            this.table = table;
            this.on = on;
        }
    }

    public enum Aggregate {
        COUNT("count"),
        SUM("sum"),
        MIN("min"),
        MAX("max"),
        AVG("avg");

        public final String text;

        Aggregate(String text) {
            this.text = text;
        }

        @Nullable
        public static Aggregate fromText(String text) {
            for (Aggregate aggregate: values())
                if (aggregate.text.equalsIgnoreCase(text))
                    return aggregate;
            return null;
        }
    }

    /** An item of the select list.  Either a column or an aggregate;
     * a star item selects every column of every table. */
    public static final class SelectItem {
        /** Null for a star item */
        @Nullable
        public final String column;
        /** Non-null for an aggregate */
        @Nullable
        public final Aggregate aggregate;
        /** Output name; null for a star item */
        @Nullable
        public final String alias;

        private SelectItem(@Nullable String column, @Nullable Aggregate aggregate, @Nullable String alias) {
            this.column = column;
            this.aggregate = aggregate;
            this.alias = alias;
        }

        public static SelectItem column(String column, String alias) {
            return new SelectItem(column, null, alias);
        }

        /** Aggregate; the argument "*" is only legal for count. */
        public static SelectItem aggregate(Aggregate aggregate, String argument, String alias) {
            return new SelectItem(argument, aggregate, alias);
        }

        public static SelectItem star() {
            return new SelectItem(null, null, null);
        }

        public boolean isStar() {
            return this.column == null;
        }

        public boolean isAggregate() {
            return this.aggregate != null;
        }

        ObjectNode toJson() {
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            if (this.isStar()) {
                result.put("type", "star");
            } else if (this.aggregate != null) {
                result.put("type", "agg");
                result.put("func", this.aggregate.text);
                result.put("arg", this.column);
                result.put("alias", this.alias);
            } else {
                result.put("type", "col");
                result.put("name", this.column);
                result.put("alias", this.alias);
            }
            return result;
        }
    }

    public final TableRef from;
    public final List<Join> joins;
    public final List<SelectItem> select;
    @Nullable
    public final Expression where;
    public final List<String> groupBy;

    public SqlSelectStep(SourcePositionRange range, String output, TableRef from, List<Join> joins,
                         List<SelectItem> select, @Nullable Expression where, List<String> groupBy) {
        super(range, inputs(from, joins), List.of(output));
        this.from = from;
        this.joins = Collections.unmodifiableList(joins);
        this.select = Collections.unmodifiableList(select);
        this.where = where;
        this.groupBy = Collections.unmodifiableList(groupBy);
    }

    static List<String> inputs(TableRef from, List<Join> joins) {
        List<String> result = new ArrayList<>();
        result.add(from.table);
        for (Join join: joins)
            if (!result.contains(join.table.table))
                result.add(join.table.table);
        return result;
    }

    public boolean isGrouped() {
        if (!this.groupBy.isEmpty())
            return true;
        for (SelectItem item: this.select)
            if (item.isAggregate())
                return true;
        return false;
    }

    /** All table references, base table first. */
    public List<TableRef> tables() {
        List<TableRef> result = new ArrayList<>();
        result.add(this.from);
        for (Join join: this.joins)
            result.add(join.table);
        return result;
    }

    @Override
    public OpKind getKind() {
        return OpKind.SQL_SELECT;
    }

    @Override
    public ObjectNode paramsToJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.set("from", this.from.toJson());
        ArrayNode joins = result.putArray("joins");
        for (Join join: this.joins) {
            ObjectNode j = join.table.toJson();
            j.put("type", join.type.text);
            j.set("on", join.on.toJson());
            joins.add(j);
        }
        ArrayNode select = result.putArray("select");
        for (SelectItem item: this.select)
            select.add(item.toJson());
        if (this.where == null)
            result.putNull("where");
        else
            result.set("where", this.where.toJson());
        result.set("group_by", stringArray(this.groupBy));
        return result;
    }

    @Override
    public <T> T accept(StepVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public OpStep withOutputs(List<String> outputs) {
        return new SqlSelectStep(this.range, outputs.get(0), this.from, this.joins,
                this.select, this.where, this.groupBy);
    }
}
