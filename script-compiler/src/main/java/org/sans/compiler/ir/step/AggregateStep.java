package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.SourcePositionRange;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Grouped aggregation.  Output: the group columns, then one column per metric.
 * Rows are ordered by group key. */
public final class AggregateStep extends OpStep {
    public enum Statistic {
        MEAN("mean"),
        SUM("sum"),
        MIN("min"),
        MAX("max"),
        /** Number of rows in the group. */
        COUNT("count"),
        /** Number of non-missing values in the group. */
        N("n");

        public final String text;

        Statistic(String text) {
            this.text = text;
        }

        @Nullable
        public static Statistic fromText(String text) {
            for (Statistic statistic: values())
                if (statistic.text.equalsIgnoreCase(text))
                    return statistic;
            return null;
        }
    }

    public static final class Metric {
        public final String column;
        public final Statistic statistic;
        public final String name;

        public Metric(String column, Statistic statistic, String name) {
            this.column = column;
            this.statistic = statistic;
            this.name = name;
        }

        @Override
        public String toString() {
            return this.name;
        }
    }

    /** Separator between the column and the statistic in output names. */
    public static final String NAME_SEPARATOR = "_";

    public final List<String> groupBy;
    public final List<Metric> metrics;

    public AggregateStep(SourcePositionRange range, String input, String output,
                         List<String> groupBy, List<Metric> metrics) {
        super(range, List.of(input), List.of(output));
        this.groupBy = Collections.unmodifiableList(groupBy);
        this.metrics = Collections.unmodifiableList(metrics);
    }

    /** Metrics for every column and every statistic, column-major:
     * for each column, for each statistic. */
    public static List<Metric> columnMajor(List<String> columns, List<Statistic> statistics) {
        List<Metric> result = new ArrayList<>();
        for (String column: columns)
            for (Statistic statistic: statistics)
                result.add(new Metric(column, statistic, column + NAME_SEPARATOR + statistic.text));
        return result;
    }

    @Override
    public OpKind getKind() {
        return OpKind.AGGREGATE;
    }

    @Override
    public ObjectNode paramsToJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.set("group_by", stringArray(this.groupBy));
        ArrayNode metrics = result.putArray("metrics");
        for (Metric metric: this.metrics) {
            ObjectNode m = metrics.addObject();
            m.put("col", metric.column);
            m.put("op", metric.statistic.text);
            m.put("name", metric.name);
        }
        return result;
    }

    @Override
    public <T> T accept(StepVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public OpStep withOutputs(List<String> outputs) {
        return new AggregateStep(this.range, this.getInput(), outputs.get(0), this.groupBy, this.metrics);
    }
}
