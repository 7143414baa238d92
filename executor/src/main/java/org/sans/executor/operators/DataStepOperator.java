package org.sans.executor.operators;

import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.step.DataStatement;
import org.sans.compiler.ir.step.DataStep;
import org.sans.compiler.ir.step.DatasetSpec;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.ExecutionError;
import org.sans.executor.ExpressionEvaluator;
import org.sans.executor.Row;
import org.sans.executor.Table;
import org.sans.executor.Values;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Row-at-a-time iteration over one or more inputs.
 *
 * <p>The inputs are first turned into a sequence of row positions.
 * SET concatenates the inputs; with BY variables the rows are interleaved
 * by key, keeping the input order for equal keys.  MERGE combines the rows of
 * all inputs that share a key: the i-th position of a key takes the i-th row
 * of every input, and an input with fewer rows repeats its last one.
 * More than one input with several rows for the same key is refused.
 *
 * <p>Each position then runs the statements.  Values of retained variables
 * are carried from one position to the next for the whole step; all other
 * assigned variables start missing at every position.
 */
public class DataStepOperator extends BaseOperator<DataStep> {
    /** Values read for one row position, with the presence flags set. */
    static final class Position {
        final List<Object> key;
        final Map<String, Object> values;

        Position(List<Object> key, Map<String, Object> values) {
            this.key = key;
            this.values = values;
        }
    }

    /** Rows of one input after its dataset options. */
    static final class Prepared {
        final DatasetSpec spec;
        final Schema schema;
        final List<Map<String, Object>> rows;

        Prepared(DatasetSpec spec, Schema schema, List<Map<String, Object>> rows) {
            this.spec = spec;
            this.schema = schema;
            this.rows = rows;
        }
    }

    /** Result of running statements on one position. */
    enum Flow {
        CONTINUE,
        /** A subsetting condition was false; the rest of the statements are skipped. */
        STOP
    }

    final List<Row> emitted = new ArrayList<>();
    @Nullable
    Schema output;

    public DataStepOperator(DataStep step, ExpressionEvaluator evaluator) {
        super(step, evaluator);
    }

    Prepared prepare(DatasetSpec spec, Table table) {
        Schema schema = table.schema;
        if (!spec.keep.isEmpty())
            schema = schema.project(spec.keep);
        schema = schema.drop(spec.drop);
        schema = schema.rename(spec.rename);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Row row: table.getRows()) {
            Map<String, Object> values = table.asMap(row);
            if (spec.where != null && !this.evaluator.test(spec.where, ExpressionEvaluator.of(values)))
                continue;
            Map<String, Object> result = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry: values.entrySet()) {
                String name = entry.getKey();
                if (!spec.keep.isEmpty() && !spec.keep.contains(name))
                    continue;
                if (spec.drop.contains(name))
                    continue;
                result.put(spec.rename.getOrDefault(name, name), entry.getValue());
            }
            rows.add(result);
        }
        return new Prepared(spec, schema, rows);
    }

    List<Object> keyOf(Map<String, Object> row) {
        List<Object> result = new ArrayList<>(this.step.by.size());
        for (String column: this.step.by)
            result.add(row.get(column));
        return result;
    }

    void checkOrder(Prepared input) {
        List<Object> previous = null;
        for (Map<String, Object> row: input.rows) {
            List<Object> key = this.keyOf(row);
            if (previous != null && Values.compareKeys(previous, key) > 0)
                throw new ExecutionError(ErrorCode.RUNTIME_ORDER_REQUIRED,
                        "Input " + input.spec.table + " is not sorted by " + this.step.by +
                                ": key " + key + " follows " + previous);
            previous = key;
        }
    }

    /** Every column of every input, missing, and every presence flag false. */
    static Map<String, Object> emptyValues(List<Prepared> inputs) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Prepared input: inputs) {
            for (String name: input.schema.names())
                result.put(name, null);
            if (input.spec.inFlag != null)
                result.put(input.spec.inFlag, false);
        }
        return result;
    }

    List<Position> setPositions(List<Prepared> inputs) {
        List<Position> result = new ArrayList<>();
        for (Prepared input: inputs) {
            for (Map<String, Object> row: input.rows) {
                Map<String, Object> values = emptyValues(inputs);
                values.putAll(row);
                if (input.spec.inFlag != null)
                    values.put(input.spec.inFlag, true);
                result.add(new Position(this.keyOf(row), values));
            }
        }
        if (!this.step.by.isEmpty())
            // Stable: rows with equal keys keep the input order.
            result.sort((left, right) -> Values.compareKeys(left.key, right.key));
        return result;
    }

    List<Position> mergePositions(List<Prepared> inputs) {
        List<Map<List<Object>, List<Map<String, Object>>>> groups = new ArrayList<>();
        TreeSet<List<Object>> keys = new TreeSet<>(Values.KEY_COMPARATOR);
        for (Prepared input: inputs) {
            Map<List<Object>, List<Map<String, Object>>> byKey = new TreeMap<>(Values.KEY_COMPARATOR);
            for (Map<String, Object> row: input.rows) {
                List<Object> key = this.keyOf(row);
                byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
                keys.add(key);
            }
            groups.add(byKey);
        }

        List<Position> result = new ArrayList<>();
        for (List<Object> key: keys) {
            int max = 0;
            int many = 0;
            for (Map<List<Object>, List<Map<String, Object>>> byKey: groups) {
                int size = byKey.getOrDefault(key, Collections.emptyList()).size();
                max = Math.max(max, size);
                if (size > 1)
                    many++;
            }
            if (many > 1)
                throw new ExecutionError(ErrorCode.RUNTIME_MERGE_MANY_MANY,
                        "merge: more than one input has several rows for key " + this.step.by + " = " + key);
            for (int index = 0; index < max; index++) {
                Map<String, Object> values = emptyValues(inputs);
                for (int k = 0; k < this.step.by.size(); k++)
                    values.put(this.step.by.get(k), key.get(k));
                for (int i = 0; i < inputs.size(); i++) {
                    List<Map<String, Object>> rows = groups.get(i).get(key);
                    if (rows == null)
                        continue;
                    values.putAll(rows.get(Math.min(index, rows.size() - 1)));
                    DatasetSpec spec = inputs.get(i).spec;
                    if (spec.inFlag != null)
                        values.put(spec.inFlag, true);
                }
                result.add(new Position(key, values));
            }
        }
        return result;
    }

    /** True if the first 'level + 1' key values are equal. */
    static boolean samePrefix(List<Object> left, List<Object> right, int level) {
        for (int i = 0; i <= level; i++)
            if (Values.compare(left.get(i), right.get(i)) != 0)
                return false;
        return true;
    }

    void setGroupFlags(List<Position> positions) {
        for (int p = 0; p < positions.size(); p++) {
            Position position = positions.get(p);
            for (int level = 0; level < this.step.by.size(); level++) {
                String column = this.step.by.get(level);
                boolean first = p == 0 || !samePrefix(positions.get(p - 1).key, position.key, level);
                boolean last = p == positions.size() - 1 ||
                        !samePrefix(position.key, positions.get(p + 1).key, level);
                position.values.put(DataStep.FIRST_PREFIX + column, first);
                position.values.put(DataStep.LAST_PREFIX + column, last);
            }
        }
    }

    static void assigned(DataStatement statement, Set<String> result) {
        DataStatement.Assign assign = statement.as(DataStatement.Assign.class);
        if (assign != null) {
            result.add(assign.target);
            return;
        }
        DataStatement.IfThen ifThen = statement.as(DataStatement.IfThen.class);
        if (ifThen != null) {
            assigned(ifThen.then, result);
            if (ifThen.otherwise != null)
                assigned(ifThen.otherwise, result);
        }
    }

    void emit(Map<String, Object> values) {
        this.emitted.add(Table.makeRow(required(this.output), values));
    }

    Flow run(DataStatement statement, Map<String, Object> values) {
        ExpressionEvaluator.IRowScope scope = ExpressionEvaluator.of(values);
        DataStatement.Assign assign = statement.as(DataStatement.Assign.class);
        if (assign != null) {
            values.put(assign.target, this.evaluator.evaluate(assign.expression, scope));
            return Flow.CONTINUE;
        }
        DataStatement.Filter filter = statement.as(DataStatement.Filter.class);
        if (filter != null)
            return this.evaluator.test(filter.predicate, scope) ? Flow.CONTINUE : Flow.STOP;
        if (statement.is(DataStatement.Output.class)) {
            this.emit(values);
            return Flow.CONTINUE;
        }
        DataStatement.IfThen ifThen = statement.to(DataStatement.IfThen.class);
        if (this.evaluator.test(ifThen.predicate, scope))
            return this.run(ifThen.then, values);
        if (ifThen.otherwise != null)
            return this.run(ifThen.otherwise, values);
        return Flow.CONTINUE;
    }

    @Override
    public Table apply(List<Table> inputs, @Nullable Schema output) {
        this.output = required(output);
        List<Prepared> prepared = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++)
            prepared.add(this.prepare(this.step.specs.get(i), inputs.get(i)));
        if (!this.step.by.isEmpty())
            for (Prepared input: prepared)
                this.checkOrder(input);

        List<Position> positions = this.step.mode == DataStep.Mode.MERGE ?
                this.mergePositions(prepared) : this.setPositions(prepared);
        this.setGroupFlags(positions);

        Set<String> targets = new LinkedHashSet<>();
        for (DataStatement statement: this.step.statements)
            assigned(statement, targets);
        // The accumulator threaded through the rows; retained variables start missing.
        Map<String, Object> retained = new LinkedHashMap<>();
        for (String variable: this.step.retain)
            retained.put(variable, null);

        for (Position position: positions) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (String target: targets)
                values.put(target, null);
            values.putAll(retained);
            values.putAll(position.values);

            Flow flow = Flow.CONTINUE;
            for (DataStatement statement: this.step.statements) {
                flow = this.run(statement, values);
                if (flow == Flow.STOP)
                    break;
            }
            if (flow == Flow.CONTINUE && !this.step.explicitOutput)
                this.emit(values);
            for (String variable: this.step.retain)
                retained.put(variable, values.get(variable));
        }

        this.counters.put("positions", positions.size());
        this.getDebugStream(2)
                .append(this.step.mode.text)
                .append(" over ")
                .append(positions.size())
                .append(" positions emitted ")
                .append(this.emitted.size())
                .append(" rows")
                .newline();
        return new Table(this.output, this.emitted);
    }
}
