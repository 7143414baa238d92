package org.sans.compiler.validator;

import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.expression.ColumnCollector;
import org.sans.compiler.ir.expression.Expression;
import org.sans.compiler.ir.step.AggregateStep;
import org.sans.compiler.ir.step.CastStep;
import org.sans.compiler.ir.step.ComputeStep;
import org.sans.compiler.ir.step.DataStep;
import org.sans.compiler.ir.step.FilterStep;
import org.sans.compiler.ir.step.FormatStep;
import org.sans.compiler.ir.step.IdentityStep;
import org.sans.compiler.ir.step.RenameStep;
import org.sans.compiler.ir.step.SelectStep;
import org.sans.compiler.ir.step.SortStep;
import org.sans.compiler.ir.step.SqlSelectStep;
import org.sans.compiler.ir.step.StepVisitor;
import org.sans.compiler.ir.step.TransposeStep;
import org.sans.compiler.ir.type.Column;
import org.sans.compiler.ir.type.ScalarType;
import org.sans.compiler.ir.type.Schema;
import org.sans.util.Utilities;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the output schema of a step from the schemas of its inputs,
 * checking every expression and column reference on the way.
 * When an input schema is open nothing can be checked and the output is open.
 */
public class SchemaInference implements StepVisitor<Schema> {
    /** Schemas of all tables defined so far. */
    final Map<String, Schema> schemas;

    public SchemaInference(Map<String, Schema> schemas) {
        this.schemas = schemas;
    }

    Schema schemaOf(String table) {
        return Utilities.getExists(this.schemas, table);
    }

    Schema input(SqlSelectStep.TableRef ref) {
        return this.schemaOf(ref.table);
    }

    static ScalarType requireNumeric(ScalarType type, String context) {
        if (type == ScalarType.UNKNOWN)
            throw new CompilationError(ErrorCode.TYPE_UNKNOWN, context + " has unknown type");
        if (!type.isNumeric())
            throw new CompilationError(ErrorCode.TYPE, context + " must be numeric, got " + type);
        return type;
    }

    @Override
    public Schema visit(IdentityStep step) {
        return this.schemaOf(step.getInput());
    }

    @Override
    public Schema visit(ComputeStep step) {
        Schema schema = this.schemaOf(step.getInput());
        if (schema.open)
            return schema;
        for (ComputeStep.Assignment assignment: step.assignments) {
            boolean exists = schema.contains(assignment.column);
            if (step.mode == ComputeStep.Mode.DERIVE && exists)
                throw new CompilationError(ErrorCode.COLUMN_EXISTS,
                        "derive: column " + assignment.column + " already exists; use update! to overwrite it");
            if (step.mode == ComputeStep.Mode.UPDATE && !exists)
                throw new CompilationError(ErrorCode.COLUMN_NOT_FOUND,
                        "update!: column " + assignment.column + " does not exist; use derive to create it");
            ScalarType type = ExpressionTypeChecker.typeOf(assignment.expression, schema);
            if (type == ScalarType.NULL && exists)
                type = schema.typeOf(assignment.column);
            schema = schema.put(new Column(assignment.column, type));
        }
        return schema;
    }

    @Override
    public Schema visit(FilterStep step) {
        Schema schema = this.schemaOf(step.getInput());
        if (schema.open)
            return schema;
        ExpressionTypeChecker.requireBool(step.predicate, schema, "filter");
        return schema;
    }

    @Override
    public Schema visit(SelectStep step) {
        Schema schema = this.schemaOf(step.getInput());
        if (!step.keep.isEmpty())
            return schema.project(step.keep);
        return schema.drop(step.drop);
    }

    @Override
    public Schema visit(RenameStep step) {
        return this.schemaOf(step.getInput()).rename(step.map);
    }

    @Override
    public Schema visit(SortStep step) {
        Schema schema = this.schemaOf(step.getInput());
        for (SortStep.SortKey key: step.by)
            schema.require(key.column);
        return schema;
    }

    @Override
    public Schema visit(DataStep step) {
        return new DataStepTyping(step, this::schemaOf).infer();
    }

    @Override
    public Schema visit(TransposeStep step) {
        Schema schema = this.schemaOf(step.getInput());
        for (String key: step.by)
            schema.require(key);
        schema.require(step.id);
        schema.require(step.var);
        // The new columns are data dependent.
        return Schema.OPEN;
    }

    @Override
    public Schema visit(SqlSelectStep step) {
        SqlScope scope = new SqlScope();
        for (SqlSelectStep.TableRef ref: step.tables()) {
            Schema schema = this.input(ref);
            if (schema.open)
                return Schema.OPEN;
        }
        scope.add(step.from, this.input(step.from));
        for (SqlSelectStep.Join join: step.joins) {
            scope.add(join.table, this.input(join.table));
            ExpressionTypeChecker.requireBool(join.on, scope.check(join.on), "on");
        }
        if (step.where != null)
            ExpressionTypeChecker.requireBool(step.where, scope.check(step.where), "where");
        for (String column: step.groupBy)
            scope.resolve(column);

        List<Column> columns = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (SqlSelectStep.SelectItem item: step.select) {
            if (item.isStar()) {
                for (Column column: scope.starColumns())
                    if (names.add(column.name))
                        columns.add(column);
                continue;
            }
            ScalarType type;
            if (item.aggregate == null) {
                type = scope.resolve(item.column).type;
            } else if (item.aggregate == SqlSelectStep.Aggregate.COUNT) {
                if (!item.column.equals("*"))
                    scope.resolve(item.column);
                type = ScalarType.INT;
            } else {
                ScalarType argument = scope.resolve(item.column).type;
                String context = item.aggregate.text + "(" + item.column + ")";
                switch (item.aggregate) {
                    case SUM:
                        type = requireNumeric(argument, context);
                        break;
                    case AVG:
                        requireNumeric(argument, context);
                        type = ScalarType.DECIMAL;
                        break;
                    default:
                        type = argument;
                        break;
                }
            }
            if (!names.add(item.alias))
                throw new CompilationError(ErrorCode.COLUMN_EXISTS,
                        "Duplicate output column " + item.alias + " in select");
            columns.add(new Column(item.alias, type));
        }
        return new Schema(columns);
    }

    @Override
    public Schema visit(FormatStep step) {
        return Schema.of(new Column("key", ScalarType.STRING), new Column("label", ScalarType.STRING));
    }

    @Override
    public Schema visit(AggregateStep step) {
        Schema schema = this.schemaOf(step.getInput());
        if (schema.open)
            return schema;
        Schema result = schema.project(step.groupBy);
        for (AggregateStep.Metric metric: step.metrics) {
            ScalarType input = schema.typeOf(metric.column);
            String context = metric.statistic.text + " of " + metric.column;
            ScalarType type;
            switch (metric.statistic) {
                case MEAN:
                    requireNumeric(input, context);
                    type = ScalarType.DECIMAL;
                    break;
                case SUM:
                    type = requireNumeric(input, context);
                    break;
                case MIN:
                case MAX:
                    type = input;
                    break;
                default:
                    type = ScalarType.INT;
                    break;
            }
            if (result.contains(metric.name))
                throw new CompilationError(ErrorCode.COLUMN_EXISTS,
                        "Aggregate output column " + metric.name + " collides with an existing column");
            result = result.add(new Column(metric.name, type));
        }
        return result;
    }

    @Override
    public Schema visit(CastStep step) {
        Schema schema = this.schemaOf(step.getInput());
        for (CastStep.CastSpec cast: step.casts) {
            schema.require(cast.column);
            schema = schema.put(new Column(cast.column, cast.target.type));
        }
        return schema;
    }

    /**
     * Column names visible in a select: every column qualified by its table alias,
     * and every column name that is unique among the joined tables.
     */
    static final class SqlScope {
        final Map<String, Column> qualified = new LinkedHashMap<>();
        final Map<String, List<Column>> bare = new LinkedHashMap<>();

        void add(SqlSelectStep.TableRef ref, Schema schema) {
            for (Column column: schema.getColumns()) {
                this.qualified.put(ref.alias + "." + column.name, column);
                this.bare.computeIfAbsent(column.name, k -> new ArrayList<>()).add(column);
            }
        }

        Column resolve(String name) {
            Column column = this.qualified.get(name);
            if (column != null)
                return column;
            List<Column> candidates = this.bare.get(name);
            if (candidates == null)
                throw new CompilationError(ErrorCode.COLUMN_NOT_FOUND,
                        "Column " + name + " does not exist in the joined tables");
            if (candidates.size() > 1)
                throw new CompilationError(ErrorCode.SQL_AMBIGUOUS_COLUMN,
                        "Column " + name + " is ambiguous; qualify it with a table alias");
            return candidates.get(0);
        }

        /** Resolve the columns of an expression; returns a schema to type it against. */
        Schema check(Expression expression) {
            List<Column> columns = new ArrayList<>();
            for (String name: ColumnCollector.collect(expression))
                columns.add(this.resolve(name).withName(name));
            return new Schema(columns);
        }

        List<Column> starColumns() {
            List<Column> result = new ArrayList<>();
            for (List<Column> columns: this.bare.values())
                result.add(columns.get(0));
            return result;
        }
    }
}
