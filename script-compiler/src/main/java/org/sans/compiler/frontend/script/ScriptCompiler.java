package org.sans.compiler.frontend.script;

import org.sans.compiler.CompilerOptions;
import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.frontend.Dialect;
import org.sans.compiler.frontend.ExpressionParser;
import org.sans.compiler.frontend.IFrontend;
import org.sans.compiler.ir.Datasource;
import org.sans.compiler.ir.Plan;
import org.sans.compiler.ir.expression.Expression;
import org.sans.compiler.ir.expression.LiteralExpression;
import org.sans.compiler.ir.expression.UnaryExpression;
import org.sans.compiler.ir.step.AggregateStep;
import org.sans.compiler.ir.step.CastStep;
import org.sans.compiler.ir.step.ComputeStep;
import org.sans.compiler.ir.step.FilterStep;
import org.sans.compiler.ir.step.FormatStep;
import org.sans.compiler.ir.step.IRStep;
import org.sans.compiler.ir.step.IdentityStep;
import org.sans.compiler.ir.step.OpStep;
import org.sans.compiler.ir.step.RefusedBlock;
import org.sans.compiler.ir.step.RenameStep;
import org.sans.compiler.ir.step.SelectStep;
import org.sans.compiler.ir.step.SortStep;
import org.sans.compiler.ir.type.Column;
import org.sans.compiler.ir.type.ScalarType;
import org.sans.compiler.ir.type.Schema;
import org.sans.util.IWritesLogs;
import org.sans.util.Utilities;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles the native pipeline syntax.  The script is line oriented:
 * every statement is one line, or a line ending in 'do' followed by
 * lines up to a line containing only 'end'.  Each statement compiles
 * independently; a statement which cannot be compiled becomes a refused block.
 */
public class ScriptCompiler implements IFrontend, IWritesLogs {
    /** Number of non-empty lines searched for the version header. */
    public static final int HEADER_WINDOW = 5;
    public static final Pattern HEADER = Pattern.compile("^#\\s*sans\\s+(\\d+(?:\\.\\d+)*)\\s*$",
            Pattern.CASE_INSENSITIVE);

    static final Pattern NAME = Pattern.compile("[A-Za-z_]\\w*");
    static final Pattern LET = Pattern.compile("^let\\s+([A-Za-z_]\\w*)\\s*=(?!=)\\s*(.+)$");
    static final Pattern CSV = Pattern.compile(
            "^datasource\\s+([A-Za-z_]\\w*)\\s*=\\s*csv\\(\\s*\"([^\"]*)\"\\s*(?:,\\s*columns\\((.*)\\))?\\s*\\)$");
    static final Pattern INLINE_CSV = Pattern.compile(
            "^datasource\\s+([A-Za-z_]\\w*)\\s*=\\s*inline_csv(?:\\s+columns\\((.*)\\))?\\s+do$");
    static final Pattern FORMAT = Pattern.compile("^format\\s+(\\$?[A-Za-z_]\\w*)\\s+do$");
    static final Pattern TABLE = Pattern.compile(
            "^table\\s+([A-Za-z_]\\w*)\\s*=\\s*from\\(\\s*([A-Za-z_]\\w*)\\s*\\)(\\s+do)?$");
    static final Pattern SORT = Pattern.compile(
            "^sort\\s+([A-Za-z_]\\w*)\\s*->\\s*([A-Za-z_]\\w*)\\s+by\\s+(.+?)(\\s+nodupkey)?$");
    static final Pattern AGGREGATE = Pattern.compile(
            "^aggregate\\s+([A-Za-z_]\\w*)\\s*->\\s*([A-Za-z_]\\w*)(?:\\s+by\\s+(.+?))?\\s+do$");
    static final Pattern OPERATION = Pattern.compile("^(filter|derive|update!|rename|select|drop|cast)\\s*\\((.*)\\)$",
            Pattern.DOTALL);
    static final Pattern ASSIGNMENT = Pattern.compile("^([A-Za-z_]\\w*)\\s*=(?!=)\\s*(.+)$", Pattern.DOTALL);
    static final Pattern METRIC = Pattern.compile("^([A-Za-z_]\\w*)\\s*:\\s*(.+)$");

    /** The kind of a name; fixed when the name is first bound. */
    enum Kind {
        SCALAR("scalar"),
        TABLE("table");

        final String text;

        Kind(String text) {
            this.text = text;
        }
    }

    private final CompilerOptions options;
    private final Map<String, Kind> kinds = new HashMap<>();
    private final Map<String, LiteralExpression> constants = new HashMap<>();
    private final Map<String, Datasource> datasources = new LinkedHashMap<>();

    public ScriptCompiler(CompilerOptions options) {
        this.options = options;
    }

    /** True if a version header appears among the first non-empty lines. */
    public static boolean hasHeader(String source) {
        return findHeader(split(source)) != null;
    }

    static List<ScriptLine> split(String source) {
        String[] lines = source.split("\\r?\\n", -1);
        List<ScriptLine> result = new ArrayList<>();
        for (int i = 0; i < lines.length; i++)
            result.add(new ScriptLine(lines[i], i + 1));
        return result;
    }

    @Nullable
    static ScriptLine findHeader(List<ScriptLine> lines) {
        int nonEmpty = 0;
        for (ScriptLine line: lines) {
            if (line.text.isEmpty())
                continue;
            if (HEADER.matcher(line.text).matches())
                return line;
            nonEmpty++;
            if (nonEmpty >= HEADER_WINDOW)
                break;
        }
        return null;
    }

    @Override
    public Plan compile(String source, Map<String, Schema> predeclared) {
        for (String table: predeclared.keySet())
            this.kinds.put(table, Kind.TABLE);
        List<ScriptLine> lines = split(source);
        ScriptLine header = findHeader(lines);
        if (header == null) {
            RefusedBlock refused = new RefusedBlock(ErrorCode.SCRIPT_HEADER,
                    "Missing '# sans <version>' header in the first " + HEADER_WINDOW + " non-empty lines",
                    SourcePositionRange.lines(1, 1));
            return new Plan(Map.of(), predeclared, List.of(refused));
        }

        for (ScriptLine line: lines.subList(0, header.number - 1)) {
            if (line.text.isEmpty() || line.isComment())
                continue;
            RefusedBlock refused = new RefusedBlock(ErrorCode.SCRIPT_HEADER,
                    "Statement '" + line.text + "' precedes the '# sans <version>' header on line " + header.number,
                    line.range());
            return new Plan(Map.of(), predeclared, List.of(refused));
        }

        List<IRStep> steps = new ArrayList<>();
        int index = header.number;
        while (index < lines.size()) {
            ScriptLine line = lines.get(index);
            index++;
            if (line.text.isEmpty() || line.isComment())
                continue;
            ScriptStatement statement;
            if (opensBlock(line)) {
                List<ScriptLine> body = new ArrayList<>();
                boolean closed = false;
                while (index < lines.size()) {
                    ScriptLine next = lines.get(index);
                    index++;
                    if (next.lower().equals("end")) {
                        closed = true;
                        break;
                    }
                    body.add(next);
                }
                int endLine = index > 0 ? lines.get(index - 1).number : line.number;
                statement = new ScriptStatement(line, body, true, endLine);
                if (!closed) {
                    steps.add(new RefusedBlock(ErrorCode.SCRIPT_SYNTAX,
                            "Block starting with '" + line.text + "' is not closed with 'end'", statement.range));
                    continue;
                }
            } else {
                statement = new ScriptStatement(line, List.of(), false, line.number);
            }

            try {
                steps.addAll(this.statement(statement));
            } catch (CompilationError error) {
                if (this.options.languageOptions.throwOnError)
                    throw error;
                steps.add(new RefusedBlock(error.code, error.getMessage(), statement.range));
            }
        }
        this.getDebugStream(1)
                .append("Compiled script into ")
                .append(steps.size())
                .append(" steps and ")
                .append(this.datasources.size())
                .append(" datasources")
                .newline();
        return new Plan(this.datasources, predeclared, steps);
    }

    static boolean opensBlock(ScriptLine line) {
        String lower = line.lower();
        return lower.endsWith(" do") || lower.equals("do");
    }

    static CompilationError syntax(String message, SourcePositionRange range) {
        return new CompilationError(ErrorCode.SCRIPT_SYNTAX, message, range);
    }

    /** Record the kind of a name; a name never changes kind. */
    void bind(String name, Kind kind, SourcePositionRange range) {
        Kind previous = this.kinds.get(name);
        if (previous != null && previous != kind)
            throw new CompilationError(ErrorCode.KIND_CONFLICT,
                    "'" + name + "' is a " + previous.text + " and cannot be rebound as a " + kind.text, range);
        this.kinds.put(name, kind);
    }

    /** The input name for a table reference: declared datasources are read through their pseudo-table. */
    String tableInput(String name, SourcePositionRange range) {
        if (this.kinds.get(name) == Kind.SCALAR)
            throw new CompilationError(ErrorCode.KIND_CONFLICT,
                    "'" + name + "' is a scalar and cannot be used as a table", range);
        if (this.datasources.containsKey(name))
            return Datasource.inputName(name);
        return name;
    }

    List<IRStep> statement(ScriptStatement statement) {
        ScriptLine head = statement.head;
        String keyword = head.text.split("\\s+", 2)[0];
        switch (keyword) {
            case "let":
                this.let(statement);
                return List.of();
            case "datasource":
                this.datasource(statement);
                return List.of();
            case "format":
                return List.of(this.format(statement));
            case "table":
                return this.table(statement);
            case "sort":
                return List.of(this.sort(statement));
            case "aggregate":
                return List.of(this.aggregate(statement));
            default:
                throw syntax("Unknown statement '" + head.text + "'", statement.range);
        }
    }

    Expression expression(String text, SourcePositionRange range) {
        return ExpressionParser.parse(text, Dialect.NATIVE, range, this.constants);
    }

    /** The literal an expression folds to, or null if it is not constant. */
    @Nullable
    static LiteralExpression fold(Expression expression) {
        LiteralExpression literal = expression.as(LiteralExpression.class);
        if (literal != null)
            return literal;
        UnaryExpression unary = expression.as(UnaryExpression.class);
        if (unary == null || unary.opcode == UnaryExpression.Opcode.NOT)
            return null;
        LiteralExpression source = fold(unary.source);
        if (source == null || source.value == null)
            return null;
        if (unary.opcode == UnaryExpression.Opcode.PLUS)
            return source;
        switch (source.type) {
            case INT:
                return LiteralExpression.of(-((Long) source.value));
            case DECIMAL:
                return LiteralExpression.of(((BigDecimal) source.value).negate());
            default:
                return null;
        }
    }

    /** Canonical text of a constant, the form used for format keys and labels. */
    static String canonicalText(LiteralExpression literal) {
        if (literal.value == null)
            return "";
        if (literal.type == ScalarType.DECIMAL)
            return LiteralExpression.canonicalDecimal((BigDecimal) literal.value);
        return literal.value.toString();
    }

    void let(ScriptStatement statement) {
        Matcher matcher = LET.matcher(statement.head.text);
        if (!matcher.matches() || statement.isBlock)
            throw syntax("Malformed let: '" + statement.head.text + "'", statement.range);
        String name = matcher.group(1);
        LiteralExpression value = fold(this.expression(matcher.group(2), statement.range));
        if (value == null)
            throw syntax("let requires a constant value: '" + statement.head.text + "'", statement.range);
        this.bind(name, Kind.SCALAR, statement.range);
        this.constants.put(name, value);
    }

    /** Split on a separator that is not inside parentheses or double quotes. */
    static List<String> splitTopLevel(String text, char separator) {
        List<String> result = new ArrayList<>();
        int depth = 0;
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted) {
                if (c == '(')
                    depth++;
                else if (c == ')')
                    depth--;
                else if (c == separator && depth == 0) {
                    result.add(text.substring(start, i).strip());
                    start = i + 1;
                }
            }
        }
        String last = text.substring(start).strip();
        if (!last.isEmpty() || !result.isEmpty())
            result.add(last);
        return result;
    }

    Schema columns(String text, SourcePositionRange range) {
        List<Column> columns = new ArrayList<>();
        for (String item: splitTopLevel(text, ',')) {
            String[] parts = item.split(":");
            if (parts.length != 2 || !NAME.matcher(parts[0].strip()).matches())
                throw new CompilationError(ErrorCode.DATASOURCE_MALFORMED,
                        "Malformed column declaration '" + item + "'", range);
            ScalarType type = ScalarType.fromText(parts[1].strip());
            if (type == null || !type.isConcrete() || type == ScalarType.NULL)
                throw new CompilationError(ErrorCode.DATASOURCE_MALFORMED,
                        "Unknown column type '" + parts[1].strip() + "'", range);
            columns.add(new Column(parts[0].strip(), type));
        }
        if (columns.isEmpty())
            throw new CompilationError(ErrorCode.DATASOURCE_MALFORMED, "Empty column list", range);
        return new Schema(columns);
    }

    void datasource(ScriptStatement statement) {
        String text = statement.head.text;
        Matcher csv = CSV.matcher(text);
        Matcher inline = INLINE_CSV.matcher(text);
        Datasource datasource;
        if (csv.matches() && !statement.isBlock) {
            Schema columns = csv.group(3) == null ? null : this.columns(csv.group(3), statement.range);
            datasource = Datasource.csv(csv.group(1), csv.group(2), columns);
        } else if (inline.matches() && statement.isBlock) {
            StringBuilder builder = new StringBuilder();
            for (ScriptLine line: statement.body) {
                if (line.text.isEmpty())
                    continue;
                builder.append(line.text).append("\n");
            }
            String csvText = builder.toString();
            Schema columns = inline.group(2) == null
                    ? InlineSchemaInference.infer(csvText, statement.range)
                    : this.columns(inline.group(2), statement.range);
            datasource = Datasource.inline(inline.group(1), csvText, columns);
        } else {
            throw new CompilationError(ErrorCode.DATASOURCE_MALFORMED,
                    "Malformed datasource declaration '" + text + "'", statement.range);
        }
        if (this.datasources.containsKey(datasource.name))
            throw new CompilationError(ErrorCode.DATASOURCE_MALFORMED,
                    "Datasource " + datasource.name + " is declared twice", statement.range);
        this.bind(datasource.name, Kind.TABLE, statement.range);
        this.datasources.put(datasource.name, datasource);
    }

    IRStep format(ScriptStatement statement) {
        Matcher matcher = FORMAT.matcher(statement.head.text);
        if (!matcher.matches())
            throw syntax("Malformed format declaration '" + statement.head.text + "'", statement.range);
        String name = matcher.group(1).toLowerCase();
        Map<String, String> map = new LinkedHashMap<>();
        String other = null;
        for (ScriptLine line: statement.body) {
            if (line.text.isEmpty() || line.isComment())
                continue;
            int arrow = line.text.indexOf("->");
            if (arrow < 0)
                throw syntax("Format entries have the form key -> label: '" + line.text + "'", line.range());
            String key = line.text.substring(0, arrow).strip();
            String label = this.constantText(line.text.substring(arrow + 2).strip(), line);
            if (key.equals("other")) {
                if (other != null)
                    throw syntax("Duplicate 'other' in format " + name, line.range());
                other = label;
                continue;
            }
            String keyText = this.constantText(key, line);
            if (map.containsKey(keyText))
                throw syntax("Duplicate key '" + keyText + "' in format " + name, line.range());
            map.put(keyText, label);
        }
        if (map.isEmpty() && other == null)
            throw syntax("Empty format " + name, statement.range);
        return new FormatStep(statement.range, name, map, other);
    }

    String constantText(String text, ScriptLine line) {
        LiteralExpression literal = fold(ExpressionParser.parse(text, Dialect.NATIVE, line.range()));
        if (literal == null || literal.value == null)
            throw syntax("Expected a constant but found '" + text + "'", line.range());
        return canonicalText(literal);
    }

    List<IRStep> table(ScriptStatement statement) {
        Matcher matcher = TABLE.matcher(statement.head.text);
        if (!matcher.matches())
            throw syntax("Malformed table statement '" + statement.head.text + "'", statement.range);
        String output = matcher.group(1);
        String source = this.tableInput(matcher.group(2), statement.range);
        this.bind(output, Kind.TABLE, statement.range);

        List<OpStep> steps = new ArrayList<>();
        String current = source;
        int counter = 0;
        for (ScriptLine line: statement.body) {
            if (line.text.isEmpty() || line.isComment())
                continue;
            counter++;
            String next = Plan.temporaryTable(output, counter);
            steps.add(this.operation(line, current, next));
            current = next;
        }
        List<IRStep> result = new ArrayList<>();
        if (steps.isEmpty()) {
            result.add(new IdentityStep(statement.range, source, output));
            return result;
        }
        OpStep last = Utilities.last(steps);
        steps.set(steps.size() - 1, last.withOutputs(List.of(output)));
        result.addAll(steps);
        return result;
    }

    static List<String> names(String text, SourcePositionRange range) {
        List<String> result = new ArrayList<>();
        for (String name: splitTopLevel(text, ',')) {
            if (!NAME.matcher(name).matches())
                throw syntax("Expected a column name but found '" + name + "'", range);
            result.add(name);
        }
        if (result.isEmpty())
            throw syntax("Expected at least one column", range);
        return result;
    }

    OpStep operation(ScriptLine line, String input, String output) {
        SourcePositionRange range = line.range();
        Matcher matcher = OPERATION.matcher(line.text);
        if (!matcher.matches())
            throw syntax("Unknown pipeline operation '" + line.text + "'", range);
        String arguments = matcher.group(2).strip();
        switch (matcher.group(1)) {
            case "filter":
                return new FilterStep(range, input, output, this.expression(arguments, range));
            case "derive":
            case "update!": {
                List<ComputeStep.Assignment> assignments = new ArrayList<>();
                for (String item: splitTopLevel(arguments, ',')) {
                    Matcher assign = ASSIGNMENT.matcher(item);
                    if (!assign.matches())
                        throw syntax("Expected 'column = expression' but found '" + item + "'", range);
                    assignments.add(new ComputeStep.Assignment(assign.group(1),
                            this.expression(assign.group(2), range)));
                }
                if (assignments.isEmpty())
                    throw syntax("Empty " + matcher.group(1), range);
                ComputeStep.Mode mode = matcher.group(1).equals("derive")
                        ? ComputeStep.Mode.DERIVE : ComputeStep.Mode.UPDATE;
                return new ComputeStep(range, input, output, mode, assignments);
            }
            case "rename": {
                Map<String, String> map = new LinkedHashMap<>();
                for (String item: splitTopLevel(arguments, ',')) {
                    String[] parts = item.split("->");
                    if (parts.length != 2 || !NAME.matcher(parts[0].strip()).matches()
                            || !NAME.matcher(parts[1].strip()).matches())
                        throw syntax("Expected 'old -> new' but found '" + item + "'", range);
                    if (map.put(parts[0].strip(), parts[1].strip()) != null)
                        throw syntax("Column " + parts[0].strip() + " renamed twice", range);
                }
                if (map.isEmpty())
                    throw syntax("Empty rename", range);
                return new RenameStep(range, input, output, map);
            }
            case "select":
                return new SelectStep(range, input, output, names(arguments, range), List.of());
            case "drop":
                return new SelectStep(range, input, output, List.of(), names(arguments, range));
            case "cast": {
                List<CastStep.CastSpec> casts = new ArrayList<>();
                for (String item: splitTopLevel(arguments, ','))
                    casts.add(castSpec(item, range));
                if (casts.isEmpty())
                    throw syntax("Empty cast", range);
                return new CastStep(range, input, output, casts);
            }
            default:
                throw syntax("Unknown pipeline operation '" + line.text + "'", range);
        }
    }

    static CastStep.CastSpec castSpec(String text, SourcePositionRange range) {
        String[] parts = text.split("->");
        if (parts.length != 2 || !NAME.matcher(parts[0].strip()).matches())
            throw syntax("Expected 'column -> type [on_error=fail|null] [trim]' but found '" + text + "'", range);
        String[] words = parts[1].strip().replaceAll("\\s*=\\s*", "=").split("\\s+");
        CastStep.Target target = CastStep.Target.fromText(words[0]);
        if (target == null)
            throw syntax("Unknown cast target '" + words[0] + "'", range);
        CastStep.OnError onError = CastStep.OnError.FAIL;
        boolean trim = false;
        for (int i = 1; i < words.length; i++) {
            String word = words[i];
            if (word.equals("trim")) {
                trim = true;
            } else if (word.equals("on_error=null")) {
                onError = CastStep.OnError.NULL;
            } else if (word.equals("on_error=fail")) {
                onError = CastStep.OnError.FAIL;
            } else {
                throw syntax("Unknown cast option '" + word + "'", range);
            }
        }
        return new CastStep.CastSpec(parts[0].strip(), target, onError, trim);
    }

    static List<String> keyList(String text, SourcePositionRange range) {
        List<String> result = new ArrayList<>();
        for (String key: text.strip().split("[,\\s]+")) {
            if (key.isEmpty())
                continue;
            if (!NAME.matcher(key).matches())
                throw syntax("Expected a column name but found '" + key + "'", range);
            result.add(key);
        }
        if (result.isEmpty())
            throw syntax("Expected at least one key column", range);
        return result;
    }

    IRStep sort(ScriptStatement statement) {
        Matcher matcher = SORT.matcher(statement.head.text);
        if (!matcher.matches() || statement.isBlock)
            throw syntax("Malformed sort statement '" + statement.head.text + "'", statement.range);
        String input = this.tableInput(matcher.group(1), statement.range);
        String output = matcher.group(2);
        this.bind(output, Kind.TABLE, statement.range);
        List<SortStep.SortKey> keys = new ArrayList<>();
        for (String key: keyList(matcher.group(3), statement.range))
            keys.add(new SortStep.SortKey(key, false));
        return new SortStep(statement.range, input, output, keys, matcher.group(4) != null);
    }

    IRStep aggregate(ScriptStatement statement) {
        Matcher matcher = AGGREGATE.matcher(statement.head.text);
        if (!matcher.matches())
            throw syntax("Malformed aggregate statement '" + statement.head.text + "'", statement.range);
        String input = this.tableInput(matcher.group(1), statement.range);
        String output = matcher.group(2);
        this.bind(output, Kind.TABLE, statement.range);
        List<String> groupBy = matcher.group(3) == null ? List.of() : keyList(matcher.group(3), statement.range);

        List<AggregateStep.Metric> metrics = new ArrayList<>();
        for (ScriptLine line: statement.body) {
            if (line.text.isEmpty() || line.isComment())
                continue;
            Matcher metric = METRIC.matcher(line.text);
            if (!metric.matches())
                throw syntax("Expected 'column: stat, ...' but found '" + line.text + "'", line.range());
            List<AggregateStep.Statistic> statistics = new ArrayList<>();
            for (String name: splitTopLevel(metric.group(2), ',')) {
                AggregateStep.Statistic statistic = AggregateStep.Statistic.fromText(name);
                if (statistic == null)
                    throw syntax("Unknown statistic '" + name + "'", line.range());
                statistics.add(statistic);
            }
            metrics.addAll(AggregateStep.columnMajor(List.of(metric.group(1)), statistics));
        }
        if (metrics.isEmpty())
            throw syntax("Aggregate without statistics", statement.range);
        return new AggregateStep(statement.range, input, output, groupBy, metrics);
    }
}
