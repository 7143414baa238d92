package org.sans.compiler.frontend.legacy;

import org.sans.compiler.CompilerOptions;
import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.frontend.Block;
import org.sans.compiler.frontend.Dialect;
import org.sans.compiler.frontend.ExpressionParser;
import org.sans.compiler.frontend.Statement;
import org.sans.compiler.ir.expression.Expression;
import org.sans.compiler.ir.step.IRStep;
import org.sans.compiler.ir.step.SqlSelectStep;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** proc sql; create table t as select ... from a [as] x [inner|left [outer]] join b [as] y on ...
 * [where ...] [group by ...]; quit;
 * Clauses are located on a copy of the text in which quoted literals are blanked,
 * so keywords inside strings are never matched. */
public class ProcSqlRecognizer extends BlockRecognizer {
    static final Pattern CREATE = Pattern.compile(
            "^create\\s+table\\s+(\\S+)\\s+as\\s+select\\s+(.*)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    static final Pattern UNSUPPORTED_CLAUSE = Pattern.compile(
            "\\b(order\\s+by|having|union|except|intersect|distinct|full\\s+join|right\\s+join|cross\\s+join|" +
                    "outer\\s+union|limit)\\b");
    static final Pattern JOIN = Pattern.compile("\\b(?:(inner|left(?:\\s+outer)?)\\s+)?join\\b");
    static final Pattern ON = Pattern.compile("\\bon\\b");
    static final Pattern FROM = Pattern.compile("\\bfrom\\b");
    static final Pattern WHERE = Pattern.compile("\\bwhere\\b");
    static final Pattern GROUP_BY = Pattern.compile("\\bgroup\\s+by\\b");
    static final Pattern AS_ALIAS = Pattern.compile("^(.*?)\\s+as\\s+([a-zA-Z_]\\w*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    static final Pattern AGGREGATE = Pattern.compile("^([a-zA-Z_]\\w*)\\s*\\(\\s*(\\*|[a-zA-Z_][\\w.]*)\\s*\\)$");
    static final Pattern COLUMN = Pattern.compile("^[a-zA-Z_]\\w*(\\.[a-zA-Z_]\\w*)?$");

    public ProcSqlRecognizer(Block block, CompilerOptions options) {
        super(block, options);
    }

    /** Lowercase copy of the text with the contents of quoted literals replaced by '_'. */
    static String mask(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                    builder.append(c);
                } else {
                    builder.append('_');
                }
            } else {
                if (c == '\'' || c == '"')
                    quote = c;
                builder.append(Character.toLowerCase(c));
            }
        }
        return builder.toString();
    }

    /** Split on commas which are not inside parentheses or quotes. */
    static List<String> splitCommas(String text) {
        List<String> result = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote)
                    quote = 0;
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                result.add(text.substring(start, i).strip());
                start = i + 1;
            }
        }
        result.add(text.substring(start).strip());
        return result;
    }

    @Override
    public List<IRStep> recognize() {
        if (!this.block.header.lower().strip().equals("proc sql"))
            throw this.error(ErrorCode.SQL_UNSUPPORTED,
                    "PROC SQL options are not supported: '" + this.block.header.text + "'", this.block.header);
        List<IRStep> result = new ArrayList<>();
        for (Statement statement: this.block.body)
            result.add(this.createTable(statement));
        if (result.isEmpty())
            throw this.error(ErrorCode.SQL_UNSUPPORTED, "PROC SQL without CREATE TABLE statement");
        return result;
    }

    CompilationError unsupported(String message, Statement statement) {
        return this.error(ErrorCode.SQL_UNSUPPORTED, message, statement);
    }

    @Nullable
    static Matcher find(Pattern pattern, String masked, int from) {
        Matcher matcher = pattern.matcher(masked);
        if (matcher.find(from))
            return matcher;
        return null;
    }

    IRStep createTable(Statement statement) {
        Matcher create = CREATE.matcher(statement.text.strip());
        if (!create.matches())
            throw this.unsupported("Only 'create table <name> as select ...' is supported in PROC SQL: '"
                    + statement.text + "'", statement);
        String output = this.tableName(create.group(1), statement);
        String query = create.group(2);
        String masked = mask(query);

        Matcher unsupported = find(UNSUPPORTED_CLAUSE, masked, 0);
        if (unsupported != null)
            throw this.unsupported("Unsupported SQL clause '" + unsupported.group(1) + "'", statement);
        Matcher from = find(FROM, masked, 0);
        if (from == null)
            throw this.unsupported("SELECT without FROM", statement);
        Matcher where = find(WHERE, masked, from.end());
        Matcher groupBy = find(GROUP_BY, masked, from.end());
        if (where != null && groupBy != null && groupBy.start() < where.start())
            throw this.unsupported("WHERE must precede GROUP BY", statement);

        int fromEnd = where != null ? where.start() : groupBy != null ? groupBy.start() : query.length();
        String selectText = query.substring(0, from.start()).strip();
        String fromText = query.substring(from.end(), fromEnd).strip();
        String whereText = null;
        if (where != null)
            whereText = query.substring(where.end(), groupBy != null ? groupBy.start() : query.length()).strip();
        String groupText = groupBy != null ? query.substring(groupBy.end()).strip() : null;

        // FROM and joins
        String fromMasked = mask(fromText);
        List<int[]> joinPositions = new ArrayList<>();
        List<SqlSelectStep.JoinType> joinTypes = new ArrayList<>();
        Matcher joinMatcher = JOIN.matcher(fromMasked);
        while (joinMatcher.find()) {
            joinPositions.add(new int[] { joinMatcher.start(), joinMatcher.end() });
            String type = joinMatcher.group(1);
            joinTypes.add(type != null && type.startsWith("left")
                    ? SqlSelectStep.JoinType.LEFT : SqlSelectStep.JoinType.INNER);
        }
        String baseText = joinPositions.isEmpty() ? fromText : fromText.substring(0, joinPositions.get(0)[0]);
        if (baseText.contains(","))
            throw this.unsupported("Comma joins are not supported; use JOIN ... ON", statement);
        SqlSelectStep.TableRef base = this.tableRef(baseText, statement);
        Set<String> aliases = new HashSet<>();
        aliases.add(base.alias);

        List<SqlSelectStep.Join> joinList = new ArrayList<>();
        for (int i = 0; i < joinPositions.size(); i++) {
            int start = joinPositions.get(i)[1];
            int end = i + 1 < joinPositions.size() ? joinPositions.get(i + 1)[0] : fromText.length();
            String joinText = fromText.substring(start, end).strip();
            Matcher on = find(ON, mask(joinText), 0);
            if (on == null)
                throw this.unsupported("JOIN without ON: '" + joinText + "'", statement);
            SqlSelectStep.TableRef ref = this.tableRef(joinText.substring(0, on.start()), statement);
            if (!aliases.add(ref.alias))
                throw this.unsupported("Duplicate table alias " + ref.alias, statement);
            Expression condition = ExpressionParser.parse(
                    joinText.substring(on.end()), Dialect.LEGACY, statement.range);
            joinList.add(new SqlSelectStep.Join(joinTypes.get(i), ref, condition));
        }

        Expression whereExpression = null;
        if (whereText != null) {
            if (whereText.isEmpty())
                throw this.unsupported("Empty WHERE clause", statement);
            whereExpression = ExpressionParser.parse(whereText, Dialect.LEGACY, statement.range);
        }

        List<String> groupColumns = new ArrayList<>();
        if (groupText != null) {
            for (String column: splitCommas(groupText)) {
                if (!COLUMN.matcher(column).matches())
                    throw this.unsupported("GROUP BY supports only column names, not '" + column + "'", statement);
                groupColumns.add(column);
            }
        }

        List<SqlSelectStep.SelectItem> items = new ArrayList<>();
        for (String itemText: splitCommas(selectText))
            items.add(this.selectItem(itemText, statement));

        SqlSelectStep result = new SqlSelectStep(statement.range, output, base, joinList, items,
                whereExpression, groupColumns);
        if (result.isGrouped()) {
            for (SqlSelectStep.SelectItem item: items) {
                if (item.isStar())
                    throw this.unsupported("SELECT * cannot be combined with grouping", statement);
                if (!item.isAggregate() && !groupColumns.contains(item.column))
                    throw this.unsupported("Column " + item.column
                            + " must appear in GROUP BY or inside an aggregate", statement);
            }
        }
        this.getDebugStream(1)
                .append("PROC SQL ")
                .append(output)
                .append(" from ")
                .append(result.inputs.toString())
                .newline();
        return result;
    }

    SqlSelectStep.TableRef tableRef(String text, Statement statement) {
        String[] words = text.strip().split("\\s+");
        String table;
        String alias;
        if (words.length == 1) {
            table = words[0];
            alias = null;
        } else if (words.length == 2) {
            table = words[0];
            alias = words[1];
        } else if (words.length == 3 && words[1].equalsIgnoreCase("as")) {
            table = words[0];
            alias = words[2];
        } else {
            throw this.unsupported("Malformed table reference '" + text.strip() + "'", statement);
        }
        if (table.isEmpty() || table.startsWith("("))
            throw this.unsupported("Subqueries are not supported", statement);
        table = this.tableName(table, statement);
        if (alias == null)
            alias = table;
        else if (!COLUMN.matcher(alias).matches() || alias.contains("."))
            throw this.unsupported("Malformed table alias '" + alias + "'", statement);
        return new SqlSelectStep.TableRef(table, alias);
    }

    static String bare(String column) {
        int dot = column.lastIndexOf('.');
        return dot < 0 ? column : column.substring(dot + 1);
    }

    SqlSelectStep.SelectItem selectItem(String text, Statement statement) {
        if (text.isEmpty())
            throw this.unsupported("Empty select item", statement);
        if (text.equals("*"))
            return SqlSelectStep.SelectItem.star();
        String alias = null;
        Matcher as = AS_ALIAS.matcher(text);
        if (as.matches()) {
            text = as.group(1).strip();
            alias = as.group(2);
        }
        Matcher aggregate = AGGREGATE.matcher(text);
        if (aggregate.matches()) {
            SqlSelectStep.Aggregate function = SqlSelectStep.Aggregate.fromText(aggregate.group(1));
            if (function == null)
                throw this.unsupported("Unsupported SQL function '" + aggregate.group(1) + "'", statement);
            String argument = aggregate.group(2);
            if (argument.equals("*") && function != SqlSelectStep.Aggregate.COUNT)
                throw this.unsupported(function.text + "(*) is not supported", statement);
            if (alias == null)
                alias = argument.equals("*") ? function.text : function.text + "_" + bare(argument);
            return SqlSelectStep.SelectItem.aggregate(function, argument, alias);
        }
        if (text.endsWith(".*"))
            throw this.unsupported("Qualified star is not supported", statement);
        if (!COLUMN.matcher(text).matches())
            throw this.unsupported("Select items must be columns or aggregates, not '" + text + "'", statement);
        return SqlSelectStep.SelectItem.column(text, alias != null ? alias : bare(text));
    }
}
