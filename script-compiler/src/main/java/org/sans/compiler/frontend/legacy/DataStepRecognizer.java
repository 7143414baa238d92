package org.sans.compiler.frontend.legacy;

import org.sans.compiler.CompilerOptions;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.frontend.Block;
import org.sans.compiler.frontend.Dialect;
import org.sans.compiler.frontend.ExpressionParser;
import org.sans.compiler.frontend.Statement;
import org.sans.compiler.ir.expression.ColumnCollector;
import org.sans.compiler.ir.expression.Expression;
import org.sans.compiler.ir.Plan;
import org.sans.compiler.ir.step.ComputeStep;
import org.sans.compiler.ir.step.DataStatement;
import org.sans.compiler.ir.step.DataStep;
import org.sans.compiler.ir.step.DatasetSpec;
import org.sans.compiler.ir.step.FilterStep;
import org.sans.compiler.ir.step.IRStep;
import org.sans.compiler.ir.step.IdentityStep;
import org.sans.compiler.ir.step.OpStep;
import org.sans.compiler.ir.step.RenameStep;
import org.sans.compiler.ir.step.SelectStep;
import org.sans.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Recognizes DATA steps.  Simple steps (one SET, assignments, one subsetting IF,
 * KEEP/DROP, RENAME) are lowered to a chain of relational steps; steps which need
 * row-at-a-time state (MERGE, BY, RETAIN, OUTPUT, IF/THEN/ELSE, first./last.)
 * are lowered to a single data_step. */
public class DataStepRecognizer extends BlockRecognizer {
    static final Pattern HEADER = Pattern.compile("^data\\s+(\\S+)$", Pattern.CASE_INSENSITIVE);
    static final Pattern ASSIGNMENT = Pattern.compile("^([a-zA-Z_]\\w*)\\s*=\\s*(.+)$", Pattern.DOTALL);
    static final Pattern IF_THEN = Pattern.compile("^if\\s+(.+?)\\s+then\\s+(.+)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    static final Pattern NUMBER = Pattern.compile("^[-+]?\\d.*");

    /** Keywords which may not start a statement of a simple DATA step. */
    static final String[] SIMPLE_FORBIDDEN = {
            "proc", "do", "end", "retain", "lag", "array", "call", "output", "by", "merge", "infile", "input"
    };
    /** Keywords which may not start a statement of any DATA step. */
    static final String[] STATEFUL_FORBIDDEN = {
            "proc", "do", "end", "lag", "array", "call", "infile", "input"
    };

    private String output = "";
    private int temporaries = 0;

    public DataStepRecognizer(Block block, CompilerOptions options) {
        super(block, options);
    }

    /** True if the statement starts with the token followed by whitespace, '(' or nothing. */
    static boolean startsWithToken(String lower, String token) {
        if (!lower.startsWith(token))
            return false;
        if (lower.length() == token.length())
            return true;
        char next = lower.charAt(token.length());
        return Character.isWhitespace(next) || next == '(' || next == ';';
    }

    @Nullable
    static String forbiddenToken(Statement statement, String[] forbidden, boolean simple) {
        String lower = statement.lower().strip();
        if (lower.startsWith("%"))
            return "%";
        for (String token: forbidden)
            if (startsWithToken(lower, token))
                return token;
        if (simple && (lower.startsWith("first.") || lower.startsWith("last.")))
            return lower.startsWith("first.") ? "first." : "last.";
        return null;
    }

    boolean isStateful() {
        for (Statement statement: this.block.body) {
            String lower = statement.lower();
            if (lower.startsWith("merge ") || lower.startsWith("by ") || lower.startsWith("retain ")
                    || lower.startsWith("output") || lower.startsWith("else ")
                    || (lower.startsWith("if ") && lower.contains(" then "))
                    || lower.contains("first.") || lower.contains("last."))
                return true;
        }
        return false;
    }

    @Override
    public List<IRStep> recognize() {
        Matcher header = HEADER.matcher(this.block.header.text.strip());
        if (!header.matches())
            throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM,
                    "Malformed DATA statement: " + this.block.header.text, this.block.header);
        this.output = this.tableName(header.group(1), this.block.header);
        List<IRStep> result = new ArrayList<>();
        if (this.isStateful())
            result.add(this.stateful());
        else
            result.addAll(this.simple());
        this.getDebugStream(1)
                .append("DATA ")
                .append(this.output)
                .append(" -> ")
                .append(result.size())
                .append(" step(s)")
                .newline();
        return result;
    }

    String temporary() {
        this.temporaries++;
        return Plan.temporaryTable(this.output, this.temporaries);
    }

    Expression expression(String text, Statement statement) {
        return ExpressionParser.parse(text, Dialect.LEGACY, statement.range);
    }

    Statement single(String keyword, String description) {
        List<Statement> found = this.statements(keyword);
        if (found.size() != 1)
            throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM,
                    "DATA step must contain exactly one " + description + " statement");
        return found.get(0);
    }

    @Nullable
    Statement atMostOne(String keyword) {
        List<Statement> found = this.statements(keyword);
        if (found.size() > 1)
            throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM,
                    "DATA step can have at most one " + keyword.toUpperCase() + " statement", found.get(1));
        return found.isEmpty() ? null : found.get(0);
    }

    List<IRStep> simple() {
        for (Statement statement: this.block.body) {
            String token = forbiddenToken(statement, SIMPLE_FORBIDDEN, true);
            if (token != null)
                throw this.error(ErrorCode.STATEFUL_TOKEN, "Forbidden token '" + token
                        + "' in DATA step: '" + statement.text
                        + "'; only SET with keep/drop/rename, assignments and a subsetting IF are supported here",
                        statement);
        }

        Statement set = this.single("set", "SET");
        DatasetSpec spec = new DatasetSpecParser(afterKeyword(set), set.range).parse(false);
        List<OpStep> steps = new ArrayList<>();
        String current = spec.table;

        if (spec.where != null) {
            String next = this.temporary();
            steps.add(new FilterStep(set.range, current, next, spec.where));
            current = next;
        }
        if (!spec.keep.isEmpty() || !spec.drop.isEmpty()) {
            String next = this.temporary();
            steps.add(new SelectStep(set.range, current, next, spec.keep, spec.drop));
            current = next;
        }
        if (!spec.rename.isEmpty()) {
            String next = this.temporary();
            steps.add(new RenameStep(set.range, current, next, spec.rename));
            current = next;
        }

        Statement keep = this.atMostOne("keep");
        Statement drop = this.atMostOne("drop");
        if (keep != null && drop != null)
            throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM,
                    "DATA step can have at most one KEEP or DROP statement", drop);
        Statement rename = this.atMostOne("rename");
        Statement filter = this.atMostOne("if");

        if (rename != null) {
            Map<String, String> map = DatasetSpecParser.parseRenamePairs(afterKeyword(rename), rename.range);
            if (map.isEmpty())
                throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM, "Empty RENAME statement", rename);
            String next = this.temporary();
            steps.add(new RenameStep(rename.range, current, next, map));
            current = next;
        }

        List<ComputeStep.Assignment> assignments = new ArrayList<>();
        SourcePositionRange assignRange = SourcePositionRange.INVALID;
        for (Statement statement: this.block.body) {
            String keyword = statement.keyword();
            if (keyword.equals("set") || keyword.equals("keep") || keyword.equals("drop")
                    || keyword.equals("rename") || keyword.equals("if"))
                continue;
            Matcher assign = ASSIGNMENT.matcher(statement.text);
            if (!assign.matches())
                throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM,
                        "Unsupported statement in DATA step: '" + statement.text
                                + "'; rewrite it using assignments and IF filters", statement);
            assignments.add(new ComputeStep.Assignment(assign.group(1),
                    this.expression(assign.group(2), statement)));
            assignRange = assignRange.merge(statement.range);
        }
        if (!assignments.isEmpty()) {
            String next = this.temporary();
            steps.add(new ComputeStep(assignRange, current, next, ComputeStep.Mode.ASSIGN, assignments));
            current = next;
        }

        if (filter != null) {
            String next = this.temporary();
            steps.add(new FilterStep(filter.range, current, next,
                    this.expression(afterKeyword(filter), filter)));
            current = next;
        }

        Statement select = keep != null ? keep : drop;
        if (select != null) {
            List<String> columns = words(select);
            if (columns.isEmpty())
                throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM, "Empty " + select.keyword().toUpperCase()
                        + " statement", select);
            String next = this.temporary();
            if (keep != null)
                steps.add(new SelectStep(select.range, current, next, columns, List.of()));
            else
                steps.add(new SelectStep(select.range, current, next, List.of(), columns));
        }

        List<IRStep> result = new ArrayList<>();
        if (steps.isEmpty()) {
            result.add(new IdentityStep(this.block.range, spec.table, this.output));
            return result;
        }
        OpStep last = Utilities.last(steps);
        steps.set(steps.size() - 1, last.withOutputs(List.of(this.output)));
        result.addAll(steps);
        return result;
    }

    /** State threaded through the parsing of the executable statements of a stateful step. */
    static final class StatementState {
        final List<DataStatement> statements = new ArrayList<>();
        boolean explicitOutput = false;
        boolean usesGroupFlags = false;
        /** Index of an if/then which may still receive an else. */
        int pendingIf = -1;
    }

    void noteFlags(Expression expression, StatementState state) {
        for (String column: ColumnCollector.collect(expression)) {
            String lower = column.toLowerCase();
            if (lower.startsWith(DataStep.FIRST_PREFIX) || lower.startsWith(DataStep.LAST_PREFIX))
                state.usesGroupFlags = true;
        }
    }

    /** An action of if/then/else: output, an assignment, or a nested if/then. */
    DataStatement action(String text, Statement statement, StatementState state, int depth) {
        String action = text.strip();
        String lower = action.toLowerCase();
        if (depth > this.options.languageOptions.maxControlDepth)
            throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM,
                    "IF/THEN nesting deeper than " + this.options.languageOptions.maxControlDepth, statement);
        if (lower.startsWith("output")) {
            if (!lower.equals("output"))
                throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM, "Unsupported OUTPUT form: '" + text + "'",
                        statement);
            state.explicitOutput = true;
            return DataStatement.Output.INSTANCE;
        }
        Matcher ifThen = IF_THEN.matcher(action);
        if (ifThen.matches()) {
            Expression predicate = this.expression(ifThen.group(1), statement);
            this.noteFlags(predicate, state);
            return new DataStatement.IfThen(predicate, this.action(ifThen.group(2), statement, state, depth + 1), null);
        }
        Matcher assign = ASSIGNMENT.matcher(action);
        if (assign.matches()) {
            Expression expression = this.expression(assign.group(2), statement);
            this.noteFlags(expression, state);
            return new DataStatement.Assign(assign.group(1), expression);
        }
        throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM, "Unsupported statement in DATA step: '" + text + "'",
                statement);
    }

    IRStep stateful() {
        for (Statement statement: this.block.body) {
            String token = forbiddenToken(statement, STATEFUL_FORBIDDEN, false);
            if (token != null)
                throw this.error(ErrorCode.STATEFUL_TOKEN, "Forbidden token '" + token
                        + "' in DATA step: '" + statement.text
                        + "'; macros, do/end blocks, arrays and lag are not supported", statement);
        }

        List<Statement> sets = this.statements("set");
        List<Statement> merges = this.statements("merge");
        if (sets.size() + merges.size() != 1)
            throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM,
                    "DATA step must contain exactly one SET or MERGE statement");
        Statement by = this.atMostOne("by");
        Statement retain = this.atMostOne("retain");
        Statement keep = this.atMostOne("keep");

        DataStep.Mode mode;
        List<DatasetSpec> specs = new ArrayList<>();
        if (!sets.isEmpty()) {
            mode = DataStep.Mode.SET;
            Statement set = sets.get(0);
            specs.add(new DatasetSpecParser(afterKeyword(set), set.range).parse(false));
        } else {
            mode = DataStep.Mode.MERGE;
            Statement merge = merges.get(0);
            List<String> parts = DatasetSpecParser.splitOutsideParens(afterKeyword(merge));
            if (parts.isEmpty())
                throw this.error(ErrorCode.MERGE_MALFORMED, "Malformed MERGE statement: " + merge.text, merge);
            Set<String> flags = new HashSet<>();
            for (String part: parts) {
                DatasetSpec spec = new DatasetSpecParser(part, merge.range).parse(true);
                if (spec.inFlag != null && !flags.add(spec.inFlag))
                    throw this.error(ErrorCode.MERGE_MALFORMED, "Duplicate IN= flag " + spec.inFlag + " in MERGE",
                            merge);
                specs.add(spec);
            }
        }

        List<String> byColumns = by == null ? List.of() : words(by);
        if (by != null) {
            if (byColumns.isEmpty())
                throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM, "Malformed BY statement", by);
            for (String column: byColumns)
                if (column.equalsIgnoreCase("descending"))
                    throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM,
                            "DESCENDING is not supported in a DATA step BY statement", by);
        }
        List<String> retained = retain == null ? List.of() : words(retain);
        if (retain != null) {
            if (retained.isEmpty())
                throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM, "Malformed RETAIN statement", retain);
            for (String column: retained)
                if (NUMBER.matcher(column).matches() || column.startsWith("'") || column.startsWith("\""))
                    throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM,
                            "RETAIN initial values are not supported: " + retain.text, retain);
        }
        List<String> kept = keep == null ? List.of() : words(keep);
        if (keep != null && kept.isEmpty())
            throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM, "Malformed KEEP statement", keep);

        StatementState state = new StatementState();
        for (Statement statement: this.block.body) {
            String keyword = statement.keyword();
            switch (keyword) {
                case "set":
                case "merge":
                case "by":
                case "retain":
                case "keep":
                    continue;
                default:
                    break;
            }
            if (!keyword.equals("else"))
                state.pendingIf = -1;

            if (keyword.equals("if")) {
                Matcher ifThen = IF_THEN.matcher(statement.text);
                if (ifThen.matches()) {
                    Expression predicate = this.expression(ifThen.group(1), statement);
                    this.noteFlags(predicate, state);
                    DataStatement then = this.action(ifThen.group(2), statement, state, 2);
                    state.statements.add(new DataStatement.IfThen(predicate, then, null));
                    state.pendingIf = state.statements.size() - 1;
                } else {
                    Expression predicate = this.expression(afterKeyword(statement), statement);
                    this.noteFlags(predicate, state);
                    state.statements.add(new DataStatement.Filter(predicate));
                }
                continue;
            }
            if (keyword.equals("else")) {
                if (state.pendingIf < 0)
                    throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM, "ELSE without matching IF: '"
                            + statement.text + "'", statement);
                DataStatement.IfThen pending = state.statements.get(state.pendingIf).to(DataStatement.IfThen.class);
                String rest = afterKeyword(statement);
                if (rest.toLowerCase().startsWith("if "))
                    throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM, "ELSE IF is not supported: '"
                            + statement.text + "'", statement);
                state.statements.set(state.pendingIf, pending.withElse(this.action(rest, statement, state, 2)));
                state.pendingIf = -1;
                continue;
            }
            if (keyword.startsWith("output")) {
                state.statements.add(this.action(statement.text, statement, state, 1));
                continue;
            }
            Matcher assign = ASSIGNMENT.matcher(statement.text);
            if (assign.matches()) {
                state.statements.add(this.action(statement.text, statement, state, 1));
                continue;
            }
            throw this.error(ErrorCode.UNSUPPORTED_DATASTEP_FORM, "Unsupported statement in DATA step: '"
                    + statement.text + "'; only assignment, if/then/else, output, retain, keep, by "
                    + "and set/merge are supported", statement);
        }

        if ((mode == DataStep.Mode.MERGE || state.usesGroupFlags) && byColumns.isEmpty())
            throw this.error(ErrorCode.DATASTEP_MISSING_BY,
                    "DATA step uses MERGE or first./last. and requires a BY statement");

        return new DataStep(this.block.range, this.output, mode, specs, byColumns, retained, kept,
                state.statements, state.explicitOutput);
    }
}
