package org.sans.compiler.frontend;

import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.util.IWritesLogs;
import org.sans.util.Utilities;

import javax.annotation.Nullable;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Textual macro expansion for the legacy dialect.
 * Supports %let, &amp;name substitution, rooted %include and single-line
 * %if/%then/%else.  Every other macro control statement is refused.
 * Output has one line per input line, so line numbers survive expansion
 * except after an %include. */
public class MacroPreprocessor implements IWritesLogs {
    static final Pattern LET = Pattern.compile("^%let\\s+([a-zA-Z_]\\w*)\\s*=\\s*(.*?);", Pattern.CASE_INSENSITIVE);
    static final Pattern REFERENCE = Pattern.compile("&([a-zA-Z_]\\w*)\\.?");
    static final Pattern IF = Pattern.compile("^%if\\b(.*)$", Pattern.CASE_INSENSITIVE);
    static final Pattern THEN = Pattern.compile("%then\\b", Pattern.CASE_INSENSITIVE);
    static final Pattern ELSE = Pattern.compile("%else\\b", Pattern.CASE_INSENSITIVE);
    static final Pattern DO = Pattern.compile("^%do\\b", Pattern.CASE_INSENSITIVE);
    static final Pattern END = Pattern.compile("^%end\\b", Pattern.CASE_INSENSITIVE);
    static final String[] CONDITION_OPERATORS = { "<=", ">=", "!=", "==", "=", "<", ">" };

    private final Map<String, String> variables;
    private final List<Path> includeRoots;
    private final List<Path> includeStack;

    public MacroPreprocessor(List<String> includeRoots) {
        this.variables = new HashMap<>();
        this.includeRoots = new ArrayList<>();
        for (String root: includeRoots)
            this.includeRoots.add(Path.of(root).toAbsolutePath().normalize());
        this.includeStack = new ArrayList<>();
    }

    public void define(String name, String value) {
        this.variables.put(name.toLowerCase(), value);
    }

    static CompilationError error(String message, int line) {
        SourcePositionRange range = line > 0 ? SourcePositionRange.lines(line, line) : SourcePositionRange.INVALID;
        return new CompilationError(ErrorCode.MACRO_ERROR, message, range);
    }

    /** Replace references to defined variables; undefined references are left alone. */
    public String substitute(String text) {
        Matcher matcher = REFERENCE.matcher(text);
        StringBuilder builder = new StringBuilder();
        while (matcher.find()) {
            String value = this.variables.get(matcher.group(1).toLowerCase());
            matcher.appendReplacement(builder, Matcher.quoteReplacement(value != null ? value : matcher.group(0)));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    public String process(String text) {
        return this.process(text, null);
    }

    public String process(String text, @Nullable Path currentFile) {
        if (currentFile != null)
            this.includeStack.add(currentFile.toAbsolutePath().normalize());
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\\r?\\n", -1)));
        List<String> output = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            String raw = lines.get(i);
            String line = raw.strip();
            int lineNo = i + 1;
            String lower = line.toLowerCase();

            Matcher let = LET.matcher(line);
            if (let.find()) {
                this.define(let.group(1), this.substitute(let.group(2).strip()));
                output.add("");
                i++;
                continue;
            }
            if (lower.startsWith("%include")) {
                output.add(this.include(line, currentFile, lineNo));
                i++;
                continue;
            }
            Matcher ifMatcher = IF.matcher(line);
            if (ifMatcher.find()) {
                String chosen = this.conditional(ifMatcher.group(1).strip(), lineNo);
                if (chosen != null) {
                    // The chosen branch is processed as if it were the line itself
                    lines.set(i, chosen);
                    continue;
                }
                output.add("");
                i++;
                continue;
            }
            if (lower.startsWith("%else"))
                throw error("Unexpected %else without matching %if", lineNo);
            if (lower.startsWith("%then"))
                throw error("Unexpected %then without matching %if", lineNo);
            if (DO.matcher(line).find())
                throw error("Unsupported macro control flow: %do", lineNo);
            if (END.matcher(line).find())
                throw error("Unsupported macro control flow: %end", lineNo);

            output.add(this.substitute(raw));
            i++;
        }
        if (currentFile != null)
            this.includeStack.remove(this.includeStack.size() - 1);
        return String.join("\n", output);
    }

    /** @return the statement selected by the condition, or null if none. */
    @Nullable
    String conditional(String remainder, int lineNo) {
        Matcher then = THEN.matcher(remainder);
        if (!then.find())
            throw error("Malformed %if: missing %then", lineNo);
        String condition = remainder.substring(0, then.start()).strip();
        String afterThen = remainder.substring(then.end()).strip();
        String thenPart = afterThen;
        String elsePart = null;
        Matcher otherwise = ELSE.matcher(afterThen);
        if (otherwise.find()) {
            thenPart = afterThen.substring(0, otherwise.start()).strip();
            elsePart = afterThen.substring(otherwise.end()).strip();
        }
        if (thenPart.isEmpty())
            throw error("Malformed %if: missing THEN statement", lineNo);
        if (DO.matcher(thenPart).find())
            throw error("Unsupported macro control flow: %do", lineNo);
        if (elsePart != null) {
            if (elsePart.isEmpty())
                throw error("Malformed %if: missing ELSE statement", lineNo);
            if (DO.matcher(elsePart).find())
                throw error("Unsupported macro control flow: %do", lineNo);
        }
        return this.evaluate(condition, lineNo) ? thenPart : elsePart;
    }

    @Nullable
    static BigDecimal asNumber(String value) {
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    static String unquote(String value) {
        value = value.strip();
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if (first == last && (first == '\'' || first == '"'))
                return value.substring(1, value.length() - 1);
        }
        return value;
    }

    boolean evaluate(String condition, int lineNo) {
        String text = this.substitute(condition);
        for (String op: CONDITION_OPERATORS) {
            int index = text.indexOf(op);
            if (index < 0)
                continue;
            String left = unquote(text.substring(0, index));
            String right = unquote(text.substring(index + op.length()));
            BigDecimal leftNumber = asNumber(left);
            BigDecimal rightNumber = asNumber(right);
            int compare;
            if (leftNumber != null && rightNumber != null) {
                compare = leftNumber.compareTo(rightNumber);
            } else if (op.equals("=") || op.equals("==") || op.equals("!=")) {
                compare = left.equals(right) ? 0 : 1;
            } else {
                throw error("Cannot compare " + Utilities.singleQuote(left) + " and "
                        + Utilities.singleQuote(right) + " with " + op, lineNo);
            }
            switch (op) {
                case "<=": return compare <= 0;
                case ">=": return compare >= 0;
                case "!=": return compare != 0;
                case "<": return compare < 0;
                case ">": return compare > 0;
                default: return compare == 0;
            }
        }
        String value = text.strip().toLowerCase();
        return !(value.isEmpty() || value.equals("0") || value.equals("false"));
    }

    String include(String line, @Nullable Path currentFile, int lineNo) {
        char quote = line.indexOf('\'') >= 0 ? '\'' : '"';
        int open = line.indexOf(quote);
        int close = open < 0 ? -1 : line.indexOf(quote, open + 1);
        if (close < 0)
            throw error("Malformed %include statement: " + line, lineNo);
        String name = line.substring(open + 1, close);
        Path resolved = this.resolve(name, currentFile, lineNo);
        if (this.includeStack.contains(resolved))
            throw error("Recursive %include detected: " + name, lineNo);
        this.getDebugStream(1).append("Including ").append(resolved.toString()).newline();
        try {
            return this.process(Utilities.readFile(resolved), resolved);
        } catch (IOException ex) {
            throw error("Cannot read included file " + name + ": " + ex.getMessage(), lineNo);
        }
    }

    Path resolve(String name, @Nullable Path currentFile, int lineNo) {
        Path raw = Path.of(name);
        if (raw.isAbsolute())
            throw error("Absolute %include paths are not allowed: " + name, lineNo);
        List<Path> candidates = new ArrayList<>();
        if (currentFile != null) {
            Path parent = currentFile.toAbsolutePath().getParent();
            if (parent != null)
                candidates.add(parent.resolve(raw));
        }
        for (Path root: this.includeRoots)
            candidates.add(root.resolve(raw));
        if (candidates.isEmpty())
            throw error("Relative %include path requires an include root: " + name, lineNo);
        for (Path candidate: candidates) {
            Path normalized = candidate.toAbsolutePath().normalize();
            boolean rooted = false;
            for (Path root: this.includeRoots)
                if (normalized.startsWith(root))
                    rooted = true;
            if (rooted && Files.isRegularFile(normalized))
                return normalized;
        }
        throw error("Included file not found or outside include roots: " + name, lineNo);
    }
}
