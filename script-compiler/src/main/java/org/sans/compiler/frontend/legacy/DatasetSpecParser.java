package org.sans.compiler.frontend.legacy;

import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.frontend.Dialect;
import org.sans.compiler.frontend.ExpressionParser;
import org.sans.compiler.ir.expression.Expression;
import org.sans.compiler.ir.step.DatasetSpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses a table reference with dataset options: name(keep=a b rename=(x=y) where=(a > 1) in=flag) */
class DatasetSpecParser {
    static final Pattern NAME = Pattern.compile("^([a-zA-Z_][\\w.]*)");
    static final List<String> OPTIONS = List.of("keep", "drop", "rename", "where", "in");

    private final SourcePositionRange range;
    private final String text;

    DatasetSpecParser(String text, SourcePositionRange range) {
        this.text = text.strip();
        this.range = range;
    }

    CompilationError error(String message) {
        return new CompilationError(ErrorCode.DATASET_OPTION_UNSUPPORTED, message, this.range);
    }

    /** Split on whitespace which is not nested inside parentheses or quotes. */
    static List<String> splitOutsideParens(String text) {
        List<String> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;
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
                depth = Math.max(0, depth - 1);
            } else if (Character.isWhitespace(c) && depth == 0) {
                if (current.length() > 0) {
                    result.add(current.toString());
                    current.setLength(0);
                }
                continue;
            }
            current.append(c);
        }
        if (current.length() > 0)
            result.add(current.toString());
        return result;
    }

    static boolean isOption(String token) {
        int eq = token.indexOf('=');
        return eq > 0 && OPTIONS.contains(token.substring(0, eq).toLowerCase());
    }

    static String parenthesized(String value) {
        if (value.startsWith("(") && value.endsWith(")"))
            return value.substring(1, value.length() - 1).strip();
        return "";
    }

    DatasetSpec parse(boolean allowInFlag) {
        if (this.text.isEmpty())
            throw this.error("Empty dataset reference");
        Matcher matcher = NAME.matcher(this.text);
        if (!matcher.find())
            throw this.error("Malformed dataset reference " + this.text);
        String table = matcher.group(1).toLowerCase();
        String rest = this.text.substring(matcher.end()).strip();
        if (rest.isEmpty())
            return DatasetSpec.plain(table);
        if (!rest.startsWith("(") || !rest.endsWith(")"))
            throw this.error("Malformed dataset options in " + this.text);
        String options = rest.substring(1, rest.length() - 1).strip();

        String inFlag = null;
        List<String> keep = new ArrayList<>();
        List<String> drop = new ArrayList<>();
        Map<String, String> rename = new LinkedHashMap<>();
        Expression where = null;

        List<String> tokens = splitOutsideParens(options);
        int i = 0;
        while (i < tokens.size()) {
            String token = tokens.get(i);
            int eq = token.indexOf('=');
            if (eq <= 0)
                throw this.error("Unknown dataset option " + token + " in " + this.text);
            String key = token.substring(0, eq).toLowerCase();
            String value = token.substring(eq + 1).strip();
            i++;
            switch (key) {
                case "in":
                    if (!allowInFlag)
                        throw this.error("IN= is only allowed in MERGE: " + this.text);
                    if (value.isEmpty())
                        throw this.error("Malformed IN= option in " + this.text);
                    inFlag = value;
                    break;
                case "keep":
                case "drop": {
                    if ((key.equals("keep") && !drop.isEmpty()) || (key.equals("drop") && !keep.isEmpty()))
                        throw this.error("KEEP= and DROP= cannot both be specified in " + this.text);
                    List<String> columns = key.equals("keep") ? keep : drop;
                    if (value.startsWith("(")) {
                        for (String column: parenthesized(value).split("\\s+"))
                            if (!column.isEmpty())
                                columns.add(column);
                    } else {
                        if (!value.isEmpty())
                            columns.add(value);
                        while (i < tokens.size() && !isOption(tokens.get(i))) {
                            columns.add(tokens.get(i));
                            i++;
                        }
                    }
                    if (columns.isEmpty())
                        throw this.error("Empty " + key.toUpperCase() + "= option in " + this.text);
                    break;
                }
                case "rename": {
                    String inner = parenthesized(value);
                    if (inner.isEmpty())
                        throw this.error("Malformed RENAME= option in " + this.text);
                    rename.putAll(parseRenamePairs(inner, this.range));
                    break;
                }
                case "where": {
                    String inner = parenthesized(value);
                    if (inner.isEmpty())
                        throw this.error("Malformed WHERE= option in " + this.text);
                    where = ExpressionParser.parse(inner, Dialect.LEGACY, this.range);
                    break;
                }
                default:
                    throw this.error("Unknown dataset option " + key + " in " + this.text);
            }
        }
        return new DatasetSpec(table, inFlag, keep, drop, rename, where);
    }

    /** Parse "old=new old2 = new2" into an ordered map. */
    static Map<String, String> parseRenamePairs(String text, SourcePositionRange range) {
        Map<String, String> result = new LinkedHashMap<>();
        String normalized = text.strip().replaceAll("\\s*=\\s*", "=");
        for (String pair: normalized.split("\\s+")) {
            if (pair.isEmpty())
                continue;
            String[] parts = pair.split("=");
            if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty())
                throw new CompilationError(ErrorCode.DATASET_OPTION_UNSUPPORTED,
                        "Malformed rename pair " + pair, range);
            if (result.containsKey(parts[0]))
                throw new CompilationError(ErrorCode.DATASET_OPTION_UNSUPPORTED,
                        "Column " + parts[0] + " renamed twice", range);
            result.put(parts[0], parts[1]);
        }
        return result;
    }
}
