package org.sans.compiler.frontend.legacy;

import org.sans.compiler.CompilerOptions;
import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.frontend.Block;
import org.sans.compiler.frontend.Statement;
import org.sans.compiler.ir.step.IRStep;
import org.sans.util.IWritesLogs;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** Base class for the recognizers of the closed set of supported blocks.
 * A recognizer either lowers its block into IR steps or throws a {@link CompilationError}. */
public abstract class BlockRecognizer implements IWritesLogs {
    static final Pattern TABLE_NAME = Pattern.compile("^[a-zA-Z_][\\w.]*$");

    protected final Block block;
    protected final CompilerOptions options;

    protected BlockRecognizer(Block block, CompilerOptions options) {
        this.block = block;
        this.options = options;
    }

    public abstract List<IRStep> recognize();

    protected CompilationError error(ErrorCode code, String message) {
        return new CompilationError(code, message, this.block.range);
    }

    protected CompilationError error(ErrorCode code, String message, Statement statement) {
        return new CompilationError(code, message, statement.range);
    }

    /** Body statements starting with the given keyword. */
    protected List<Statement> statements(String keyword) {
        List<Statement> result = new ArrayList<>();
        for (Statement statement: this.block.body)
            if (statement.keyword().equals(keyword))
                result.add(statement);
        return result;
    }

    /** The text following the leading keyword. */
    protected static String afterKeyword(Statement statement) {
        String keyword = statement.keyword();
        return statement.text.substring(keyword.length()).strip();
    }

    /** Whitespace-separated words following the leading keyword. */
    protected static List<String> words(Statement statement) {
        List<String> result = new ArrayList<>();
        for (String word: afterKeyword(statement).split("\\s+"))
            if (!word.isEmpty())
                result.add(word);
        return result;
    }

    /** Options of a header such as "proc sort data=a out=b nodupkey";
     * flags map to the empty string.  Keys are lowercase. */
    protected static Map<String, String> headerOptions(Statement header, int skipWords) {
        String normalized = header.text.strip().replaceAll("\\s*=\\s*", "=");
        String[] parts = normalized.split("\\s+");
        Map<String, String> result = new LinkedHashMap<>();
        for (int i = skipWords; i < parts.length; i++) {
            String part = parts[i];
            int eq = part.indexOf('=');
            if (eq < 0)
                result.put(part.toLowerCase(), "");
            else
                result.put(part.substring(0, eq).toLowerCase(), part.substring(eq + 1));
        }
        return result;
    }

    /** Validate and normalize a table name. */
    protected String tableName(String name, Statement statement) {
        if (!TABLE_NAME.matcher(name).matches())
            throw this.error(ErrorCode.UNSUPPORTED_STATEMENT, "Invalid table name " + name, statement);
        return name.toLowerCase();
    }

    /** Fail if the body contains statements other than the given keywords. */
    protected void onlyStatements(ErrorCode code, String procName, String... keywords) {
        for (Statement statement: this.block.body) {
            boolean known = false;
            for (String keyword: keywords)
                if (statement.keyword().equals(keyword))
                    known = true;
            if (!known)
                throw this.error(code, procName + " does not support the statement '" + statement.text + "'",
                        statement);
        }
    }
}
