package org.sans.compiler.frontend.legacy;

import org.sans.compiler.CompilerOptions;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.frontend.Block;
import org.sans.compiler.frontend.Dialect;
import org.sans.compiler.frontend.ExpressionLexer;
import org.sans.compiler.frontend.Statement;
import org.sans.compiler.frontend.Token;
import org.sans.compiler.ir.expression.LiteralExpression;
import org.sans.compiler.ir.step.FormatStep;
import org.sans.compiler.ir.step.IRStep;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** proc format; value [$]name 'key'='label' ... [other='label']; run;
 * Each VALUE statement declares one lookup table.  Numeric keys are stored
 * in their canonical text form, the form in which lookups convert their argument. */
public class ProcFormatRecognizer extends BlockRecognizer {
    public ProcFormatRecognizer(Block block, CompilerOptions options) {
        super(block, options);
    }

    @Override
    public List<IRStep> recognize() {
        if (!this.block.header.lower().strip().equals("proc format"))
            throw this.error(ErrorCode.FORMAT_MALFORMED,
                    "PROC FORMAT options are not supported: '" + this.block.header.text + "'", this.block.header);
        this.onlyStatements(ErrorCode.FORMAT_MALFORMED, "PROC FORMAT", "value");
        List<IRStep> result = new ArrayList<>();
        for (Statement statement: this.block.body)
            result.add(this.value(statement));
        if (result.isEmpty())
            throw this.error(ErrorCode.FORMAT_MALFORMED, "PROC FORMAT without VALUE statement");
        return result;
    }

    /** Canonical text of a key or label token; the index is advanced past a leading sign. */
    String literal(List<Token> tokens, int[] index, Statement statement) {
        Token token = tokens.get(index[0]);
        boolean negative = false;
        if (token.is(Token.Kind.OPERATOR, "-")) {
            negative = true;
            index[0]++;
            token = tokens.get(index[0]);
            if (token.kind != Token.Kind.NUMBER)
                throw this.error(ErrorCode.FORMAT_MALFORMED, "Expected a number after '-' in '"
                        + statement.text + "'", statement);
        }
        index[0]++;
        switch (token.kind) {
            case STRING:
                return token.text;
            case NUMBER: {
                String text = token.text.endsWith(".") ? token.text.substring(0, token.text.length() - 1) : token.text;
                BigDecimal value = new BigDecimal(text);
                if (negative)
                    value = value.negate();
                return LiteralExpression.canonicalDecimal(value);
            }
            default:
                throw this.error(ErrorCode.FORMAT_MALFORMED, "Expected a quoted string or number but found "
                        + token + " in '" + statement.text + "'", statement);
        }
    }

    IRStep value(Statement statement) {
        List<Token> tokens = new ExpressionLexer(afterKeyword(statement), Dialect.LEGACY, statement.range).tokenize();
        Token nameToken = tokens.get(0);
        if (nameToken.kind != Token.Kind.IDENTIFIER && nameToken.kind != Token.Kind.FORMAT)
            throw this.error(ErrorCode.FORMAT_MALFORMED, "VALUE statement without a format name: '"
                    + statement.text + "'", statement);
        String name = nameToken.text.toLowerCase();
        if (name.contains("."))
            throw this.error(ErrorCode.FORMAT_MALFORMED, "Invalid format name " + nameToken.text, statement);

        Map<String, String> map = new LinkedHashMap<>();
        String other = null;
        int[] index = { 1 };
        while (tokens.get(index[0]).kind != Token.Kind.END) {
            Token token = tokens.get(index[0]);
            boolean isOther = token.isWord("other");
            if (isOther && other != null)
                throw this.error(ErrorCode.FORMAT_MALFORMED, "Duplicate OTHER in format " + name, statement);
            if (token.isWord("low") || token.isWord("high"))
                throw this.error(ErrorCode.FORMAT_MALFORMED, "Ranges are not supported in format " + name, statement);
            String key = null;
            if (isOther)
                index[0]++;
            else
                key = this.literal(tokens, index, statement);
            Token next = tokens.get(index[0]);
            if (next.is(Token.Kind.OPERATOR, "-"))
                throw this.error(ErrorCode.FORMAT_MALFORMED, "Ranges are not supported in format " + name, statement);
            if (!next.is(Token.Kind.OPERATOR, "="))
                throw this.error(ErrorCode.FORMAT_MALFORMED, "Expected '=' but found " + next
                        + " in format " + name, statement);
            index[0]++;
            if (tokens.get(index[0]).kind == Token.Kind.END)
                throw this.error(ErrorCode.FORMAT_MALFORMED, "Missing label in format " + name, statement);
            String label = this.literal(tokens, index, statement);
            if (isOther) {
                other = label;
            } else {
                if (map.containsKey(key))
                    throw this.error(ErrorCode.FORMAT_MALFORMED, "Duplicate key '" + key + "' in format " + name,
                            statement);
                map.put(key, label);
            }
        }
        if (map.isEmpty() && other == null)
            throw this.error(ErrorCode.FORMAT_MALFORMED, "Empty format " + name, statement);
        this.getDebugStream(1)
                .append("FORMAT ")
                .append(name)
                .append(" with ")
                .append(map.size())
                .append(" entries")
                .newline();
        return new FormatStep(statement.range, name, map, other);
    }
}
