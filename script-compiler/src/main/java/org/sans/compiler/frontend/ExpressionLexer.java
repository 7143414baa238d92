package org.sans.compiler.frontend;

import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;

import java.util.ArrayList;
import java.util.List;

/** Converts expression text into tokens. */
public class ExpressionLexer {
    static final String[] OPERATORS = {
            "<=", ">=", "==", "!=", "^=", "~=", "<>", "=", "<", ">", "+", "-", "*", "/"
    };

    private final String text;
    private final Dialect dialect;
    private final SourcePositionRange range;
    private int position;

    public ExpressionLexer(String text, Dialect dialect, SourcePositionRange range) {
        this.text = text;
        this.dialect = dialect;
        this.range = range;
        this.position = 0;
    }

    CompilationError error(String message) {
        return new CompilationError(ErrorCode.EXPRESSION_ERROR,
                message + " in expression " + this.text, this.range);
    }

    char peek(int offset) {
        int index = this.position + offset;
        return index < this.text.length() ? this.text.charAt(index) : '\0';
    }

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    public List<Token> tokenize() {
        List<Token> result = new ArrayList<>();
        while (true) {
            while (Character.isWhitespace(this.peek(0)))
                this.position++;
            if (this.position >= this.text.length())
                break;
            result.add(this.next());
        }
        result.add(new Token(Token.Kind.END, "", this.text.length()));
        return result;
    }

    String word() {
        int start = this.position;
        while (isIdentifierPart(this.peek(0)))
            this.position++;
        return this.text.substring(start, this.position);
    }

    Token next() {
        int start = this.position;
        char c = this.peek(0);
        if (c == '"' || (c == '\'' && this.dialect == Dialect.LEGACY))
            return this.string(c);
        if (Character.isDigit(c) || (c == '.' && Character.isDigit(this.peek(1))))
            return this.number();
        if (c == '.') {
            if (this.dialect != Dialect.LEGACY)
                throw this.error("Unexpected '.'");
            this.position++;
            return new Token(Token.Kind.MISSING, ".", start);
        }
        if (c == '$') {
            this.position++;
            if (!isIdentifierStart(this.peek(0)))
                throw this.error("Expected a format name after '$'");
            String name = "$" + this.word();
            if (this.peek(0) == '.')
                this.position++;
            return new Token(Token.Kind.FORMAT, name, start);
        }
        if (isIdentifierStart(c)) {
            String name = this.word();
            if (this.peek(0) == '.') {
                if (isIdentifierStart(this.peek(1))) {
                    // Qualified names: first.x, last.x, alias.column
                    this.position++;
                    name = name + "." + this.word();
                } else if (this.dialect == Dialect.LEGACY && !Character.isDigit(this.peek(1))) {
                    // A trailing dot names a format or informat: best.
                    this.position++;
                    return new Token(Token.Kind.FORMAT, name, start);
                }
            }
            return new Token(Token.Kind.IDENTIFIER, name, start);
        }
        if (c == '(') {
            this.position++;
            return new Token(Token.Kind.LPAREN, "(", start);
        }
        if (c == ')') {
            this.position++;
            return new Token(Token.Kind.RPAREN, ")", start);
        }
        if (c == ',') {
            this.position++;
            return new Token(Token.Kind.COMMA, ",", start);
        }
        for (String op: OPERATORS) {
            if (this.text.startsWith(op, this.position)) {
                this.position += op.length();
                return new Token(Token.Kind.OPERATOR, op, start);
            }
        }
        throw this.error("Unexpected character '" + c + "'");
    }

    Token string(char quote) {
        int start = this.position;
        this.position++;
        StringBuilder builder = new StringBuilder();
        while (true) {
            if (this.position >= this.text.length())
                throw this.error("Unterminated string literal");
            char c = this.peek(0);
            this.position++;
            if (c == quote) {
                // A doubled quote stands for the quote character itself
                if (this.peek(0) == quote) {
                    builder.append(quote);
                    this.position++;
                    continue;
                }
                break;
            }
            builder.append(c);
        }
        return new Token(Token.Kind.STRING, builder.toString(), start);
    }

    Token number() {
        int start = this.position;
        while (Character.isDigit(this.peek(0)))
            this.position++;
        if (this.peek(0) == '.') {
            this.position++;
            while (Character.isDigit(this.peek(0)))
                this.position++;
        }
        return new Token(Token.Kind.NUMBER, this.text.substring(start, this.position), start);
    }
}
