package org.sans.compiler.frontend;

/** A lexical token of an expression. */
public final class Token {
    public enum Kind {
        NUMBER,
        STRING,
        IDENTIFIER,
        /** A format or informat name: '$name', 'name.' or '$name.' */
        FORMAT,
        /** The legacy missing value '.' */
        MISSING,
        OPERATOR,
        LPAREN,
        RPAREN,
        COMMA,
        END
    }

    public final Kind kind;
    /** Source text; for strings, the contents without quotes. */
    public final String text;
    /** Offset of the token within the expression text. */
    public final int offset;

    public Token(Kind kind, String text, int offset) {
        this.kind = kind;
        this.text = text;
        this.offset = offset;
    }

    public boolean is(Kind kind, String text) {
        return this.kind == kind && this.text.equalsIgnoreCase(text);
    }

    public boolean isWord(String word) {
        return this.is(Kind.IDENTIFIER, word);
    }

    @Override
    public String toString() {
        if (this.kind == Kind.END)
            return "end of expression";
        if (this.kind == Kind.STRING)
            return "\"" + this.text + "\"";
        return "'" + this.text + "'";
    }
}
