package org.sans.compiler.frontend;

import org.sans.compiler.IHasSourcePositionRange;
import org.sans.compiler.errors.SourcePositionRange;

/** A legacy statement: the text between two semicolons, comments removed. */
public final class Statement implements IHasSourcePositionRange {
    /** Trimmed text without the terminating semicolon. */
    public final String text;
    public final SourcePositionRange range;

    public Statement(String text, SourcePositionRange range) {
        this.text = text;
        this.range = range;
    }

    /** Lowercase text, used for keyword recognition. */
    public String lower() {
        return this.text.toLowerCase();
    }

    /** First whitespace-delimited word, lowercase. */
    public String keyword() {
        String lower = this.lower();
        int end = 0;
        while (end < lower.length() && !Character.isWhitespace(lower.charAt(end)))
            end++;
        return lower.substring(0, end);
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this.range;
    }

    @Override
    public String toString() {
        return this.text + ";";
    }
}
