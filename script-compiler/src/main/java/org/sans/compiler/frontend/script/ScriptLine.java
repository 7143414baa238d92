package org.sans.compiler.frontend.script;

import org.sans.compiler.errors.SourcePosition;
import org.sans.compiler.errors.SourcePositionRange;

/** One non-empty line of a native script. */
final class ScriptLine {
    final String text;
    final int number;

    ScriptLine(String text, int number) {
        this.text = text.strip();
        this.number = number;
    }

    String lower() {
        return this.text.toLowerCase();
    }

    boolean isComment() {
        return this.text.startsWith("#");
    }

    SourcePositionRange range() {
        return new SourcePositionRange(new SourcePosition(this.number, 1),
                new SourcePosition(this.number, Math.max(1, this.text.length())));
    }

    @Override
    public String toString() {
        return this.number + ": " + this.text;
    }
}
