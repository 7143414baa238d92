package org.sans.compiler.frontend;

import org.sans.compiler.errors.SourcePosition;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.util.IWritesLogs;
import org.sans.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Splits legacy source text into semicolon-terminated statements.
 * Semicolons inside quoted strings and comments do not terminate statements.
 * Two comment forms are recognized: block comments and statement comments,
 * which start with '*' at the beginning of a line and end at the next semicolon. */
public class StatementSplitter implements IWritesLogs {
    enum State {
        NORMAL,
        DOUBLE_QUOTED,
        SINGLE_QUOTED,
        BLOCK_COMMENT,
        STAR_COMMENT
    }

    private final List<Statement> statements = new ArrayList<>();
    private final StringBuilder buffer = new StringBuilder();
    @Nullable
    private SourcePosition start = null;
    @Nullable
    private SourcePosition end = null;

    private StatementSplitter() {}

    public static List<Statement> split(String text) {
        StatementSplitter splitter = new StatementSplitter();
        splitter.run(text);
        Logger.INSTANCE.belowLevel(splitter, 2)
                .append("Split ")
                .append(splitter.statements.size())
                .append(" statements")
                .newline();
        return splitter.statements;
    }

    private void token(char c, int line, int column) {
        this.buffer.append(c);
        if (Character.isWhitespace(c))
            return;
        SourcePosition position = new SourcePosition(line, column);
        if (this.start == null)
            this.start = position;
        this.end = position;
    }

    private void flush() {
        String text = this.buffer.toString().trim();
        if (!text.isEmpty() && this.start != null && this.end != null)
            this.statements.add(new Statement(text, new SourcePositionRange(this.start, this.end)));
        this.buffer.setLength(0);
        this.start = null;
        this.end = null;
    }

    private void run(String text) {
        State state = State.NORMAL;
        int line = 1;
        int column = 0;
        boolean atLineStart = true;
        final int length = text.length();

        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            char next = i + 1 < length ? text.charAt(i + 1) : '\0';
            column++;

            if (c == '\n') {
                if (state == State.NORMAL || state == State.DOUBLE_QUOTED || state == State.SINGLE_QUOTED)
                    this.buffer.append(c);
                line++;
                column = 0;
                atLineStart = true;
                continue;
            }

            switch (state) {
                case BLOCK_COMMENT:
                    if (c == '*' && next == '/') {
                        state = State.NORMAL;
                        i++;
                        column++;
                    }
                    continue;
                case STAR_COMMENT:
                    if (c == ';')
                        state = State.NORMAL;
                    continue;
                case DOUBLE_QUOTED:
                case SINGLE_QUOTED:
                    this.token(c, line, column);
                    if ((state == State.DOUBLE_QUOTED && c == '"') || (state == State.SINGLE_QUOTED && c == '\''))
                        state = State.NORMAL;
                    atLineStart = false;
                    continue;
                default:
                    break;
            }

            if (atLineStart) {
                if (Character.isWhitespace(c)) {
                    this.buffer.append(c);
                    continue;
                }
                atLineStart = false;
                if (c == '*') {
                    state = State.STAR_COMMENT;
                    continue;
                }
            }

            if (c == '/' && next == '*') {
                state = State.BLOCK_COMMENT;
                i++;
                column++;
            } else if (c == '"') {
                state = State.DOUBLE_QUOTED;
                this.token(c, line, column);
            } else if (c == '\'') {
                state = State.SINGLE_QUOTED;
                this.token(c, line, column);
            } else if (c == ';') {
                this.flush();
            } else {
                this.token(c, line, column);
            }
        }
        this.flush();
    }
}
