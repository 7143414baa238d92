package org.sans.compiler.frontend.script;

import org.sans.compiler.errors.SourcePositionRange;

import java.util.Collections;
import java.util.List;

/** A top-level statement of a native script: a single line, or a line ending
 * with 'do' together with the lines up to the matching 'end'. */
final class ScriptStatement {
    final ScriptLine head;
    final List<ScriptLine> body;
    final boolean isBlock;
    final SourcePositionRange range;

    ScriptStatement(ScriptLine head, List<ScriptLine> body, boolean isBlock, int endLine) {
        this.head = head;
        this.body = Collections.unmodifiableList(body);
        this.isBlock = isBlock;
        this.range = SourcePositionRange.lines(head.number, endLine);
    }

    @Override
    public String toString() {
        return this.head.text;
    }
}
