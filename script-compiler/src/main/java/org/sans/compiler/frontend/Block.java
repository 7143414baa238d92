package org.sans.compiler.frontend;

import org.sans.compiler.IHasSourcePositionRange;
import org.sans.compiler.errors.SourcePositionRange;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;

/** A group of statements recognized as a unit: a DATA step, a PROC,
 * or a single statement outside both. */
public final class Block implements IHasSourcePositionRange {
    public enum Kind {
        DATA,
        PROC,
        OTHER
    }

    public final Kind kind;
    public final Statement header;
    public final List<Statement> body;
    /** The run; or quit; statement, if present. */
    @Nullable
    public final Statement end;
    public final SourcePositionRange range;

    public Block(Kind kind, Statement header, List<Statement> body, @Nullable Statement end) {
        this.kind = kind;
        this.header = header;
        this.body = Collections.unmodifiableList(body);
        this.end = end;
        SourcePositionRange range = header.range;
        for (Statement statement: body)
            range = range.merge(statement.range);
        if (end != null)
            range = range.merge(end.range);
        this.range = range;
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this.range;
    }

    @Override
    public String toString() {
        return this.kind + " " + this.header.text;
    }
}
