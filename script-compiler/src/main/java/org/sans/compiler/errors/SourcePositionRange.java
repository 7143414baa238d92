package org.sans.compiler.errors;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.IHasSourcePositionRange;

/** A range of characters inside the source code. */
public class SourcePositionRange implements IHasSourcePositionRange {
    public final SourcePosition start;
    public final SourcePosition end;

    public static final SourcePositionRange INVALID =
            new SourcePositionRange(SourcePosition.INVALID, SourcePosition.INVALID);

    public SourcePositionRange(SourcePosition start, SourcePosition end) {
        this.start = start;
        this.end = end;
    }

    /** A range covering whole lines. */
    public static SourcePositionRange lines(int startLine, int endLine) {
        return new SourcePositionRange(new SourcePosition(startLine, 1), new SourcePosition(endLine, 1));
    }

    public boolean isValid() {
        return this.start.isValid() && this.end.isValid();
    }

    @Override
    public String toString() {
        return this.start + "--" + this.end;
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this;
    }

    /** Append the position information to a JSON node */
    public void appendAsJson(ObjectNode parent) {
        parent.put("start_line_number", this.start.line);
        parent.put("start_column", this.start.column);
        parent.put("end_line_number", this.end.line);
        parent.put("end_column", this.end.column);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        SourcePositionRange that = (SourcePositionRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    /** Merge two source position ranges by creating a range that spans both. */
    public SourcePositionRange merge(SourcePositionRange other) {
        if (!this.isValid())
            return other;
        if (!other.isValid())
            return this;
        SourcePosition start = this.start.min(other.start);
        SourcePosition end = this.end.max(other.end);
        return new SourcePositionRange(start, end);
    }

    @Override
    public int hashCode() {
        int result = start.hashCode();
        result = 31 * result + end.hashCode();
        return result;
    }

    public String toShortString() {
        if (!this.isValid())
            return "";
        if (this.start.line == this.end.line)
            return "#" + this.start.line;
        else
            return "#" + this.start.line + "-" + this.end.line;
    }
}
