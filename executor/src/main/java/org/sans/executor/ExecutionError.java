package org.sans.executor;

import org.sans.compiler.errors.BaseCompilerException;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;

/** A failure which is only detectable with the data in hand.
 * The step in progress is abandoned and no output table is produced. */
public final class ExecutionError extends BaseCompilerException {
    public ExecutionError(ErrorCode code, String message, SourcePositionRange range) {
        super(code, message, range);
    }

    public ExecutionError(ErrorCode code, String message) {
        this(code, message, SourcePositionRange.INVALID);
    }

    /** The same error, located at the given step if it has no position yet. */
    public ExecutionError at(SourcePositionRange range) {
        if (this.range.isValid())
            return this;
        return new ExecutionError(this.code, this.getMessage(), range);
    }
}
