package org.sans.compiler.errors;

/** Signals a bug -- some expected invariant doesn't hold. */
public final class InternalCompilerError extends BaseCompilerException {
    public InternalCompilerError(ErrorCode code, String message, SourcePositionRange range) {
        super(code, message, range);
    }

    public InternalCompilerError(String message, SourcePositionRange range) {
        this(ErrorCode.INTERNAL, message, range);
    }

    public InternalCompilerError(String message) {
        this(message, SourcePositionRange.INVALID);
    }
}
