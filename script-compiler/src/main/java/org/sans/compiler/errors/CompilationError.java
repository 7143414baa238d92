package org.sans.compiler.errors;

/** A refusal: the input is outside the supported subset, or breaks a static invariant. */
public final class CompilationError extends BaseCompilerException {
    public CompilationError(ErrorCode code, String message, SourcePositionRange range) {
        super(code, message, range);
    }

    public CompilationError(ErrorCode code, String message) {
        this(code, message, SourcePositionRange.INVALID);
    }

    public CompilationError(String message) {
        this(ErrorCode.INTERNAL, message);
    }
}
