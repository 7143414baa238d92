package org.sans.compiler.errors;

import org.sans.compiler.IHasSourcePositionRange;

import javax.annotation.Nullable;

/** Base class for exceptions which are thrown by the compiler and the executor. */
public abstract class BaseCompilerException
        extends RuntimeException
        implements IHasSourcePositionRange {
    public final ErrorCode code;
    public final SourcePositionRange range;

    protected BaseCompilerException(ErrorCode code, String message, SourcePositionRange range,
                                    @Nullable Throwable throwable) {
        super(message, throwable);
        this.code = code;
        this.range = range;
    }

    protected BaseCompilerException(ErrorCode code, String message, SourcePositionRange range) {
        this(code, message, range, null);
    }

    public SourcePositionRange getPositionRange() {
        return this.range;
    }

    public String getErrorKind() {
        return this.code.family.description;
    }
}
